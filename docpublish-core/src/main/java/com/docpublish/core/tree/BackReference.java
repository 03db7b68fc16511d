package com.docpublish.core.tree;

import java.util.Objects;

/**
 * Non-owning link from one node to another, used to tie diagnostics to the node they are about.
 *
 * <p>Back-references never take part in ownership or traversal. When either end is removed from
 * the tree the reference becomes unresolved, see {@link Document#resolve(BackReference)}.
 *
 * @param from node holding the reference (usually a system message)
 * @param to referenced node
 */
public record BackReference(NodeId from, NodeId to) {

    /**
     * Compact constructor with validation.
     */
    public BackReference {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
    }
}
