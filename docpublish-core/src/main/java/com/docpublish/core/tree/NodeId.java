package com.docpublish.core.tree;

/**
 * Stable handle of a node inside the arena of one {@link Document}.
 *
 * <p>Ids are never reused: a removed node keeps its id, it just stops being reachable from
 * the root.
 *
 * @param index position of the node in the document arena
 */
public record NodeId(int index) {

    /**
     * Compact constructor with validation.
     */
    public NodeId {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
    }

    @Override
    public String toString() {
        return "#" + index;
    }
}
