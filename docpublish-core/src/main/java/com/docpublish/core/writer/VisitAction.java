package com.docpublish.core.writer;

/**
 * What the {@link TreeWalker} does after visiting a node.
 */
public enum VisitAction {
    /** Walk the children, then depart the node. */
    CONTINUE,

    /** Depart the node without walking its children. */
    SKIP_CHILDREN,

    /**
     * Neither walk the children nor depart the node, and skip the remaining siblings. The parent
     * is still departed.
     */
    SKIP_SIBLINGS
}
