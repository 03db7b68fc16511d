package com.docpublish.core.writer;

/**
 * How the {@link TreeWalker} reacts to a {@link com.docpublish.core.error.VisitorCondition}.
 */
public enum VisitorFailurePolicy {
    /** Log, skip the rest of the failing node and continue with its next sibling. */
    CONTINUE,

    /** Rethrow, ending the walk. */
    PROPAGATE
}
