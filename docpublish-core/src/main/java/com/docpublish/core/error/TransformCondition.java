package com.docpublish.core.error;

import java.util.Objects;

/**
 * Raised by a transform to report a problem with the tree it rewrites.
 *
 * <p>The scheduler turns it into a system message in the document. Below halt-level the run
 * continues with the next transform; at or above it the run is aborted with a
 * {@link HaltException}.
 */
public class TransformCondition extends PublishException {

    private static final long serialVersionUID = 1L;

    private final transient Condition condition;

    public TransformCondition(Condition condition) {
        super(Objects.requireNonNull(condition, "condition must not be null").message());
        this.condition = condition;
    }

    public TransformCondition(Severity severity, String message) {
        this(Condition.of(severity, message));
    }

    public Condition condition() {
        return condition;
    }

    public int severity() {
        return condition.severity();
    }
}
