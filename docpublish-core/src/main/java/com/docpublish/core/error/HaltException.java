package com.docpublish.core.error;

/**
 * Fatal end of a run: a condition reached the configured halt-level.
 *
 * <p>No output should be produced from a document whose run halted.
 */
public class HaltException extends PublishException {

    private static final long serialVersionUID = 1L;

    private final transient Condition condition;
    private final String transformId;

    public HaltException(String transformId, Condition condition, int haltLevel) {
        super(String.format("Transform '%s' halted the run: %s (%s, severity %d >= halt-level %d)",
            transformId, condition.message(), condition.label(), condition.severity(), haltLevel));
        this.transformId = transformId;
        this.condition = condition;
    }

    /** The condition that caused the halt. */
    public Condition condition() {
        return condition;
    }

    /** Id of the transform that raised the condition. */
    public String transformId() {
        return transformId;
    }
}
