package com.docpublish.core.error;

/**
 * A transform failed with an unexpected exception instead of raising a
 * {@link TransformCondition}. Always propagates out of the scheduler.
 */
public class TransformFailedException extends PublishException {

    private static final long serialVersionUID = 1L;

    private final String transformId;

    public TransformFailedException(String transformId, Throwable cause) {
        super("Transform '" + transformId + "' failed: " + cause.getMessage(), cause);
        this.transformId = transformId;
    }

    public String transformId() {
        return transformId;
    }
}
