package com.docpublish.core.error;

/**
 * Abstract base for all DocPublish exceptions. Never thrown directly; see the concrete
 * subclasses for each phase of a run.
 */
public abstract class PublishException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected PublishException(String message) {
        super(message);
    }

    protected PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
