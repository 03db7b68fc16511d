package com.docpublish.core.writer;

/**
 * Active-part guard returned by {@link Writer#withPart(String)}.
 *
 * <p>Closing the scope restores the part that was active before it was opened, also when the
 * guarded block throws.
 */
public final class PartScope implements AutoCloseable {

    private final Runnable restore;
    private boolean closed;

    PartScope(Runnable restore) {
        this.restore = restore;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            restore.run();
        }
    }
}
