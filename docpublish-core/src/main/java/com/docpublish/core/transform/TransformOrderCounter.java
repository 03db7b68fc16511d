package com.docpublish.core.transform;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of transform order numbers: unique and increasing for the life of the counter.
 *
 * <p>Order {@code 0} is reserved for callables wrapped by {@link TransformSpec#callable}; the
 * counter starts at 1 and is never reset.
 */
public final class TransformOrderCounter {

    private static final TransformOrderCounter GLOBAL = new TransformOrderCounter();

    private final AtomicLong next = new AtomicLong(1);

    /**
     * Returns the process-wide counter.
     *
     * @return shared counter
     */
    public static TransformOrderCounter global() {
        return GLOBAL;
    }

    /**
     * Returns the next order number.
     *
     * @return unique order number, at least 1
     */
    public long next() {
        return next.getAndIncrement();
    }
}
