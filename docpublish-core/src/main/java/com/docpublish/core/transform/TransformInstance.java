package com.docpublish.core.transform;

import com.docpublish.core.tree.NodeId;

import java.util.Comparator;
import java.util.Objects;

/**
 * A transform bound to a target node and a scheduling order number.
 *
 * @param transform the transform
 * @param target root of the subtree it rewrites
 * @param order creation sequence number, breaks priority ties
 */
public record TransformInstance(
    Transform transform,
    NodeId target,
    long order
) {
    /**
     * Execution order: priority ascending, then order ascending.
     */
    public static final Comparator<TransformInstance> EXECUTION_ORDER =
        Comparator.comparingInt(TransformInstance::priority).thenComparingLong(TransformInstance::order);

    /**
     * Compact constructor with validation.
     */
    public TransformInstance {
        Objects.requireNonNull(transform, "transform must not be null");
        Objects.requireNonNull(target, "target must not be null");
        if (order < 0) {
            throw new IllegalArgumentException("order must not be negative: " + order);
        }
        int priority = transform.getPriority();
        if (priority < Transform.MIN_PRIORITY || priority > Transform.MAX_PRIORITY) {
            throw new IllegalArgumentException("Transform " + transform.getId() + " has priority " + priority
                + " outside " + Transform.MIN_PRIORITY + ".." + Transform.MAX_PRIORITY);
        }
    }

    public int priority() {
        return transform.getPriority();
    }

    public String id() {
        return transform.getId();
    }
}
