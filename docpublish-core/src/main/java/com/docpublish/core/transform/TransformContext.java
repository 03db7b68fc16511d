package com.docpublish.core.transform;

import com.docpublish.core.error.Condition;
import com.docpublish.core.error.Severity;
import com.docpublish.core.error.TransformCondition;
import com.docpublish.core.settings.Settings;
import com.docpublish.core.tree.Document;
import com.docpublish.core.tree.NodeId;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * What a running transform sees: the document, its target subtree, the run's settings and a way
 * to schedule more transforms into the same run.
 */
public final class TransformContext {

    private final Document document;
    private final NodeId target;
    private final Settings settings;
    private final Consumer<TransformSpec> scheduler;

    TransformContext(Document document, NodeId target, Settings settings, Consumer<TransformSpec> scheduler) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    public Document document() {
        return document;
    }

    public NodeId target() {
        return target;
    }

    public Settings settings() {
        return settings;
    }

    /**
     * Adds a transform to the current run. It is ordered among the transforms that have not run
     * yet by the usual priority/order rule; if its priority is lower than that of transforms
     * already executed, it simply runs next.
     *
     * @param spec transform to add
     */
    public void schedule(TransformSpec spec) {
        scheduler.accept(Objects.requireNonNull(spec, "spec must not be null"));
    }

    /**
     * Builds a condition to throw.
     *
     * @param severity severity
     * @param message description
     * @return condition exception, not yet thrown
     */
    public TransformCondition condition(Severity severity, String message) {
        return new TransformCondition(Condition.of(severity, message));
    }

    /**
     * Builds a condition about a specific node.
     *
     * @param severity severity
     * @param message description
     * @param node originating node
     * @return condition exception, not yet thrown
     */
    public TransformCondition condition(Severity severity, String message, NodeId node) {
        return new TransformCondition(Condition.of(severity, message).about(node));
    }
}
