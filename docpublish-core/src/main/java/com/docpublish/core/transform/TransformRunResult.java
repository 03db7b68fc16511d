package com.docpublish.core.transform;

import com.docpublish.core.error.Condition;

import java.util.List;

/**
 * Summary of a completed scheduler run.
 *
 * @param skipped true if the document was empty and nothing ran
 * @param executedTransforms ids of the transforms applied, in execution order
 * @param conditions conditions recorded in the document, in the order they were raised
 */
public record TransformRunResult(
    boolean skipped,
    List<String> executedTransforms,
    List<Condition> conditions
) {
    /**
     * Compact constructor with defensive copies.
     */
    public TransformRunResult {
        executedTransforms = executedTransforms == null ? List.of() : List.copyOf(executedTransforms);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    /**
     * Result of a run over an empty document.
     *
     * @return skipped result
     */
    public static TransformRunResult skippedRun() {
        return new TransformRunResult(true, List.of(), List.of());
    }

    public boolean hasConditions() {
        return !conditions.isEmpty();
    }
}
