package com.docpublish.core.error;

import java.util.Objects;

/**
 * Non-fatal structural problem, such as a configuration line without a separator.
 *
 * <p>Structural warnings are logged and collected; they never stop a run.
 *
 * @param source file or component the warning is about
 * @param line one-based line number, or 0 if not applicable
 * @param message description
 */
public record StructuralWarning(
    String source,
    int line,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public StructuralWarning {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return line > 0 ? source + ":" + line + ": " + message : source + ": " + message;
    }
}
