package com.docpublish.core.error;

import com.docpublish.core.tree.NodeId;

import java.util.Objects;
import java.util.Optional;

/**
 * A diagnosed problem: severity, message and where it came from.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Condition condition = Condition.of(Severity.WARNING, "Duplicate section title")
 *     .atLine(12)
 *     .about(sectionNode);
 * }</pre>
 *
 * @param severity value on the 0-10 scale
 * @param message human-readable description
 * @param line source line number, or {@code null} if unknown
 * @param node originating node, or {@code null} if none
 */
public record Condition(
    int severity,
    String message,
    Integer line,
    NodeId node
) {
    /**
     * Compact constructor with validation.
     */
    public Condition {
        Objects.requireNonNull(message, "message must not be null");
        Severity.of(severity);
        if (line != null && line < 1) {
            throw new IllegalArgumentException("line must be positive: " + line);
        }
    }

    /**
     * Creates a condition without line or node.
     *
     * @param severity named severity
     * @param message description
     * @return new condition
     */
    public static Condition of(Severity severity, String message) {
        return new Condition(severity.level(), message, null, null);
    }

    public Condition atLine(int line) {
        return new Condition(severity, message, line, node);
    }

    public Condition about(NodeId node) {
        return new Condition(severity, message, line, node);
    }

    public String label() {
        return Severity.labelOf(severity);
    }

    public Optional<Integer> lineNumber() {
        return Optional.ofNullable(line);
    }

    public Optional<NodeId> originatingNode() {
        return Optional.ofNullable(node);
    }
}
