package com.docpublish.core.settings;

import java.util.Objects;

/**
 * One {@code name: value} line of a configuration file.
 *
 * @param name normalised option name
 * @param rawValue value text after the separator, trimmed
 * @param line one-based line number
 */
public record ConfigEntry(
    String name,
    String rawValue,
    int line
) {
    /**
     * Compact constructor with validation.
     */
    public ConfigEntry {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(rawValue, "rawValue must not be null");
    }
}
