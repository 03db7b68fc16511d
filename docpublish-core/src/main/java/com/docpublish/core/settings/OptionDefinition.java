package com.docpublish.core.settings;

import java.util.Objects;

/**
 * Declaration of one recognised configuration option.
 *
 * @param name option name, normalised with {@link SettingsRegistry#normalizeName(String)}
 * @param type value type used to parse configuration text
 * @param defaultValue value used when no configuration source sets the option (may be null)
 * @param description one-line human description
 */
public record OptionDefinition(
    String name,
    OptionType type,
    Object defaultValue,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public OptionDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        name = SettingsRegistry.normalizeName(name);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (description == null) {
            description = "";
        }
    }
}
