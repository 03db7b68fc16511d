package com.docpublish.core.settings;

import com.docpublish.core.error.ConfigException;

/**
 * Decides what happens when a configuration value fails to parse against its option type.
 *
 * <p>Supplied by the caller of {@link SettingsResolver}.
 */
@FunctionalInterface
public interface InvalidValuePolicy {

    /**
     * Ignore the invalid value: the option keeps what lower-precedence sources (or its default)
     * gave it.
     */
    InvalidValuePolicy KEEP_CURRENT = (definition, current, error) -> current;

    /**
     * Reset the option to its default, discarding values from lower-precedence sources.
     */
    InvalidValuePolicy USE_DEFAULT = (definition, current, error) -> definition.defaultValue();

    /**
     * Abort resolution by propagating the error.
     */
    InvalidValuePolicy ABORT = (definition, current, error) -> {
        throw error;
    };

    /**
     * Handles an invalid value.
     *
     * @param definition option whose value was invalid
     * @param current value resolved for the option so far
     * @param error the parse failure, with file and line
     * @return value to store for the option
     * @throws ConfigException to abort resolution
     */
    Object onInvalidValue(OptionDefinition definition, Object current, ConfigException error);
}
