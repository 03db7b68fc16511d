package com.docpublish.core.settings;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved, immutable settings of one run: option name to typed value.
 *
 * <p>Every option of the catalogue the settings were resolved against has an entry (its default
 * if nothing overrode it). Unrecognised keys read from configuration files are kept as raw
 * strings. Values may be {@code null} for nullable options.
 *
 * <p>Typed accessors throw {@link IllegalArgumentException} for unknown names and
 * {@link IllegalStateException} when the stored value has another type.
 */
public final class Settings {

    private final Map<String, Object> values;

    /**
     * Creates settings from a resolved mapping.
     *
     * @param values option values; copied
     */
    public Settings(Map<String, Object> values) {
        Objects.requireNonNull(values, "values must not be null");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Creates settings holding the default of every registered option.
     *
     * @param registry option catalogue
     * @return default settings
     */
    public static Settings defaults(SettingsRegistry registry) {
        Map<String, Object> values = new LinkedHashMap<>();
        registry.definitions().forEach(definition -> values.put(definition.name(), definition.defaultValue()));
        return new Settings(values);
    }

    public boolean contains(String name) {
        return values.containsKey(SettingsRegistry.normalizeName(name));
    }

    /**
     * Returns the raw stored value.
     *
     * @param name option name
     * @return value, possibly {@code null}
     * @throws IllegalArgumentException if the option is unknown
     */
    public Object get(String name) {
        String key = SettingsRegistry.normalizeName(name);
        if (!values.containsKey(key)) {
            throw new IllegalArgumentException("Unknown setting: " + name);
        }
        return values.get(key);
    }

    public boolean getBoolean(String name) {
        return typed(name, Boolean.class);
    }

    /**
     * Returns a boolean option, or a fallback when the option was never registered.
     *
     * @param name option name
     * @param fallback value for unknown options
     * @return stored value or fallback
     */
    public boolean getBoolean(String name, boolean fallback) {
        if (!contains(name)) {
            return fallback;
        }
        Object value = get(name);
        if (value instanceof String raw) {
            return Boolean.TRUE.equals(OptionType.bool().parse(raw));
        }
        Boolean typedValue = typed(name, Boolean.class);
        return typedValue == null ? fallback : typedValue;
    }

    public int getInt(String name) {
        return typed(name, Integer.class);
    }

    public String getString(String name) {
        return typed(name, String.class);
    }

    public Path getPath(String name) {
        return typed(name, Path.class);
    }

    @SuppressWarnings("unchecked")
    public <T> List<T> getList(String name) {
        return (List<T>) typed(name, List.class);
    }

    public int reportLevel() {
        return getInt(StandardOptions.REPORT_LEVEL);
    }

    public int haltLevel() {
        return getInt(StandardOptions.HALT_LEVEL);
    }

    /**
     * Returns a copy with one value replaced or added.
     *
     * @param name option name
     * @param value new value
     * @return new settings instance
     */
    public Settings with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(SettingsRegistry.normalizeName(name), value);
        return new Settings(copy);
    }

    /**
     * Returns the mapping as an unmodifiable view in catalogue order.
     *
     * @return name to value
     */
    public Map<String, Object> asMap() {
        return values;
    }

    private <T> T typed(String name, Class<T> type) {
        Object value = get(name);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException("Setting '" + name + "' is " + value.getClass().getSimpleName()
                + ", not " + type.getSimpleName());
        }
        return type.cast(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Settings other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Settings" + values;
    }
}
