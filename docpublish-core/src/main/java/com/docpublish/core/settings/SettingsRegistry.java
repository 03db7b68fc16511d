package com.docpublish.core.settings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Catalogue of recognised configuration options.
 *
 * <p>Components register their options here before any document is processed. Registering a
 * name that is already known replaces its definition; the last registration wins.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SettingsRegistry registry = SettingsRegistry.withStandardOptions();
 * registry.register("html-stylesheet", OptionType.nullablePath(), null, "Stylesheet to link");
 * registry.registerAll(writer);
 * }</pre>
 */
public class SettingsRegistry {

    private static final Logger log = LoggerFactory.getLogger(SettingsRegistry.class);

    private final Map<String, OptionDefinition> definitions = new LinkedHashMap<>();

    /**
     * Creates a registry pre-populated with {@link StandardOptions}.
     *
     * @return new registry
     */
    public static SettingsRegistry withStandardOptions() {
        SettingsRegistry registry = new SettingsRegistry();
        StandardOptions.definitions().forEach(registry::register);
        return registry;
    }

    /**
     * Registers or replaces an option definition.
     *
     * @param definition option to register
     */
    public void register(OptionDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        OptionDefinition previous = definitions.put(definition.name(), definition);
        if (previous != null && !previous.equals(definition)) {
            log.debug("Option '{}' redefined: {} -> {}", definition.name(), previous.type().describe(),
                definition.type().describe());
        }
    }

    /**
     * Registers or replaces an option definition.
     *
     * @param name option name
     * @param type value type
     * @param defaultValue default value
     * @param description human description
     */
    public void register(String name, OptionType type, Object defaultValue, String description) {
        register(new OptionDefinition(name, type, defaultValue, description));
    }

    /**
     * Registers every option a component declares.
     *
     * @param component component declaring options
     */
    public void registerAll(SettingsSpec component) {
        component.getSettingsSpec().forEach(this::register);
    }

    public Optional<OptionDefinition> lookup(String name) {
        return Optional.ofNullable(definitions.get(normalizeName(name)));
    }

    public boolean contains(String name) {
        return definitions.containsKey(normalizeName(name));
    }

    /**
     * Returns all definitions in registration order.
     *
     * @return snapshot of the catalogue
     */
    public List<OptionDefinition> definitions() {
        return new ArrayList<>(definitions.values());
    }

    public int size() {
        return definitions.size();
    }

    /**
     * Normalises an option name: trimmed, lower-case, underscores as hyphens.
     *
     * @param name raw name
     * @return canonical name
     */
    public static String normalizeName(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
