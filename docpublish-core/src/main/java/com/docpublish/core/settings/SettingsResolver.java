package com.docpublish.core.settings;

import com.docpublish.core.error.ConfigException;
import com.docpublish.core.error.StructuralWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the {@link Settings} of one run from option defaults and configuration files.
 *
 * <h2>Precedence</h2>
 * <p>From lowest to highest:
 * <ol>
 *   <li>option defaults from the {@link SettingsRegistry}</li>
 *   <li>the standard files, in list order ({@link StandardConfigFiles})</li>
 *   <li>the document-specific file {@code <source>.conf}, when the source is a file</li>
 *   <li>programmatic overrides passed to {@link #resolveWithReport(Path, Map)}</li>
 * </ol>
 * Later sources overwrite earlier ones key by key.
 *
 * <h2>Includes</h2>
 * <p>A {@code config: <path>} line reads another file, relative paths being resolved against the
 * including file's directory. Inside one file, includes are merged in line order and the
 * file's own keys are merged on top of them, wherever the {@code config:} line appears. Each file
 * is read at most once per resolution, which breaks include cycles.
 *
 * <h2>Invalid values</h2>
 * <p>Values of recognised options are parsed with their {@link OptionType}. A failure is handed to
 * the {@link InvalidValuePolicy} together with the value resolved so far from lower-precedence
 * sources. The default, {@link InvalidValuePolicy#KEEP_CURRENT}, keeps that value, so an invalid
 * line never undoes a valid one read earlier. Unrecognised keys are stored as raw strings.
 */
public class SettingsResolver {

    private static final Logger log = LoggerFactory.getLogger(SettingsResolver.class);

    private final SettingsRegistry registry;
    private final List<Path> standardFiles;
    private final InvalidValuePolicy invalidValuePolicy;

    /**
     * Creates a resolver reading the standard configuration files and ignoring invalid values.
     *
     * @param registry option catalogue
     */
    public SettingsResolver(SettingsRegistry registry) {
        this(registry, StandardConfigFiles.defaults(), InvalidValuePolicy.KEEP_CURRENT);
    }

    /**
     * Creates a resolver.
     *
     * @param registry option catalogue
     * @param standardFiles standard configuration files in processing order
     * @param invalidValuePolicy what to do with values that fail to parse
     */
    public SettingsResolver(SettingsRegistry registry, List<Path> standardFiles, InvalidValuePolicy invalidValuePolicy) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.standardFiles = List.copyOf(Objects.requireNonNull(standardFiles, "standardFiles must not be null"));
        this.invalidValuePolicy = Objects.requireNonNull(invalidValuePolicy, "invalidValuePolicy must not be null");
    }

    public SettingsRegistry registry() {
        return registry;
    }

    /**
     * Resolves settings for a run without a file-backed source.
     *
     * @return resolved settings
     */
    public Settings resolve() {
        return resolveWithReport(null, Map.of()).settings();
    }

    /**
     * Resolves settings for a file-backed source.
     *
     * @param source source document, or {@code null}
     * @return resolved settings
     */
    public Settings resolve(Path source) {
        return resolveWithReport(source, Map.of()).settings();
    }

    /**
     * Resolves settings and reports which files were read and which warnings came up.
     *
     * @param source source document, or {@code null} for non-file sources
     * @param overrides raw option values applied last (e.g. from the command line)
     * @return settings with resolution details
     * @throws ConfigException if a value is invalid and the policy aborts
     */
    public SettingsResolution resolveWithReport(Path source, Map<String, String> overrides) {
        Resolution resolution = new Resolution();

        Map<String, Object> values = new LinkedHashMap<>();
        for (OptionDefinition definition : registry.definitions()) {
            values.put(definition.name(), definition.defaultValue());
        }

        for (Path file : configSources(source)) {
            if (!Files.isRegularFile(file)) {
                log.debug("Configuration file not present: {}", file);
                continue;
            }
            readFile(file, resolution, values);
        }

        overrides.forEach((name, raw) -> {
            String key = SettingsRegistry.normalizeName(name);
            values.put(key, parseValue(key, raw, null, 0, values));
        });

        log.debug("Resolved {} settings from {} configuration file(s)", values.size(), resolution.processed.size());
        return new SettingsResolution(new Settings(values), new ArrayList<>(resolution.processed), resolution.warnings);
    }

    /**
     * Returns the configuration files consulted for a source, lowest precedence first.
     *
     * @param source source document, or {@code null}
     * @return files to read, existing or not
     */
    public List<Path> configSources(Path source) {
        List<Path> sources = new ArrayList<>(standardFiles);
        if (source != null && source.getFileName() != null) {
            sources.add(StandardConfigFiles.documentSpecific(source));
        }
        return sources;
    }

    private void readFile(Path file, Resolution resolution, Map<String, Object> values) {
        Path key = file.toAbsolutePath().normalize();
        if (!resolution.processed.add(key)) {
            log.debug("Configuration file already read, skipping: {}", key);
            return;
        }

        ConfigFileParser.ParsedConfigFile parsed;
        try {
            parsed = ConfigFileParser.parse(key);
        } catch (IOException e) {
            resolution.warn(new StructuralWarning(key.toString(), 0, "Cannot read configuration file: " + e.getMessage()));
            return;
        }
        log.debug("Reading configuration from: {}", key);
        parsed.warnings().forEach(resolution::warn);

        List<ConfigEntry> own = new ArrayList<>();
        for (ConfigEntry entry : parsed.entries()) {
            if (StandardOptions.CONFIG.equals(entry.name())) {
                includeFile(key, entry, resolution, values);
            } else {
                own.add(entry);
            }
        }
        for (ConfigEntry entry : own) {
            values.put(entry.name(), parseValue(entry.name(), entry.rawValue(), key, entry.line(), values));
        }
    }

    private void includeFile(Path includingFile, ConfigEntry entry, Resolution resolution, Map<String, Object> values) {
        Object value = parseValue(entry.name(), entry.rawValue(), includingFile, entry.line(), values);
        if (!(value instanceof Path path)) {
            return;
        }
        Path target = path.isAbsolute() ? path : includingFile.getParent().resolve(path);
        if (!Files.isRegularFile(target)) {
            resolution.warn(new StructuralWarning(includingFile.toString(), entry.line(),
                "Included configuration file not found: " + target));
            return;
        }
        readFile(target, resolution, values);
    }

    private Object parseValue(String name, String raw, Path file, int line, Map<String, Object> values) {
        Optional<OptionDefinition> definition = registry.lookup(name);
        if (definition.isEmpty()) {
            log.debug("Unrecognised option '{}' kept as raw text", name);
            return raw;
        }
        try {
            return definition.get().type().parse(raw);
        } catch (IllegalArgumentException e) {
            String location = file == null ? "override" : file + " line " + line;
            ConfigException error = new ConfigException(
                String.format("Invalid value for '%s' (%s): %s", name, location, e.getMessage()),
                file, line, name, raw, e);
            Object fallback = invalidValuePolicy.onInvalidValue(definition.get(), values.get(name), error);
            log.warn("{}. Using {}", error.getMessage(), fallback);
            return fallback;
        }
    }

    private static final class Resolution {
        private final Set<Path> processed = new LinkedHashSet<>();
        private final List<StructuralWarning> warnings = new ArrayList<>();

        private void warn(StructuralWarning warning) {
            log.warn("Configuration warning: {}", warning);
            warnings.add(warning);
        }
    }
}
