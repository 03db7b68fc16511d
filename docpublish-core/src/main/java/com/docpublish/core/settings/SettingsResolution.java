package com.docpublish.core.settings;

import com.docpublish.core.error.StructuralWarning;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one settings resolution: the settings plus what was read on the way.
 *
 * @param settings resolved settings
 * @param processedFiles configuration files read, in processing order (includes listed where
 *     they were read)
 * @param warnings structural warnings raised while reading
 */
public record SettingsResolution(
    Settings settings,
    List<Path> processedFiles,
    List<StructuralWarning> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public SettingsResolution {
        Objects.requireNonNull(settings, "settings must not be null");
        processedFiles = processedFiles == null ? List.of() : List.copyOf(processedFiles);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
