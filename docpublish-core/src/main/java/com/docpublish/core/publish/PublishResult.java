package com.docpublish.core.publish;

import com.docpublish.core.reader.ReadResult;
import com.docpublish.core.renderer.GeneratedOutput;
import com.docpublish.core.settings.SettingsResolution;

import java.util.Objects;

/**
 * Everything one publish run produced.
 *
 * @param settings resolved settings with the configuration files read
 * @param read transformed document and transform summary
 * @param output files produced by the writer
 */
public record PublishResult(
    SettingsResolution settings,
    ReadResult read,
    GeneratedOutput output
) {
    /**
     * Compact constructor with validation.
     */
    public PublishResult {
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(read, "read must not be null");
        Objects.requireNonNull(output, "output must not be null");
    }
}
