package com.docpublish.core.transform;

import com.docpublish.core.error.Reporter;
import com.docpublish.core.settings.Settings;
import com.docpublish.core.settings.StandardOptions;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Creates the {@link Reporter} for one scheduler run from the run's settings.
 */
@FunctionalInterface
public interface ReporterFactory {

    /**
     * Writes to the {@code warning-stream} file when set, otherwise to standard error.
     */
    ReporterFactory STANDARD = settings -> {
        Path warningStream = settings.getPath(StandardOptions.WARNING_STREAM);
        return warningStream == null
            ? Reporter.standardError(settings.reportLevel())
            : Reporter.toFile(warningStream, settings.reportLevel());
    };

    /**
     * Creates a reporter.
     *
     * @param settings run settings
     * @return reporter honouring the run's report-level
     * @throws IOException if the destination cannot be opened
     */
    Reporter create(Settings settings) throws IOException;

    /**
     * Returns a factory writing to a fixed stream.
     *
     * @param out destination
     * @return factory
     */
    static ReporterFactory to(PrintStream out) {
        return settings -> new Reporter(out, settings.reportLevel());
    }
}
