package com.docpublish.core.settings;

import com.docpublish.core.error.Severity;

import java.util.List;

/**
 * Options every run recognises, independent of reader and writer.
 */
public final class StandardOptions {

    public static final String REPORT_LEVEL = "report-level";
    public static final String HALT_LEVEL = "halt-level";
    /** Reserved: includes another configuration file. */
    public static final String CONFIG = "config";
    public static final String OUTPUT_ENCODING = "output-encoding";
    public static final String WARNING_STREAM = "warning-stream";
    public static final String TRACEBACK = "traceback";

    public static final int DEFAULT_REPORT_LEVEL = Severity.WARNING.level();
    public static final int DEFAULT_HALT_LEVEL = Severity.SEVERE.level();

    private StandardOptions() {
        // Utility class
    }

    /**
     * Returns the standard option definitions.
     *
     * @return definitions in display order
     */
    public static List<OptionDefinition> definitions() {
        return List.of(
            new OptionDefinition(REPORT_LEVEL, OptionType.level(), DEFAULT_REPORT_LEVEL,
                "Minimum severity of conditions written to the warning stream"),
            new OptionDefinition(HALT_LEVEL, OptionType.level(), DEFAULT_HALT_LEVEL,
                "Minimum severity of conditions that abort the run"),
            new OptionDefinition(CONFIG, OptionType.nullablePath(), null,
                "Additional configuration file to read"),
            new OptionDefinition(OUTPUT_ENCODING, OptionType.string(), "UTF-8",
                "Character encoding of written output"),
            new OptionDefinition(WARNING_STREAM, OptionType.nullablePath(), null,
                "File receiving reported conditions (standard error when unset)"),
            new OptionDefinition(TRACEBACK, OptionType.bool(), Boolean.FALSE,
                "Print stack traces of fatal errors")
        );
    }
}
