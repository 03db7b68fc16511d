package com.docpublish.core.error;

import java.util.Locale;

/**
 * Named points on the 0-10 severity scale used by conditions, report-level and halt-level.
 *
 * <p>Numbers between named points are legal; they take the label of the highest named level
 * not above them (e.g. 5 is reported as {@code WARNING}).
 *
 * @since 1.0.0
 */
public enum Severity {
    /** Debugging detail, never reported with default settings. */
    DEBUG(0),

    /** Informational, suppressed with the default report-level. */
    INFO(2),

    /** Possible problem, reported with the default report-level. */
    WARNING(4),

    /** Definite problem; the run continues. */
    ERROR(6),

    /** Severe problem; halts the run with the default halt-level. */
    SEVERE(8);

    /** Lowest legal severity. */
    public static final int MIN = 0;

    /** Highest legal severity. */
    public static final int MAX = 10;

    private final int level;

    Severity(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    /**
     * Returns the named level a numeric severity falls under.
     *
     * @param severity value in {@code MIN..MAX}
     * @return highest named level whose value is {@code <= severity}
     */
    public static Severity of(int severity) {
        checkRange(severity);
        Severity result = DEBUG;
        for (Severity candidate : values()) {
            if (candidate.level <= severity) {
                result = candidate;
            }
        }
        return result;
    }

    /**
     * Returns the label printed for a numeric severity.
     *
     * @param severity value in {@code MIN..MAX}
     * @return upper-case label such as {@code WARNING}
     */
    public static String labelOf(int severity) {
        return of(severity).name();
    }

    /**
     * Parses a severity given either as a number or as a label (case-insensitive).
     *
     * @param raw text such as {@code "5"} or {@code "warning"}
     * @return numeric severity
     * @throws IllegalArgumentException if the text is neither a number in range nor a label
     */
    public static int parse(String raw) {
        String value = raw.trim();
        try {
            int parsed = Integer.parseInt(value);
            checkRange(parsed);
            return parsed;
        } catch (NumberFormatException e) {
            try {
                return valueOf(value.toUpperCase(Locale.ROOT)).level;
            } catch (IllegalArgumentException unknown) {
                throw new IllegalArgumentException("Not a severity: '" + raw + "'", unknown);
            }
        }
    }

    private static void checkRange(int severity) {
        if (severity < MIN || severity > MAX) {
            throw new IllegalArgumentException(
                "Severity must be between " + MIN + " and " + MAX + ": " + severity);
        }
    }
}
