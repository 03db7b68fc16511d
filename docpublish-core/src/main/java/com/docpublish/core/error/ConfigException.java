package com.docpublish.core.error;

import java.nio.file.Path;

/**
 * A configuration value could not be parsed or failed validation against its option type.
 *
 * <p>Whether this aborts settings resolution is decided by the caller's invalid-value policy.
 */
public class ConfigException extends PublishException {

    private static final long serialVersionUID = 1L;

    private final transient Path file;
    private final int line;
    private final String key;
    private final String rawValue;

    public ConfigException(String message, Path file, int line, String key, String rawValue, Throwable cause) {
        super(message, cause);
        this.file = file;
        this.line = line;
        this.key = key;
        this.rawValue = rawValue;
    }

    /** The configuration file, or {@code null} for programmatic overrides. */
    public Path file() {
        return file;
    }

    /** One-based line in {@link #file()}, or 0 when not read from a file. */
    public int line() {
        return line;
    }

    public String key() {
        return key;
    }

    public String rawValue() {
        return rawValue;
    }
}
