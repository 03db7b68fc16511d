package com.docpublish.core.settings;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Well-known configuration file locations, in processing order (later files win).
 *
 * <ol>
 *   <li>{@code /etc/docpublish.conf}</li>
 *   <li>{@code ~/.docpublish.conf}</li>
 *   <li>{@code ./docpublish.conf}</li>
 * </ol>
 *
 * <p>The {@value #ENVIRONMENT_VARIABLE} environment variable replaces the list with its own
 * entries, separated by the platform path separator. The document-specific file
 * ({@link #documentSpecific(Path)}) is processed after all of them.
 */
public final class StandardConfigFiles {

    public static final String ENVIRONMENT_VARIABLE = "DOCPUBLISH_CONFIG";
    public static final String DOCUMENT_CONFIG_SUFFIX = ".conf";

    private StandardConfigFiles() {
        // Utility class
    }

    /**
     * Returns the standard list for the current process.
     *
     * @return configuration files, existing or not
     */
    public static List<Path> defaults() {
        return fromEnvironment(System.getenv(), Path.of(System.getProperty("user.home")), Path.of(""));
    }

    /**
     * Returns the standard list for a given environment.
     *
     * @param environment environment variables
     * @param home user home directory
     * @param workingDirectory current directory
     * @return configuration files, existing or not
     */
    public static List<Path> fromEnvironment(Map<String, String> environment, Path home, Path workingDirectory) {
        String override = environment.get(ENVIRONMENT_VARIABLE);
        if (override != null) {
            List<Path> files = new ArrayList<>();
            for (String entry : override.split(File.pathSeparator)) {
                if (!entry.isBlank()) {
                    files.add(Path.of(entry.trim()));
                }
            }
            return List.copyOf(files);
        }
        return List.of(
            Path.of("/etc/docpublish.conf"),
            home.resolve(".docpublish.conf"),
            workingDirectory.resolve("docpublish.conf")
        );
    }

    /**
     * Returns the configuration file belonging to a path-backed source: the source file name
     * with {@value #DOCUMENT_CONFIG_SUFFIX} appended, in the same directory.
     *
     * @param source source document path
     * @return document-specific configuration file
     */
    public static Path documentSpecific(Path source) {
        Path fileName = source.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("Source has no file name: " + source);
        }
        return source.resolveSibling(fileName + DOCUMENT_CONFIG_SUFFIX);
    }
}
