package com.docpublish.core.settings;

import com.docpublish.core.error.StructuralWarning;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a configuration file into {@link ConfigEntry} lines.
 *
 * <p>Format: one {@code name: value} pair per line. Blank lines and lines starting with
 * {@code #} are ignored. The name is everything before the first {@code :}; a line without a
 * separator yields a {@link StructuralWarning} and is skipped. Values are not interpreted here.
 */
public final class ConfigFileParser {

    static final char SEPARATOR = ':';
    static final String COMMENT_MARKER = "#";

    private ConfigFileParser() {
        // Utility class
    }

    /**
     * Result of parsing one file.
     *
     * @param file parsed file
     * @param entries recognised lines in file order
     * @param warnings malformed lines
     */
    public record ParsedConfigFile(Path file, List<ConfigEntry> entries, List<StructuralWarning> warnings) {
        /**
         * Compact constructor with defensive copies.
         */
        public ParsedConfigFile {
            entries = List.copyOf(entries);
            warnings = List.copyOf(warnings);
        }
    }

    /**
     * Reads and splits a configuration file.
     *
     * @param file file to read (UTF-8)
     * @return parsed entries and warnings
     * @throws IOException if the file cannot be read
     */
    public static ParsedConfigFile parse(Path file) throws IOException {
        return parse(file, Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    /**
     * Splits already-read configuration lines.
     *
     * @param file file the lines came from, used in warnings
     * @param lines file content
     * @return parsed entries and warnings
     */
    public static ParsedConfigFile parse(Path file, List<String> lines) {
        List<ConfigEntry> entries = new ArrayList<>();
        List<StructuralWarning> warnings = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            int lineNumber = i + 1;
            String line = lines.get(i).strip();
            if (line.isEmpty() || line.startsWith(COMMENT_MARKER)) {
                continue;
            }
            int separator = line.indexOf(SEPARATOR);
            if (separator < 0) {
                warnings.add(new StructuralWarning(file.toString(), lineNumber,
                    "Missing '" + SEPARATOR + "' separator, line ignored: " + line));
                continue;
            }
            String name = SettingsRegistry.normalizeName(line.substring(0, separator));
            if (name.isEmpty()) {
                warnings.add(new StructuralWarning(file.toString(), lineNumber,
                    "Missing option name, line ignored: " + line));
                continue;
            }
            entries.add(new ConfigEntry(name, line.substring(separator + 1).strip(), lineNumber));
        }
        return new ParsedConfigFile(file, entries, warnings);
    }
}
