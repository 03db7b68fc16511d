package com.docpublish.core.settings;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigFileParser}.
 */
class ConfigFileParserTest {

    private static final Path FILE = Path.of("docpublish.conf");

    @Test
    void parse_skipsCommentsAndBlankLines() {
        // Given
        List<String> lines = List.of(
            "# comment",
            "",
            "report_level: 2",
            "  output-encoding :  latin-1  "
        );

        // When
        ConfigFileParser.ParsedConfigFile parsed = ConfigFileParser.parse(FILE, lines);

        // Then
        assertThat(parsed.warnings()).isEmpty();
        assertThat(parsed.entries()).containsExactly(
            new ConfigEntry("report-level", "2", 3),
            new ConfigEntry("output-encoding", "latin-1", 4));
    }

    @Test
    void parse_lineWithoutSeparator_warnsAndContinues() {
        ConfigFileParser.ParsedConfigFile parsed = ConfigFileParser.parse(FILE,
            List.of("no separator here", "traceback: yes"));

        assertThat(parsed.entries()).extracting(ConfigEntry::name).containsExactly("traceback");
        assertThat(parsed.warnings()).singleElement()
            .satisfies(warning -> {
                assertThat(warning.line()).isEqualTo(1);
                assertThat(warning.message()).contains("separator");
            });
    }

    @Test
    void parse_valueMayContainSeparator() {
        ConfigFileParser.ParsedConfigFile parsed = ConfigFileParser.parse(FILE,
            List.of("html-stylesheet: C:/styles/site.css"));

        assertThat(parsed.entries().get(0).rawValue()).isEqualTo("C:/styles/site.css");
    }
}
