package com.docpublish.core.error;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Reporter}.
 */
class ReporterTest {

    @TempDir
    Path tempDir;

    @Test
    void report_belowReportLevel_isNotPrinted() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Reporter reporter = new Reporter(new PrintStream(buffer, true, StandardCharsets.UTF_8), 4);

        boolean printed = reporter.report(new Condition(3, "quiet", null, null));

        assertThat(printed).isFalse();
        assertThat(buffer.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void report_atOrAboveReportLevel_isPrinted() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Reporter reporter = new Reporter(new PrintStream(buffer, true, StandardCharsets.UTF_8), 4);

        reporter.report(new Condition(5, "loud", 12, null));
        reporter.report(Condition.of(Severity.ERROR, "no line"));

        assertThat(buffer.toString(StandardCharsets.UTF_8).lines())
            .containsExactly("WARNING [line 12] loud", "ERROR no line");
    }

    @Test
    void toFile_appendsToWarningStream() throws IOException {
        Path file = tempDir.resolve("warnings.log");

        try (Reporter reporter = Reporter.toFile(file, 0)) {
            reporter.report(Condition.of(Severity.INFO, "first"));
        }
        try (Reporter reporter = Reporter.toFile(file, 0)) {
            reporter.report(Condition.of(Severity.INFO, "second"));
        }

        assertThat(Files.readAllLines(file)).containsExactly("INFO first", "INFO second");
    }
}
