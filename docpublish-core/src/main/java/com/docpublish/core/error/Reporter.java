package com.docpublish.core.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes conditions to the error-reporting destination, gated by report-level.
 *
 * <p>Every condition is logged at DEBUG regardless of level; only conditions whose severity is
 * at least the report-level are printed, one line each:
 * <pre>
 * WARNING [line 12] Duplicate section title
 * ERROR Unknown reference target
 * </pre>
 */
public class Reporter implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(Reporter.class);

    private final PrintStream out;
    private final int reportLevel;
    private final boolean ownsStream;

    /**
     * Creates a reporter writing to a stream it does not own.
     *
     * @param out destination
     * @param reportLevel minimum severity that is printed
     */
    public Reporter(PrintStream out, int reportLevel) {
        this(out, reportLevel, false);
    }

    private Reporter(PrintStream out, int reportLevel, boolean ownsStream) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        Severity.of(reportLevel);
        this.reportLevel = reportLevel;
        this.ownsStream = ownsStream;
    }

    /**
     * Creates a reporter writing to standard error.
     *
     * @param reportLevel minimum severity that is printed
     * @return reporter
     */
    public static Reporter standardError(int reportLevel) {
        return new Reporter(System.err, reportLevel);
    }

    /**
     * Creates a reporter appending to a file; the file is closed with the reporter.
     *
     * @param file warning stream file
     * @param reportLevel minimum severity that is printed
     * @return reporter
     * @throws IOException if the file cannot be opened
     */
    public static Reporter toFile(Path file, int reportLevel) throws IOException {
        PrintStream stream = new PrintStream(new FileOutputStream(file.toFile(), true), true, StandardCharsets.UTF_8);
        return new Reporter(stream, reportLevel, true);
    }

    public int reportLevel() {
        return reportLevel;
    }

    /**
     * Reports a condition.
     *
     * @param condition condition to report
     * @return true if the condition reached report-level and was printed
     */
    public boolean report(Condition condition) {
        log.debug("Condition recorded: {}", format(condition));
        if (condition.severity() < reportLevel) {
            return false;
        }
        out.println(format(condition));
        out.flush();
        return true;
    }

    /**
     * Formats a condition as {@code <LABEL> [line <N>] <message>}.
     *
     * @param condition condition to format
     * @return single-line representation
     */
    public static String format(Condition condition) {
        StringBuilder sb = new StringBuilder(condition.label());
        condition.lineNumber().ifPresent(line -> sb.append(" [line ").append(line).append(']'));
        return sb.append(' ').append(condition.message()).toString();
    }

    @Override
    public void close() {
        if (ownsStream) {
            out.close();
        }
    }
}
