package com.docpublish.core.reader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Raw input of a document: a name, the text, and the file it came from when there is one.
 *
 * <p>The text is split on line terminators without dropping trailing empty lines, so joining
 * {@link #readLines()} with {@code "\n"} gives back the text (with line terminators normalised).
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * DocumentSource source = DocumentSource.fromPath(Path.of("guide.txt"));
 * DocumentSource inline = DocumentSource.fromString("<inline>", "# Title\n\nBody\n");
 * }</pre>
 */
public final class DocumentSource {

    private final String name;
    private final String text;
    private final Path path;

    private DocumentSource(String name, String text, Path path) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.path = path;
    }

    /**
     * Reads a UTF-8 file.
     *
     * @param file file to read
     * @return source named after the file
     * @throws UncheckedIOException if the file cannot be read
     */
    public static DocumentSource fromPath(Path file) {
        return fromPath(file, StandardCharsets.UTF_8);
    }

    /**
     * Reads a file in the given encoding.
     *
     * @param file file to read
     * @param charset input encoding
     * @return source named after the file
     * @throws UncheckedIOException if the file cannot be read
     */
    public static DocumentSource fromPath(Path file, Charset charset) {
        Objects.requireNonNull(file, "file must not be null");
        try {
            return new DocumentSource(file.toString(), Files.readString(file, charset), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read source " + file, e);
        }
    }

    public static DocumentSource fromString(String name, String text) {
        return new DocumentSource(name, text, null);
    }

    public static DocumentSource fromLines(String name, List<String> lines) {
        return new DocumentSource(name, String.join("\n", lines), null);
    }

    /**
     * Reads a stream to its end as UTF-8; the stream is not closed.
     *
     * @param name source name used in diagnostics
     * @param in input stream
     * @return source
     * @throws UncheckedIOException if the stream cannot be read
     */
    public static DocumentSource fromStream(String name, InputStream in) {
        Objects.requireNonNull(in, "in must not be null");
        try {
            return new DocumentSource(name, new String(in.readAllBytes(), StandardCharsets.UTF_8), null);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read source " + name, e);
        }
    }

    public String name() {
        return name;
    }

    public String text() {
        return text;
    }

    /**
     * Returns the file backing this source, used to locate its document-specific configuration.
     *
     * @return file, or empty for in-memory sources
     */
    public Optional<Path> path() {
        return Optional.ofNullable(path);
    }

    /**
     * Splits the text into lines.
     *
     * @return lines without terminators; text ending in a newline yields a trailing empty line
     */
    public List<String> readLines() {
        return Arrays.asList(text.split("\\R", -1));
    }

    @Override
    public String toString() {
        return "DocumentSource[" + name + "]";
    }
}
