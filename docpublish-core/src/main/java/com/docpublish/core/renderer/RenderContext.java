package com.docpublish.core.renderer;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where and how renderers emit files.
 *
 * @param outputDirectory directory receiving the files
 * @param encoding character encoding of written files
 */
public record RenderContext(
    Path outputDirectory,
    Charset encoding
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        if (encoding == null) {
            encoding = StandardCharsets.UTF_8;
        }
    }

    /**
     * Creates a context writing UTF-8.
     *
     * @param outputDirectory directory receiving the files
     * @return context
     */
    public static RenderContext of(Path outputDirectory) {
        return new RenderContext(outputDirectory, StandardCharsets.UTF_8);
    }

    /**
     * Resolves a generated file against the output directory.
     *
     * @param file generated file
     * @return target path
     */
    public Path resolve(GeneratedFile file) {
        return outputDirectory.resolve(file.relativePath());
    }
}
