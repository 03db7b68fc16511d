package com.docpublish.core.renderer;

import java.util.Objects;

/**
 * One rendered output file.
 *
 * @param relativePath path relative to the output directory (e.g., "guide.html")
 * @param content file content
 * @param contentType media type of the content (e.g., "text/html")
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }
}
