package com.docpublish.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Files produced by a writer for one document.
 *
 * @param files generated files in output order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput of(GeneratedFile file) {
        return new GeneratedOutput(List.of(file));
    }
}
