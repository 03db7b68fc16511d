package com.docpublish.core.renderer.impl;

import com.docpublish.core.renderer.GeneratedFile;
import com.docpublish.core.renderer.GeneratedOutput;
import com.docpublish.core.renderer.OutputRenderer;
import com.docpublish.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes generated files below the output directory, creating directories as needed and
 * overwriting existing files.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GeneratedOutput output = writer.output();
 * new FileSystemRenderer().render(output, RenderContext.of(Path.of("build/docs")));
 * // Creates: build/docs/guide.html
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory();
        logger.info("Writing {} file(s) to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }
        for (GeneratedFile file : output.files()) {
            writeFile(context, file);
        }
    }

    private void writeFile(RenderContext context, GeneratedFile file) {
        Path targetPath = context.resolve(file);
        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), context.encoding());
            logger.info("Wrote file: {} ({} chars)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
