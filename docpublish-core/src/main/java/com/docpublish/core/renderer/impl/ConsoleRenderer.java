package com.docpublish.core.renderer.impl;

import com.docpublish.core.renderer.GeneratedFile;
import com.docpublish.core.renderer.GeneratedOutput;
import com.docpublish.core.renderer.OutputRenderer;
import com.docpublish.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Prints generated files to a stream, standard output by default.
 *
 * <p>A single file is printed as-is so the output can be piped. Several files are each preceded
 * by a {@code ==> path <==} header.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private final PrintWriter out;

    public ConsoleRenderer() {
        this(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
    }

    public ConsoleRenderer(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        logger.debug("Printing {} file(s)", output.files().size());
        boolean headers = output.files().size() > 1;
        for (GeneratedFile file : output.files()) {
            if (headers) {
                out.println("==> " + file.relativePath() + " <==");
            }
            out.print(file.content());
            if (headers && !file.content().endsWith("\n")) {
                out.println();
            }
        }
        out.flush();
    }
}
