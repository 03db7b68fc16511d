package com.docpublish.core.renderer.impl;

import com.docpublish.core.renderer.GeneratedFile;
import com.docpublish.core.renderer.GeneratedOutput;
import com.docpublish.core.renderer.RenderContext;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private final StringWriter buffer = new StringWriter();
    private final ConsoleRenderer renderer = new ConsoleRenderer(new PrintWriter(buffer));

    @Test
    void render_singleFile_printsContentOnly() {
        renderer.render(GeneratedOutput.of(new GeneratedFile("guide.txt", "text\n", "text/plain")),
            RenderContext.of(Path.of(".")));

        assertThat(buffer.toString()).isEqualTo("text\n");
    }

    @Test
    void render_severalFiles_printsHeaders() {
        renderer.render(new GeneratedOutput(List.of(
                new GeneratedFile("a.txt", "one", "text/plain"),
                new GeneratedFile("b.txt", "two\n", "text/plain"))),
            RenderContext.of(Path.of(".")));

        assertThat(buffer.toString().lines())
            .containsExactly("==> a.txt <==", "one", "==> b.txt <==", "two");
    }
}
