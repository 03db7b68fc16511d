package com.docpublish.core.reader;

import com.docpublish.core.TestDocuments;
import com.docpublish.core.reader.impl.PlainTextParser;
import com.docpublish.core.reader.impl.StandaloneReader;
import com.docpublish.core.settings.OptionDefinition;
import com.docpublish.core.transform.ReporterFactory;
import com.docpublish.core.transform.TransformOrderCounter;
import com.docpublish.core.transform.TransformScheduler;
import com.docpublish.core.transform.impl.DocTitleTransform;
import com.docpublish.core.transform.impl.StripCommentsTransform;
import com.docpublish.core.tree.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Reader}, {@link StandaloneReader} and {@link DocumentSource}.
 */
class ReaderTest {

    @TempDir
    Path tempDir;

    private final TransformScheduler scheduler = new TransformScheduler(new TransformOrderCounter(),
        ReporterFactory.to(new PrintStream(OutputStream.nullOutputStream())));

    @Test
    void read_parsesAndRunsStockTransforms() {
        // Given
        Reader reader = new StandaloneReader(new PlainTextParser());
        DocumentSource source = DocumentSource.fromString("guide.txt", "# Guide\n\nIntro\n\n## Part\n\nBody\n");

        // When
        ReadResult result = reader.read(source, TestDocuments.defaultSettings(), scheduler);

        // Then
        Document document = result.document();
        assertThat(document.attribute(document.root(), DocTitleTransform.TITLE_ATTRIBUTE)).contains("Guide");
        assertThat(result.transforms().executedTransforms())
            .containsExactly("section-ids", "doc-title", "strip-comments", "filter-messages");
    }

    @Test
    void read_customTransformList_runsOnlyThose() {
        Reader reader = new StandaloneReader(new PlainTextParser(), List.of(StripCommentsTransform::new));

        ReadResult result = reader.read(DocumentSource.fromString("a.txt", "text"),
            TestDocuments.defaultSettings(), scheduler);

        assertThat(result.transforms().executedTransforms()).containsExactly("strip-comments");
    }

    @Test
    void read_emptySource_skipsTransforms() {
        Reader reader = new StandaloneReader(new PlainTextParser());

        ReadResult result = reader.read(DocumentSource.fromString("empty.txt", ""),
            TestDocuments.defaultSettings(), scheduler);

        assertThat(result.document().isEmpty()).isTrue();
        assertThat(result.transforms().skipped()).isTrue();
    }

    @Test
    void getSettingsSpec_includesTransformOptions() {
        Reader reader = new StandaloneReader(new PlainTextParser());

        assertThat(reader.getSettingsSpec()).extracting(OptionDefinition::name)
            .containsExactly("doctitle-xform", "strip-comments", "keep-quiet-messages");
    }

    @Test
    void documentSource_readLines_keepsTrailingEmptyLine() {
        DocumentSource source = DocumentSource.fromString("a.txt", "one\r\ntwo\n");

        assertThat(source.readLines()).containsExactly("one", "two", "");
    }

    @Test
    void documentSource_fromPath_keepsPath() throws IOException {
        Path file = Files.writeString(tempDir.resolve("doc.txt"), "text");

        DocumentSource source = DocumentSource.fromPath(file);

        assertThat(source.path()).contains(file);
        assertThat(source.text()).isEqualTo("text");
        assertThat(DocumentSource.fromString("inline", "x").path()).isEmpty();
    }

    @Test
    void documentSource_fromPath_missingFile_throwsUncheckedIOException() {
        assertThatThrownBy(() -> DocumentSource.fromPath(tempDir.resolve("missing.txt")))
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("missing.txt");
    }

    @Test
    void documentSource_fromStream_readsUtf8() {
        DocumentSource source = DocumentSource.fromStream("stdin",
            new ByteArrayInputStream("Grüße".getBytes(StandardCharsets.UTF_8)));

        assertThat(source.text()).isEqualTo("Grüße");
    }
}
