package com.docpublish.core.writer.impl;

import com.docpublish.core.TestDocuments;
import com.docpublish.core.settings.Settings;
import com.docpublish.core.transform.TransformScheduler;
import com.docpublish.core.tree.Document;
import com.docpublish.core.tree.NodeId;
import com.docpublish.core.tree.NodeKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link HtmlWriter}.
 */
class HtmlWriterTest {

    @Test
    void attach_fillsAllParts() {
        // Given
        Document document = TestDocuments.empty();
        document.setAttribute(document.root(), "title", "Guide & Notes");
        NodeId section = TestDocuments.section(document, document.root(), "Usage");
        document.setAttribute(section, "id", "usage");
        TestDocuments.paragraph(document, section, "Use <b> tags");
        HtmlWriter writer = new HtmlWriter();

        // When
        writer.attach(document);

        // Then
        assertThat(writer.part(HtmlWriter.HEAD).content()).isEqualTo("<meta charset=\"UTF-8\">\n");
        assertThat(writer.part(HtmlWriter.TITLE).content()).isEqualTo("Guide &amp; Notes");
        assertThat(writer.part(HtmlWriter.BODY).content()).isEqualTo(
            "<section id=\"usage\">\n<h2>Usage</h2>\n<p>Use &lt;b&gt; tags</p>\n</section>\n");
        assertThat(writer.part(HtmlWriter.MESSAGES).isEmpty()).isTrue();
    }

    @Test
    void attach_withoutDocumentTitle_usesSourceNameAndTopLevelHeadings() {
        Document document = TestDocuments.empty();
        TestDocuments.section(document, document.root(), "Usage");
        HtmlWriter writer = new HtmlWriter();

        writer.attach(document);

        assertThat(writer.part(HtmlWriter.TITLE).content()).isEqualTo("test.txt");
        assertThat(writer.part(HtmlWriter.BODY).content()).contains("<h1>Usage</h1>");
    }

    @Test
    void attach_diagnosticsSection_goesToMessagesPartWithBacklink() {
        // Given
        Document document = TestDocuments.empty();
        NodeId paragraph = TestDocuments.paragraph(document, document.root(), "text");
        document.setAttribute(paragraph, "id", "id1");
        NodeId diagnostics = TestDocuments.section(document, document.root(), TransformScheduler.DIAGNOSTICS_TITLE);
        document.setAttribute(diagnostics, "class", TransformScheduler.DIAGNOSTICS_CLASS);
        NodeId message = document.createNode(NodeKind.SYSTEM_MESSAGE);
        document.setAttribute(message, "type", "ERROR");
        document.setAttribute(message, "source", "test.txt");
        document.setAttribute(message, "line", "3");
        TestDocuments.paragraph(document, message, "Broken");
        document.appendChild(diagnostics, message);
        document.addBackReference(message, paragraph);
        HtmlWriter writer = new HtmlWriter();

        // When
        writer.attach(document);

        // Then
        assertThat(writer.part(HtmlWriter.BODY).content()).isEqualTo("<p id=\"id1\">text</p>\n");
        assertThat(writer.part(HtmlWriter.MESSAGES).content())
            .startsWith("<section class=\"system-messages\">\n")
            .contains("<p class=\"system-message-title\">ERROR (test.txt, line 3) <a href=\"#id1\">backlink</a></p>")
            .contains("<p>Broken</p>")
            .endsWith("</section>\n");
    }

    @Test
    void attach_stylesheetSetting_linksStylesheet() {
        Settings settings = TestDocuments.defaultSettings()
            .with(HtmlWriter.STYLESHEET_SETTING, Path.of("css", "site.css"));
        Document document = TestDocuments.withParagraphs(settings, "text");
        HtmlWriter writer = new HtmlWriter();

        writer.attach(document);

        assertThat(writer.part(HtmlWriter.HEAD).content())
            .contains("<link rel=\"stylesheet\" href=\"css/site.css\">");
    }

    @Test
    void attach_elementWithInvalidTag_isSkippedAndRecorded() {
        Document document = TestDocuments.withParagraphs("kept");
        NodeId element = document.createNode(NodeKind.ELEMENT);
        document.setAttribute(element, "tag", "bad tag");
        document.appendChild(document.root(), element);
        NodeId aside = document.createNode(NodeKind.ELEMENT);
        document.setAttribute(aside, "tag", "aside");
        document.appendChild(document.root(), aside);
        HtmlWriter writer = new HtmlWriter();

        writer.attach(document);

        assertThat(writer.part(HtmlWriter.BODY).content()).isEqualTo("<p>kept</p>\n<aside></aside>");
        assertThat(writer.recoveredFailures()).hasSize(1);
    }

    @Test
    void content_assemblesCompletePage() {
        Document document = TestDocuments.withParagraphs("text");
        HtmlWriter writer = new HtmlWriter();

        writer.attach(document);

        assertThat(writer.content())
            .startsWith("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n<title>test.txt</title>\n")
            .endsWith("<body>\n<p>text</p>\n</body>\n</html>\n");
        assertThat(writer.output().files().get(0).relativePath()).isEqualTo("test.html");
    }
}
