package com.docpublish.core.writer.impl;

import com.docpublish.core.tree.Document;
import com.docpublish.core.tree.NodeId;
import com.docpublish.core.tree.NodeKind;
import com.docpublish.core.writer.NodeVisitor;
import com.docpublish.core.writer.VisitAction;
import com.docpublish.core.writer.Writer;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Dumps the tree as indented pseudo-XML, for debugging transforms.
 *
 * <pre>
 * &lt;document source="guide.txt" title="Guide"&gt;
 *     &lt;title&gt;
 *         Guide
 *     &lt;paragraph blank-lines="1" line="3"&gt;
 *         Body text
 * </pre>
 *
 * Attributes are sorted by name; there are no closing tags.
 */
public class PseudoXmlWriter extends Writer {

    public static final String WHOLE = "whole";

    private static final String INDENT = "    ";

    public PseudoXmlWriter() {
        super(WHOLE);
    }

    @Override
    public String getId() {
        return "pseudoxml";
    }

    @Override
    public String getDisplayName() {
        return "Pseudo-XML";
    }

    @Override
    public String getFileExtension() {
        return "xml";
    }

    @Override
    public String getContentType() {
        return "text/xml";
    }

    @Override
    protected NodeVisitor createVisitor(Document document) {
        return new PseudoXmlVisitor();
    }

    static String tagName(NodeKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }

    private final class PseudoXmlVisitor implements NodeVisitor {

        private int depth;

        @Override
        public VisitAction visitDocument(Document document, NodeId node) {
            return open(document, node);
        }

        @Override
        public void departDocument(Document document, NodeId node) {
            depth--;
        }

        @Override
        public VisitAction visitSection(Document document, NodeId node) {
            return open(document, node);
        }

        @Override
        public void departSection(Document document, NodeId node) {
            depth--;
        }

        @Override
        public VisitAction visitTitle(Document document, NodeId node) {
            return open(document, node);
        }

        @Override
        public void departTitle(Document document, NodeId node) {
            depth--;
        }

        @Override
        public VisitAction visitParagraph(Document document, NodeId node) {
            return open(document, node);
        }

        @Override
        public void departParagraph(Document document, NodeId node) {
            depth--;
        }

        @Override
        public VisitAction visitSystemMessage(Document document, NodeId node) {
            return open(document, node);
        }

        @Override
        public void departSystemMessage(Document document, NodeId node) {
            depth--;
        }

        @Override
        public VisitAction visitElement(Document document, NodeId node) {
            return open(document, node);
        }

        @Override
        public void departElement(Document document, NodeId node) {
            depth--;
        }

        @Override
        public VisitAction visitText(Document document, NodeId node) {
            textLines(document.text(node));
            return VisitAction.CONTINUE;
        }

        @Override
        public VisitAction visitComment(Document document, NodeId node) {
            line(tag(document, node));
            depth++;
            textLines(document.text(node));
            depth--;
            return VisitAction.CONTINUE;
        }

        private VisitAction open(Document document, NodeId node) {
            line(tag(document, node));
            depth++;
            return VisitAction.CONTINUE;
        }

        private String tag(Document document, NodeId node) {
            StringBuilder sb = new StringBuilder("<").append(tagName(document.kind(node)));
            Map<String, String> sorted = new TreeMap<>(document.attributes(node));
            sorted.forEach((name, value) -> sb.append(' ').append(name).append("=\"")
                .append(value.replace("\"", "&quot;")).append('"'));
            return sb.append('>').toString();
        }

        private void textLines(String text) {
            for (String textLine : text.split("\n", -1)) {
                line(textLine);
            }
        }

        private void line(String text) {
            append(INDENT.repeat(depth) + text + "\n");
        }
    }
}
