package com.docpublish.core.writer.impl;

import com.docpublish.core.error.Severity;
import com.docpublish.core.reader.impl.PlainTextParser;
import com.docpublish.core.tree.Document;
import com.docpublish.core.tree.NodeId;
import com.docpublish.core.tree.NodeKind;
import com.docpublish.core.writer.NodeVisitor;
import com.docpublish.core.writer.VisitAction;
import com.docpublish.core.writer.Writer;

import java.util.Optional;

/**
 * Writes a document back in the plain-text markup read by {@link PlainTextParser}.
 *
 * <p>Layout attributes recorded by the parser (empty lines before each block, trailing empty
 * lines, heading depth) are honoured, so an untransformed document is written exactly as it was
 * read. Blocks without them are separated by one empty line.
 */
public class PlainTextWriter extends Writer {

    public static final String BODY = "body";

    public PlainTextWriter() {
        super(BODY);
    }

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String getDisplayName() {
        return "Plain Text";
    }

    @Override
    public String getFileExtension() {
        return "txt";
    }

    @Override
    protected NodeVisitor createVisitor(Document document) {
        return new TextVisitor();
    }

    private final class TextVisitor implements NodeVisitor {

        private int lines;
        private int blocks;

        @Override
        public void departDocument(Document document, NodeId node) {
            int trailing = intAttribute(document, node, PlainTextParser.TRAILING_BLANK_LINES_ATTRIBUTE)
                .orElse(lines > 0 ? 1 : 0);
            for (int i = 0; i < trailing; i++) {
                line("");
            }
        }

        @Override
        public VisitAction visitSection(Document document, NodeId node) {
            startBlock(document, node);
            return VisitAction.CONTINUE;
        }

        @Override
        public VisitAction visitTitle(Document document, NodeId node) {
            if (document.parent(node).map(document::kind).orElse(NodeKind.SECTION) != NodeKind.SECTION) {
                startBlock(document, node);
            }
            line("#".repeat(headingDepth(document, node)) + " " + document.textContent(node));
            return VisitAction.SKIP_CHILDREN;
        }

        @Override
        public VisitAction visitParagraph(Document document, NodeId node) {
            startBlock(document, node);
            lines(document.textContent(node));
            return VisitAction.SKIP_CHILDREN;
        }

        @Override
        public VisitAction visitText(Document document, NodeId node) {
            startBlock(document, node);
            lines(document.text(node));
            return VisitAction.CONTINUE;
        }

        @Override
        public VisitAction visitComment(Document document, NodeId node) {
            startBlock(document, node);
            line(PlainTextParser.COMMENT_PREFIX + document.text(node));
            return VisitAction.CONTINUE;
        }

        @Override
        public VisitAction visitSystemMessage(Document document, NodeId node) {
            startBlock(document, node);
            StringBuilder sb = new StringBuilder(document.attribute(node, "type")
                .orElseGet(() -> Severity.labelOf(intAttribute(document, node, "level").orElse(0))));
            document.attribute(node, "line").ifPresent(line -> sb.append(" [line ").append(line).append(']'));
            sb.append(' ').append(document.textContent(node));
            lines(sb.toString());
            return VisitAction.SKIP_CHILDREN;
        }

        private void startBlock(Document document, NodeId node) {
            int blanks = intAttribute(document, node, PlainTextParser.BLANK_LINES_ATTRIBUTE)
                .orElse(blocks > 0 ? 1 : 0);
            for (int i = 0; i < blanks; i++) {
                line("");
            }
            blocks++;
        }

        private void lines(String text) {
            for (String line : text.split("\n", -1)) {
                line(line);
            }
        }

        private void line(String text) {
            if (lines > 0) {
                append("\n");
            }
            append(text);
            lines++;
        }
    }

    static int headingDepth(Document document, NodeId title) {
        Optional<NodeId> parent = document.parent(title);
        if (parent.isEmpty() || document.kind(parent.get()) != NodeKind.SECTION) {
            return 1;
        }
        Optional<Integer> recorded = intAttribute(document, parent.get(), PlainTextParser.DEPTH_ATTRIBUTE);
        if (recorded.isPresent()) {
            return recorded.get();
        }
        int depth = 0;
        Optional<NodeId> current = parent;
        while (current.isPresent()) {
            if (document.kind(current.get()) == NodeKind.SECTION) {
                depth++;
            }
            current = document.parent(current.get());
        }
        return Math.min(depth, 6);
    }

    static Optional<Integer> intAttribute(Document document, NodeId node, String name) {
        return document.attribute(node, name).flatMap(value -> {
            try {
                return Optional.of(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        });
    }
}
