package com.docpublish.core.writer.impl;

import com.docpublish.core.error.VisitorCondition;
import com.docpublish.core.settings.OptionDefinition;
import com.docpublish.core.settings.OptionType;
import com.docpublish.core.settings.Settings;
import com.docpublish.core.settings.StandardOptions;
import com.docpublish.core.transform.TransformScheduler;
import com.docpublish.core.tree.BackReference;
import com.docpublish.core.tree.Document;
import com.docpublish.core.tree.NodeId;
import com.docpublish.core.writer.NodeVisitor;
import com.docpublish.core.writer.PartScope;
import com.docpublish.core.writer.VisitAction;
import com.docpublish.core.writer.Writer;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Writes HTML5 into four parts.
 *
 * <table>
 *   <caption>Parts</caption>
 *   <tr><th>Part</th><th>Content</th></tr>
 *   <tr><td>{@value #HEAD}</td><td>meta and stylesheet elements</td></tr>
 *   <tr><td>{@value #TITLE}</td><td>escaped document title</td></tr>
 *   <tr><td>{@value #BODY}</td><td>rendered document content</td></tr>
 *   <tr><td>{@value #MESSAGES}</td><td>the diagnostics section</td></tr>
 * </table>
 *
 * <p>The assembled page wraps them in a complete HTML document. Single parts are useful to embed
 * the body in another page.
 */
public class HtmlWriter extends Writer {

    public static final String HEAD = "head";
    public static final String TITLE = "title";
    public static final String BODY = "body";
    public static final String MESSAGES = "messages";

    /** Setting naming a stylesheet to link. */
    public static final String STYLESHEET_SETTING = "html-stylesheet";

    public HtmlWriter() {
        super(HEAD, TITLE, BODY, MESSAGES);
    }

    @Override
    public String getId() {
        return "html";
    }

    @Override
    public String getDisplayName() {
        return "HTML";
    }

    @Override
    public String getFileExtension() {
        return "html";
    }

    @Override
    public String getContentType() {
        return "text/html";
    }

    @Override
    public List<OptionDefinition> getSettingsSpec() {
        return List.of(new OptionDefinition(STYLESHEET_SETTING, OptionType.nullablePath(), null,
            "Stylesheet linked from generated HTML pages"));
    }

    @Override
    protected NodeVisitor createVisitor(Document document) {
        return new HtmlVisitor();
    }

    @Override
    protected String assemble() {
        return "<!DOCTYPE html>\n<html>\n<head>\n"
            + part(HEAD).content()
            + "<title>" + part(TITLE).content() + "</title>\n"
            + "</head>\n<body>\n"
            + part(BODY).content()
            + part(MESSAGES).content()
            + "</body>\n</html>\n";
    }

    /**
     * Escapes text for element content and attribute values.
     *
     * @param text raw text
     * @return escaped text
     */
    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private final class HtmlVisitor implements NodeVisitor {

        private final Deque<PartScope> scopes = new ArrayDeque<>();
        private int sectionDepth;

        @Override
        public VisitAction visitDocument(Document document, NodeId node) {
            Settings settings = document.settings();
            try (PartScope scope = withPart(HEAD)) {
                String encoding = settings.contains(StandardOptions.OUTPUT_ENCODING)
                    ? settings.getString(StandardOptions.OUTPUT_ENCODING) : "UTF-8";
                append("<meta charset=\"" + escape(encoding) + "\">\n");
                if (settings.contains(STYLESHEET_SETTING) && settings.get(STYLESHEET_SETTING) != null) {
                    Path stylesheet = settings.getPath(STYLESHEET_SETTING);
                    append("<link rel=\"stylesheet\" href=\"" + escape(stylesheet.toString().replace('\\', '/')) + "\">\n");
                }
            }
            try (PartScope scope = withPart(TITLE)) {
                append(escape(document.attribute(node, "title").orElse(document.sourceName())));
            }
            scopes.push(withPart(BODY));
            return VisitAction.CONTINUE;
        }

        @Override
        public void departDocument(Document document, NodeId node) {
            closeScope();
        }

        @Override
        public VisitAction visitSection(Document document, NodeId node) {
            boolean diagnostics = document.attribute(node, "class")
                .map(TransformScheduler.DIAGNOSTICS_CLASS::equals)
                .orElse(false);
            scopes.push(withPart(diagnostics ? MESSAGES : BODY));
            sectionDepth++;
            append("<section" + idAttribute(document, node) + classAttribute(document, node) + ">\n");
            return VisitAction.CONTINUE;
        }

        @Override
        public void departSection(Document document, NodeId node) {
            append("</section>\n");
            sectionDepth--;
            closeScope();
        }

        @Override
        public VisitAction visitTitle(Document document, NodeId node) {
            int level = 1;
            if (sectionDepth > 0) {
                boolean titled = document.attribute(document.root(), "title").isPresent();
                level = Math.min(6, sectionDepth + (titled ? 1 : 0));
            }
            append("<h" + level + ">" + escape(document.textContent(node)) + "</h" + level + ">\n");
            return VisitAction.SKIP_CHILDREN;
        }

        @Override
        public VisitAction visitParagraph(Document document, NodeId node) {
            append("<p" + idAttribute(document, node) + ">");
            return VisitAction.CONTINUE;
        }

        @Override
        public void departParagraph(Document document, NodeId node) {
            append("</p>\n");
        }

        @Override
        public VisitAction visitText(Document document, NodeId node) {
            append(escape(document.text(node)));
            return VisitAction.CONTINUE;
        }

        @Override
        public VisitAction visitComment(Document document, NodeId node) {
            append("<!-- " + document.text(node).replace("--", "- -") + " -->\n");
            return VisitAction.CONTINUE;
        }

        @Override
        public VisitAction visitSystemMessage(Document document, NodeId node) {
            String type = document.attribute(node, "type").orElse("MESSAGE");
            StringBuilder heading = new StringBuilder(escape(type));
            document.attribute(node, "source").ifPresent(source -> heading.append(" (").append(escape(source))
                .append(document.attribute(node, "line").map(line -> ", line " + escape(line)).orElse(""))
                .append(')'));
            append("<div class=\"system-message\"" + idAttribute(document, node) + ">\n");
            append("<p class=\"system-message-title\">" + heading);
            for (BackReference reference : document.backReferences(node)) {
                document.resolve(reference)
                    .flatMap(target -> document.attribute(target, Document.ID_ATTRIBUTE))
                    .ifPresent(id -> append(" <a href=\"#" + escape(id) + "\">backlink</a>"));
            }
            append("</p>\n");
            return VisitAction.CONTINUE;
        }

        @Override
        public void departSystemMessage(Document document, NodeId node) {
            append("</div>\n");
        }

        @Override
        public VisitAction visitElement(Document document, NodeId node) {
            String tag = document.attribute(node, "tag").orElse("div");
            if (!tag.matches("[a-z][a-z0-9]*")) {
                throw new VisitorCondition("Invalid element tag '" + tag + "'", node);
            }
            append("<" + tag + idAttribute(document, node) + classAttribute(document, node) + ">");
            return VisitAction.CONTINUE;
        }

        @Override
        public void departElement(Document document, NodeId node) {
            append("</" + document.attribute(node, "tag").orElse("div") + ">");
        }

        private void closeScope() {
            PartScope scope = scopes.poll();
            if (scope != null) {
                scope.close();
            }
        }

        private String idAttribute(Document document, NodeId node) {
            return document.attribute(node, Document.ID_ATTRIBUTE)
                .map(id -> " id=\"" + escape(id) + "\"")
                .orElse("");
        }

        private String classAttribute(Document document, NodeId node) {
            return document.attribute(node, "class")
                .map(value -> " class=\"" + escape(value) + "\"")
                .orElse("");
        }
    }
}
