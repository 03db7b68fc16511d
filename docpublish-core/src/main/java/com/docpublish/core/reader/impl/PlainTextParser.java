package com.docpublish.core.reader.impl;

import com.docpublish.core.reader.Parser;
import com.docpublish.core.tree.Document;
import com.docpublish.core.tree.NodeId;
import com.docpublish.core.tree.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for a minimal plain-text markup.
 *
 * <ul>
 *   <li>{@code # Title} starts a section; the number of {@code #} (1-6) is its depth and
 *       deeper headings nest inside shallower ones</li>
 *   <li>{@code .. text} is a single-line comment</li>
 *   <li>other non-empty lines form paragraphs, separated by empty lines</li>
 * </ul>
 *
 * <p>Every block records its source line in {@value #LINE_ATTRIBUTE} and the number of empty
 * lines before it in {@value #BLANK_LINES_ATTRIBUTE}; the root records the empty lines after the
 * last block in {@value #TRAILING_BLANK_LINES_ATTRIBUTE}. With these the plain-text writer
 * reproduces the input exactly.
 */
public class PlainTextParser implements Parser {

    public static final String LINE_ATTRIBUTE = "line";
    public static final String BLANK_LINES_ATTRIBUTE = "blank-lines";
    public static final String TRAILING_BLANK_LINES_ATTRIBUTE = "trailing-blank-lines";
    public static final String DEPTH_ATTRIBUTE = "depth";

    /** Prefix marking a comment line. */
    public static final String COMMENT_PREFIX = ".. ";

    private static final Pattern HEADING = Pattern.compile("^(#{1,6}) (.*)$");

    private static final Logger log = LoggerFactory.getLogger(PlainTextParser.class);

    @Override
    public String getId() {
        return "plaintext";
    }

    @Override
    public void parse(List<String> lines, Document document) {
        Deque<OpenSection> sections = new ArrayDeque<>();
        List<String> paragraph = new ArrayList<>();
        int paragraphLine = 0;
        int paragraphBlanks = 0;
        int blanks = 0;
        int blocks = 0;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNumber = i + 1;
            Matcher heading = HEADING.matcher(line);
            boolean comment = line.startsWith(COMMENT_PREFIX);

            if (!paragraph.isEmpty() && (line.isEmpty() || heading.matches() || comment)) {
                addParagraph(document, container(document, sections), paragraph, paragraphLine, paragraphBlanks);
                paragraph.clear();
                blocks++;
            }

            if (line.isEmpty()) {
                blanks++;
            } else if (heading.matches()) {
                int depth = heading.group(1).length();
                while (!sections.isEmpty() && sections.peek().depth() >= depth) {
                    sections.pop();
                }
                NodeId section = document.createNode(NodeKind.SECTION);
                setBlockAttributes(document, section, lineNumber, blanks);
                document.setAttribute(section, DEPTH_ATTRIBUTE, Integer.toString(depth));
                NodeId title = document.createNode(NodeKind.TITLE);
                document.appendChild(title, document.createText(heading.group(2)));
                document.appendChild(section, title);
                document.appendChild(container(document, sections), section);
                sections.push(new OpenSection(section, depth));
                blanks = 0;
                blocks++;
            } else if (comment) {
                NodeId node = document.createLeaf(NodeKind.COMMENT, line.substring(COMMENT_PREFIX.length()));
                setBlockAttributes(document, node, lineNumber, blanks);
                document.appendChild(container(document, sections), node);
                blanks = 0;
                blocks++;
            } else {
                if (paragraph.isEmpty()) {
                    paragraphLine = lineNumber;
                    paragraphBlanks = blanks;
                    blanks = 0;
                }
                paragraph.add(line);
            }
        }
        if (!paragraph.isEmpty()) {
            addParagraph(document, container(document, sections), paragraph, paragraphLine, paragraphBlanks);
            blocks++;
        }
        document.setAttribute(document.root(), TRAILING_BLANK_LINES_ATTRIBUTE, Integer.toString(blanks));
        log.debug("Parsed {} block(s) from {} line(s) of {}", blocks, lines.size(), document.sourceName());
    }

    private NodeId container(Document document, Deque<OpenSection> sections) {
        return sections.isEmpty() ? document.root() : sections.peek().node();
    }

    private void addParagraph(Document document, NodeId parent, List<String> lines, int line, int blanks) {
        NodeId paragraph = document.createNode(NodeKind.PARAGRAPH);
        setBlockAttributes(document, paragraph, line, blanks);
        document.appendChild(paragraph, document.createText(String.join("\n", lines)));
        document.appendChild(parent, paragraph);
    }

    private void setBlockAttributes(Document document, NodeId node, int line, int blanks) {
        document.setAttribute(node, LINE_ATTRIBUTE, Integer.toString(line));
        document.setAttribute(node, BLANK_LINES_ATTRIBUTE, Integer.toString(blanks));
    }

    private record OpenSection(NodeId node, int depth) {
    }
}
