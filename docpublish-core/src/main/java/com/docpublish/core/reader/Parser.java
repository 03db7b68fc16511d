package com.docpublish.core.reader;

import com.docpublish.core.settings.SettingsSpec;
import com.docpublish.core.transform.TransformSpec;
import com.docpublish.core.tree.Document;

import java.util.List;

/**
 * Builds the initial tree of a document from its source lines.
 *
 * <p>Parsers only populate the tree. Clean-up they need afterwards is returned from
 * {@link #getTransforms()} and run by the {@link Reader} together with its own transforms.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class LineParser implements Parser {
 *     @Override
 *     public String getId() {
 *         return "lines";
 *     }
 *
 *     @Override
 *     public void parse(List<String> lines, Document document) {
 *         for (String line : lines) {
 *             NodeId paragraph = document.createNode(NodeKind.PARAGRAPH);
 *             document.appendChild(paragraph, document.createText(line));
 *             document.appendChild(document.root(), paragraph);
 *         }
 *     }
 * }
 * }</pre>
 */
public interface Parser extends SettingsSpec {

    /**
     * Returns unique identifier for this parser (e.g., "plaintext").
     *
     * @return parser identifier
     */
    String getId();

    /**
     * Appends the parsed content below the document root.
     *
     * @param lines source lines without terminators
     * @param document empty document to populate
     */
    void parse(List<String> lines, Document document);

    /**
     * Returns transforms this parser needs after parsing.
     *
     * @return transform specs, empty by default
     */
    default List<TransformSpec> getTransforms() {
        return List.of();
    }
}
