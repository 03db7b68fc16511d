package com.docpublish.core.writer;

import com.docpublish.core.error.VisitorCondition;
import com.docpublish.core.renderer.GeneratedFile;
import com.docpublish.core.renderer.GeneratedOutput;
import com.docpublish.core.settings.SettingsSpec;
import com.docpublish.core.tree.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders a document tree into named {@link Part parts} and assembles them into output files.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link #attach(Document)} resets every part, walks the tree with the visitor from
 *       {@link #createVisitor(Document)} and freezes the parts. Attaching the document that is
 *       already attached does nothing.</li>
 *   <li>{@link #output()} assembles the parts into the document file; {@link #partOutput(String)}
 *       emits a single part.</li>
 * </ol>
 *
 * <h2>Active part</h2>
 * <p>Visitors write through {@link #append(String)} and {@link #prepend(String)}, which go to the
 * part activated with {@link #withPart(String)}:
 * <pre>{@code
 * try (PartScope scope = withPart("title")) {
 *     append(document.textContent(node));
 * }
 * }</pre>
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class WordCountWriter extends Writer {
 *     public WordCountWriter() {
 *         super("body");
 *     }
 *
 *     @Override
 *     protected NodeVisitor createVisitor(Document document) {
 *         return new NodeVisitor() {
 *             @Override
 *             public VisitAction visitText(Document doc, NodeId node) {
 *                 append(doc.text(node).split("\\s+").length + "\n");
 *                 return VisitAction.CONTINUE;
 *             }
 *         };
 *     }
 *     ...
 * }
 * }</pre>
 */
public abstract class Writer implements SettingsSpec {

    private static final Logger log = LoggerFactory.getLogger(Writer.class);

    private final Map<String, Part> parts = new LinkedHashMap<>();
    private Document document;
    private Part activePart;
    private List<VisitorCondition> recovered = List.of();

    /**
     * Creates a writer with the given parts; the first one is active during the walk unless the
     * visitor switches.
     *
     * @param partNames names of the parts, in assembly order
     */
    protected Writer(String... partNames) {
        if (partNames.length == 0) {
            throw new IllegalArgumentException("A writer needs at least one part");
        }
        for (String name : partNames) {
            if (parts.put(name, new Part(name)) != null) {
                throw new IllegalArgumentException("Duplicate part name: " + name);
            }
        }
    }

    /**
     * Returns unique identifier for this writer. Used to select the writer on the command line
     * (e.g., "html", "text").
     *
     * @return writer identifier
     */
    public abstract String getId();

    /**
     * Returns human-readable name for this writer.
     *
     * @return display name
     */
    public abstract String getDisplayName();

    /**
     * Returns the extension of the files this writer produces, without the dot.
     *
     * @return file extension
     */
    public abstract String getFileExtension();

    /**
     * Returns the media type of the produced files.
     *
     * @return content type
     */
    public String getContentType() {
        return "text/plain";
    }

    /**
     * Creates the visitor that renders one document into the parts.
     *
     * @param document document being rendered
     * @return visitor
     */
    protected abstract NodeVisitor createVisitor(Document document);

    /**
     * How visitor failures are handled during the walk.
     *
     * @return failure policy, {@link VisitorFailurePolicy#CONTINUE} by default
     */
    protected VisitorFailurePolicy visitorFailurePolicy() {
        return VisitorFailurePolicy.CONTINUE;
    }

    /**
     * Renders a document into the parts.
     *
     * @param document document to render
     */
    public final void attach(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        if (this.document == document) {
            log.debug("Writer {} already attached to {}", getId(), document.sourceName());
            return;
        }
        parts.values().forEach(Part::reset);
        this.document = document;
        activePart = parts.values().iterator().next();

        TreeWalker walker = new TreeWalker(document, createVisitor(document), visitorFailurePolicy());
        boolean rendered = false;
        try {
            walker.walk();
            rendered = true;
        } finally {
            activePart = null;
            parts.values().forEach(Part::freeze);
            recovered = walker.recovered();
            if (!rendered) {
                // a failed walk leaves partial parts; the next attach must render again
                this.document = null;
            }
        }
        if (!recovered.isEmpty()) {
            log.warn("Writer {} skipped {} node(s) of {}", getId(), recovered.size(), document.sourceName());
        }
        log.debug("Writer {} rendered {} into part(s) {}", getId(), document.sourceName(), parts.keySet());
    }

    public Optional<Document> document() {
        return Optional.ofNullable(document);
    }

    public List<String> partNames() {
        return new ArrayList<>(parts.keySet());
    }

    /**
     * Returns a part by name.
     *
     * @param name part name
     * @return the part
     * @throws IllegalArgumentException if the writer has no such part
     */
    public Part part(String name) {
        Part part = parts.get(name);
        if (part == null) {
            throw new IllegalArgumentException("Writer " + getId() + " has no part '" + name + "'; parts: " + parts.keySet());
        }
        return part;
    }

    /**
     * Visitor failures recovered during the last walk.
     *
     * @return recovered conditions
     */
    public List<VisitorCondition> recoveredFailures() {
        return recovered;
    }

    /**
     * Makes a part the target of {@link #append(String)} and {@link #prepend(String)} until the
     * returned scope is closed.
     *
     * @param name part name
     * @return scope restoring the previous part on close
     */
    protected PartScope withPart(String name) {
        Part previous = activePart;
        activePart = part(name);
        return new PartScope(() -> activePart = previous);
    }

    protected void append(String fragment) {
        requireActivePart().append(fragment);
    }

    protected void prepend(String fragment) {
        requireActivePart().prepend(fragment);
    }

    private Part requireActivePart() {
        if (activePart == null) {
            throw new IllegalStateException("Writer " + getId() + " has no active part");
        }
        return activePart;
    }

    /**
     * Combines the frozen parts into the document's content. Concatenates the parts in
     * declaration order unless overridden.
     *
     * @return assembled content
     */
    protected String assemble() {
        StringBuilder sb = new StringBuilder();
        parts.values().forEach(part -> sb.append(part.content()));
        return sb.toString();
    }

    /**
     * Assembled content of the attached document.
     *
     * @return content
     * @throws IllegalStateException if no document is attached
     */
    public String content() {
        requireDocument();
        return assemble();
    }

    /**
     * Produces the output file of the attached document.
     *
     * @return output with one file named after the source
     * @throws IllegalStateException if no document is attached
     */
    public GeneratedOutput output() {
        Document attached = requireDocument();
        String fileName = baseName(attached) + "." + getFileExtension();
        return GeneratedOutput.of(new GeneratedFile(fileName, assemble(), getContentType()));
    }

    /**
     * Produces one part of the attached document as a file.
     *
     * @param name part name
     * @return output with one file named {@code <source>-<part>.<ext>}
     */
    public GeneratedOutput partOutput(String name) {
        Document attached = requireDocument();
        Part part = part(name);
        String fileName = baseName(attached) + "-" + name + "." + getFileExtension();
        return GeneratedOutput.of(new GeneratedFile(fileName, part.content(), getContentType()));
    }

    private Document requireDocument() {
        if (document == null) {
            throw new IllegalStateException("Writer " + getId() + " has no attached document");
        }
        return document;
    }

    private static String baseName(Document document) {
        String name = document.sourceName();
        name = name.substring(Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        name = dot > 0 ? name.substring(0, dot) : name;
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return name.isEmpty() ? "document" : name;
    }
}
