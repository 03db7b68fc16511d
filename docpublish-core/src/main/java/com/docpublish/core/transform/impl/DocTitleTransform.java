package com.docpublish.core.transform.impl;

import com.docpublish.core.error.Severity;
import com.docpublish.core.settings.OptionDefinition;
import com.docpublish.core.settings.OptionType;
import com.docpublish.core.transform.Transform;
import com.docpublish.core.transform.TransformContext;
import com.docpublish.core.tree.Document;
import com.docpublish.core.tree.NodeId;
import com.docpublish.core.tree.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Promotes a lone top-level section to the document title.
 *
 * <p>When the only structural child of the root is a section that starts with a title, the
 * title text becomes the root's {@code title} attribute, the title node moves to the front of the
 * root and the section's remaining children take the section's place. Comments next to the
 * section are not structural and stay where they are.
 *
 * <p>Before:
 * <pre>
 * document
 *   section
 *     title "Guide"
 *     paragraph
 * </pre>
 * After:
 * <pre>
 * document title="Guide"
 *   title "Guide"
 *   paragraph
 * </pre>
 *
 * <p>An empty title is still promoted and reported as {@link Severity#INFO}.
 */
public class DocTitleTransform implements Transform {

    /** Setting that enables the promotion. */
    public static final String SETTING = "doctitle-xform";

    /** Root attribute receiving the title text. */
    public static final String TITLE_ATTRIBUTE = "title";

    private static final Logger log = LoggerFactory.getLogger(DocTitleTransform.class);

    @Override
    public String getId() {
        return "doc-title";
    }

    @Override
    public int getPriority() {
        return 320;
    }

    @Override
    public List<OptionDefinition> getSettingsSpec() {
        return List.of(new OptionDefinition(SETTING, OptionType.bool(), Boolean.TRUE,
            "Promote a lone top-level section title to the document title"));
    }

    @Override
    public void apply(TransformContext context) {
        if (!context.settings().getBoolean(SETTING, true)) {
            log.debug("Document title promotion disabled");
            return;
        }

        Document document = context.document();
        NodeId root = document.root();
        NodeId section = null;
        for (NodeId child : document.children(root)) {
            if (document.kind(child) == NodeKind.COMMENT) {
                continue;
            }
            if (section != null || document.kind(child) != NodeKind.SECTION) {
                log.debug("Root of {} has several structural children, no title promoted", document.sourceName());
                return;
            }
            section = child;
        }
        if (section == null || document.childCount(section) == 0
            || document.kind(document.child(section, 0)) != NodeKind.TITLE) {
            return;
        }

        NodeId promoted = section;
        NodeId title = document.child(promoted, 0);
        String titleText = document.textContent(title).strip();
        int position = document.children(root).indexOf(promoted);
        List<NodeId> body = document.children(promoted);

        document.remove(promoted);
        document.remove(title);
        document.insertChild(root, 0, title);
        int insertAt = position + 1;
        for (NodeId child : body.subList(1, body.size())) {
            document.remove(child);
            document.insertChild(root, insertAt++, child);
        }
        document.setAttribute(root, TITLE_ATTRIBUTE, titleText);
        document.attribute(promoted, Document.ID_ATTRIBUTE)
            .filter(id -> document.attribute(root, Document.ID_ATTRIBUTE).isEmpty())
            .ifPresent(id -> {
                document.removeAttribute(promoted, Document.ID_ATTRIBUTE);
                document.setAttribute(root, Document.ID_ATTRIBUTE, id);
            });
        log.debug("Promoted '{}' to the title of {}", titleText, document.sourceName());

        if (titleText.isEmpty()) {
            throw context.condition(Severity.INFO, "Document title is empty", title);
        }
    }
}
