package com.docpublish.core.transform.impl;

import com.docpublish.core.transform.Transform;
import com.docpublish.core.transform.TransformContext;
import com.docpublish.core.tree.Document;
import com.docpublish.core.tree.NodeId;
import com.docpublish.core.tree.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives every section below the target a document-unique identifier.
 *
 * <p>Sections that already carry an {@code id} attribute keep it.
 */
public class SectionIdTransform implements Transform {

    private static final Logger log = LoggerFactory.getLogger(SectionIdTransform.class);

    @Override
    public String getId() {
        return "section-ids";
    }

    @Override
    public int getPriority() {
        return 260;
    }

    @Override
    public void apply(TransformContext context) {
        Document document = context.document();
        int assigned = assignIds(document, context.target());
        log.debug("Ensured identifiers on {} section(s) of {}", assigned, document.sourceName());
    }

    private int assignIds(Document document, NodeId node) {
        int count = 0;
        if (document.kind(node) == NodeKind.SECTION) {
            document.ensureIdentifier(node);
            count++;
        }
        if (document.kind(node).isLeaf()) {
            return count;
        }
        for (NodeId child : document.children(node)) {
            count += assignIds(document, child);
        }
        return count;
    }
}
