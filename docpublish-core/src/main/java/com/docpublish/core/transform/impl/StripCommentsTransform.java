package com.docpublish.core.transform.impl;

import com.docpublish.core.settings.OptionDefinition;
import com.docpublish.core.settings.OptionType;
import com.docpublish.core.transform.Transform;
import com.docpublish.core.transform.TransformContext;
import com.docpublish.core.tree.Document;
import com.docpublish.core.tree.NodeId;
import com.docpublish.core.tree.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes comment nodes from the target subtree when {@value #SETTING} is enabled.
 */
public class StripCommentsTransform implements Transform {

    public static final String SETTING = "strip-comments";

    private static final Logger log = LoggerFactory.getLogger(StripCommentsTransform.class);

    @Override
    public String getId() {
        return "strip-comments";
    }

    @Override
    public int getPriority() {
        return 740;
    }

    @Override
    public List<OptionDefinition> getSettingsSpec() {
        return List.of(new OptionDefinition(SETTING, OptionType.bool(), Boolean.FALSE,
            "Remove comments from the document before writing"));
    }

    @Override
    public void apply(TransformContext context) {
        if (!context.settings().getBoolean(SETTING, false)) {
            return;
        }
        Document document = context.document();
        List<NodeId> comments = new ArrayList<>();
        collectComments(document, context.target(), comments);
        comments.forEach(document::remove);
        log.debug("Stripped {} comment(s) from {}", comments.size(), document.sourceName());
    }

    private void collectComments(Document document, NodeId node, List<NodeId> comments) {
        if (document.kind(node) == NodeKind.COMMENT) {
            comments.add(node);
            return;
        }
        if (document.kind(node).isLeaf()) {
            return;
        }
        for (NodeId child : document.children(node)) {
            collectComments(document, child, comments);
        }
    }
}
