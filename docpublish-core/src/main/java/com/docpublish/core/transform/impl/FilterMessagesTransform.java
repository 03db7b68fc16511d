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
 * Drops system messages below report-level from the tree unless {@value #SETTING} is enabled.
 *
 * <p>A diagnostics section left with nothing but its title is removed by the scheduler when the
 * run ends.
 */
public class FilterMessagesTransform implements Transform {

    public static final String SETTING = "keep-quiet-messages";

    private static final Logger log = LoggerFactory.getLogger(FilterMessagesTransform.class);

    @Override
    public String getId() {
        return "filter-messages";
    }

    @Override
    public int getPriority() {
        return 870;
    }

    @Override
    public List<OptionDefinition> getSettingsSpec() {
        return List.of(new OptionDefinition(SETTING, OptionType.bool(), Boolean.TRUE,
            "Keep system messages below report-level in the output"));
    }

    @Override
    public void apply(TransformContext context) {
        if (context.settings().getBoolean(SETTING, true)) {
            return;
        }
        Document document = context.document();
        int reportLevel = context.settings().reportLevel();
        List<NodeId> quiet = new ArrayList<>();
        collectQuietMessages(document, context.target(), reportLevel, quiet);
        quiet.forEach(document::remove);
        log.debug("Removed {} system message(s) below level {} from {}", quiet.size(), reportLevel,
            document.sourceName());
    }

    private void collectQuietMessages(Document document, NodeId node, int reportLevel, List<NodeId> quiet) {
        if (document.kind(node) == NodeKind.SYSTEM_MESSAGE) {
            int level = document.attribute(node, "level").map(Integer::parseInt).orElse(reportLevel);
            if (level < reportLevel) {
                quiet.add(node);
            }
            return;
        }
        if (document.kind(node).isLeaf()) {
            return;
        }
        for (NodeId child : document.children(node)) {
            collectQuietMessages(document, child, reportLevel, quiet);
        }
    }
}
