package com.docpublish.core.error;

import com.docpublish.core.tree.NodeId;

/**
 * Raised by a writer's visitor while rendering a node.
 *
 * <p>The tree walker recovers by skipping the rest of the node and continuing with its next
 * sibling, unless the writer asks for failures to propagate.
 */
public class VisitorCondition extends PublishException {

    private static final long serialVersionUID = 1L;

    private final transient NodeId node;

    public VisitorCondition(String message, NodeId node) {
        super(message);
        this.node = node;
    }

    public VisitorCondition(String message, NodeId node, Throwable cause) {
        super(message, cause);
        this.node = node;
    }

    /** Node being visited when the failure happened, or {@code null}. */
    public NodeId node() {
        return node;
    }
}
