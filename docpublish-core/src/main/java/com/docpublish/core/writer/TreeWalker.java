package com.docpublish.core.writer;

import com.docpublish.core.error.VisitorCondition;
import com.docpublish.core.tree.Document;
import com.docpublish.core.tree.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Depth-first, pre-order walk of a document that dispatches each node to a {@link NodeVisitor}
 * by kind.
 *
 * <p>The {@link VisitAction} returned by a visit decides how the walk goes on; a
 * {@link VisitAction#SKIP_SIBLINGS} only ends the loop over the children of the current parent.
 *
 * <p>A {@link VisitorCondition} thrown while visiting or departing a node is recovered at that
 * node under {@link VisitorFailurePolicy#CONTINUE}: the rest of the node is skipped and the walk
 * continues with its next sibling. Recovered conditions are available from {@link #recovered()}.
 * Other exceptions are not caught.
 */
public final class TreeWalker {

    private static final Logger log = LoggerFactory.getLogger(TreeWalker.class);

    private final Document document;
    private final NodeVisitor visitor;
    private final VisitorFailurePolicy failurePolicy;
    private final List<VisitorCondition> recovered = new ArrayList<>();

    public TreeWalker(Document document, NodeVisitor visitor, VisitorFailurePolicy failurePolicy) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.visitor = Objects.requireNonNull(visitor, "visitor must not be null");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy must not be null");
    }

    /**
     * Walks the whole document from its root.
     */
    public void walk() {
        walk(document.root());
    }

    /**
     * Walks the subtree below a node.
     *
     * @param start subtree root
     */
    public void walk(NodeId start) {
        walkNode(start);
    }

    public List<VisitorCondition> recovered() {
        return List.copyOf(recovered);
    }

    /**
     * Walks one node.
     *
     * @return true if the caller must skip the node's remaining siblings
     */
    private boolean walkNode(NodeId node) {
        VisitAction action;
        try {
            action = visit(node);
        } catch (VisitorCondition e) {
            recover(node, e);
            return false;
        }

        if (action == VisitAction.SKIP_SIBLINGS) {
            return true;
        }
        if (action == VisitAction.CONTINUE) {
            for (NodeId child : document.children(node)) {
                if (walkNode(child)) {
                    break;
                }
            }
        }

        try {
            depart(node);
        } catch (VisitorCondition e) {
            recover(node, e);
        }
        return false;
    }

    private void recover(NodeId node, VisitorCondition e) {
        if (failurePolicy == VisitorFailurePolicy.PROPAGATE) {
            throw e;
        }
        log.warn("Skipping {} node {} of {}: {}", document.kind(node), node, document.sourceName(), e.getMessage());
        recovered.add(e);
    }

    private VisitAction visit(NodeId node) {
        VisitAction action = switch (document.kind(node)) {
            case DOCUMENT -> visitor.visitDocument(document, node);
            case SECTION -> visitor.visitSection(document, node);
            case TITLE -> visitor.visitTitle(document, node);
            case PARAGRAPH -> visitor.visitParagraph(document, node);
            case TEXT -> visitor.visitText(document, node);
            case COMMENT -> visitor.visitComment(document, node);
            case SYSTEM_MESSAGE -> visitor.visitSystemMessage(document, node);
            case ELEMENT -> visitor.visitElement(document, node);
        };
        return action == null ? VisitAction.CONTINUE : action;
    }

    private void depart(NodeId node) {
        switch (document.kind(node)) {
            case DOCUMENT -> visitor.departDocument(document, node);
            case SECTION -> visitor.departSection(document, node);
            case TITLE -> visitor.departTitle(document, node);
            case PARAGRAPH -> visitor.departParagraph(document, node);
            case TEXT -> visitor.departText(document, node);
            case COMMENT -> visitor.departComment(document, node);
            case SYSTEM_MESSAGE -> visitor.departSystemMessage(document, node);
            case ELEMENT -> visitor.departElement(document, node);
        }
    }
}
