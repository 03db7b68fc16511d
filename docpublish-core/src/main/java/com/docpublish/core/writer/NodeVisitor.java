package com.docpublish.core.writer;

import com.docpublish.core.error.VisitorCondition;
import com.docpublish.core.tree.Document;
import com.docpublish.core.tree.NodeId;

/**
 * Per-kind callbacks invoked by the {@link TreeWalker}.
 *
 * <p>Every {@code visitX} runs before the node's children and decides how the walk continues;
 * the matching {@code departX} runs after them. All methods default to doing nothing and
 * continuing, so a visitor overrides only the kinds it renders.
 *
 * <p>A visitor reports a problem with a node by throwing {@link VisitorCondition}.
 */
public interface NodeVisitor {

    default VisitAction visitDocument(Document document, NodeId node) {
        return VisitAction.CONTINUE;
    }

    default void departDocument(Document document, NodeId node) {
    }

    default VisitAction visitSection(Document document, NodeId node) {
        return VisitAction.CONTINUE;
    }

    default void departSection(Document document, NodeId node) {
    }

    default VisitAction visitTitle(Document document, NodeId node) {
        return VisitAction.CONTINUE;
    }

    default void departTitle(Document document, NodeId node) {
    }

    default VisitAction visitParagraph(Document document, NodeId node) {
        return VisitAction.CONTINUE;
    }

    default void departParagraph(Document document, NodeId node) {
    }

    default VisitAction visitText(Document document, NodeId node) {
        return VisitAction.CONTINUE;
    }

    default void departText(Document document, NodeId node) {
    }

    default VisitAction visitComment(Document document, NodeId node) {
        return VisitAction.CONTINUE;
    }

    default void departComment(Document document, NodeId node) {
    }

    default VisitAction visitSystemMessage(Document document, NodeId node) {
        return VisitAction.CONTINUE;
    }

    default void departSystemMessage(Document document, NodeId node) {
    }

    default VisitAction visitElement(Document document, NodeId node) {
        return VisitAction.CONTINUE;
    }

    default void departElement(Document document, NodeId node) {
    }
}
