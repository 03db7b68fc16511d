package com.docpublish.core.tree;

/**
 * Kinds of nodes a {@link Document} can hold.
 *
 * <p>The set is closed: visitors and writers dispatch over it exhaustively.
 */
public enum NodeKind {
    /** The root of every document. */
    DOCUMENT,
    /** A titled section; its first child is normally a {@link #TITLE}. */
    SECTION,
    /** Heading text of a section or of the document. */
    TITLE,
    /** A block of running text. */
    PARAGRAPH,
    /** Leaf text. */
    TEXT,
    /** Source comment carried through to the tree; never rendered by default. */
    COMMENT,
    /** A diagnostic record produced while processing the document. */
    SYSTEM_MESSAGE,
    /** Generic element for parser-specific structure. */
    ELEMENT;

    /**
     * Returns true for kinds whose payload is a text value instead of children.
     *
     * @return true for {@link #TEXT} and {@link #COMMENT}
     */
    public boolean isLeaf() {
        return this == TEXT || this == COMMENT;
    }
}
