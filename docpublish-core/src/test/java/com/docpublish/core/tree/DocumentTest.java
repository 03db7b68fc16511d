package com.docpublish.core.tree;

import com.docpublish.core.TestDocuments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Document}.
 */
class DocumentTest {

    private Document document;

    @BeforeEach
    void setUp() {
        document = TestDocuments.empty();
    }

    @Test
    void create_rootIsDocumentWithoutChildren() {
        assertThat(document.kind(document.root())).isEqualTo(NodeKind.DOCUMENT);
        assertThat(document.isEmpty()).isTrue();
        assertThat(document.attribute(document.root(), "source")).contains("test.txt");
    }

    @Test
    void appendChild_keepsChildOrder() {
        NodeId first = TestDocuments.paragraph(document, document.root(), "one");
        NodeId second = TestDocuments.paragraph(document, document.root(), "two");

        assertThat(document.children(document.root())).containsExactly(first, second);
        assertThat(document.child(document.root(), 1)).isEqualTo(second);
        assertThat(document.parent(first)).contains(document.root());
        assertThat(document.textContent(document.root())).isEqualTo("onetwo");
    }

    @Test
    void appendChild_nodeWithParent_throwsException() {
        NodeId paragraph = TestDocuments.paragraph(document, document.root(), "text");
        NodeId section = document.createNode(NodeKind.SECTION);

        assertThatThrownBy(() -> document.appendChild(section, paragraph))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already belongs");
    }

    @Test
    void appendChild_ancestorBelowDescendant_throwsException() {
        NodeId outer = document.createNode(NodeKind.SECTION);
        NodeId inner = document.createNode(NodeKind.SECTION);
        document.appendChild(outer, inner);

        assertThatThrownBy(() -> document.appendChild(inner, outer))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("ancestor");
    }

    @Test
    void appendChild_toLeaf_throwsException() {
        NodeId text = document.createText("leaf");
        NodeId other = document.createText("other");

        assertThatThrownBy(() -> document.appendChild(text, other))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void insertChild_placesNodeAtIndex() {
        NodeId first = TestDocuments.paragraph(document, document.root(), "one");
        NodeId inserted = document.createNode(NodeKind.COMMENT);

        document.insertChild(document.root(), 0, inserted);

        assertThat(document.children(document.root())).containsExactly(inserted, first);
    }

    @Test
    void remove_detachesSubtree() {
        NodeId section = TestDocuments.section(document, document.root(), "Title");
        NodeId paragraph = TestDocuments.paragraph(document, section, "body");

        document.remove(section);

        assertThat(document.isEmpty()).isTrue();
        assertThat(document.isAttached(section)).isFalse();
        assertThat(document.isAttached(paragraph)).isFalse();
        assertThat(document.parent(paragraph)).contains(section);
    }

    @Test
    void remove_root_throwsException() {
        assertThatThrownBy(() -> document.remove(document.root()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createNode_document_throwsException() {
        assertThatThrownBy(() -> document.createNode(NodeKind.DOCUMENT))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void text_ofNonLeaf_throwsException() {
        NodeId paragraph = TestDocuments.paragraph(document, document.root(), "text");

        assertThatThrownBy(() -> document.text(paragraph))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(document.text(document.child(paragraph, 0))).isEqualTo("text");
    }

    @Test
    void ensureIdentifier_assignsUniqueIdsOnce() {
        NodeId first = TestDocuments.section(document, document.root(), "A");
        NodeId second = TestDocuments.section(document, document.root(), "B");

        String firstId = document.ensureIdentifier(first);
        String secondId = document.ensureIdentifier(second);

        assertThat(firstId).isEqualTo("id1");
        assertThat(secondId).isEqualTo("id2");
        assertThat(document.ensureIdentifier(first)).isEqualTo(firstId);
        assertThat(document.findById("id2")).contains(second);
    }

    @Test
    void ensureIdentifier_skipsIdsAlreadyTaken() {
        NodeId taken = TestDocuments.section(document, document.root(), "A");
        document.setAttribute(taken, Document.ID_ATTRIBUTE, "id1");
        NodeId other = TestDocuments.section(document, document.root(), "B");

        assertThat(document.ensureIdentifier(other)).isEqualTo("id2");
    }

    @Test
    void setAttribute_idOfAnotherNode_throwsAndKeepsOwner() {
        NodeId first = TestDocuments.section(document, document.root(), "A");
        NodeId second = TestDocuments.section(document, document.root(), "B");
        document.setAttribute(first, Document.ID_ATTRIBUTE, "intro");

        assertThatThrownBy(() -> document.setAttribute(second, Document.ID_ATTRIBUTE, "intro"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("intro");

        assertThat(document.findById("intro")).contains(first);
        assertThat(document.attribute(second, Document.ID_ATTRIBUTE)).isEmpty();
    }

    @Test
    void setAttribute_sameIdOnSameNode_isAllowed() {
        NodeId section = TestDocuments.section(document, document.root(), "A");
        document.setAttribute(section, Document.ID_ATTRIBUTE, "intro");

        document.setAttribute(section, Document.ID_ATTRIBUTE, "intro");

        assertThat(document.findById("intro")).contains(section);
    }

    @Test
    void resolve_targetRemoved_isUnresolved() {
        NodeId message = document.createNode(NodeKind.SYSTEM_MESSAGE);
        document.appendChild(document.root(), message);
        NodeId target = TestDocuments.paragraph(document, document.root(), "text");
        BackReference reference = document.addBackReference(message, target);

        assertThat(document.resolve(reference)).contains(target);

        document.remove(target);

        assertThat(document.resolve(reference)).isEmpty();
        assertThat(document.backReferences(message)).containsExactly(reference);
    }

    @Test
    void findById_detachedNode_isEmpty() {
        NodeId section = TestDocuments.section(document, document.root(), "A");
        String id = document.ensureIdentifier(section);

        document.remove(section);

        assertThat(document.findById(id)).isEmpty();
    }
}
