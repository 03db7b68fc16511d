package com.docpublish.core.tree;

import com.docpublish.core.settings.Settings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable document tree stored as an arena of nodes addressed by {@link NodeId}.
 *
 * <p>Node {@code #0} is the root and always has kind {@link NodeKind#DOCUMENT}. Nodes are
 * created detached and become part of the tree once appended to an attached parent. Every
 * attached node except the root has exactly one owning parent; the tree enforces this on
 * {@link #appendChild(NodeId, NodeId)} and {@link #insertChild(NodeId, int, NodeId)}.
 *
 * <p><b>Back-references:</b> {@link #addBackReference(NodeId, NodeId)} records a lookup relation
 * that owns nothing. Removing a node never deletes the references pointing at it; they resolve
 * to {@link Optional#empty()} from then on.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Document document = Document.create("notes.txt", settings);
 * NodeId paragraph = document.createNode(NodeKind.PARAGRAPH);
 * document.appendChild(paragraph, document.createText("Hello"));
 * document.appendChild(document.root(), paragraph);
 * }</pre>
 *
 * <p>Instances are not thread-safe.
 */
public final class Document {

    /** Attribute holding the document-unique identifier of a node. */
    public static final String ID_ATTRIBUTE = "id";

    private static final String ID_PREFIX = "id";

    private final String sourceName;
    private final Settings settings;
    private final List<NodeData> nodes = new ArrayList<>();
    private final List<BackReference> backReferences = new ArrayList<>();
    private final Map<String, NodeId> identifiers = new LinkedHashMap<>();
    private int idCounter;

    private Document(String sourceName, Settings settings) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        nodes.add(new NodeData(NodeKind.DOCUMENT, null));
        setAttribute(root(), "source", sourceName);
    }

    /**
     * Creates an empty document whose root has no children.
     *
     * @param sourceName name of the source the document is built from
     * @param settings resolved settings of the run
     * @return new document
     */
    public static Document create(String sourceName, Settings settings) {
        return new Document(sourceName, settings);
    }

    public String sourceName() {
        return sourceName;
    }

    public Settings settings() {
        return settings;
    }

    public NodeId root() {
        return new NodeId(0);
    }

    /**
     * Returns true if the root has no children.
     *
     * @return true for an empty document
     */
    public boolean isEmpty() {
        return childCount(root()) == 0;
    }

    /**
     * Number of nodes ever created in this document, attached or not.
     *
     * @return arena size
     */
    public int size() {
        return nodes.size();
    }

    // ==================== Node Creation ====================

    /**
     * Creates a detached node.
     *
     * @param kind node kind, must not be {@link NodeKind#DOCUMENT}
     * @return id of the new node
     */
    public NodeId createNode(NodeKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == NodeKind.DOCUMENT) {
            throw new IllegalArgumentException("A document has exactly one DOCUMENT node");
        }
        nodes.add(new NodeData(kind, kind.isLeaf() ? "" : null));
        return new NodeId(nodes.size() - 1);
    }

    /**
     * Creates a detached text leaf.
     *
     * @param text text value
     * @return id of the new node
     */
    public NodeId createText(String text) {
        return createLeaf(NodeKind.TEXT, text);
    }

    /**
     * Creates a detached leaf of the given kind carrying a text value.
     *
     * @param kind {@link NodeKind#TEXT} or {@link NodeKind#COMMENT}
     * @param text text value
     * @return id of the new node
     */
    public NodeId createLeaf(NodeKind kind, String text) {
        if (!kind.isLeaf()) {
            throw new IllegalArgumentException("Not a leaf kind: " + kind);
        }
        NodeId id = createNode(kind);
        data(id).text = Objects.requireNonNull(text, "text must not be null");
        return id;
    }

    // ==================== Structure ====================

    public NodeKind kind(NodeId node) {
        return data(node).kind;
    }

    public int childCount(NodeId node) {
        return data(node).children.size();
    }

    /**
     * Returns the child at the given position.
     *
     * @param node parent node
     * @param index zero-based child position
     * @return child id
     * @throws IndexOutOfBoundsException if the node has no such child
     */
    public NodeId child(NodeId node, int index) {
        return data(node).children.get(index);
    }

    /**
     * Returns a snapshot of the children of a node; later mutations do not affect it.
     *
     * @param node parent node
     * @return children in order
     */
    public List<NodeId> children(NodeId node) {
        return List.copyOf(data(node).children);
    }

    public Optional<NodeId> parent(NodeId node) {
        return Optional.ofNullable(data(node).parent);
    }

    /**
     * Appends a detached node as the last child of {@code parent}.
     *
     * @param parent new owner
     * @param child detached node
     * @throws IllegalStateException if the child already has a parent, is the root, or is an
     *     ancestor of {@code parent}
     */
    public void appendChild(NodeId parent, NodeId child) {
        insertChild(parent, childCount(parent), child);
    }

    /**
     * Inserts a detached node at a given position among the children of {@code parent}.
     *
     * @param parent new owner
     * @param index position, {@code 0..childCount(parent)}
     * @param child detached node
     */
    public void insertChild(NodeId parent, int index, NodeId child) {
        NodeData parentData = data(parent);
        NodeData childData = data(child);
        if (parentData.kind.isLeaf()) {
            throw new IllegalStateException("Leaf node " + parent + " cannot have children");
        }
        if (child.index() == 0) {
            throw new IllegalStateException("The root cannot be a child");
        }
        if (childData.parent != null) {
            throw new IllegalStateException("Node " + child + " already belongs to " + childData.parent);
        }
        if (isAncestorOrSelf(child, parent)) {
            throw new IllegalStateException("Node " + child + " is an ancestor of " + parent);
        }
        parentData.children.add(index, child);
        childData.parent = parent;
    }

    /**
     * Detaches a node, with its subtree, from its parent.
     *
     * <p>Back-references into the removed subtree stay registered but no longer resolve.
     * Removing an already detached node is a no-op.
     *
     * @param node node to remove
     * @throws IllegalArgumentException if {@code node} is the root
     */
    public void remove(NodeId node) {
        if (node.index() == 0) {
            throw new IllegalArgumentException("The root cannot be removed");
        }
        NodeData nodeData = data(node);
        if (nodeData.parent == null) {
            return;
        }
        data(nodeData.parent).children.remove(node);
        nodeData.parent = null;
    }

    /**
     * Returns true if the node is reachable from the root.
     *
     * @param node node to check
     * @return true if attached
     */
    public boolean isAttached(NodeId node) {
        NodeId current = node;
        while (current != null) {
            if (current.index() == 0) {
                return true;
            }
            current = data(current).parent;
        }
        return false;
    }

    private boolean isAncestorOrSelf(NodeId candidate, NodeId node) {
        NodeId current = node;
        while (current != null) {
            if (current.equals(candidate)) {
                return true;
            }
            current = data(current).parent;
        }
        return false;
    }

    // ==================== Text ====================

    /**
     * Returns the text value of a leaf node.
     *
     * @param node {@link NodeKind#TEXT} or {@link NodeKind#COMMENT} node
     * @return text value
     */
    public String text(NodeId node) {
        NodeData nodeData = data(node);
        if (!nodeData.kind.isLeaf()) {
            throw new IllegalArgumentException("Node " + node + " of kind " + nodeData.kind + " has no text value");
        }
        return nodeData.text;
    }

    public void setText(NodeId node, String text) {
        text(node);
        data(node).text = Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Concatenates the text of all {@link NodeKind#TEXT} leaves below a node, in document order.
     *
     * @param node subtree root
     * @return flattened text
     */
    public String textContent(NodeId node) {
        StringBuilder sb = new StringBuilder();
        collectText(node, sb);
        return sb.toString();
    }

    private void collectText(NodeId node, StringBuilder sb) {
        NodeData nodeData = data(node);
        if (nodeData.kind == NodeKind.TEXT) {
            sb.append(nodeData.text);
            return;
        }
        for (NodeId child : nodeData.children) {
            collectText(child, sb);
        }
    }

    // ==================== Attributes ====================

    public Optional<String> attribute(NodeId node, String name) {
        return Optional.ofNullable(data(node).attributes.get(name));
    }

    /**
     * Sets an attribute. Setting {@link #ID_ATTRIBUTE} also registers the id for
     * {@link #findById(String)}; ids are unique within the document, detached nodes included.
     *
     * @param node target node
     * @param name attribute name
     * @param value attribute value
     * @throws IllegalStateException if the id already belongs to another node
     */
    public void setAttribute(NodeId node, String name, String value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (ID_ATTRIBUTE.equals(name)) {
            NodeId owner = identifiers.get(value);
            if (owner != null && !owner.equals(node)) {
                throw new IllegalStateException("Id '" + value + "' already belongs to node " + owner);
            }
        }
        String previous = data(node).attributes.put(name, value);
        if (ID_ATTRIBUTE.equals(name)) {
            if (previous != null) {
                identifiers.remove(previous);
            }
            identifiers.put(value, node);
        }
    }

    public void removeAttribute(NodeId node, String name) {
        String previous = data(node).attributes.remove(name);
        if (ID_ATTRIBUTE.equals(name) && previous != null) {
            identifiers.remove(previous);
        }
    }

    public Map<String, String> attributes(NodeId node) {
        return Collections.unmodifiableMap(data(node).attributes);
    }

    /**
     * Returns the node's identifier, assigning a new document-unique one if it has none.
     *
     * @param node node to identify
     * @return the node's {@link #ID_ATTRIBUTE} value
     */
    public String ensureIdentifier(NodeId node) {
        Optional<String> existing = attribute(node, ID_ATTRIBUTE);
        if (existing.isPresent()) {
            return existing.get();
        }
        String id;
        do {
            id = ID_PREFIX + (++idCounter);
        } while (identifiers.containsKey(id));
        setAttribute(node, ID_ATTRIBUTE, id);
        return id;
    }

    /**
     * Looks up an attached node by identifier.
     *
     * @param id identifier value
     * @return node, or empty if unknown or detached
     */
    public Optional<NodeId> findById(String id) {
        return Optional.ofNullable(identifiers.get(id)).filter(this::isAttached);
    }

    // ==================== Back-references ====================

    /**
     * Registers a non-owning reference from {@code from} to {@code to}.
     *
     * @param from referring node
     * @param to referenced node
     * @return the registered reference
     */
    public BackReference addBackReference(NodeId from, NodeId to) {
        data(from);
        data(to);
        BackReference reference = new BackReference(from, to);
        backReferences.add(reference);
        return reference;
    }

    /**
     * Returns all references registered from a node, resolved or not.
     *
     * @param from referring node
     * @return references in registration order
     */
    public List<BackReference> backReferences(NodeId from) {
        return backReferences.stream()
            .filter(reference -> reference.from().equals(from))
            .toList();
    }

    /**
     * Resolves a back-reference.
     *
     * @param reference reference to resolve
     * @return the target, or empty if either end is no longer attached to the tree
     */
    public Optional<NodeId> resolve(BackReference reference) {
        if (isAttached(reference.from()) && isAttached(reference.to())) {
            return Optional.of(reference.to());
        }
        return Optional.empty();
    }

    private NodeData data(NodeId node) {
        Objects.requireNonNull(node, "node must not be null");
        if (node.index() >= nodes.size()) {
            throw new IllegalArgumentException("Unknown node " + node + " in document " + sourceName);
        }
        return nodes.get(node.index());
    }

    @Override
    public String toString() {
        return "Document[" + sourceName + ", " + nodes.size() + " nodes]";
    }

    private static final class NodeData {
        private final NodeKind kind;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<NodeId> children = new ArrayList<>();
        private NodeId parent;
        private String text;

        private NodeData(NodeKind kind, String text) {
            this.kind = kind;
            this.text = text;
        }
    }
}
