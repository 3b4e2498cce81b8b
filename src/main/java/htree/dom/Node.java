// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.dom;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node of a markup tree.
 * <p>
 * Children form a doubly linked list owned by their parent: {@link #firstChild()} has no previous sibling,
 * {@link #lastChild()} has no next sibling, and following {@link #nextSibling()} from the first child reaches the last
 * one. The parent and sibling links are plain back references.
 * <p>
 * Nodes compare by identity. A node's own payload, that is its type, tag, data and attributes, never changes after
 * construction; only the structural links are mutable, through {@link #appendChild(Node)}.
 */
public final class Node {
    private Node(
        final NodeType type,
        final @Nullable Tag tag,
        final String data,
        final List<Attribute> attributes
    ) {
        this.type = type;
        this.tag = tag;
        this.data = data;
        this.attributes = List.copyOf(attributes);
    }

    /**
     * Returns a new, empty document node.
     */
    public static Node document() {
        return new Node(NodeType.DOCUMENT, null, "", List.of());
    }

    /**
     * Returns a new element node for the given known tag.
     */
    public static Node element(final Tag tag, final List<Attribute> attributes) {
        return new Node(NodeType.ELEMENT, tag, tag.htmlName(), attributes);
    }

    /**
     * Returns a new element node for the given known tag, with no attributes.
     */
    public static Node element(final Tag tag) {
        return element(tag, List.of());
    }

    /**
     * Returns a new element node with the given name, which doesn't need to be the name of a known {@link Tag}.
     */
    public static Node element(final String name, final List<Attribute> attributes) {
        return new Node(NodeType.ELEMENT, Tag.byHtmlName(name), name, attributes);
    }

    /**
     * Returns a new text node. The text is stored as given; this method does no entity processing.
     */
    public static Node text(final String text) {
        return new Node(NodeType.TEXT, null, text, List.of());
    }

    public static Node comment(final String text) {
        return new Node(NodeType.COMMENT, null, text, List.of());
    }

    /**
     * Returns a new doctype node. Empty identifiers are left out.
     */
    public static Node doctype(final String name, final String publicId, final String systemId) {
        final var attributes = new ArrayList<Attribute>(2);
        if (!publicId.isEmpty()) {
            attributes.add(new Attribute(PUBLIC_ID, publicId));
        }
        if (!systemId.isEmpty()) {
            attributes.add(new Attribute(SYSTEM_ID, systemId));
        }
        return new Node(NodeType.DOCTYPE, null, name, attributes);
    }

    /**
     * Returns a new node whose content is emitted verbatim by every renderer.
     */
    public static Node raw(final String content) {
        return new Node(NodeType.RAW, null, content, List.of());
    }

    public static Node error(final String message) {
        return new Node(NodeType.ERROR, null, message, List.of());
    }

    public NodeType type() {
        return type;
    }

    /**
     * Retrieves the tag of an element node, or {@code null} if this isn't an element or the element's name is not a
     * known {@link Tag}.
     */
    public @Nullable Tag tag() {
        return tag;
    }

    /**
     * Retrieves the payload of this node: the name of an element or a doctype, the content of a text, comment or raw
     * node. Empty for documents.
     */
    public String data() {
        return data;
    }

    /**
     * Retrieves the attributes in their original order. Keys are not guaranteed to be unique.
     */
    public List<Attribute> attributes() {
        return attributes;
    }

    public boolean isElement() {
        return type == NodeType.ELEMENT;
    }

    public @Nullable Node parent() {
        return parent;
    }

    public @Nullable Node firstChild() {
        return firstChild;
    }

    public @Nullable Node lastChild() {
        return lastChild;
    }

    public @Nullable Node previousSibling() {
        return previousSibling;
    }

    public @Nullable Node nextSibling() {
        return nextSibling;
    }

    /**
     * Returns an iterable over the children of this node, from the first to the last.
     */
    public Iterable<Node> children() {
        return () -> new ChildIterator(firstChild);
    }

    /**
     * Appends the given node as the last child of this node.
     *
     * @throws IllegalArgumentException If {@code child} is already attached to a parent or to siblings, or if it is
     *     this node or one of its ancestors.
     */
    public void appendChild(final Node child) {
        if (child.parent != null || child.previousSibling != null || child.nextSibling != null) {
            throw new IllegalArgumentException("Node is already attached to a tree: " + child);
        }
        for (var ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == child) {
                throw new IllegalArgumentException("Node cannot be a child of itself or its descendant: " + child);
            }
        }
        final var last = lastChild;
        if (last == null) {
            firstChild = child;
        } else {
            last.nextSibling = child;
        }
        child.previousSibling = last;
        child.parent = this;
        lastChild = child;
    }

    /**
     * Returns a detached copy of this node: same type, tag, data and attributes, but no parent, siblings nor children.
     */
    @CheckReturnValue
    public Node shallowCopy() {
        return new Node(type, tag, data, attributes);
    }

    @Override
    public String toString() {
        return (type == NodeType.ELEMENT) ? "Node[<" + data + ">]" : "Node[" + type + "]";
    }

    /**
     * The attribute key a doctype node stores its public identifier under.
     */
    public static final String PUBLIC_ID = "public";
    /**
     * The attribute key a doctype node stores its system identifier under.
     */
    public static final String SYSTEM_ID = "system";

    private final NodeType type;
    private final @Nullable Tag tag;
    private final String data;
    private final List<Attribute> attributes;
    private @Nullable Node parent = null;
    private @Nullable Node firstChild = null;
    private @Nullable Node lastChild = null;
    private @Nullable Node previousSibling = null;
    private @Nullable Node nextSibling = null;

    private static final class ChildIterator implements Iterator<Node> {
        private ChildIterator(final @Nullable Node first) {
            current = first;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public Node next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more children left");
            }
            current = result.nextSibling;
            return result;
        }

        private @Nullable Node current;
    }
}
