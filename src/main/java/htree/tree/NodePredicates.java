// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.tree;

import java.util.function.Predicate;
import java.util.regex.Pattern;
import htree.dom.Node;
import htree.dom.Tag;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Predicates over nodes, and the attribute lookups they're typically built from.
 */
public final class NodePredicates {
    private NodePredicates() {
    }

    /**
     * Returns a predicate that holds only for element nodes that also satisfy {@code predicate}.
     * <p>
     * {@code predicate} is never invoked on anything but an element. If it's {@code null}, every element matches.
     */
    public static Predicate<Node> element(final @Nullable Predicate<? super Node> predicate) {
        if (predicate == null) {
            return Node::isElement;
        }
        return (final Node node) -> node.isElement() && predicate.test(node);
    }

    /**
     * Returns a predicate that holds for element nodes with the given tag.
     */
    public static Predicate<Node> hasTag(final Tag tag) {
        return (final Node node) -> node.isElement() && node.tag() == tag;
    }

    /**
     * Returns the value of the first attribute of {@code node} with the given key, or the empty string if there's
     * none.
     */
    public static String attribute(final Node node, final String key) {
        for (final var attribute : node.attributes()) {
            if (key.equals(attribute.key())) {
                return attribute.value();
            }
        }
        return "";
    }

    /**
     * Checks whether the whitespace-separated {@code class} attribute of {@code node} contains the class name
     * {@code className}.
     */
    public static boolean classContains(final Node node, final String className) {
        final var classes = attribute(node, "class");
        for (final var name : whitespace.split(classes)) {
            if (!name.isEmpty() && name.equals(className)) {
                return true;
            }
        }
        return false;
    }

    private static final Pattern whitespace = Pattern.compile("\\s+");
}
