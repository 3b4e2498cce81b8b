// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.tree;

import java.util.function.Predicate;
import htree.dom.Node;
import htree.dom.NodeType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Single-result searches of a tree.
 */
public final class Search {
    private Search() {
    }

    /**
     * Finds the first node, in a preorder depth-first search of the tree rooted at {@code root}, satisfying the given
     * predicate, or {@code null} if there's none.
     * <p>
     * The root itself is tested first. Text nodes are never descended into.
     */
    public static @Nullable Node find(final Node root, final Predicate<? super Node> predicate) {
        if (predicate.test(root)) {
            return root;
        }
        if (root.type() == NodeType.TEXT) {
            return null;
        }
        for (var child = root.firstChild(); child != null; child = child.nextSibling()) {
            final var found = find(child, predicate);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Like {@link #find(Node, Predicate)}, but only element nodes are ever tested with, and returned for,
     * {@code predicate}. A {@code null} predicate matches every element.
     */
    public static @Nullable Node findElement(final Node root, final @Nullable Predicate<? super Node> predicate) {
        return find(root, NodePredicates.element(predicate));
    }
}
