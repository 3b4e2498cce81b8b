// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.tree;

import java.util.ArrayDeque;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import htree.dom.Node;
import htree.dom.NodeType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Lazy preorder, depth-first traversals of a tree.
 * <p>
 * Every method returns a new sequential, single-use {@link Stream}. Nodes are visited only as the stream is consumed:
 * a consumer that stops early, for example with {@link Stream#findFirst()} or {@link Stream#limit(long)}, stops the
 * traversal along with it. Text nodes are never descended into.
 */
public final class Traversal {
    private Traversal() {
    }

    /**
     * Returns a stream of the nodes of the tree rooted at {@code root}, in preorder.
     * <p>
     * The root is always included. Text nodes below it are skipped entirely.
     */
    public static Stream<Node> walk(final Node root) {
        return stream(new PreorderSpliterator(root, root, walkSelector));
    }

    /**
     * Returns a stream of the nodes of the tree rooted at {@code root} that satisfy {@code predicate}, in preorder.
     * <p>
     * The subtree of a matching node is <em>not</em> searched. To continue searching in the subtree of a matched node
     * {@code n}, call {@link #findAllChildren(Node, Predicate) findAllChildren(n, predicate)} while handling it.
     */
    public static Stream<Node> findAll(final Node root, final Predicate<? super Node> predicate) {
        return stream(new PreorderSpliterator(root, root, filterSelector(predicate)));
    }

    /**
     * Like {@link #findAll(Node, Predicate)}, but starts with the children of {@code node}, not {@code node} itself.
     */
    public static Stream<Node> findAllChildren(final Node node, final Predicate<? super Node> predicate) {
        if (node.type() == NodeType.TEXT) {
            return Stream.empty();
        }
        return stream(new PreorderSpliterator(node.firstChild(), node, filterSelector(predicate)));
    }

    /**
     * Like {@link #findAll(Node, Predicate)}, but tests, and returns, only element nodes. A {@code null} predicate
     * matches every element.
     */
    public static Stream<Node> findAllElements(final Node root, final @Nullable Predicate<? super Node> predicate) {
        return findAll(root, NodePredicates.element(predicate));
    }

    /**
     * Like {@link #findAllElements(Node, Predicate)}, but starts with the children of {@code node}.
     */
    public static Stream<Node> findAllChildElements(
        final Node node,
        final @Nullable Predicate<? super Node> predicate
    ) {
        return findAllChildren(node, NodePredicates.element(predicate));
    }

    private static Stream<Node> stream(final Spliterator<Node> spliterator) {
        return StreamSupport.stream(spliterator, false);
    }

    private static Selector filterSelector(final Predicate<? super Node> predicate) {
        return (final Node node, final boolean isRoot) -> predicate.test(node) ? Visit.YIELD : Visit.DESCEND;
    }

    private static final Selector walkSelector = (final Node node, final boolean isRoot) ->
        (isRoot || node.type() != NodeType.TEXT) ? Visit.YIELD_AND_DESCEND : Visit.SKIP;

    private enum Visit {
        YIELD(true, false),
        DESCEND(false, true),
        YIELD_AND_DESCEND(true, true),
        SKIP(false, false);

        Visit(final boolean yields, final boolean descends) {
            this.yields = yields;
            this.descends = descends;
        }

        private final boolean yields;
        private final boolean descends;
    }

    @FunctionalInterface
    private interface Selector {
        Visit visit(Node node, boolean isRoot);
    }

    /**
     * A preorder walk driven by an explicit stack of cursors. Each cursor is the next node to visit in its sibling
     * chain; the siblings of the root are never followed.
     */
    private static final class PreorderSpliterator extends Spliterators.AbstractSpliterator<Node> {
        private PreorderSpliterator(final @Nullable Node first, final Node root, final Selector selector) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.root = root;
            this.selector = selector;
            if (first != null) {
                pending.push(first);
            }
        }

        @Override
        public boolean tryAdvance(final Consumer<? super Node> action) {
            while (!pending.isEmpty()) {
                final var node = pending.pop();
                final var isRoot = node == root;
                if (!isRoot) {
                    final var sibling = node.nextSibling();
                    if (sibling != null) {
                        pending.push(sibling);
                    }
                }
                final var visit = selector.visit(node, isRoot);
                if (visit.descends && node.type() != NodeType.TEXT) {
                    final var child = node.firstChild();
                    if (child != null) {
                        pending.push(child);
                    }
                }
                if (visit.yields) {
                    action.accept(node);
                    return true;
                }
            }
            return false;
        }

        private final Node root;
        private final Selector selector;
        private final ArrayDeque<Node> pending = new ArrayDeque<>();
    }
}
