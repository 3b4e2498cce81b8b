// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.tree;

import java.util.ArrayList;
import java.util.function.Predicate;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import htree.dom.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Copy-producing removal of subtrees.
 */
public final class Pruner {
    private Pruner() {
    }

    /**
     * Returns a copy of the tree rooted at {@code node}, minus every subtree whose root satisfies {@code predicate}.
     * If {@code node} itself satisfies it, returns {@code null} instead.
     * <p>
     * The original tree is left untouched. The copy shares no structural links with it: the copied root has no
     * parent, and the sibling links of retained children are rebuilt to skip the removed ones.
     * <p>
     * {@code predicate} should be free of side effects, otherwise the result is not well-defined.
     */
    @CheckReturnValue
    public static @Nullable Node prune(final Node node, final Predicate<? super Node> predicate) {
        if (predicate.test(node)) {
            return null;
        }
        final var retained = new ArrayList<Node>();
        for (final var child : node.children()) {
            final var pruned = prune(child, predicate);
            if (pruned != null) {
                retained.add(pruned);
            }
        }
        final var result = node.shallowCopy();
        for (final var child : retained) {
            result.appendChild(child);
        }
        return result;
    }
}
