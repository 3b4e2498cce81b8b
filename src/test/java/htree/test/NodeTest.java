// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.test;

import java.util.ArrayList;
import java.util.List;
import htree.dom.Attribute;
import htree.dom.Node;
import htree.dom.NodeType;
import htree.dom.Tag;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import org.junit.jupiter.api.Test;

final class NodeTest {
    @Test
    void appendChildLinksSiblingsAndParent() {
        final var parent = Node.element(Tag.UL);
        final var first = Node.element(Tag.LI);
        final var second = Node.text("t");
        final var third = Node.element(Tag.LI);
        parent.appendChild(first);
        parent.appendChild(second);
        parent.appendChild(third);

        assertThat(parent.firstChild()).isSameAs(first);
        assertThat(parent.lastChild()).isSameAs(third);
        assertThat(first.previousSibling()).isNull();
        assertThat(first.nextSibling()).isSameAs(second);
        assertThat(second.previousSibling()).isSameAs(first);
        assertThat(second.nextSibling()).isSameAs(third);
        assertThat(third.nextSibling()).isNull();
        assertThat(List.of(first, second, third)).allSatisfy((final Node child) ->
            assertThat(child.parent()).isSameAs(parent));

        final var children = new ArrayList<Node>();
        parent.children().forEach(children::add);
        assertThat(children).containsExactly(first, second, third);
    }

    @Test
    void attachedNodeCannotBeAppendedAgain() {
        final var parent = Node.element(Tag.DIV);
        final var child = Node.element(Tag.P);
        parent.appendChild(child);
        assertThatIllegalArgumentException()
            .isThrownBy(() -> Node.element(Tag.SECTION).appendChild(child))
            .withMessageContaining("already attached");
    }

    @Test
    void nodeCannotBeItsOwnChild() {
        final var node = Node.element(Tag.DIV);
        assertThatIllegalArgumentException().isThrownBy(() -> node.appendChild(node));
    }

    @Test
    void ancestorCannotBecomeDescendant() {
        final var outer = Node.element(Tag.DIV);
        final var middle = Node.element(Tag.SPAN);
        final var inner = Node.element(Tag.EM);
        outer.appendChild(middle);
        middle.appendChild(inner);
        assertThatIllegalArgumentException()
            .isThrownBy(() -> inner.appendChild(outer))
            .withMessageContaining("descendant");
        assertThat(inner.firstChild()).isNull();
        assertThat(outer.parent()).isNull();
    }

    @Test
    void shallowCopyIsDetached() {
        final var parent = Node.element(Tag.DIV);
        final var node = Node.element(Tag.A, List.of(new Attribute("href", "/x")));
        parent.appendChild(node);
        node.appendChild(Node.text("link"));

        final var copy = node.shallowCopy();
        assertThat(copy).isNotSameAs(node);
        assertThat(copy.type()).isEqualTo(NodeType.ELEMENT);
        assertThat(copy.tag()).isEqualTo(Tag.A);
        assertThat(copy.data()).isEqualTo("a");
        assertThat(copy.attributes()).containsExactly(new Attribute("href", "/x"));
        assertThat(copy.parent()).isNull();
        assertThat(copy.firstChild()).isNull();
        assertThat(copy.lastChild()).isNull();
        assertThat(node.parent()).isSameAs(parent);
    }

    @Test
    void elementsByNameResolveKnownTags() {
        assertThat(Node.element("TABLE", List.of()).tag()).isEqualTo(Tag.TABLE);
        final var custom = Node.element("x-widget", List.of());
        assertThat(custom.tag()).isNull();
        assertThat(custom.data()).isEqualTo("x-widget");
        assertThat(custom.isElement()).isTrue();
    }

    @Test
    void doctypeKeepsOnlyPresentIdentifiers() {
        assertThat(Node.doctype("html", "", "").attributes()).isEmpty();
        assertThat(Node.doctype("html", "", "sys").attributes())
            .containsExactly(new Attribute(Node.SYSTEM_ID, "sys"));
    }

    @Test
    void describesItself() {
        assertThat(Node.element(Tag.DIV)).hasToString("Node[<div>]");
        assertThat(Node.text("x")).hasToString("Node[TEXT]");
    }
}
