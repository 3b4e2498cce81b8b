// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import htree.dom.Attribute;
import htree.dom.Node;
import htree.dom.Serializer;
import htree.dom.Tag;
import htree.dom.UnrenderableNodeException;
import static htree.test.TestTrees.element;
import static htree.test.TestTrees.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.Test;

final class SerializerTest {
    @Test
    void escapesText() throws IOException {
        assertThat(serialize(text("a<b>&'\"\r"))).isEqualTo("a&lt;b&gt;&amp;&#39;&#34;&#13;");
    }

    @Test
    void escapesAttributeValues() {
        assertThat(Serializer.escapeAttributeValue("plain")).isEqualTo("plain");
        assertThat(Serializer.escapeAttributeValue("a\"b'c<&>\r")).isEqualTo("a&#34;b&#39;c&lt;&amp;&gt;\r");
    }

    @Test
    void writesElementsWithoutAddingWhitespace() throws IOException {
        final var root = element(Tag.DIV, List.of(new Attribute("hidden", ""), new Attribute("id", "x")),
            element(Tag.P, text("a"), element(Tag.EM, text("b"))),
            Node.comment(" c "));
        assertThat(serialize(root)).isEqualTo("<div hidden=\"\" id=\"x\"><p>a<em>b</em></p><!-- c --></div>");
    }

    @Test
    void voidElementsSelfClose() throws IOException {
        final var image = element(Tag.IMG, List.of(new Attribute("src", "a.png"), new Attribute("alt", "")));
        assertThat(serialize(element(Tag.P, text("x"), element(Tag.BR), image)))
            .isEqualTo("<p>x<br/><img src=\"a.png\" alt=\"\"/></p>");
    }

    @Test
    void voidElementWithChildrenIsRejected() {
        final var lineBreak = element(Tag.BR, text("child"));
        final var exception = catchThrowableOfType(
            () -> serialize(element(Tag.DIV, lineBreak)),
            UnrenderableNodeException.class
        );
        assertThat(exception).hasMessage("Void element <br> has child nodes");
        assertThat(exception.traces()).containsExactly("Serializing element <br>", "Serializing element <div>");
    }

    @Test
    void literalContentIsNotEscaped() throws IOException {
        assertThat(serialize(element(Tag.SCRIPT, text("a < b && c"))))
            .isEqualTo("<script>a < b && c</script>");
        assertThat(serialize(element(Tag.PLAINTEXT, text("<b>")))).isEqualTo("<plaintext><b>");
    }

    @Test
    void leadingNewlineInPreformattedTextIsDoubled() throws IOException {
        assertThat(serialize(element(Tag.PRE, text("\ncode")))).isEqualTo("<pre>\n\ncode</pre>");
        assertThat(serialize(element(Tag.PRE, text("code\n")))).isEqualTo("<pre>code\n</pre>");
    }

    @Test
    void writesDoctypes() throws IOException {
        assertThat(serialize(Node.doctype("html", "", ""))).isEqualTo("<!DOCTYPE html>");
        assertThat(serialize(Node.doctype(
            "html",
            "-//W3C//DTD HTML 4.01//EN",
            "http://www.w3.org/TR/html4/strict.dtd"
        ))).isEqualTo("<!DOCTYPE html PUBLIC \"-//W3C//DTD HTML 4.01//EN\" \"http://www.w3.org/TR/html4/strict.dtd\">");
        assertThat(serialize(Node.doctype("html", "", "about:legacy-compat")))
            .isEqualTo("<!DOCTYPE html SYSTEM \"about:legacy-compat\">");
    }

    @Test
    void writesDocumentsAndRawContent() throws IOException {
        final var document = Node.document();
        document.appendChild(Node.raw("<?xml version=\"1.0\"?>"));
        document.appendChild(Node.element("x-custom", List.of()));
        assertThat(serialize(document)).isEqualTo("<?xml version=\"1.0\"?><x-custom></x-custom>");
    }

    @Test
    void errorNodesAreRejected() {
        assertThatExceptionOfType(UnrenderableNodeException.class)
            .isThrownBy(() -> serialize(Node.error("oops")))
            .withMessage("Cannot render an error node");
    }

    private static String serialize(final Node node) throws IOException {
        final var writer = new StringWriter();
        Serializer.serialize(writer, node);
        return writer.toString();
    }
}
