// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.stream.Stream;
import htree.dom.Node;
import htree.dom.Tag;
import htree.parse.JsoupTreeBuilder;
import htree.tree.TextExtractor;
import static htree.test.TestTrees.element;
import static htree.test.TestTrees.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

final class TextExtractorTest {
    static Stream<Arguments> provideDocuments() {
        return Stream.of(
            Arguments.of("<div>x</div>", "x"),
            Arguments.of("<div>x<br>y</div>", "x\ny"),
            Arguments.of("<div>x <style>y</style> z</div>", "x  z"),
            Arguments.of("<div>a<script>var b = 1;</script>c</div>", "ac"),
            Arguments.of("<p>one <b>two</b> <i>three</i></p>", "one two three"),
            Arguments.of("<title>Fish &amp; chips</title><!-- not text -->", "Fish & chips")
        );
    }

    @ParameterizedTest
    @MethodSource("provideDocuments")
    void extractsTextOfParsedDocument(final String html, final String expected) {
        assertThat(TextExtractor.text(JsoupTreeBuilder.parse(html))).isEqualTo(expected);
    }

    @Test
    void decodesEntitiesInTextData() {
        final var root = element(Tag.P, text("a &lt; b &amp;&amp; c &#x263A; &eacute;"));
        assertThat(TextExtractor.text(root)).isEqualTo("a < b && c ☺ é");
    }

    @Test
    void lineBreakIgnoresItsChildren() {
        final var lineBreak = element(Tag.BR, text("never"));
        assertThat(TextExtractor.text(element(Tag.DIV, text("a"), lineBreak, text("b")))).isEqualTo("a\nb");
    }

    @Test
    void commentsAndDoctypesContributeNothing() {
        final var document = Node.document();
        document.appendChild(Node.doctype("html", "", ""));
        document.appendChild(Node.comment("hidden"));
        document.appendChild(element(Tag.SPAN, text("shown")));
        assertThat(TextExtractor.text(document)).isEqualTo("shown");
    }

    @Test
    void wholeFixtureText() throws IOException {
        final var root = TestTrees.parseFixture("sample.html");
        assertThat(TextExtractor.text(root))
            .isEqualTo("HTML & entitiesCharacter entitiesUse < for less-than.\nOr don't.NamedResult&&");
    }

    @Test
    void writesIntoGivenWriter() throws IOException {
        final var writer = new StringWriter();
        writer.write("> ");
        TextExtractor.writeText(writer, element(Tag.DIV, text("quoted")));
        assertThat(writer.toString()).isEqualTo("> quoted");
    }

    @Test
    void propagatesWriterFailure() {
        final var failure = new IOException("disk full");
        final var writer = new FailingWriter(failure);
        assertThatThrownBy(() -> TextExtractor.writeText(writer, element(Tag.DIV, text("x"))))
            .isSameAs(failure);
    }
}
