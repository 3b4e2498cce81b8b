// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.parse;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import htree.dom.Attribute;
import htree.dom.Node;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.DocumentType;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.nodes.XmlDeclaration;
import org.jsoup.parser.Parser;

/**
 * Builds trees out of HTML, using jsoup as the parser.
 * <p>
 * jsoup does all the actual parsing, including tag soup resolution; this class only converts jsoup's DOM into
 * {@link Node}s.
 * <p>
 * Text nodes receive jsoup's already decoded text. Since {@link htree.tree.TextExtractor} decodes entities once more,
 * text extracted from converted trees is decoded twice: {@code &amp;lt;} in the source comes out as {@code <}.
 */
public final class JsoupTreeBuilder {
    private JsoupTreeBuilder() {
    }

    /**
     * Parses the given HTML document and returns the resulting document node.
     */
    public static Node parse(final String html) {
        return convert(Jsoup.parse(html));
    }

    /**
     * Parses the HTML document read from the given reader and returns the resulting document node.
     * <p>
     * Any {@link IOException}s thrown by the reader are allowed to propagate.
     */
    public static Node parse(final Reader reader) throws IOException {
        return convert(Parser.htmlParser().parseInput(reader, ""));
    }

    /**
     * Converts the jsoup subtree rooted at {@code jsoupNode} into a new, independent tree.
     *
     * @throws IllegalArgumentException If the subtree contains a kind of jsoup node with no counterpart.
     */
    public static Node convert(final org.jsoup.nodes.Node jsoupNode) {
        final var node = convertSingle(jsoupNode);
        final var isDocument = jsoupNode instanceof Document;
        for (final var child : jsoupNode.childNodes()) {
            // Whitespace before <html> never becomes a node in standard tree construction, but jsoup keeps it.
            if (isDocument && child instanceof final TextNode text && text.isBlank()) {
                continue;
            }
            node.appendChild(convert(child));
        }
        return node;
    }

    private static Node convertSingle(final org.jsoup.nodes.Node jsoupNode) {
        // CDataNode is a TextNode, and Document an Element, so order matters.
        if (jsoupNode instanceof final TextNode text) {
            return Node.text(text.getWholeText());
        } else if (jsoupNode instanceof final DataNode data) {
            return Node.text(data.getWholeData());
        } else if (jsoupNode instanceof Document) {
            return Node.document();
        } else if (jsoupNode instanceof final Element element) {
            final var attributes = new ArrayList<Attribute>(element.attributesSize());
            for (final var attribute : element.attributes()) {
                attributes.add(new Attribute(attribute.getKey(), attribute.getValue()));
            }
            return Node.element(element.normalName(), attributes);
        } else if (jsoupNode instanceof final Comment comment) {
            return Node.comment(comment.getData());
        } else if (jsoupNode instanceof final DocumentType doctype) {
            return Node.doctype(doctype.name(), doctype.publicId(), doctype.systemId());
        } else if (jsoupNode instanceof final XmlDeclaration declaration) {
            return Node.raw(declaration.outerHtml());
        }
        throw new IllegalArgumentException("Unsupported jsoup node type " + jsoupNode.getClass().getName());
    }
}
