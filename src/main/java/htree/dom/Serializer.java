// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.dom;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Objects;
import htree.util.Trace;
import htree.util.UnreachableCodeReachedError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The tree-to-HTML serializer, producing markup as close to the original as the tree allows, with no added
 * whitespace.
 */
public final class Serializer {
    private Serializer(final Writer writer) {
        this.writer = writer;
    }

    /**
     * Serializes the tree rooted at {@code rootNode} to HTML, writing the output to the given {@link Writer}.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     *
     * @throws UnrenderableNodeException If the tree contains an error node, or a void element with children.
     */
    public static void serialize(final Writer writer, final Node rootNode) throws IOException {
        final var serializer = new Serializer(writer);
        serializer.serializeNode(rootNode);
    }

    /**
     * Escapes the given string for use as a double-quoted attribute value.
     */
    public static String escapeAttributeValue(final String value) {
        final var writer = new StringWriter(value.length());
        try {
            new Serializer(writer).serializeString(value, AttributeEscaper.instance);
        } catch (final IOException e) {
            throw new UnreachableCodeReachedError("StringWriter failed", e);
        }
        return writer.toString();
    }

    private void serializeNode(final Node node) throws IOException {
        switch (node.type()) {
            case ERROR -> throw new UnrenderableNodeException("Cannot render an error node");
            case TEXT -> serializeString(node.data(), TextEscaper.instance);
            case DOCUMENT -> serializeChildren(node);
            case ELEMENT -> serializeElement(node);
            case COMMENT -> {
                writer.write("<!--");
                writer.write(node.data());
                writer.write("-->");
            }
            case DOCTYPE -> serializeDoctype(node);
            case RAW -> writer.write(node.data());
            default -> throw new UnrenderableNodeException("Unrecognized node type " + node.type());
        }
    }

    private void serializeElement(final Node element) throws IOException {
        try (final var trace = new Trace(() -> "Serializing element <" + element.data() + ">")) {
            trace.use();
            final var tag = element.tag();
            writer.write('<');
            writer.write(element.data());
            serializeAttributes(element);
            if (tag != null && tag.isVoid()) {
                if (element.firstChild() != null) {
                    throw new UnrenderableNodeException("Void element <" + element.data() + "> has child nodes");
                }
                writer.write("/>");
                return;
            }
            writer.write('>');
            if (tag == Tag.PRE || tag == Tag.LISTING || tag == Tag.TEXTAREA) {
                // A parser drops a newline right after the start tag, so a leading one has to be doubled.
                final var first = element.firstChild();
                if (first != null && first.type() == NodeType.TEXT && first.data().startsWith("\n")) {
                    writer.write('\n');
                }
            }
            if (tag != null && tag.hasLiteralContent()) {
                for (final var child : element.children()) {
                    if (child.type() == NodeType.TEXT) {
                        writer.write(child.data());
                    } else {
                        serializeNode(child);
                    }
                }
                if (tag == Tag.PLAINTEXT) {
                    // Nothing after <plaintext> is ever markup again, including its own closing tag.
                    return;
                }
            } else {
                serializeChildren(element);
            }
            writer.write("</");
            writer.write(element.data());
            writer.write('>');
        }
    }

    private void serializeChildren(final Node node) throws IOException {
        for (final var child : node.children()) {
            serializeNode(child);
        }
    }

    private void serializeDoctype(final Node doctype) throws IOException {
        writer.write("<!DOCTYPE ");
        writer.write(doctype.data());
        @Nullable String publicId = null;
        @Nullable String systemId = null;
        for (final var attribute : doctype.attributes()) {
            if (Node.PUBLIC_ID.equals(attribute.key())) {
                publicId = attribute.value();
            } else if (Node.SYSTEM_ID.equals(attribute.key())) {
                systemId = attribute.value();
            }
        }
        if (publicId != null) {
            writer.write(" PUBLIC ");
            serializeQuoted(publicId);
            if (systemId != null) {
                writer.write(' ');
                serializeQuoted(systemId);
            }
        } else if (systemId != null) {
            writer.write(" SYSTEM ");
            serializeQuoted(systemId);
        }
        writer.write('>');
    }

    private void serializeQuoted(final String string) throws IOException {
        final char quote = (string.indexOf('"') >= 0) ? '\'' : '"';
        writer.write(quote);
        writer.write(string);
        writer.write(quote);
    }

    private void serializeAttributes(final Node element) throws IOException {
        for (final var attribute : element.attributes()) {
            writer.write(' ');
            writer.write(attribute.key());
            writer.write("=\"");
            serializeString(attribute.value(), AttributeEscaper.instance);
            writer.write('"');
        }
    }

    private void serializeString(final String string, final Escaper escaper) throws IOException {
        int index = 0;
        int indexToEscape;
        while ((indexToEscape = findCharacterToEscape(string, index, escaper)) >= 0) {
            writer.write(string, index, indexToEscape - index);
            writer.write(Objects.requireNonNull(escaper.escape(string.charAt(indexToEscape))));
            index = indexToEscape + 1;
        }
        if (index < string.length()) {
            writer.write(string, index, string.length() - index);
        }
    }

    private static int findCharacterToEscape(final String string, final int startIndex, final Escaper escaper) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            if (escaper.escape(string.charAt(i)) != null) {
                return i;
            }
        }
        return -1;
    }

    private final Writer writer;

    private sealed interface Escaper {
        @Nullable String escape(char character);
    }

    private static final class AttributeEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return switch (character) {
                case '&' -> "&amp;";
                case '\'' -> "&#39;";
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '"' -> "&#34;";
                default -> null;
            };
        }

        private static final AttributeEscaper instance = new AttributeEscaper();
    }

    private static final class TextEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return (character == '\r') ? "&#13;" : AttributeEscaper.instance.escape(character);
        }

        private static final TextEscaper instance = new TextEscaper();
    }
}
