// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.render;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import htree.dom.Node;
import htree.dom.NodeType;
import htree.dom.Serializer;
import htree.dom.UnrenderableNodeException;
import htree.util.Trace;

/**
 * The indenting tree-to-HTML renderer.
 * <p>
 * Nesting is shown with two spaces of indentation per level. Block elements, such as {@code <div>}, start on a line of
 * their own and put their content on separate lines, while inline elements and text flow along the current line.
 * Void elements get no closing tag, and the content of literal-content elements, such as {@code <script>}, is passed
 * through untouched.
 */
public final class Indenter {
    private Indenter(final BeginningOfLineWriter writer) {
        this.writer = writer;
    }

    /**
     * Writes the tree rooted at {@code node} to {@code writer}, indented as if it was nested {@code level} levels
     * deep.
     * <p>
     * Output is buffered, and flushed to {@code writer} once rendering finishes, successfully or not. Any
     * {@link IOException}s thrown by the writer are allowed to propagate.
     *
     * @throws UnrenderableNodeException If the tree contains a node that can't be represented as markup.
     */
    public static void indent(final Writer writer, final Node node, final int level) throws IOException {
        render(writer, node, level, false);
    }

    /**
     * Like {@link #indent(Writer, Node, int)}, but also makes sure the output ends with a newline.
     */
    public static void indentln(final Writer writer, final Node node, final int level) throws IOException {
        render(writer, node, level, true);
    }

    private static void render(
        final Writer writer,
        final Node node,
        final int level,
        final boolean endWithNewline
    ) throws IOException {
        if (level < 0) {
            throw new IllegalArgumentException("Negative indentation level " + level);
        }
        final var buffered = new BufferedWriter(writer);
        final var lineWriter = new BeginningOfLineWriter(buffered);
        try {
            new Indenter(lineWriter).indentNode(node, level);
            if (endWithNewline) {
                lineWriter.ensureNewline();
            }
        } catch (final IOException | RuntimeException e) {
            flushAfterFailure(buffered, e);
            throw e;
        }
        buffered.flush();
    }

    private static void flushAfterFailure(final Writer writer, final Exception failure) {
        try {
            writer.flush();
        } catch (final IOException e) {
            failure.addSuppressed(e);
        }
    }

    private void indentNode(final Node node, final int level) throws IOException {
        final var prefix = indentUnit.repeat(level);
        switch (node.type()) {
            case ERROR -> throw new UnrenderableNodeException("Cannot render an error node");
            case TEXT, COMMENT -> {
                if (writer.isAtBeginningOfLine()) {
                    writer.write(prefix);
                }
                Serializer.serialize(writer, node);
            }
            case DOCTYPE -> {
                Serializer.serialize(writer, node);
                writer.ensureNewline();
            }
            case DOCUMENT -> {
                for (final var child : node.children()) {
                    indentNode(child, level);
                }
            }
            case ELEMENT -> indentElement(node, level, prefix);
            case RAW -> writer.write(node.data());
            default -> throw new UnrenderableNodeException("Unrecognized node type " + node.type());
        }
    }

    private void indentElement(final Node element, final int level, final String prefix) throws IOException {
        try (final var trace = new Trace(() -> "Indenting element <" + element.data() + "> at level " + level)) {
            trace.use();
            final var tag = element.tag();
            final var isBlock = tag != null && tag.isBlock();
            if (isBlock) {
                writer.ensureNewline();
            }
            if (writer.isAtBeginningOfLine()) {
                writer.write(prefix);
            }
            writer.write('<');
            writer.write(element.data());
            for (final var attribute : element.attributes()) {
                writer.write(' ');
                writer.write(attribute.key());
                if (!attribute.value().isEmpty()) {
                    writer.write("=\"");
                    writer.write(Serializer.escapeAttributeValue(attribute.value()));
                    writer.write('"');
                }
            }
            writer.write('>');
            if (isBlock) {
                writer.write('\n');
            }

            if (tag != null && tag.isVoid()) {
                return;
            }

            final var literal = tag != null && tag.hasLiteralContent();
            for (final var child : element.children()) {
                if (!literal) {
                    indentNode(child, level + 1);
                } else if (child.type() == NodeType.TEXT) {
                    writer.write(child.data());
                } else {
                    Serializer.serialize(writer, child);
                }
            }

            if (isBlock) {
                writer.ensureNewline();
                writer.write(prefix);
            } else if (writer.isAtBeginningOfLine()) {
                // An inline element whose last child was a block.
                writer.write(prefix);
            }
            writer.write("</");
            writer.write(element.data());
            writer.write('>');
        }
    }

    private static final String indentUnit = "  ";

    private final BeginningOfLineWriter writer;
}
