// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.tree;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import htree.dom.Node;
import htree.dom.NodeType;
import htree.dom.Tag;
import htree.util.UnreachableCodeReachedError;
import org.jsoup.parser.Parser;

/**
 * Conversion of trees to plain text.
 */
public final class TextExtractor {
    private TextExtractor() {
    }

    /**
     * Writes the plain text content of the tree rooted at {@code node} to the given {@link Writer}.
     * <p>
     * HTML entities in text are decoded, {@code <br>} elements turn into newlines, and {@code <script>} and
     * {@code <style>} elements are skipped along with their content.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     */
    public static void writeText(final Writer writer, final Node node) throws IOException {
        if (node.type() == NodeType.TEXT) {
            writer.write(Parser.unescapeEntities(node.data(), false));
            return;
        }
        if (node.type() == NodeType.ELEMENT) {
            final var tag = node.tag();
            if (tag == Tag.BR) {
                writer.write('\n');
                return;
            }
            if (tag == Tag.SCRIPT || tag == Tag.STYLE) {
                return;
            }
        }
        for (final var child : node.children()) {
            writeText(writer, child);
        }
    }

    /**
     * Returns the plain text content of the tree rooted at {@code node}, as produced by
     * {@link #writeText(Writer, Node)}.
     */
    public static String text(final Node node) {
        final var writer = new StringWriter();
        try {
            writeText(writer, node);
        } catch (final IOException e) {
            throw new UnreachableCodeReachedError("StringWriter failed", e);
        }
        return writer.toString();
    }
}
