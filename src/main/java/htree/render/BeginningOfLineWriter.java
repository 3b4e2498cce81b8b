// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.render;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that remembers whether the last character written through it was a newline.
 * <p>
 * Initially, before anything is written, the writer is at the beginning of a line. Writing nothing, such as an empty
 * string, doesn't change the state.
 */
final class BeginningOfLineWriter extends Writer {
    BeginningOfLineWriter(final Writer writer) {
        this.writer = writer;
    }

    boolean isAtBeginningOfLine() {
        return atBeginningOfLine;
    }

    /**
     * Writes a newline, unless the writer is already at the beginning of a line.
     */
    void ensureNewline() throws IOException {
        if (!atBeginningOfLine) {
            write('\n');
        }
    }

    @Override
    public void write(final int c) throws IOException {
        writer.write(c);
        atBeginningOfLine = c == '\n';
    }

    @Override
    public void write(final char[] buffer, final int offset, final int length) throws IOException {
        if (length == 0) {
            return;
        }
        writer.write(buffer, offset, length);
        atBeginningOfLine = buffer[offset + length - 1] == '\n';
    }

    @Override
    public void write(final String string, final int offset, final int length) throws IOException {
        if (length == 0) {
            return;
        }
        writer.write(string, offset, length);
        atBeginningOfLine = string.charAt(offset + length - 1) == '\n';
    }

    @Override
    public void flush() throws IOException {
        writer.flush();
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }

    private final Writer writer;
    private boolean atBeginningOfLine = true;
}
