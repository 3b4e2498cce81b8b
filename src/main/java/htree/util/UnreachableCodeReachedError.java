// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.util;

/**
 * Error type signifying that control flow reached a point that should be unreachable, such as an in-memory writer
 * reporting an I/O failure.
 * <p>
 * Since this represents a programming error, this class extends {@link AssertionError}.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError(final String message, final Throwable cause) {
        super(message, cause);
    }
}
