// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.dom;

/**
 * The kinds of nodes a markup tree is made of.
 */
public enum NodeType {
    /**
     * The root of a whole parsed document.
     */
    DOCUMENT,
    ELEMENT,
    TEXT,
    COMMENT,
    DOCTYPE,
    /**
     * Content written out verbatim, without escaping.
     */
    RAW,
    /**
     * A marker left behind by a parser that failed to make sense of its input. Not representable as markup.
     */
    ERROR,
}
