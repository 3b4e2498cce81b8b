// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Human-readable rendering of markup trees, with one level of indentation per block element.
 */
package htree.render;
