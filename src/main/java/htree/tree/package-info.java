// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Read-only operations on markup trees: searching, lazy traversal, text extraction, and copy-producing pruning.
 */
package htree.tree;
