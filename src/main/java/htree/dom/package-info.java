// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The markup tree model, and its full-fidelity serialization to HTML.
 */
package htree.dom;
