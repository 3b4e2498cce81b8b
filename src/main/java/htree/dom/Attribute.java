// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.dom;

/**
 * A single attribute of an element node.
 * <p>
 * An empty value stands for an attribute present without a value, such as {@code <input disabled>}.
 */
public record Attribute(String key, String value) {
}
