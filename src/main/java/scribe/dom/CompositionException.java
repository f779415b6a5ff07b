// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when content can't be attached to a node: attributes on nodes that can't have them, children of void
 * elements, cycles, unrecognized arguments.
 * <p>
 * The node the content was meant for is left unchanged.
 */
public class CompositionException extends IllegalArgumentException {
    public CompositionException(final @NotNull String message) {
        super(message);
    }
}
