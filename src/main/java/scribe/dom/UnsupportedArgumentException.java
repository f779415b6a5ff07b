// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a value of an unsupported type is used as node content, a child, an operand or an attribute value.
 */
public final class UnsupportedArgumentException extends CompositionException {
    UnsupportedArgumentException(final @NotNull Object argument, final @NotNull String role) {
        super("Value of type " + argument.getClass().getName() + " cannot be used as " + role);
        this.argument = argument;
    }

    /**
     * Retrieves the rejected value.
     */
    public @NotNull Object argument() {
        return argument;
    }

    private final transient @NotNull Object argument;
}
