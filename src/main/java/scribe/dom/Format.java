// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.jetbrains.annotations.NotNull;

/**
 * Serialization settings.
 *
 * @param pretty       Whether to put every tag and text on its own line, indented by depth. If not set, nothing is
 *                     inserted between tags and text.
 * @param indent       The string emitted once per depth level in pretty mode.
 * @param newLine      The line separator used in pretty mode.
 * @param booleanStyle How boolean attributes are written.
 */
public record Format(
    boolean pretty,
    @NotNull String indent,
    @NotNull String newLine,
    @NotNull BooleanStyle booleanStyle
) {
    /**
     * Indented output, two spaces per level, {@code \n} line separators, bare boolean attribute names.
     */
    public static final Format PRETTY = new Format(true, "  ", "\n", BooleanStyle.SHORT);

    /**
     * Single-line output, bare boolean attribute names.
     */
    public static final Format COMPACT = new Format(false, "  ", "\n", BooleanStyle.SHORT);

    /**
     * Returns {@link #PRETTY} or {@link #COMPACT}.
     */
    public static @NotNull Format of(final boolean pretty) {
        return pretty ? PRETTY : COMPACT;
    }

    @CheckReturnValue
    public @NotNull Format withIndent(final @NotNull String indent) {
        return new Format(pretty, indent, newLine, booleanStyle);
    }

    @CheckReturnValue
    public @NotNull Format withNewLine(final @NotNull String newLine) {
        return new Format(pretty, indent, newLine, booleanStyle);
    }

    @CheckReturnValue
    public @NotNull Format withBooleanStyle(final @NotNull BooleanStyle booleanStyle) {
        return new Format(pretty, indent, newLine, booleanStyle);
    }

    /**
     * The serialized forms of a boolean attribute named {@code required}.
     */
    public enum BooleanStyle {
        /**
         * {@code required}
         */
        SHORT,
        /**
         * {@code required=""}
         */
        EMPTY,
        /**
         * {@code required="required"}
         */
        REPEATED
    }
}
