// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * DOM node representing bare text.
 * <p>
 * The content is stored unescaped; escaping happens during serialization.
 */
public final class Text extends Node {
    /**
     * Initializes a new text node from a string, character, number or another text node's content. {@code null}
     * yields empty text.
     * <p>
     * If the calling thread's {@link ScopeStack} isn't empty, the new node becomes a child of its top element.
     *
     * @throws UnsupportedArgumentException if {@code content} is of any other type.
     */
    public Text(final @Nullable Object content) {
        this((content == null) ? "" : textOf(content), true);
    }

    private Text(final String content, final boolean adopt) {
        this.content = content;
        if (adopt) {
            ScopeStack.current().adopt(this);
        }
    }

    static @NotNull Text detached(final @NotNull String content) {
        return new Text(content, false);
    }

    /**
     * Retrieves the text, unescaped.
     */
    public @NotNull String content() {
        return content;
    }

    /**
     * Replaces the text.
     *
     * @return {@code this}
     */
    public @NotNull Text setContent(final @Nullable Object content) {
        this.content = (content == null) ? "" : textOf(content);
        return this;
    }

    /**
     * Appends more text to this node, in order, with nothing in between.
     * <p>
     * Text nodes never have children: other text nodes passed here contribute their content.
     *
     * @return {@code this}
     * @throws UnsupportedArgumentException if any argument isn't text. The node is unchanged in that case.
     */
    public @NotNull Text add(final @Nullable Object... more) {
        final var builder = new StringBuilder(content);
        for (final var item : more) {
            if (item != null) {
                builder.append(textOf(item));
            }
        }
        content = builder.toString();
        return this;
    }

    /**
     * Retrieves the length of the text.
     */
    public int length() {
        return content.length();
    }

    @Override
    public @NotNull Text copy() {
        return detached(content);
    }

    private static String textOf(final Object value) {
        if (value instanceof Text text) {
            return text.content;
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Character) {
            return value.toString();
        }
        throw new UnsupportedArgumentException(value, "text");
    }

    private String content;
}
