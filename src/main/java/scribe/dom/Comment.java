// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * DOM node representing an HTML comment, whose body may mix text and elements.
 * <p>
 * A comment with a condition is serialized as an Internet Explorer conditional comment,
 * {@code <!--[if condition]>body<![endif]-->}.
 */
public final class Comment extends Composite {
    /**
     * Initializes a new unconditional comment with the given body.
     * <p>
     * If the calling thread's {@link ScopeStack} isn't empty, the new comment becomes a child of its top element.
     */
    public Comment(final @Nullable Object... body) {
        this(null, true, body);
    }

    private Comment(final @Nullable String condition, final boolean adopt, final @Nullable Object[] body) {
        this.condition = condition;
        attach(0, body);
        if (adopt) {
            ScopeStack.current().adopt(this);
        }
    }

    /**
     * Returns a new conditional comment with the given condition, such as {@code lt IE 9}, and body.
     * <p>
     * If the calling thread's {@link ScopeStack} isn't empty, the new comment becomes a child of its top element.
     */
    public static @NotNull Comment conditional(final @NotNull String condition, final @Nullable Object... body) {
        return new Comment(condition, true, body);
    }

    /**
     * Retrieves the condition of this comment, or {@code null} if it's unconditional.
     */
    public @Nullable String condition() {
        return condition;
    }

    /**
     * Sets the condition of this comment; {@code null} makes it unconditional.
     *
     * @return {@code this}
     */
    public @NotNull Comment setCondition(final @Nullable String condition) {
        this.condition = condition;
        return this;
    }

    @Override
    public @NotNull Comment add(final @Nullable Object... content) {
        super.add(content);
        return this;
    }

    @Override
    public @NotNull Comment insert(final int index, final @Nullable Object... content) {
        super.insert(index, content);
        return this;
    }

    @Override
    public @NotNull Comment copy() {
        final var commentCopy = new Comment(condition, false, Container.noContent);
        copyChildrenInto(commentCopy);
        return commentCopy;
    }

    @Override
    @NotNull String describe() {
        return (condition == null) ? "comment" : "conditional comment";
    }

    private @Nullable String condition;
}
