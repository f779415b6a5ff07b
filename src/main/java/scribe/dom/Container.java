// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A transparent grouping of sibling nodes.
 * <p>
 * A container has no tag and no attributes; when serialized, only its children appear. It's also the result type of
 * {@link Node#plus(Object)} and {@link Node#times(int)}.
 */
public sealed class Container extends Composite permits Document {
    /**
     * Initializes a new container with the given content.
     * <p>
     * If the calling thread's {@link ScopeStack} isn't empty, the new container becomes a child of its top element.
     *
     * @throws CompositionException if any content argument can't be attached, notably if it's an attribute.
     */
    public Container(final @Nullable Object... content) {
        this(true, content);
    }

    Container(final boolean adopt, final @Nullable Object[] content) {
        attach(0, content);
        if (adopt) {
            ScopeStack.current().adopt(this);
        }
    }

    @Override
    public @NotNull Container add(final @Nullable Object... content) {
        super.add(content);
        return this;
    }

    @Override
    public @NotNull Container insert(final int index, final @Nullable Object... content) {
        super.insert(index, content);
        return this;
    }

    @Override
    public @NotNull Container copy() {
        final var containerCopy = new Container(false, noContent);
        copyChildrenInto(containerCopy);
        return containerCopy;
    }

    @Override
    @NotNull String describe() {
        return "container";
    }

    static final Object[] noContent = new Object[0];
}
