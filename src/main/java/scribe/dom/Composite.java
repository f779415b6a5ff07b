// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The base class for nodes that have an ordered sequence of children.
 * <p>
 * All composites share the same composition protocol. Arguments passed to {@link #add(Object...)},
 * {@link #insert(int, Object...)} and the constructors are classified by their runtime type:
 * <ul>
 *     <li>{@link Node}s become children, detached from their previous parent first;</li>
 *     <li>{@link Attribute}s are merged into the attribute map, for composites that have one;</li>
 *     <li>strings, characters and numbers are wrapped in new {@link Text} nodes;</li>
 *     <li>{@link Iterable}s and arrays are flattened, in order;</li>
 *     <li>{@code null}s are ignored.</li>
 * </ul>
 * All arguments are classified before anything is attached, so an invalid argument leaves the composite unchanged.
 */
public abstract sealed class Composite extends Node permits Element, Container, Comment {
    Composite() {
    }

    /**
     * Appends the given content to this node.
     *
     * @return {@code this}
     * @throws CompositionException if any argument can't be attached to this node.
     */
    public @NotNull Composite add(final @Nullable Object... content) {
        attach(children.size(), content);
        return this;
    }

    /**
     * Inserts the given content at the given child index, shifting the child at that index, if any, and all following
     * children to the right.
     *
     * @return {@code this}
     * @throws IndexOutOfBoundsException if {@code index} is negative or greater than {@link #size()}.
     * @throws CompositionException      if any argument can't be attached to this node.
     */
    public @NotNull Composite insert(final int index, final @Nullable Object... content) {
        Objects.checkIndex(index, children.size() + 1);
        attach(index, content);
        return this;
    }

    /**
     * Retrieves the number of direct children.
     */
    public final int size() {
        return children.size();
    }

    /**
     * Checks whether this node has no children.
     */
    public final boolean isEmpty() {
        return children.isEmpty();
    }

    /**
     * Retrieves an unmodifiable live view of the children of this node.
     */
    public final @NotNull List<@NotNull Node> children() {
        return childrenView;
    }

    /**
     * Retrieves the child at the given index.
     *
     * @throws IndexOutOfBoundsException if there's no child at that index.
     */
    public final @NotNull Node child(final int index) {
        return children.get(Objects.checkIndex(index, children.size()));
    }

    /**
     * Retrieves the index of the given node among the children of this node, or -1 if it's not a child.
     */
    public final int indexOf(final @NotNull Node node) {
        for (int i = 0; i < children.size(); i += 1) {
            if (children.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Replaces the child at the given index.
     * <p>
     * {@code value} may be a node, which is detached from its previous parent first, or text, which is wrapped in a
     * new {@link Text} node. The replaced child becomes detached.
     *
     * @return The replaced child.
     * @throws IndexOutOfBoundsException    if there's no child at that index.
     * @throws UnsupportedArgumentException if {@code value} is neither a node nor text.
     * @throws CompositionException         if {@code value} is an ancestor of this node.
     */
    public final @NotNull Node set(final int index, final @NotNull Object value) {
        Objects.checkIndex(index, children.size());
        final var replacement = toChild(value);
        final var previous = children.get(index);
        if (replacement == previous) {
            return previous;
        }
        var target = index;
        final var oldParent = replacement.parent;
        if (oldParent != null) {
            final var oldIndex = oldParent.indexOf(replacement);
            oldParent.children.remove(oldIndex);
            replacement.parent = null;
            if (oldParent == this && oldIndex < target) {
                target -= 1;
            }
        }
        children.set(target, replacement);
        previous.parent = null;
        replacement.parent = this;
        return previous;
    }

    /**
     * Removes the child at the given index, shifting all following children to the left.
     *
     * @return The removed child, now detached.
     * @throws IndexOutOfBoundsException if there's no child at that index.
     */
    public final @NotNull Node remove(final int index) {
        final var removed = children.remove(Objects.checkIndex(index, children.size()));
        removed.parent = null;
        return removed;
    }

    /**
     * Checks whether this node can hold attributes.
     */
    public boolean acceptsAttributes() {
        return false;
    }

    /**
     * Checks whether this node can hold children.
     */
    public boolean acceptsChildren() {
        return true;
    }

    /**
     * Converts a node or text into a node, without attaching it anywhere.
     */
    static @NotNull Node toNode(final @NotNull Object value, final @NotNull String role) {
        if (value instanceof Node node) {
            return node;
        }
        if (isText(value)) {
            return Text.detached(value.toString());
        }
        throw new UnsupportedArgumentException(value, role);
    }

    final void attach(final int index, final @Nullable Object[] content) {
        final var batch = new Batch();
        for (final var item : content) {
            classify(item, batch);
        }
        if (!batch.nodes.isEmpty() && !acceptsChildren()) {
            throw new CompositionException(describe() + " cannot have children");
        }
        apply(index, batch);
    }

    void mergeAttribute(final @NotNull Attribute attribute) {
        throw new AssertionError("mergeAttribute called on " + describe());
    }

    abstract @NotNull String describe();

    final void copyChildrenInto(final @NotNull Composite target) {
        for (final var child : children) {
            final var childCopy = child.copy();
            childCopy.parent = target;
            target.children.add(childCopy);
        }
    }

    private void classify(final @Nullable Object item, final Batch batch) {
        if (item == null) {
            return;
        }
        if (item instanceof Node node) {
            batch.nodes.add(acceptNode(node, batch.seen));
        } else if (item instanceof Attribute attribute) {
            if (!acceptsAttributes()) {
                throw new CompositionException(describe() + " cannot have attributes");
            }
            batch.attributes.add(attribute);
        } else if (isText(item)) {
            batch.nodes.add(Text.detached(item.toString()));
        } else if (item instanceof Iterable<?> iterable) {
            for (final var element : iterable) {
                classify(element, batch);
            }
        } else if (item instanceof Object[] array) {
            for (final var element : array) {
                classify(element, batch);
            }
        } else {
            throw new UnsupportedArgumentException(item, "content of " + describe());
        }
    }

    private @NotNull Node toChild(final @NotNull Object value) {
        if (value instanceof Attribute) {
            throw new UnsupportedArgumentException(value, "a child of " + describe());
        }
        final var role = "a child of " + describe();
        final var node = acceptNode(toNode(value, role), Collections.newSetFromMap(new IdentityHashMap<>()));
        if (!acceptsChildren()) {
            throw new CompositionException(describe() + " cannot have children");
        }
        return node;
    }

    // The node itself, or one already seen in the same batch, is attached as a copy: one instance can't have two
    // parents, nor be its own child.
    private @NotNull Node acceptNode(final @NotNull Node node, final Set<Node> seen) {
        if (node == this || seen.contains(node)) {
            final var nodeCopy = node.copy();
            seen.add(nodeCopy);
            return nodeCopy;
        }
        if (node.isAncestorOf(this)) {
            throw new CompositionException("Attaching an ancestor to " + describe() + " would create a cycle");
        }
        seen.add(node);
        return node;
    }

    private void apply(final int index, final Batch batch) {
        for (final var attribute : batch.attributes) {
            mergeAttribute(attribute);
        }
        var target = index;
        for (final var node : batch.nodes) {
            final var oldParent = node.parent;
            if (oldParent != null) {
                final var oldIndex = oldParent.indexOf(node);
                oldParent.children.remove(oldIndex);
                node.parent = null;
                if (oldParent == this && oldIndex < target) {
                    target -= 1;
                }
                logger.trace("Moving a child of {} to {}", oldParent::describe, this::describe);
            }
            children.add(target, node);
            node.parent = this;
            target += 1;
        }
    }

    private static boolean isText(final @NotNull Object value) {
        return value instanceof CharSequence || value instanceof Number || value instanceof Character;
    }

    private static final Logger logger = LogManager.getLogger(Composite.class);

    private final List<Node> children = new ArrayList<>();
    private final List<Node> childrenView = Collections.unmodifiableList(children);

    private static final class Batch {
        private final List<Node> nodes = new ArrayList<>();
        private final List<Attribute> attributes = new ArrayList<>();
        private final Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
