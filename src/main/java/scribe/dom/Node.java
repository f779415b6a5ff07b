// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The base class for DOM tree nodes.
 * <p>
 * DOM tree nodes are mutable, and every node belongs to at most one parent at a time: attaching a node somewhere
 * detaches it from wherever it was before.
 * <p>
 * Node instances are not thread-safe. A tree should be built, queried and serialized by one thread at a time.
 */
public abstract sealed class Node permits Text, Composite {
    Node() {
    }

    /**
     * Retrieves the composite node this node is a child of, or {@code null} if it's detached.
     */
    public final @Nullable Composite parent() {
        return parent;
    }

    /**
     * Removes this node from its parent, if any.
     *
     * @return {@code this}
     */
    public final @NotNull Node detach() {
        final var currentParent = parent;
        if (currentParent != null) {
            currentParent.remove(currentParent.indexOf(this));
        }
        return this;
    }

    /**
     * Returns a deep copy of this node. The copy is detached and shares no mutable state with the original.
     */
    @CheckReturnValue
    public abstract @NotNull Node copy();

    /**
     * Returns a container holding this node followed by {@code other}.
     * <p>
     * If this node is itself a plain {@link Container}, {@code other} is appended into it and this container is
     * returned. Otherwise, if {@code other} is a plain container, this node is inserted at its front and {@code other}
     * is returned. Only when neither side is a plain container is a new one created. A {@link Document} is never
     * flattened: it takes part as a whole, rendered in operand order. Text and numbers are wrapped in {@link Text}
     * nodes.
     * <p>
     * Both operands end up owned by the returned container.
     *
     * @throws UnsupportedArgumentException if {@code other} isn't a node or text.
     */
    @CheckReturnValue
    public @NotNull Container plus(final @NotNull Object other) {
        final var right = (other == this) ? copy() : Composite.toNode(other, "an operand of plus");
        if (isPlainContainer(this)) {
            final var container = (Container) this;
            final Object content = isPlainContainer(right) ? List.copyOf(((Container) right).children()) : right;
            container.attach(container.size(), new Object[] {content});
            return container;
        }
        if (isPlainContainer(right)) {
            final var rightContainer = (Container) right;
            rightContainer.attach(0, new Object[] {this});
            return rightContainer;
        }
        return new Container(this, right);
    }

    /**
     * Returns a new container holding {@code count} independent deep copies of this node.
     * <p>
     * This node itself stays where it is.
     *
     * @throws IllegalArgumentException if {@code count} is not positive.
     */
    @CheckReturnValue
    public @NotNull Container times(final int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Replication count must be positive, got " + count);
        }
        final var copies = new Node[count];
        for (int i = 0; i < count; i += 1) {
            copies[i] = copy();
        }
        return new Container((Object[]) copies);
    }

    /**
     * Returns all nodes of the tree rooted at this node matching the given query, in document order.
     * <p>
     * The search includes this node itself. If nothing matches, the returned list is empty.
     */
    public final @NotNull List<@NotNull Node> find(final @NotNull Query query) {
        return Matcher.find(this, query);
    }

    /**
     * Returns all text nodes of the tree rooted at this node whose content contains the given string.
     */
    public final @NotNull List<@NotNull Node> find(final @NotNull String substring) {
        return find(Query.containing(substring));
    }

    /**
     * Returns all nodes of the tree rooted at this node shaped like the given example.
     *
     * @see Query#like(Node)
     */
    public final @NotNull List<@NotNull Node> find(final @NotNull Node example) {
        return find(Query.like(example));
    }

    /**
     * Checks whether the given node is of the same kind as this one, with equal attributes, content and children.
     * <p>
     * Node identity and parents don't matter.
     */
    public final boolean structurallyEquals(final @NotNull Node other) {
        return Matcher.structurallyEqual(this, other);
    }

    /**
     * Serializes the tree rooted at this node to indented HTML.
     */
    public final @NotNull String display() {
        return display(Format.PRETTY);
    }

    /**
     * Serializes the tree rooted at this node to HTML, indented if {@code pretty} is set and on a single line
     * otherwise.
     */
    public final @NotNull String display(final boolean pretty) {
        return display(Format.of(pretty));
    }

    /**
     * Serializes the tree rooted at this node to HTML in the given format.
     */
    public final @NotNull String display(final @NotNull Format format) {
        return Serializer.render(this, format);
    }

    @Override
    public final String toString() {
        return display();
    }

    private static boolean isPlainContainer(final @NotNull Node node) {
        return node.getClass() == Container.class;
    }

    final boolean isAncestorOf(final @NotNull Node node) {
        for (var ancestor = node.parent; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == this) {
                return true;
            }
        }
        return false;
    }

    @Nullable Composite parent = null;
}
