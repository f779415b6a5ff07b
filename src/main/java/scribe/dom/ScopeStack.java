// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A stack of "currently open" elements, used to build trees without passing every node to its parent explicitly.
 * <p>
 * While the stack isn't empty, nodes created through public constructors attach themselves to the top element:
 * <pre>{@code
 * final var list = new Element(Tag.UL);
 * try (final var scope = ScopeStack.current().enter(list)) {
 *     new Element(Tag.LI, "first");
 *     new Element(Tag.LI, "second");
 *     scope.add(Attribute.classes("menu"));
 * }
 * }</pre>
 * Attributes are values, not nodes, so they never attach themselves; use {@link Scope#add(Object...)}.
 * <p>
 * Each thread has its own stack, which should <em>never</em> be used from other threads.
 */
public final class ScopeStack {
    private ScopeStack() {
        owner = Thread.currentThread();
    }

    /**
     * Returns the calling thread's scope stack.
     */
    public static @NotNull ScopeStack current() {
        return localStack.get();
    }

    /**
     * Pushes the given elements, from left to right, and returns the scope that pops them.
     * <p>
     * Each pushed element that has no parent becomes a child of the element below it, so {@code enter(outer, inner)}
     * nests {@code inner} in {@code outer}. The returned scope should be used with try-with-resources, so the elements
     * are popped on every exit path.
     *
     * @throws CompositionException if any of the elements is void, in which case nothing is pushed.
     */
    public @NotNull Scope enter(final @NotNull Element... elements) {
        checkOwner();
        for (final var element : elements) {
            if (!element.acceptsChildren()) {
                throw new CompositionException("Cannot open a scope on void element " + element.describe());
            }
        }
        for (final var element : elements) {
            adopt(element);
            stack.add(element);
            logger.trace("Entered scope of {}, depth {}", element::describe, stack::size);
        }
        return new Scope(List.of(elements), stack.size());
    }

    /**
     * Retrieves the top element, or {@code null} if the stack is empty.
     */
    public @Nullable Element top() {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }

    /**
     * Retrieves the number of elements currently on the stack.
     */
    public int depth() {
        return stack.size();
    }

    /**
     * Retrieves an unmodifiable view of the stack, from the bottom element to the top one.
     */
    public @NotNull List<@NotNull Element> elements() {
        return stackView;
    }

    void adopt(final @NotNull Node node) {
        final var top = top();
        if (top == null || node.parent != null || node == top || node.isAncestorOf(top)) {
            return;
        }
        top.add(node);
    }

    private void checkOwner() {
        assert owner == Thread.currentThread() : "Scope stack used by a different thread";
    }

    private static final Logger logger = LogManager.getLogger(ScopeStack.class);

    @SuppressWarnings("nullness:type.argument") // Not actually nullable, CF doesn't understand withInitial.
    private static final ThreadLocal<ScopeStack> localStack = ThreadLocal.withInitial(ScopeStack::new);

    private final Thread owner;
    private final List<Element> stack = new ArrayList<>();
    private final List<Element> stackView = Collections.unmodifiableList(stack);

    /**
     * An entered scope, intended to be used within try-with-resources.
     * <p>
     * Closing the scope pops the elements it pushed. Scopes must be closed in the reverse order of entering, by the
     * thread that entered them.
     */
    public final class Scope implements AutoCloseable {
        private Scope(final List<Element> elements, final int depthAfterEnter) {
            this.elements = elements;
            this.depthAfterEnter = depthAfterEnter;
        }

        /**
         * Retrieves the elements pushed by this scope, in the order they were pushed.
         */
        public @NotNull List<@NotNull Element> elements() {
            return elements;
        }

        /**
         * Adds the given content to the current top element of the stack.
         *
         * @return The element the content was added to.
         * @throws IllegalStateException if this scope is already closed.
         */
        public @NotNull Element add(final @Nullable Object... content) {
            final var top = top();
            if (closed || top == null) {
                throw new IllegalStateException("Scope is already closed");
            }
            return top.add(content);
        }

        /**
         * Pops the elements pushed by this scope.
         * <p>
         * This method should never be called manually: use try-with-resources with scope objects instead.
         *
         * @throws IllegalStateException if a scope entered after this one is still open. Nothing is popped in that
         *                               case.
         */
        @Override
        public void close() {
            if (closed) {
                return;
            }
            checkOwner();
            if (stack.size() != depthAfterEnter) {
                throw new IllegalStateException(
                    "Scope closed out of order: depth is " + stack.size() + ", expected " + depthAfterEnter
                );
            }
            final var newDepth = depthAfterEnter - elements.size();
            stack.subList(newDepth, stack.size()).clear();
            closed = true;
            logger.trace("Left scope, depth {}", newDepth);
        }

        private final List<Element> elements;
        private final int depthAfterEnter;
        private boolean closed = false;
    }
}
