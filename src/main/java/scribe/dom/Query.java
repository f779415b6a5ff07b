// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A query for {@link Node#find(Query)}.
 * <p>
 * A query is either a substring to look for in text nodes, or a shape that candidate nodes have to match.
 */
public sealed interface Query permits Query.TextContaining, Query.Shape {
    /**
     * Returns a query matching text nodes whose content contains the given string.
     */
    static TextContaining containing(final String substring) {
        return new TextContaining(substring);
    }

    /**
     * Returns a query matching nodes shaped like the given example.
     * <p>
     * Candidates have to be of the same class as the example. For elements, the tag has to be the same, every
     * attribute of the example has to be present with an equal value, and if the example has children, the
     * candidate's children have to be structurally equal to them. For text nodes, the content has to be equal. For
     * conditional comments, the condition has to be equal.
     * <p>
     * The query captures the example's state at the time of the call.
     */
    static Shape like(final Node example) {
        if (example instanceof Text text) {
            return new Shape(Text.class, null, Map.of(), List.of(), text.content(), null);
        } else if (example instanceof Element element) {
            return new Shape(Element.class, element.tag(), element.attributes(), element.children(), null, null);
        } else if (example instanceof Comment comment) {
            return new Shape(Comment.class, null, Map.of(), comment.children(), null, comment.condition());
        } else if (example instanceof Container container) {
            return new Shape(container.getClass(), null, Map.of(), container.children(), null, null);
        }
        throw new AssertionError("Unknown node type " + example.getClass().getName());
    }

    /**
     * Returns a query matching every element of the given tag.
     */
    static Shape element(final Tag tag) {
        return new Shape(Element.class, tag, Map.of(), List.of(), null, null);
    }

    /**
     * Returns a query matching every text node.
     */
    static Shape anyText() {
        return new Shape(Text.class, null, Map.of(), List.of(), null, null);
    }

    /**
     * Returns a query matching every comment, conditional or not.
     */
    static Shape anyComment() {
        return new Shape(Comment.class, null, Map.of(), List.of(), null, null);
    }

    /**
     * A query matching text nodes whose content contains {@code substring}.
     */
    record TextContaining(String substring) implements Query {
        public TextContaining {
            Objects.requireNonNull(substring);
        }
    }

    /**
     * A query matching nodes by shape.
     *
     * @param type       The exact class of matching nodes.
     * @param tag        The tag of matching elements, or {@code null} for non-element shapes.
     * @param attributes Attributes every matching element has to have, with equal values. Extra attributes are
     *                   allowed.
     * @param children   If not empty, the children of matching nodes, compared structurally. Stored as deep copies,
     *                   so later changes to the given nodes don't affect the query.
     * @param content    The content of matching text nodes, or {@code null} for any content.
     * @param condition  The condition of matching comments, or {@code null} for any condition.
     */
    record Shape(
        Class<? extends Node> type,
        @Nullable Tag tag,
        Map<String, Attribute> attributes,
        List<Node> children,
        @Nullable String content,
        @Nullable String condition
    ) implements Query {
        public Shape {
            attributes = Map.copyOf(attributes);
            children = children.stream().map(Node::copy).toList();
        }

        /**
         * Returns a query that additionally requires the given attribute.
         */
        @CheckReturnValue
        public Shape withAttribute(final Attribute attribute) {
            final var newAttributes = new LinkedHashMap<>(attributes);
            newAttributes.put(attribute.name(), attribute);
            return new Shape(type, tag, newAttributes, children, content, condition);
        }

        /**
         * Returns a query that additionally requires the given attribute, built from a keyword and a value.
         *
         * @see Attribute#keyword(String, Object)
         */
        @CheckReturnValue
        public Shape withAttribute(final String keyword, final Object value) {
            return withAttribute(Attribute.keyword(keyword, value));
        }

        /**
         * Returns a query that requires matching nodes to have children structurally equal to the given ones.
         * <p>
         * Strings and numbers stand for text nodes. The given nodes are only compared against, never attached.
         */
        @CheckReturnValue
        public Shape withChildren(final Object... newChildren) {
            final var nodes = new ArrayList<Node>(newChildren.length);
            for (final var child : newChildren) {
                nodes.add(Composite.toNode(child, "a query child"));
            }
            return new Shape(type, tag, attributes, nodes, content, condition);
        }
    }
}
