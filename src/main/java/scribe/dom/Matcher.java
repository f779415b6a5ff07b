// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * The structural search over DOM trees.
 */
public final class Matcher {
    private Matcher() {
    }

    /**
     * Returns all nodes of the tree rooted at {@code rootNode} matching the query, in document order: each node comes
     * before its children, and children come from left to right.
     */
    public static @NotNull List<@NotNull Node> find(final @NotNull Node rootNode, final @NotNull Query query) {
        final var matches = new ArrayList<Node>();
        collect(rootNode, query, matches);
        return matches;
    }

    /**
     * Checks whether the given node, on its own, matches the query. Descendants aren't considered.
     */
    public static boolean matches(final @NotNull Node candidate, final @NotNull Query query) {
        if (query instanceof Query.TextContaining textContaining) {
            return candidate instanceof Text text && text.content().contains(textContaining.substring());
        } else if (query instanceof Query.Shape shape) {
            return matchesShape(candidate, shape);
        }
        throw new AssertionError("Unknown query type " + query.getClass().getName());
    }

    static boolean structurallyEqual(final @NotNull Node first, final @NotNull Node second) {
        if (first == second) {
            return true;
        }
        if (first.getClass() != second.getClass()) {
            return false;
        }
        if (first instanceof Text firstText) {
            return firstText.content().equals(((Text) second).content());
        } else if (first instanceof Element firstElement) {
            final var secondElement = (Element) second;
            return firstElement.tag() == secondElement.tag()
                && firstElement.attributes().equals(secondElement.attributes())
                && childrenEqual(firstElement.children(), secondElement.children());
        } else if (first instanceof Comment firstComment) {
            final var secondComment = (Comment) second;
            return Objects.equals(firstComment.condition(), secondComment.condition())
                && childrenEqual(firstComment.children(), secondComment.children());
        } else if (first instanceof Container firstContainer) {
            return childrenEqual(firstContainer.children(), ((Container) second).children());
        }
        throw new AssertionError("Unknown node type " + first.getClass().getName());
    }

    private static void collect(final Node node, final Query query, final List<Node> matches) {
        if (matches(node, query)) {
            matches.add(node);
        }
        if (node instanceof Composite composite) {
            for (final var child : composite.children()) {
                collect(child, query, matches);
            }
        }
    }

    private static boolean matchesShape(final Node candidate, final Query.Shape shape) {
        if (candidate.getClass() != shape.type()) {
            return false;
        }
        if (candidate instanceof Text text) {
            final var content = shape.content();
            return content == null || content.equals(text.content());
        }
        if (candidate instanceof Element element) {
            if (element.tag() != shape.tag() || !hasAttributes(element, shape.attributes())) {
                return false;
            }
        } else if (candidate instanceof Comment comment) {
            final var condition = shape.condition();
            if (condition != null && !condition.equals(comment.condition())) {
                return false;
            }
        }
        final var children = shape.children();
        return children.isEmpty() || childrenEqual(((Composite) candidate).children(), children);
    }

    private static boolean hasAttributes(final Element element, final Map<String, Attribute> attributes) {
        for (final var attribute : attributes.values()) {
            if (!attribute.equals(element.attributes().get(attribute.name()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean childrenEqual(final List<Node> first, final List<Node> second) {
        if (first.size() != second.size()) {
            return false;
        }
        for (int i = 0; i < first.size(); i += 1) {
            if (!structurallyEqual(first.get(i), second.get(i))) {
                return false;
            }
        }
        return true;
    }
}
