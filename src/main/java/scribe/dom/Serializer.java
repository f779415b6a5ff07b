// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Collection;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The DOM-to-HTML serializer.
 */
public final class Serializer {
    private Serializer(final @NotNull Writer writer, final @NotNull Format format) {
        this.writer = writer;
        this.format = format;
    }

    /**
     * Serializes the DOM tree rooted at {@code rootNode} to HTML, writing the output to the given {@link Writer}.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     */
    public static void serialize(
        final @NotNull Writer writer,
        final @NotNull Node rootNode,
        final @NotNull Format format
    ) throws IOException {
        final var serializer = new Serializer(writer, format);
        serializer.serializeNode(rootNode, 0);
    }

    /**
     * Serializes the DOM tree rooted at {@code rootNode} to an HTML string.
     */
    public static @NotNull String render(final @NotNull Node rootNode, final @NotNull Format format) {
        final var writer = new StringWriter();
        try {
            serialize(writer, rootNode, format);
        } catch (final IOException e) {
            throw new AssertionError("StringWriter threw an IOException", e);
        }
        return writer.toString();
    }

    private void serializeNode(final @NotNull Node node, final int depth) throws IOException {
        if (node instanceof Text text) {
            startLine(depth);
            serializeString(text.content(), TextEscaper.instance);
        } else if (node instanceof Element element) {
            serializeElement(element, depth);
        } else if (node instanceof Comment comment) {
            serializeComment(comment, depth);
        } else if (node instanceof Container container) {
            // Containers are transparent: their children sit at the container's own depth.
            serializeChildren(container, depth);
        } else {
            throw new AssertionError("Unknown node type " + node.getClass().getName());
        }
    }

    private void serializeElement(final @NotNull Element element, final int depth) throws IOException {
        final var tag = element.tag();
        startLine(depth);
        writer.write('<');
        writer.write(tag.htmlName());
        serializeAttributes(element.attributes().values());
        writer.write('>');
        if (tag.isVoid()) {
            return;
        }
        serializeChildren(element, depth + 1);
        startLine(depth);
        writer.write("</");
        writer.write(tag.htmlName());
        writer.write('>');
    }

    private void serializeComment(final @NotNull Comment comment, final int depth) throws IOException {
        final var condition = comment.condition();
        startLine(depth);
        if (condition == null) {
            writer.write("<!--");
        } else {
            writer.write("<!--[if ");
            writer.write(condition);
            writer.write("]>");
        }
        serializeChildren(comment, depth + 1);
        if (!comment.isEmpty()) {
            startLine(depth);
        }
        writer.write((condition == null) ? "-->" : "<![endif]-->");
    }

    private void serializeChildren(final @NotNull Composite composite, final int depth) throws IOException {
        for (final var child : composite.children()) {
            serializeNode(child, depth);
        }
    }

    private void serializeAttributes(final @NotNull Collection<@NotNull Attribute> attributes) throws IOException {
        for (final var attribute : attributes) {
            if (attribute instanceof Attribute.Boolean booleanAttr) {
                serializeBooleanAttribute(booleanAttr.name());
            } else if (attribute instanceof Attribute.String stringAttr) {
                serializeAttributeName(stringAttr.name());
                writer.write("=\"");
                serializeString(stringAttr.value(), AttributeEscaper.instance);
                writer.write('"');
            } else {
                throw new AssertionError("Unknown attribute type " + attribute.getClass().getName());
            }
        }
    }

    private void serializeBooleanAttribute(final @NotNull String name) throws IOException {
        serializeAttributeName(name);
        switch (format.booleanStyle()) {
            case SHORT -> {
            }
            case EMPTY -> writer.write("=\"\"");
            case REPEATED -> {
                writer.write("=\"");
                writer.write(name);
                writer.write('"');
            }
        }
    }

    // In pretty mode, every line but the first is preceded by a line separator.
    private void startLine(final int depth) throws IOException {
        if (!format.pretty()) {
            return;
        }
        if (lineStarted) {
            writer.write(format.newLine());
        }
        lineStarted = true;
        for (int i = 0; i < depth; i += 1) {
            writer.write(format.indent());
        }
    }

    private void serializeString(final @NotNull String string, final @NotNull Escaper escaper) throws IOException {
        int index = 0;
        int indexToEscape;
        while ((indexToEscape = findCharacterToEscape(string, index, escaper)) >= 0) {
            writer.write(string, index, indexToEscape - index);
            writer.write(Objects.requireNonNull(escaper.escape(string.charAt(indexToEscape))));
            index = indexToEscape + 1;
        }
        if (index < string.length()) {
            writer.write(string, index, string.length() - index);
        }
    }

    private void serializeAttributeName(final @NotNull String name) throws IOException {
        writer.write(' ');
        writer.write(name);
    }

    private static int findCharacterToEscape(
        final @NotNull String string,
        final int startIndex,
        final @NotNull Escaper escaper
    ) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            if (escaper.escape(string.charAt(i)) != null) {
                return i;
            }
        }
        return -1;
    }

    private final @NotNull Writer writer;
    private final @NotNull Format format;
    private boolean lineStarted = false;

    private sealed interface Escaper {
        @Nullable String escape(char character);
    }

    private static final class TextEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return switch (character) {
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '&' -> "&amp;";
                default -> null;
            };
        }

        private static final TextEscaper instance = new TextEscaper();
    }

    private static final class AttributeEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return (character == '"') ? "&quot;" : TextEscaper.instance.escape(character);
        }

        private static final AttributeEscaper instance = new AttributeEscaper();
    }
}
