// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import java.util.Map;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.jetbrains.annotations.NotNull;

/**
 * A typed representation of an element's attribute.
 * <p>
 * Attributes are immutable values. Names are expected to be canonical already; the {@link #keyword(java.lang.String,
 * Object)} factory is the one place where keyword-style names get normalized.
 */
public abstract sealed class Attribute {
    private Attribute(final java.lang.String name) {
        this.name = name;
    }

    /**
     * Returns a new boolean attribute, present by name only.
     */
    public static @NotNull Boolean flag(final @NotNull java.lang.String name) {
        return new Boolean(name);
    }

    /**
     * Returns a new string attribute.
     */
    public static @NotNull String of(final @NotNull java.lang.String name, final @NotNull java.lang.String value) {
        return new String(name, value);
    }

    /**
     * Returns a new string attribute holding the decimal representation of the given number.
     */
    public static @NotNull String of(final @NotNull java.lang.String name, final @NotNull Number value) {
        return new String(name, value.toString());
    }

    /**
     * Returns a new attribute from a keyword-style name and a scalar value.
     * <p>
     * The name goes through {@link AttributeNames#normalize(java.lang.String)}. {@link java.lang.Boolean#TRUE}
     * produces a boolean attribute, strings, characters and numbers produce string attributes.
     *
     * @throws UnsupportedArgumentException if the value is of any other type, including {@code false}.
     */
    public static @NotNull Attribute keyword(final @NotNull java.lang.String keyword, final @NotNull Object value) {
        return withValue(AttributeNames.normalize(keyword), value);
    }

    /**
     * Returns a new {@code class} attribute listing the given class names, separated by spaces.
     */
    public static @NotNull String classes(final @NotNull java.lang.String... classNames) {
        return new String(AttributeNames.CLASS, java.lang.String.join(" ", classNames));
    }

    /**
     * Returns a new {@code style} attribute made of the given raw CSS declarations.
     * <p>
     * Declarations are concatenated; one missing its terminating semicolon gets one.
     */
    public static @NotNull String style(final @NotNull java.lang.String... declarations) {
        final var builder = new StringBuilder();
        for (final var declaration : declarations) {
            appendDeclaration(builder, declaration);
        }
        return new String(AttributeNames.STYLE, builder.toString());
    }

    /**
     * Returns a new {@code style} attribute made of the given keyword properties, in iteration order.
     * <p>
     * Each entry is rendered as {@code property-name: value;}, with no space between entries. Property names go
     * through {@link AttributeNames#cssProperty(java.lang.String)}.
     */
    public static @NotNull String style(final @NotNull Map<java.lang.String, ?> properties) {
        final var builder = new StringBuilder();
        for (final var entry : properties.entrySet()) {
            builder.append(AttributeNames.cssProperty(entry.getKey()));
            builder.append(": ");
            builder.append(scalarToString(entry.getValue()));
            builder.append(';');
        }
        return new String(AttributeNames.STYLE, builder.toString());
    }

    /**
     * Returns a new {@code data-*} attribute. An empty name yields the plain {@code data} attribute.
     */
    public static @NotNull String data(final @NotNull java.lang.String name, final @NotNull Object value) {
        return new String(AttributeNames.dashed("data", name), scalarToString(value));
    }

    /**
     * Returns a new {@code aria-*} attribute.
     */
    public static @NotNull String aria(final @NotNull java.lang.String name, final @NotNull Object value) {
        return new String(AttributeNames.dashed("aria", name), scalarToString(value));
    }

    /**
     * Retrieves the name of this attribute.
     */
    public final @NotNull java.lang.String name() {
        return name;
    }

    /**
     * Returns an attribute equal to this one, but with the given name.
     */
    @CheckReturnValue
    public abstract @NotNull Attribute renamed(@NotNull java.lang.String name);

    /**
     * Returns the attribute resulting from adding {@code later} to an element already holding this attribute.
     * <p>
     * String values are joined: {@code style} declarations are concatenated, all other values are separated with a
     * single space. A boolean attribute never overrides a string one, and is itself overridden by a string one.
     *
     * @throws IllegalArgumentException if the attributes have different names.
     */
    @CheckReturnValue
    public final @NotNull Attribute mergedWith(final @NotNull Attribute later) {
        if (!name.equals(later.name)) {
            throw new IllegalArgumentException("Cannot merge attribute '" + later.name + "' into '" + name + "'");
        }
        if (!(later instanceof String laterString)) {
            return this;
        }
        if (!(this instanceof String string)) {
            return later;
        }
        return new String(name, joinValues(string.value(), laterString.value()));
    }

    static @NotNull Attribute withValue(final @NotNull java.lang.String name, final @NotNull Object value) {
        if (java.lang.Boolean.TRUE.equals(value)) {
            return new Boolean(name);
        }
        return new String(name, scalarToString(value));
    }

    private java.lang.String joinValues(final java.lang.String first, final java.lang.String second) {
        if (AttributeNames.isStyle(name)) {
            final var builder = new StringBuilder();
            appendDeclaration(builder, first);
            appendDeclaration(builder, second);
            return builder.toString();
        }
        if (first.isEmpty()) {
            return second;
        }
        return second.isEmpty() ? first : first + ' ' + second;
    }

    private static void appendDeclaration(final StringBuilder builder, final java.lang.String declaration) {
        final var trimmed = declaration.strip();
        if (trimmed.isEmpty()) {
            return;
        }
        builder.append(trimmed);
        if (!trimmed.endsWith(";")) {
            builder.append(';');
        }
    }

    private static java.lang.String scalarToString(final Object value) {
        if (value instanceof CharSequence || value instanceof Number || value instanceof Character) {
            return value.toString();
        }
        throw new UnsupportedArgumentException(value, "an attribute value");
    }

    private final java.lang.String name;

    /**
     * An attribute whose value is its presence.
     * <p>
     * Boolean attributes don't have values in serialized form, unless a {@link Format.BooleanStyle} says otherwise.
     */
    public static final class Boolean extends Attribute {
        /**
         * Initializes a new boolean attribute with the given name.
         */
        public Boolean(final @NotNull java.lang.String name) {
            super(name);
        }

        @Override
        public @NotNull Boolean renamed(final @NotNull java.lang.String name) {
            return new Boolean(name);
        }

        @Override
        public boolean equals(final Object other) {
            return other instanceof Boolean booleanAttr && name().equals(booleanAttr.name());
        }

        @Override
        public int hashCode() {
            return name().hashCode();
        }

        @Override
        public java.lang.String toString() {
            return name();
        }
    }

    /**
     * An attribute whose value is a string.
     */
    public static final class String extends Attribute {
        /**
         * Initializes a new string attribute with the given name and value.
         */
        public String(final @NotNull java.lang.String name, final @NotNull java.lang.String value) {
            super(name);
            this.value = value;
        }

        /**
         * Retrieves the value of this attribute, unescaped.
         */
        public @NotNull java.lang.String value() {
            return value;
        }

        @Override
        public @NotNull String renamed(final @NotNull java.lang.String name) {
            return new String(name, value);
        }

        @Override
        public boolean equals(final Object other) {
            return other instanceof String string && name().equals(string.name()) && value.equals(string.value);
        }

        @Override
        public int hashCode() {
            return 31 * name().hashCode() + value.hashCode();
        }

        @Override
        public java.lang.String toString() {
            return name() + "=\"" + value + '"';
        }

        private final java.lang.String value;
    }
}
