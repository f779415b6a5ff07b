// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * DOM node representing an HTML element, with optional attributes and optional children.
 * <p>
 * Attributes are kept in insertion order, with at most one attribute per name. Adding an attribute whose name is
 * already present merges the two (see {@link Attribute#mergedWith(Attribute)}); {@link #setAttribute(String, Object)}
 * replaces instead.
 */
public final class Element extends Composite {
    /**
     * Initializes a new element of the given tag with the given content.
     * <p>
     * If the calling thread's {@link ScopeStack} isn't empty, the new element becomes a child of its top element.
     *
     * @throws CompositionException if any content argument can't be attached.
     */
    public Element(final @NotNull Tag tag, final @Nullable Object... content) {
        this(tag, true, content);
    }

    private Element(final Tag tag, final boolean adopt, final @Nullable Object[] content) {
        this.tag = tag;
        attach(0, content);
        if (adopt) {
            ScopeStack.current().adopt(this);
        }
    }

    static @NotNull Element detached(final @NotNull Tag tag, final @Nullable Object... content) {
        return new Element(tag, false, content);
    }

    /**
     * Retrieves the tag of this element.
     */
    public @NotNull Tag tag() {
        return tag;
    }

    /**
     * Retrieves an unmodifiable live view of the attributes of this element, keyed by name, in insertion order.
     */
    public @NotNull Map<@NotNull String, @NotNull Attribute> attributes() {
        return attributesView;
    }

    /**
     * Retrieves the attribute with the given name.
     * <p>
     * The key is normalized with {@link AttributeNames#normalize(String)}.
     *
     * @throws NoSuchElementException if there's no such attribute.
     */
    public @NotNull Attribute attribute(final @NotNull String key) {
        final var name = AttributeNames.normalize(key);
        final var attribute = attributes.get(name);
        if (attribute == null) {
            throw new NoSuchElementException("Attribute '" + name + "' does not exist in " + describe());
        }
        return attribute;
    }

    /**
     * Retrieves the attribute with the given name, or {@code null} if there's no such attribute.
     */
    public @Nullable Attribute findAttribute(final @NotNull String key) {
        return attributes.get(AttributeNames.normalize(key));
    }

    /**
     * Checks whether this element has an attribute with the given name.
     */
    public boolean hasAttribute(final @NotNull String key) {
        return attributes.containsKey(AttributeNames.normalize(key));
    }

    /**
     * Creates or replaces the attribute with the given name. Never merges.
     * <p>
     * {@code value} may be an {@link Attribute}, whose own name is ignored in favor of the key, a string, character or
     * number, {@link Boolean#TRUE} for a boolean attribute, or {@link Boolean#FALSE} to remove the attribute. An
     * existing attribute keeps its position.
     *
     * @return {@code this}
     * @throws UnsupportedArgumentException if {@code value} is of any other type.
     */
    public @NotNull Element setAttribute(final @NotNull String key, final @NotNull Object value) {
        final var name = AttributeNames.normalize(key);
        if (Boolean.FALSE.equals(value)) {
            attributes.remove(name);
        } else if (value instanceof Attribute attribute) {
            attributes.put(name, attribute.renamed(name));
        } else {
            attributes.put(name, Attribute.withValue(name, value));
        }
        return this;
    }

    /**
     * Removes the attribute with the given name. Removing an attribute that isn't present does nothing.
     *
     * @return Whether an attribute was removed.
     */
    public boolean removeAttribute(final @NotNull String key) {
        return attributes.remove(AttributeNames.normalize(key)) != null;
    }

    @Override
    public @NotNull Element add(final @Nullable Object... content) {
        super.add(content);
        return this;
    }

    @Override
    public @NotNull Element insert(final int index, final @Nullable Object... content) {
        super.insert(index, content);
        return this;
    }

    @Override
    public boolean acceptsAttributes() {
        return true;
    }

    @Override
    public boolean acceptsChildren() {
        return !tag.isVoid();
    }

    @Override
    public @NotNull Element copy() {
        final var elementCopy = detached(tag);
        elementCopy.attributes.putAll(attributes);
        copyChildrenInto(elementCopy);
        return elementCopy;
    }

    @Override
    void mergeAttribute(final @NotNull Attribute attribute) {
        attributes.merge(attribute.name(), attribute, Attribute::mergedWith);
    }

    @Override
    @NotNull String describe() {
        return "<" + tag.htmlName() + '>';
    }

    private final Tag tag;
    private final Map<String, Attribute> attributes = new LinkedHashMap<>();
    private final Map<String, Attribute> attributesView = Collections.unmodifiableMap(attributes);
}
