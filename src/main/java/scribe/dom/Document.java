// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A container prepared with the basic structure of an HTML5 document:
 * <pre>{@code
 * <!DOCTYPE html>
 * <html>
 *   <head>
 *     <meta charset="utf-8">
 *     <title>...</title>
 *   </head>
 *   <body>...</body>
 * </html>
 * }</pre>
 * The declaration can be one of the legacy ones, see {@link #declared(Tag, String, Object...)}.
 * <p>
 * {@link #add(Object...)} and {@link #insert(int, Object...)} operate on the body; index access operates on the
 * document's own children, the doctype declaration and the {@code <html>} element.
 */
public final class Document extends Container {
    /**
     * Initializes a new document with the default title and the given body content.
     */
    public Document(final @Nullable Object... bodyContent) {
        this(Tag.DOCTYPE, DEFAULT_TITLE, true, bodyContent);
    }

    private Document(
        final Tag doctype,
        final String title,
        final boolean adopt,
        final @Nullable Object[] bodyContent
    ) {
        super(false, noContent);
        head = Element.detached(
            Tag.HEAD,
            Element.detached(Tag.META, Attribute.of("charset", "utf-8")),
            Element.detached(Tag.TITLE, title)
        );
        body = Element.detached(Tag.BODY, bodyContent);
        attach(0, new Object[] {Element.detached(doctype), Element.detached(Tag.HTML, head, body)});
        logger.debug("Assembled document '{}' with {} body nodes", title, body.size());
        if (adopt) {
            ScopeStack.current().adopt(this);
        }
    }

    /**
     * Returns a new document with the given title and body content.
     */
    public static @NotNull Document titled(final @NotNull String title, final @Nullable Object... bodyContent) {
        return new Document(Tag.DOCTYPE, title, true, bodyContent);
    }

    /**
     * Returns a new document with the given document type declaration, title and body content.
     *
     * @throws CompositionException if {@code doctype} isn't a document type declaration.
     * @see Tag#isDoctype()
     */
    public static @NotNull Document declared(
        final @NotNull Tag doctype,
        final @NotNull String title,
        final @Nullable Object... bodyContent
    ) {
        if (!doctype.isDoctype()) {
            throw new CompositionException(doctype + " is not a document type declaration");
        }
        return new Document(doctype, title, true, bodyContent);
    }

    /**
     * Retrieves the {@code <head>} element.
     */
    public @NotNull Element head() {
        return head;
    }

    /**
     * Retrieves the {@code <body>} element.
     */
    public @NotNull Element body() {
        return body;
    }

    /**
     * Appends the given content to the body.
     */
    @Override
    public @NotNull Document add(final @Nullable Object... content) {
        body.add(content);
        return this;
    }

    /**
     * Inserts the given content into the body, at the given index of the body's children.
     */
    @Override
    public @NotNull Document insert(final int index, final @Nullable Object... content) {
        body.insert(index, content);
        return this;
    }

    /**
     * Returns a deep copy of this document. The copy's {@link #head()} and {@link #body()} are the first matching
     * elements of its own tree; detached ones are created if the original no longer has them in place.
     */
    @Override
    public @NotNull Document copy() {
        return new Document(this);
    }

    private Document(final Document original) {
        super(false, noContent);
        original.copyChildrenInto(this);
        final var html = findSection(this, Tag.HTML);
        head = findSection(html, Tag.HEAD);
        body = findSection(html, Tag.BODY);
    }

    @Override
    @NotNull String describe() {
        return "document";
    }

    private static Element findSection(final Composite parent, final Tag tag) {
        for (final var child : parent.children()) {
            if (child instanceof Element element && element.tag() == tag) {
                return element;
            }
        }
        return Element.detached(tag);
    }

    private static final String DEFAULT_TITLE = "Title of the page";
    private static final Logger logger = LogManager.getLogger(Document.class);

    private final Element head;
    private final Element body;
}
