// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.html;

import scribe.dom.Comment;
import scribe.dom.CompositionException;
import scribe.dom.Container;
import scribe.dom.Document;
import scribe.dom.Element;
import scribe.dom.Tag;
import scribe.dom.Text;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thin factory functions over {@link Element} and the other node constructors.
 * <p>
 * Every factory follows the composition protocol described in {@link scribe.dom.Composite}: content arguments may
 * be nodes, attributes, text, numbers, iterables or arrays of those. Like the constructors, the factories attach the
 * new node to the top of the calling thread's {@link scribe.dom.ScopeStack}, if any.
 * <pre>{@code
 * import static scribe.html.Html.*;
 *
 * final var page = div(h1("Title"), p("Paragraph"), Attribute.classes("container"), hr());
 * }</pre>
 */
public final class Html {
    private Html() {
    }

    /**
     * Returns a new element of the given tag. Useful for tags that have no dedicated factory here.
     */
    public static @NotNull Element element(final @NotNull Tag tag, final @Nullable Object... content) {
        return new Element(tag, content);
    }

    /**
     * Returns a new text node.
     */
    public static @NotNull Text text(final @Nullable Object content) {
        return new Text(content);
    }

    /**
     * Returns a new container, a tagless group of nodes.
     */
    public static @NotNull Container container(final @Nullable Object... content) {
        return new Container(content);
    }

    public static @NotNull Comment comment(final @Nullable Object... body) {
        return new Comment(body);
    }

    /**
     * Returns a new conditional comment, e.g. {@code conditionalComment("lt IE 9", script(...))}.
     */
    public static @NotNull Comment conditionalComment(final @NotNull String condition, final @Nullable Object... body) {
        return Comment.conditional(condition, body);
    }

    /**
     * Returns a new HTML5 document with the given body content.
     *
     * @see Document
     */
    public static @NotNull Document document(final @Nullable Object... bodyContent) {
        return new Document(bodyContent);
    }

    /**
     * Returns a new HTML5 document type declaration, {@code <!DOCTYPE html>}.
     */
    public static @NotNull Element doctype() {
        return new Element(Tag.DOCTYPE);
    }

    /**
     * Returns a new document type declaration of the given kind, e.g. {@link Tag#DOCTYPE_HTML4_01_STRICT}.
     *
     * @throws CompositionException if {@code declaration} isn't a document type declaration.
     */
    public static @NotNull Element doctype(final @NotNull Tag declaration) {
        if (!declaration.isDoctype()) {
            throw new CompositionException(declaration + " is not a document type declaration");
        }
        return new Element(declaration);
    }

    /**
     * Same as {@link #p(Object...)}.
     */
    public static @NotNull Element paragraph(final @Nullable Object... content) {
        return p(content);
    }

    public static @NotNull Element html(final @Nullable Object... content) {
        return new Element(Tag.HTML, content);
    }

    public static @NotNull Element head(final @Nullable Object... content) {
        return new Element(Tag.HEAD, content);
    }

    public static @NotNull Element title(final @Nullable Object... content) {
        return new Element(Tag.TITLE, content);
    }

    public static @NotNull Element body(final @Nullable Object... content) {
        return new Element(Tag.BODY, content);
    }

    public static @NotNull Element h1(final @Nullable Object... content) {
        return new Element(Tag.H1, content);
    }

    public static @NotNull Element h2(final @Nullable Object... content) {
        return new Element(Tag.H2, content);
    }

    public static @NotNull Element h3(final @Nullable Object... content) {
        return new Element(Tag.H3, content);
    }

    public static @NotNull Element h4(final @Nullable Object... content) {
        return new Element(Tag.H4, content);
    }

    public static @NotNull Element h5(final @Nullable Object... content) {
        return new Element(Tag.H5, content);
    }

    public static @NotNull Element h6(final @Nullable Object... content) {
        return new Element(Tag.H6, content);
    }

    public static @NotNull Element p(final @Nullable Object... content) {
        return new Element(Tag.P, content);
    }

    public static @NotNull Element br(final @Nullable Object... content) {
        return new Element(Tag.BR, content);
    }

    public static @NotNull Element hr(final @Nullable Object... content) {
        return new Element(Tag.HR, content);
    }

    public static @NotNull Element abbr(final @Nullable Object... content) {
        return new Element(Tag.ABBR, content);
    }

    public static @NotNull Element b(final @Nullable Object... content) {
        return new Element(Tag.B, content);
    }

    public static @NotNull Element blockquote(final @Nullable Object... content) {
        return new Element(Tag.BLOCKQUOTE, content);
    }

    public static @NotNull Element cite(final @Nullable Object... content) {
        return new Element(Tag.CITE, content);
    }

    public static @NotNull Element code(final @Nullable Object... content) {
        return new Element(Tag.CODE, content);
    }

    public static @NotNull Element del(final @Nullable Object... content) {
        return new Element(Tag.DEL, content);
    }

    public static @NotNull Element em(final @Nullable Object... content) {
        return new Element(Tag.EM, content);
    }

    public static @NotNull Element i(final @Nullable Object... content) {
        return new Element(Tag.I, content);
    }

    public static @NotNull Element ins(final @Nullable Object... content) {
        return new Element(Tag.INS, content);
    }

    public static @NotNull Element kbd(final @Nullable Object... content) {
        return new Element(Tag.KBD, content);
    }

    public static @NotNull Element mark(final @Nullable Object... content) {
        return new Element(Tag.MARK, content);
    }

    public static @NotNull Element pre(final @Nullable Object... content) {
        return new Element(Tag.PRE, content);
    }

    public static @NotNull Element q(final @Nullable Object... content) {
        return new Element(Tag.Q, content);
    }

    public static @NotNull Element s(final @Nullable Object... content) {
        return new Element(Tag.S, content);
    }

    public static @NotNull Element small(final @Nullable Object... content) {
        return new Element(Tag.SMALL, content);
    }

    public static @NotNull Element strong(final @Nullable Object... content) {
        return new Element(Tag.STRONG, content);
    }

    public static @NotNull Element sub(final @Nullable Object... content) {
        return new Element(Tag.SUB, content);
    }

    public static @NotNull Element sup(final @Nullable Object... content) {
        return new Element(Tag.SUP, content);
    }

    public static @NotNull Element time(final @Nullable Object... content) {
        return new Element(Tag.TIME, content);
    }

    public static @NotNull Element u(final @Nullable Object... content) {
        return new Element(Tag.U, content);
    }

    public static @NotNull Element form(final @Nullable Object... content) {
        return new Element(Tag.FORM, content);
    }

    public static @NotNull Element input(final @Nullable Object... content) {
        return new Element(Tag.INPUT, content);
    }

    public static @NotNull Element textarea(final @Nullable Object... content) {
        return new Element(Tag.TEXTAREA, content);
    }

    public static @NotNull Element button(final @Nullable Object... content) {
        return new Element(Tag.BUTTON, content);
    }

    public static @NotNull Element select(final @Nullable Object... content) {
        return new Element(Tag.SELECT, content);
    }

    public static @NotNull Element option(final @Nullable Object... content) {
        return new Element(Tag.OPTION, content);
    }

    public static @NotNull Element label(final @Nullable Object... content) {
        return new Element(Tag.LABEL, content);
    }

    public static @NotNull Element fieldset(final @Nullable Object... content) {
        return new Element(Tag.FIELDSET, content);
    }

    public static @NotNull Element legend(final @Nullable Object... content) {
        return new Element(Tag.LEGEND, content);
    }

    public static @NotNull Element iframe(final @Nullable Object... content) {
        return new Element(Tag.IFRAME, content);
    }

    public static @NotNull Element img(final @Nullable Object... content) {
        return new Element(Tag.IMG, content);
    }

    public static @NotNull Element figure(final @Nullable Object... content) {
        return new Element(Tag.FIGURE, content);
    }

    public static @NotNull Element figcaption(final @Nullable Object... content) {
        return new Element(Tag.FIGCAPTION, content);
    }

    public static @NotNull Element picture(final @Nullable Object... content) {
        return new Element(Tag.PICTURE, content);
    }

    public static @NotNull Element audio(final @Nullable Object... content) {
        return new Element(Tag.AUDIO, content);
    }

    public static @NotNull Element video(final @Nullable Object... content) {
        return new Element(Tag.VIDEO, content);
    }

    public static @NotNull Element source(final @Nullable Object... content) {
        return new Element(Tag.SOURCE, content);
    }

    public static @NotNull Element a(final @Nullable Object... content) {
        return new Element(Tag.A, content);
    }

    public static @NotNull Element link(final @Nullable Object... content) {
        return new Element(Tag.LINK, content);
    }

    public static @NotNull Element nav(final @Nullable Object... content) {
        return new Element(Tag.NAV, content);
    }

    public static @NotNull Element ul(final @Nullable Object... content) {
        return new Element(Tag.UL, content);
    }

    public static @NotNull Element ol(final @Nullable Object... content) {
        return new Element(Tag.OL, content);
    }

    public static @NotNull Element li(final @Nullable Object... content) {
        return new Element(Tag.LI, content);
    }

    public static @NotNull Element dl(final @Nullable Object... content) {
        return new Element(Tag.DL, content);
    }

    public static @NotNull Element dt(final @Nullable Object... content) {
        return new Element(Tag.DT, content);
    }

    public static @NotNull Element dd(final @Nullable Object... content) {
        return new Element(Tag.DD, content);
    }

    public static @NotNull Element table(final @Nullable Object... content) {
        return new Element(Tag.TABLE, content);
    }

    public static @NotNull Element caption(final @Nullable Object... content) {
        return new Element(Tag.CAPTION, content);
    }

    public static @NotNull Element thead(final @Nullable Object... content) {
        return new Element(Tag.THEAD, content);
    }

    public static @NotNull Element tbody(final @Nullable Object... content) {
        return new Element(Tag.TBODY, content);
    }

    public static @NotNull Element tfoot(final @Nullable Object... content) {
        return new Element(Tag.TFOOT, content);
    }

    public static @NotNull Element tr(final @Nullable Object... content) {
        return new Element(Tag.TR, content);
    }

    public static @NotNull Element th(final @Nullable Object... content) {
        return new Element(Tag.TH, content);
    }

    public static @NotNull Element td(final @Nullable Object... content) {
        return new Element(Tag.TD, content);
    }

    public static @NotNull Element style(final @Nullable Object... content) {
        return new Element(Tag.STYLE, content);
    }

    public static @NotNull Element div(final @Nullable Object... content) {
        return new Element(Tag.DIV, content);
    }

    public static @NotNull Element span(final @Nullable Object... content) {
        return new Element(Tag.SPAN, content);
    }

    public static @NotNull Element header(final @Nullable Object... content) {
        return new Element(Tag.HEADER, content);
    }

    public static @NotNull Element footer(final @Nullable Object... content) {
        return new Element(Tag.FOOTER, content);
    }

    public static @NotNull Element main(final @Nullable Object... content) {
        return new Element(Tag.MAIN, content);
    }

    public static @NotNull Element section(final @Nullable Object... content) {
        return new Element(Tag.SECTION, content);
    }

    public static @NotNull Element article(final @Nullable Object... content) {
        return new Element(Tag.ARTICLE, content);
    }

    public static @NotNull Element aside(final @Nullable Object... content) {
        return new Element(Tag.ASIDE, content);
    }

    public static @NotNull Element details(final @Nullable Object... content) {
        return new Element(Tag.DETAILS, content);
    }

    public static @NotNull Element summary(final @Nullable Object... content) {
        return new Element(Tag.SUMMARY, content);
    }

    public static @NotNull Element meta(final @Nullable Object... content) {
        return new Element(Tag.META, content);
    }

    public static @NotNull Element script(final @Nullable Object... content) {
        return new Element(Tag.SCRIPT, content);
    }

    public static @NotNull Element noscript(final @Nullable Object... content) {
        return new Element(Tag.NOSCRIPT, content);
    }
}
