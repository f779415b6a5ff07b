// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * HTML elements known to the builder.
 * <p>
 * The HTML name of a tag is derived from the constant name: lowercase, with underscores replaced by dashes. Void
 * elements never have children and are serialized without a closing tag.
 */
public enum Tag {
    /**
     * A pseudo-element representing the HTML5 document type declaration, {@code <!DOCTYPE html>}.
     */
    DOCTYPE(build().setDoctype("html")),

    // Legacy document type declarations
    DOCTYPE_HTML4_01_STRICT(build().setDoctype(
        "HTML PUBLIC \"-//W3C//DTD HTML 4.01//EN\" \"http://www.w3.org/TR/html4/strict.dtd\""
    )),
    DOCTYPE_HTML4_01_TRANSITIONAL(build().setDoctype(
        "HTML PUBLIC \"-//W3C//DTD HTML 4.01 Transitional//EN\" \"http://www.w3.org/TR/html4/loose.dtd\""
    )),
    DOCTYPE_HTML4_01_FRAMESET(build().setDoctype(
        "HTML PUBLIC \"-//W3C//DTD HTML 4.01 Frameset//EN\" \"http://www.w3.org/TR/html4/frameset.dtd\""
    )),
    DOCTYPE_XHTML1_0_STRICT(build().setDoctype(
        "html PUBLIC \"-//W3C//DTD XHTML 1.0 Strict//EN\" \"http://www.w3.org/TR/xhtml1/DTD/xhtml1-strict.dtd\""
    )),
    DOCTYPE_XHTML1_0_TRANSITIONAL(build().setDoctype(
        "html PUBLIC \"-//W3C//DTD XHTML 1.0 Transitional//EN\""
            + " \"http://www.w3.org/TR/xhtml1/DTD/xhtml1-transitional.dtd\""
    )),
    DOCTYPE_XHTML1_0_FRAMESET(build().setDoctype(
        "html PUBLIC \"-//W3C//DTD XHTML 1.0 Frameset//EN\" \"http://www.w3.org/TR/xhtml1/DTD/xhtml1-frameset.dtd\""
    )),
    DOCTYPE_XHTML1_1(build().setDoctype(
        "html PUBLIC \"-//W3C//DTD XHTML 1.1//EN\" \"http://www.w3.org/TR/xhtml11/DTD/xhtml11.dtd\""
    )),
    DOCTYPE_XHTML1_1_BASIC(build().setDoctype(
        "html PUBLIC \"-//W3C//DTD XHTML Basic 1.1//EN\" \"http://www.w3.org/TR/xhtml-basic/xhtml-basic11.dtd\""
    )),

    // Basic structure
    HTML(build()),
    HEAD(build()),
    TITLE(build()),
    BODY(build()),
    H1(build()),
    H2(build()),
    H3(build()),
    H4(build()),
    H5(build()),
    H6(build()),
    P(build()),
    BR(build().setVoid()),
    HR(build().setVoid()),

    // Formatting
    ABBR(build()),
    ACRONYM(build()),
    ADDRESS(build()),
    B(build()),
    BDI(build()),
    BDO(build()),
    BIG(build()),
    BLOCKQUOTE(build()),
    CENTER(build()),
    CITE(build()),
    CODE(build()),
    DEL(build()),
    DFN(build()),
    EM(build()),
    FONT(build()),
    I(build()),
    INS(build()),
    KBD(build()),
    MARK(build()),
    METER(build()),
    PRE(build()),
    PROGRESS(build()),
    Q(build()),
    RP(build()),
    RT(build()),
    RUBY(build()),
    S(build()),
    SAMP(build()),
    SMALL(build()),
    STRIKE(build()),
    STRONG(build()),
    SUB(build()),
    SUP(build()),
    TEMPLATE(build()),
    TIME(build()),
    TT(build()),
    U(build()),
    VAR(build()),
    WBR(build().setVoid()),

    // Forms and input
    FORM(build()),
    INPUT(build().setVoid()),
    TEXTAREA(build()),
    BUTTON(build()),
    SELECT(build()),
    OPTGROUP(build()),
    OPTION(build()),
    LABEL(build()),
    FIELDSET(build()),
    LEGEND(build()),
    DATALIST(build()),
    OUTPUT(build()),

    // Frames
    FRAME(build()),
    FRAMESET(build()),
    NOFRAMES(build()),
    IFRAME(build()),

    // Images and media
    IMG(build().setVoid()),
    MAP(build()),
    AREA(build().setVoid()),
    CANVAS(build()),
    FIGCAPTION(build()),
    FIGURE(build()),
    PICTURE(build()),
    SVG(build()),
    AUDIO(build()),
    SOURCE(build().setVoid()),
    TRACK(build().setVoid()),
    VIDEO(build()),

    // Links and lists
    A(build()),
    LINK(build().setVoid()),
    NAV(build()),
    MENU(build()),
    UL(build()),
    OL(build()),
    LI(build()),
    DIR(build()),
    DL(build()),
    DT(build()),
    DD(build()),

    // Tables
    TABLE(build()),
    CAPTION(build()),
    TH(build()),
    TR(build()),
    TD(build()),
    THEAD(build()),
    TBODY(build()),
    TFOOT(build()),
    COL(build().setVoid()),
    COLGROUP(build()),

    // Styles and semantics
    STYLE(build()),
    DIV(build()),
    SPAN(build()),
    HEADER(build()),
    HGROUP(build()),
    FOOTER(build()),
    MAIN(build()),
    SECTION(build()),
    SEARCH(build()),
    ARTICLE(build()),
    ASIDE(build()),
    DETAILS(build()),
    DIALOG(build()),
    SUMMARY(build()),
    DATA(build()),

    // Meta information
    META(build().setVoid()),
    BASE(build().setVoid()),
    BASEFONT(build()),

    // Programming
    SCRIPT(build()),
    NOSCRIPT(build()),
    APPLET(build()),
    EMBED(build().setVoid()),
    OBJECT(build()),
    PARAM(build().setVoid());

    Tag(final Builder builder) {
        htmlName = (builder.htmlName != null) ? builder.htmlName : name().toLowerCase(Locale.ROOT).replace('_', '-');
        isVoid = builder.isVoid;
        isDoctype = builder.isDoctype;
    }

    /**
     * Retrieves the tag with the given HTML name, or {@code null} if one doesn't exist.
     */
    public static @Nullable Tag byHtmlName(final String htmlName) {
        return tagsByHtmlName.get(htmlName.toLowerCase(Locale.ROOT));
    }

    /**
     * Retrieves the HTML name of the tag, as it appears in the serialized form.
     */
    public String htmlName() {
        return htmlName;
    }

    /**
     * Checks whether this is a void element, one that can't have any children and has no closing tag.
     */
    public boolean isVoid() {
        return isVoid;
    }

    /**
     * Checks whether this is a document type declaration pseudo-element. Every such tag is void.
     */
    public boolean isDoctype() {
        return isDoctype;
    }

    private static Builder build() {
        return new Builder();
    }

    private static final Map<String, Tag> tagsByHtmlName = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(tag -> tag.htmlName().toLowerCase(Locale.ROOT), Function.identity()));

    private final String htmlName;
    private final boolean isVoid;
    private final boolean isDoctype;

    private static final class Builder {
        private Builder setHtmlName(final String htmlName) {
            this.htmlName = htmlName;
            return this;
        }

        private Builder setVoid() {
            isVoid = true;
            return this;
        }

        private Builder setDoctype(final String declaration) {
            isDoctype = true;
            return setHtmlName("!DOCTYPE " + declaration).setVoid();
        }

        private @Nullable String htmlName = null;
        private boolean isVoid = false;
        private boolean isDoctype = false;
    }
}
