// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import java.io.IOException;
import java.io.StringWriter;
import scribe.dom.Attribute;
import scribe.dom.Comment;
import scribe.dom.Format;
import scribe.dom.Serializer;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import static scribe.html.Html.container;
import static scribe.html.Html.div;
import static scribe.html.Html.h1;
import static scribe.html.Html.hr;
import static scribe.html.Html.input;
import static scribe.html.Html.p;
import static scribe.html.Html.span;

final class SerializerTest {
    @Test
    void prettyOutputIndentsByDepth() {
        final var root = div(Attribute.keyword("class_", "container"), h1("Title"), p("Paragraph"), hr());
        assertThat(root.display()).isEqualTo(
            "<div class=\"container\">\n"
                + "  <h1>\n"
                + "    Title\n"
                + "  </h1>\n"
                + "  <p>\n"
                + "    Paragraph\n"
                + "  </p>\n"
                + "  <hr>\n"
                + "</div>"
        );
    }

    @Test
    void toStringIsPrettyOutput() {
        final var root = div(span("x"));
        assertThat(root).asString().isEqualTo(root.display(true));
    }

    @Test
    void compactOutputHasNoWhitespace() {
        assertThat(div(h1("Header")).display(false)).isEqualTo("<div><h1>Header</h1></div>");
    }

    @Test
    void conditionalCommentIsWrapped() {
        final var comment = Comment.conditional("IE 8", "This is conditional comment");
        assertThat(comment.display()).isEqualTo("<!--[if IE 8]>\n  This is conditional comment\n<![endif]-->");
        assertThat(comment.display(false)).isEqualTo("<!--[if IE 8]>This is conditional comment<![endif]-->");
    }

    @Test
    void emptyCommentStaysOnOneLine() {
        assertThat(new Comment().display()).isEqualTo("<!---->");
        assertThat(Comment.conditional("IE").display()).isEqualTo("<!--[if IE]><![endif]-->");
        assertThat(div(new Comment()).display()).isEqualTo("<div>\n  <!---->\n</div>");
    }

    @Test
    void changingConditionChangesDelimiters() {
        final var comment = new Comment("x");
        comment.setCondition("lt IE 9");
        assertThat(comment.display(false)).isEqualTo("<!--[if lt IE 9]>x<![endif]-->");
        comment.setCondition(null);
        assertThat(comment.display(false)).isEqualTo("<!--x-->");
    }

    @Test
    void plainCommentHoldsElements() {
        final var comment = new Comment("old ", span("markup"));
        assertThat(comment.display(false)).isEqualTo("<!--old <span>markup</span>-->");
    }

    @Test
    void containerIsTransparent() {
        final var group = container(p("a"), p("b"));
        assertThat(group.display()).isEqualTo("<p>\n  a\n</p>\n<p>\n  b\n</p>");
        assertThat(div(group).display(false)).isEqualTo("<div><p>a</p><p>b</p></div>");
    }

    @Test
    void textIsEscaped() {
        assertThat(p("a < b && c > d").display(false)).isEqualTo("<p>a &lt; b &amp;&amp; c &gt; d</p>");
        assertThat(p("\"quoted\"").display(false)).isEqualTo("<p>\"quoted\"</p>");
    }

    @Test
    void attributeValuesAreEscaped() {
        final var element = span(Attribute.of("title", "say \"hi\" & <leave>"));
        assertThat(element.display(false))
            .isEqualTo("<span title=\"say &quot;hi&quot; &amp; &lt;leave&gt;\"></span>");
    }

    @Test
    void attributesKeepInsertionOrder() {
        final var element = input(Attribute.of("type", "text"), Attribute.of("name", "q"), Attribute.flag("required"));
        assertThat(element.display(false)).isEqualTo("<input type=\"text\" name=\"q\" required>");
    }

    @ParameterizedTest
    @CsvSource({
        "SHORT, '<input required>'",
        "EMPTY, '<input required=\"\">'",
        "REPEATED, '<input required=\"required\">'",
    })
    void booleanAttributeStyles(final Format.BooleanStyle style, final String expected) {
        final var element = input(Attribute.flag("required"));
        assertThat(element.display(Format.COMPACT.withBooleanStyle(style))).isEqualTo(expected);
    }

    @Test
    void customIndentAndNewLine() {
        final var format = Format.PRETTY.withIndent("\t").withNewLine("\r\n");
        assertThat(div(span("x")).display(format)).isEqualTo("<div>\r\n\t<span>\r\n\t\tx\r\n\t</span>\r\n</div>");
    }

    @Test
    void keywordNamesRenderAsHtmlNames() {
        final var element = input(
            Attribute.keyword("tabIndex", 1),
            Attribute.keyword("readOnly", true),
            Attribute.keyword("maxLength", 5)
        );
        assertThat(element.display(false)).isEqualTo("<input tabindex=\"1\" readonly maxlength=\"5\">");
    }

    @Test
    void renderingIsRepeatable() {
        final var root = div(
            Attribute.classes("a"),
            p("x & y"),
            Comment.conditional("IE", span(Attribute.flag("hidden"))),
            container("t", hr())
        );
        final var pretty = root.display();
        final var compact = root.display(false);
        assertThat(root.display()).isEqualTo(pretty);
        assertThat(root.display(false)).isEqualTo(compact);
        assertThat(pretty).isNotEqualTo(compact);
    }

    @Test
    void numbersAreText() {
        assertThat(p(42, " and ", 1.5).display(false)).isEqualTo("<p>42 and 1.5</p>");
    }

    @Test
    void serializesToWriter() throws IOException {
        final var writer = new StringWriter();
        Serializer.serialize(writer, div(h1("Header")), Format.COMPACT);
        assertThat(writer).asString().isEqualTo("<div><h1>Header</h1></div>");
    }
}
