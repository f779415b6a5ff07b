// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import java.util.List;
import java.util.NoSuchElementException;
import scribe.dom.Attribute;
import scribe.dom.CompositionException;
import scribe.dom.Container;
import scribe.dom.Element;
import scribe.dom.Tag;
import scribe.dom.Text;
import scribe.dom.UnsupportedArgumentException;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;
import static scribe.html.Html.br;
import static scribe.html.Html.comment;
import static scribe.html.Html.container;
import static scribe.html.Html.div;
import static scribe.html.Html.document;
import static scribe.html.Html.h1;
import static scribe.html.Html.hr;
import static scribe.html.Html.li;
import static scribe.html.Html.p;
import static scribe.html.Html.span;
import static scribe.html.Html.strong;
import static scribe.html.Html.ul;

final class CompositionTest {
    @Test
    void constructorArgumentsAreClassified() {
        final var heading = h1("Title");
        final var root = div(heading, "tail", Attribute.of("id", "main"), null);
        assertThat(root.children()).hasSize(2);
        assertThat(root.child(0)).isSameAs(heading);
        assertThat(root.child(1)).isInstanceOf(Text.class);
        assertThat(root.attribute("id")).isEqualTo(Attribute.of("id", "main"));
        assertThat(heading.parent()).isSameAs(root);
    }

    @Test
    void iterablesAndArraysAreFlattened() {
        final var root = div(List.of("a", span("b")), new Object[] {"c", null, new Object[] {"d"}});
        assertThat(root.size()).isEqualTo(4);
        assertThat(root.display(false)).isEqualTo("<div>a<span>b</span>cd</div>");
    }

    @Test
    void addAppends() {
        final var root = div(p("first"));
        assertThat(root.add(p("second"), Attribute.classes("wide"))).isSameAs(root);
        assertThat(root.display(false)).isEqualTo("<div class=\"wide\"><p>first</p><p>second</p></div>");
    }

    @Test
    void insertShiftsFollowingChildren() {
        final var list = ul(li("1"), li("3"));
        list.insert(1, li("2"));
        list.insert(0, li("0"));
        list.insert(list.size(), li("4"));
        assertThat(list.display(false)).isEqualTo("<ul><li>0</li><li>1</li><li>2</li><li>3</li><li>4</li></ul>");
    }

    @Test
    void insertChecksIndex() {
        final var list = ul(li("1"));
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> list.insert(2, li("x")));
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> list.insert(-1, li("x")));
        assertThat(list.size()).isEqualTo(1);
    }

    @Test
    void setAndRemoveByIndex() {
        final var list = ul(li("1"), li("2"), li("3"));
        final var second = list.child(1);
        final var replaced = list.set(1, li("two"));
        assertThat(replaced).isSameAs(second);
        assertThat(replaced.parent()).isNull();
        final var removed = list.remove(0);
        assertThat(removed.parent()).isNull();
        assertThat(list.display(false)).isEqualTo("<ul><li>two</li><li>3</li></ul>");
        list.set(0, "plain");
        assertThat(list.display(false)).isEqualTo("<ul>plain<li>3</li></ul>");
    }

    @Test
    void replaceThenRemoveInMixedChildren() {
        final var root = div(p("a"), br(), p("b"));
        root.set(2, strong("x"));
        root.remove(1);
        assertThat(root.display(false)).isEqualTo("<div><p>a</p><strong>x</strong></div>");
    }

    @Test
    void indexedAccessChecksBounds() {
        final var list = ul(li("1"));
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> list.child(1));
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> list.remove(3));
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> list.set(-1, li("x")));
    }

    @Test
    void setRejectsAttributes() {
        final var list = ul(li("1"));
        assertThatExceptionOfType(UnsupportedArgumentException.class)
            .isThrownBy(() -> list.set(0, Attribute.classes("x")));
        assertThat(list.display(false)).isEqualTo("<ul><li>1</li></ul>");
    }

    @Test
    void attachingMovesNodeFromPreviousParent() {
        final var item = span("x");
        final var first = div(item);
        final var second = div();
        second.add(item);
        assertThat(first.isEmpty()).isTrue();
        assertThat(item.parent()).isSameAs(second);
        assertThat(second.indexOf(item)).isEqualTo(0);
        assertThat(first.indexOf(item)).isEqualTo(-1);
    }

    @Test
    void readdingChildMovesItToTheEnd() {
        final var first = li("1");
        final var list = ul(first, li("2"), li("3"));
        list.add(first);
        assertThat(list.display(false)).isEqualTo("<ul><li>2</li><li>3</li><li>1</li></ul>");
    }

    @Test
    void detachRemovesFromParent() {
        final var item = li("1");
        final var list = ul(item, li("2"));
        assertThat(item.detach()).isSameAs(item);
        assertThat(item.parent()).isNull();
        assertThat(list.size()).isEqualTo(1);
    }

    @Test
    void addingNodeToItselfAddsCopy() {
        final var root = div("x");
        root.add(root);
        assertThat(root.size()).isEqualTo(2);
        assertThat(root.child(1)).isNotSameAs(root);
        assertThat(root.display(false)).isEqualTo("<div>x<div>x</div></div>");
    }

    @Test
    void addingSameNodeTwiceInOneCallAddsCopy() {
        final var item = li("1");
        final var list = ul(item, item);
        assertThat(list.size()).isEqualTo(2);
        assertThat(list.child(0)).isSameAs(item);
        assertThat(list.child(1)).isNotSameAs(item);
        assertThat(list.child(1).structurallyEquals(item)).isTrue();
    }

    @Test
    void cyclesAreRejected() {
        final var inner = span();
        final var outer = div(p(inner));
        assertThatExceptionOfType(CompositionException.class).isThrownBy(() -> inner.add(outer));
        assertThat(inner.isEmpty()).isTrue();
        assertThat(outer.parent()).isNull();
    }

    @Test
    void failedAddLeavesNodeUnchanged() {
        final var item = span("x");
        final var root = div(Attribute.classes("a"));
        assertThatExceptionOfType(UnsupportedArgumentException.class)
            .isThrownBy(() -> root.add(item, Attribute.classes("b"), new Object()))
            .withMessageContaining("java.lang.Object");
        assertThat(root.isEmpty()).isTrue();
        assertThat(root.attribute("class")).isEqualTo(Attribute.classes("a"));
        assertThat(item.parent()).isNull();
    }

    @Test
    void voidElementsRejectChildren() {
        assertThatExceptionOfType(CompositionException.class).isThrownBy(() -> hr("x"));
        final var lineBreak = br(Attribute.classes("clear"));
        assertThatExceptionOfType(CompositionException.class).isThrownBy(() -> lineBreak.add(span()));
        assertThat(lineBreak.acceptsChildren()).isFalse();
        assertThat(lineBreak.display(false)).isEqualTo("<br class=\"clear\">");
    }

    @Test
    void tagLessNodesRejectAttributes() {
        assertThatExceptionOfType(CompositionException.class).isThrownBy(() -> container(Attribute.classes("x")));
        assertThatExceptionOfType(CompositionException.class).isThrownBy(() -> comment(Attribute.flag("hidden")));
    }

    @Test
    void addingAttributesMerges() {
        final var root = div(Attribute.classes("a"), Attribute.classes("b", "c"));
        root.add(Attribute.style("color: red"), Attribute.style("margin: 0;"));
        assertThat(root.attribute("class")).isEqualTo(Attribute.of("class", "a b c"));
        assertThat(root.attribute("style")).isEqualTo(Attribute.of("style", "color: red;margin: 0;"));
    }

    @Test
    void flagAndValueMergeToValue() {
        assertThat(div(Attribute.flag("data"), Attribute.of("data", "x")).attribute("data"))
            .isEqualTo(Attribute.of("data", "x"));
        assertThat(div(Attribute.of("data", "x"), Attribute.flag("data")).attribute("data"))
            .isEqualTo(Attribute.of("data", "x"));
        assertThat(div(Attribute.flag("hidden"), Attribute.flag("hidden")).attribute("hidden"))
            .isEqualTo(Attribute.flag("hidden"));
    }

    @Test
    void setAttributeReplacesInPlace() {
        final var root = div(Attribute.classes("a"), Attribute.of("id", "main"));
        root.setAttribute("class_", "b");
        assertThat(root.display(false)).isEqualTo("<div class=\"b\" id=\"main\"></div>");
        root.setAttribute("hidden", true);
        assertThat(root.attribute("hidden")).isInstanceOf(Attribute.Boolean.class);
        root.setAttribute("title", Attribute.of("ignored", "t"));
        assertThat(root.attribute("title")).isEqualTo(Attribute.of("title", "t"));
        root.setAttribute("tabIndex", 3);
        assertThat(root.attribute("tabindex")).isEqualTo(Attribute.of("tabindex", "3"));
    }

    @Test
    void settingFalseRemovesAttribute() {
        final var root = div(Attribute.flag("hidden"));
        root.setAttribute("hidden", false);
        assertThat(root.hasAttribute("hidden")).isFalse();
    }

    @Test
    void removeAttributeReportsWhetherItWasPresent() {
        final var root = div(Attribute.keyword("data_row", 1));
        assertThat(root.removeAttribute("data_row")).isTrue();
        assertThat(root.removeAttribute("data_row")).isFalse();
        assertThat(root.attributes()).isEmpty();
    }

    @Test
    void missingAttributeLookup() {
        final var root = div();
        assertThatExceptionOfType(NoSuchElementException.class).isThrownBy(() -> root.attribute("id"));
        assertThat(root.findAttribute("id")).isNull();
    }

    @Test
    void unsupportedContentIsRejected() {
        assertThatExceptionOfType(UnsupportedArgumentException.class).isThrownBy(() -> div(new Object()));
        assertThatExceptionOfType(UnsupportedArgumentException.class).isThrownBy(() -> div(Boolean.TRUE));
        assertThatExceptionOfType(UnsupportedArgumentException.class).isThrownBy(() -> new Text(new Object()));
    }

    @Test
    void plusOfTwoNodesMakesContainer() {
        final var first = p("a");
        final var second = p("b");
        final var sum = first.plus(second);
        assertThat(sum.children()).containsExactly(first, second);
        assertThat(first.parent()).isSameAs(sum);
        assertThat(sum.display(false)).isEqualTo("<p>a</p><p>b</p>");
    }

    @Test
    void plusAcceptsText() {
        assertThat(h1("x").plus("tail").display(false)).isEqualTo("<h1>x</h1>tail");
        assertThatExceptionOfType(UnsupportedArgumentException.class).isThrownBy(() -> h1("x").plus(new Object()));
    }

    @Test
    void plusExtendsContainers() {
        final var left = container(p("a"));
        assertThat(left.plus(p("b"))).isSameAs(left);
        assertThat(left.size()).isEqualTo(2);

        final var right = container(p("z"));
        final var head = p("y");
        assertThat(head.plus(right)).isSameAs(right);
        assertThat(right.child(0)).isSameAs(head);

        final var merged = container(p("1")).plus(container(p("2"), p("3")));
        assertThat(merged.display(false)).isEqualTo("<p>1</p><p>2</p><p>3</p>");
    }

    @Test
    void plusKeepsDocumentsWhole() {
        final var before = p("before");
        final var page = document();
        final var sum = before.plus(page);
        assertThat(sum.children()).containsExactly(before, page);
        assertThat(page.body().isEmpty()).isTrue();
        assertThat(sum.display(false)).startsWith("<p>before</p><!DOCTYPE html><html>");

        final var after = p("after");
        final var otherPage = document();
        final var otherSum = otherPage.plus(after);
        assertThat(otherSum).isNotSameAs(otherPage);
        assertThat(otherSum.children()).containsExactly(otherPage, after);
        assertThat(otherPage.body().isEmpty()).isTrue();
        assertThat(otherSum.display(false)).endsWith("</body></html><p>after</p>");
    }

    @Test
    void plusWithItselfCopiesRightOperand() {
        final var item = p("a");
        final var sum = item.plus(item);
        assertThat(sum.size()).isEqualTo(2);
        assertThat(sum.child(0)).isSameAs(item);
        assertThat(sum.child(1)).isNotSameAs(item);
        assertThat(sum.display(false)).isEqualTo("<p>a</p><p>a</p>");
    }

    @Test
    void timesMakesIndependentCopies() {
        final var item = div(Attribute.classes("cell"), span("x"));
        final var row = item.times(3);
        assertThat(row.size()).isEqualTo(3);
        assertThat(item.parent()).isNull();
        assertThat(row.children()).doesNotContain(item).doesNotHaveDuplicates();
        ((Element) row.child(0)).add("more");
        ((Element) row.child(1)).setAttribute("class", "other");
        assertThat(row.child(2).structurallyEquals(item)).isTrue();
        assertThat(row.display(false)).isEqualTo(
            "<div class=\"cell\"><span>x</span>more</div>"
                + "<div class=\"other\"><span>x</span></div>"
                + "<div class=\"cell\"><span>x</span></div>"
        );
    }

    @Test
    void timesCopiesDoNotShareText() {
        final var row = p("text").times(3);
        final var firstText = (Text) ((Element) row.child(0)).child(0);
        firstText.setContent("changed");
        assertThat(row.display(false)).isEqualTo("<p>changed</p><p>text</p><p>text</p>");
    }

    @Test
    void timesRequiresPositiveCount() {
        assertThatExceptionOfType(IllegalArgumentException.class).isThrownBy(() -> p("a").times(0));
        assertThatExceptionOfType(IllegalArgumentException.class).isThrownBy(() -> p("a").times(-2));
        assertThat(p("a").times(1)).isInstanceOf(Container.class);
    }

    @Test
    void textAppendsWithoutSeparator() {
        final var text = new Text("a");
        text.add("b", 1, 'c', new Text("d"), null);
        assertThat(text.content()).isEqualTo("ab1cd");
        assertThat(text.length()).isEqualTo(5);
        assertThatExceptionOfType(UnsupportedArgumentException.class).isThrownBy(() -> text.add("e", new Object()));
        assertThat(text.content()).isEqualTo("ab1cd");
        assertThat(new Text(null).content()).isEmpty();
    }

    @Test
    void copyIsDeepAndDetached() {
        final var original = div(Attribute.classes("a"), p("x"));
        final var holder = div(original);
        final var copy = original.copy();
        assertThat(copy.parent()).isNull();
        assertThat(copy.structurallyEquals(original)).isTrue();
        ((Element) copy.child(0)).add("y");
        assertThat(original.display(false)).isEqualTo("<div class=\"a\"><p>x</p></div>");
        assertThat(holder.size()).isEqualTo(1);
    }

    @Test
    void genericElementFactory() {
        final var element = new Element(Tag.ABBR, Attribute.of("title", "HyperText Markup Language"), "HTML");
        assertThat(element.tag()).isEqualTo(Tag.ABBR);
        assertThat(element.display(false)).isEqualTo("<abbr title=\"HyperText Markup Language\">HTML</abbr>");
    }
}
