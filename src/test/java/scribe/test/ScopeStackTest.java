// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.test;

import java.util.concurrent.atomic.AtomicInteger;
import scribe.dom.Attribute;
import scribe.dom.CompositionException;
import scribe.dom.ScopeStack;
import scribe.dom.Text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import static scribe.html.Html.br;
import static scribe.html.Html.div;
import static scribe.html.Html.li;
import static scribe.html.Html.p;
import static scribe.html.Html.section;
import static scribe.html.Html.span;
import static scribe.html.Html.ul;

final class ScopeStackTest {
    @AfterEach
    void stackIsEmptyAfterEachTest() {
        assertThat(ScopeStack.current().depth()).isZero();
    }

    @Test
    void newNodesAttachToTopElement() {
        final var list = ul();
        try (final var scope = ScopeStack.current().enter(list)) {
            li("first");
            li("second");
            scope.add(Attribute.classes("menu"));
            assertThat(ScopeStack.current().top()).isSameAs(list);
        }
        assertThat(list.display(false)).isEqualTo("<ul class=\"menu\"><li>first</li><li>second</li></ul>");
        assertThat(ScopeStack.current().top()).isNull();
    }

    @Test
    void scopesNest() {
        final var outer = div();
        try (final var outerScope = ScopeStack.current().enter(outer)) {
            final var inner = section();
            try (final var innerScope = ScopeStack.current().enter(inner)) {
                p("x");
                assertThat(ScopeStack.current().elements()).containsExactly(outer, inner);
            }
            span("y");
            assertThat(outerScope.elements()).containsExactly(outer);
        }
        assertThat(outer.display(false)).isEqualTo("<div><section><p>x</p></section><span>y</span></div>");
    }

    @Test
    void enteringSeveralElementsNestsThem() {
        final var paragraph = p();
        final var inline = span();
        try (final var scope = ScopeStack.current().enter(paragraph, inline)) {
            new Text("t");
            assertThat(ScopeStack.current().depth()).isEqualTo(2);
            assertThat(scope.elements()).containsExactly(paragraph, inline);
        }
        assertThat(paragraph.display(false)).isEqualTo("<p><span>t</span></p>");
    }

    @Test
    void explicitlyAttachedNodesStayWhereTheyArePut() {
        final var root = div();
        try (final var scope = ScopeStack.current().enter(root)) {
            final var child = span();
            p(child);
        }
        assertThat(root.display(false)).isEqualTo("<div><p><span></span></p></div>");
    }

    @Test
    void scopeAddTargetsCurrentTop() {
        final var root = div();
        try (final var outer = ScopeStack.current().enter(root)) {
            final var inner = section();
            try (final var innerScope = ScopeStack.current().enter(inner)) {
                assertThat(outer.add("text")).isSameAs(inner);
            }
            assertThat(outer.add(Attribute.of("id", "r"))).isSameAs(root);
        }
        assertThat(root.display(false)).isEqualTo("<div id=\"r\"><section>text</section></div>");
    }

    @Test
    void voidElementsCannotBeEntered() {
        final var container = div();
        assertThatExceptionOfType(CompositionException.class)
            .isThrownBy(() -> ScopeStack.current().enter(container, br()));
        assertThat(ScopeStack.current().depth()).isZero();
    }

    @Test
    void closedScopeRejectsContent() {
        final var root = div();
        final var scope = ScopeStack.current().enter(root);
        scope.close();
        scope.close();
        assertThatExceptionOfType(IllegalStateException.class).isThrownBy(() -> scope.add("late"));
        assertThat(root.isEmpty()).isTrue();
    }

    @Test
    void closingOuterScopeFirstIsRejected() {
        final var outer = ScopeStack.current().enter(div());
        final var inner = ScopeStack.current().enter(section());
        assertThatExceptionOfType(IllegalStateException.class).isThrownBy(outer::close);
        assertThat(ScopeStack.current().depth()).isEqualTo(2);
        inner.close();
        outer.close();
        assertThat(ScopeStack.current().depth()).isZero();
    }

    @Test
    void scopeIsPoppedOnException() {
        final var root = div();
        assertThatExceptionOfType(CompositionException.class).isThrownBy(() -> {
            try (final var scope = ScopeStack.current().enter(root)) {
                p("kept");
                br("rejected");
            }
        });
        assertThat(ScopeStack.current().depth()).isZero();
        assertThat(root.display(false)).isEqualTo("<div><p>kept</p></div>");
    }

    @Test
    void stacksArePerThread() throws InterruptedException {
        final var otherDepth = new AtomicInteger(-1);
        final var root = div();
        try (final var scope = ScopeStack.current().enter(root)) {
            final var thread = new Thread(() -> {
                otherDepth.set(ScopeStack.current().depth());
                span("elsewhere");
            });
            thread.start();
            thread.join();
        }
        assertThat(otherDepth).hasValue(0);
        assertThat(root.isEmpty()).isTrue();
    }
}
