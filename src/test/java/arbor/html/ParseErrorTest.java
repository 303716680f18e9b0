// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.html;

import arbor.util.Trace;
import arbor.util.condition.UnhandledErrorError;
import static arbor.html.ParseErrors.signaledBy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

final class ParseErrorTest {
    @Test
    void unknownStartTagIsInvalid() {
        final var condition = signaledBy("<div><bogus></bogus></div>");
        assertThat(condition).isInstanceOf(InvalidTagCondition.class);
        assertThat(((InvalidTagCondition) condition).tagName()).isEqualTo("bogus");
        assertThat(condition.message()).isEqualTo("Invalid HTML tag: 'bogus'");
        assertThat(condition.location()).isEqualTo(new SourceLocation(5, 1, 6));
    }

    @Test
    void unknownEndTagIsInvalid() {
        final var condition = signaledBy("<div>text</bogus>");
        assertThat(condition).isInstanceOf(InvalidTagCondition.class);
        assertThat(((InvalidTagCondition) condition).tagName()).isEqualTo("bogus");
        assertThat(condition.location().offset()).isEqualTo(9);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "<DIV></DIV>|DIV",
        "<Div>|Div",
        "<!DOCTYPE html><custom-element>|custom-element",
        "<p>a <b>b</b> <blinky>|blinky",
    })
    void namesOutsideVocabularyAreInvalid(final String html, final String expectedName) {
        final var condition = signaledBy(html);
        assertThat(condition).isInstanceOf(InvalidTagCondition.class);
        assertThat(((InvalidTagCondition) condition).tagName()).isEqualTo(expectedName);
    }

    @ParameterizedTest
    @ValueSource(strings = {"<>", "text <", "< div>", "</>"})
    void emptyTagNameIsInvalid(final String html) {
        final var condition = signaledBy(html);
        assertThat(condition).isInstanceOf(InvalidTagCondition.class);
        assertThat(((InvalidTagCondition) condition).tagName()).isEmpty();
    }

    @Test
    void locationCountsLinesAndColumns() {
        final var condition = signaledBy("<div>\n  <p>ok</p>\n  <bogus>");
        assertThat(condition.location()).isEqualTo(new SourceLocation(20, 3, 3));
        assertThat(condition.detailedMessage()).isEqualTo("Invalid HTML tag: 'bogus'\nAt line 3, column 3 (offset 20)");
    }

    @Test
    void unterminatedCommentIsMalformed() {
        final var condition = signaledBy("<div><!-- never closed -- >");
        assertThat(condition).isInstanceOf(MalformedInputCondition.class);
        assertThat(condition.message()).contains("'-->'");
        assertThat(condition.location().offset()).isEqualTo(5);
    }

    @Test
    void unterminatedLeadingCommentIsMalformed() {
        assertThat(signaledBy("<!-- <!DOCTYPE html>")).isInstanceOf(MalformedInputCondition.class);
    }

    @Test
    void unterminatedDoctypeIsMalformed() {
        final var condition = signaledBy("<!DOCTYPE html");
        assertThat(condition).isInstanceOf(MalformedInputCondition.class);
        assertThat(condition.message()).contains("DOCTYPE");
        assertThat(condition.location().offset()).isZero();
    }

    @Test
    void unterminatedAttributeValueIsMalformed() {
        final var condition = signaledBy("<div title=\"oops>text</div>");
        assertThat(condition).isInstanceOf(MalformedInputCondition.class);
        assertThat(condition.message()).contains("'title'");
        assertThat(condition.location().offset()).isEqualTo(11);
    }

    @ParameterizedTest
    @ValueSource(strings = {"<div", "<div class=\"a\"", "<div id=a ", "<p>text<br"})
    void unterminatedStartTagIsMalformed(final String html) {
        final var condition = signaledBy(html);
        assertThat(condition).isInstanceOf(MalformedInputCondition.class);
        assertThat(condition.message()).contains("start tag");
    }

    @Test
    void missingAttributeValueIsMalformed() {
        final var condition = signaledBy("<div id=");
        assertThat(condition).isInstanceOf(MalformedInputCondition.class);
        assertThat(condition.message()).contains("'id'");
    }

    @Test
    void missingAttributeNameIsMalformed() {
        final var condition = signaledBy("<div =\"x\"></div>");
        assertThat(condition).isInstanceOf(MalformedInputCondition.class);
        assertThat(condition.location().offset()).isEqualTo(5);
    }

    @ParameterizedTest
    @ValueSource(strings = {"<div></div", "<p>a</span", "<!foo", "<?xml version=\"1.0\""})
    void unterminatedEndTagOrDeclarationIsMalformed(final String html) {
        assertThat(signaledBy(html)).isInstanceOf(MalformedInputCondition.class);
    }

    @Test
    void excessiveNestingIsMalformed() {
        final var condition = signaledBy("<div>".repeat(513));
        assertThat(condition).isInstanceOf(MalformedInputCondition.class);
        assertThat(condition.message()).contains("Nesting limit");
        assertThat(condition.location().offset()).isEqualTo(512 * "<div>".length());
    }

    @Test
    void handlersSeeTracesOfEnclosingElements() {
        final var captured = ParseErrors.capture("<div><span>\n<bogus>");
        assertThat(captured.traces()).containsExactly(
            "Parsing element <span> at line 1, column 6",
            "Parsing element <div> at line 1, column 1",
            "Parsing HTML document"
        );
        assertThat(Trace.activeTraces()).isEmpty();
    }

    @Test
    void unhandledParseErrorIsThrownAsError() {
        assertThatExceptionOfType(UnhandledErrorError.class)
            .isThrownBy(() -> HtmlParser.parse("<html><bogus>"))
            .withMessageContaining(InvalidTagCondition.class.getName())
            .withMessageContaining("'bogus'");
        assertThat(Trace.activeTraces()).isEmpty();
    }
}
