package com.actexport.core.markup;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InlineMarkupParser}.
 */
class InlineMarkupParserTest {

    @Test
    void parse_nullOrBlank_returnsEmpty() {
        assertThat(InlineMarkupParser.parse(null).lines()).isEmpty();
        assertThat(InlineMarkupParser.parse("   ").isBlank()).isTrue();
    }

    @Test
    void parse_styledRunsAndBreak_splitsLinesAndKeepsStyles() {
        // When
        InlineContent content = InlineMarkupParser.parse("<b>Важно</b> и <i>срочно</i><br>Вторая строка");

        // Then
        assertThat(content.lines()).hasSize(2);
        assertThat(content.lines().get(0)).containsExactly(
            new TextRun("Важно", true, false, false),
            TextRun.plain(" и "),
            new TextRun("срочно", false, true, false));
        assertThat(content.lines().get(1)).containsExactly(TextRun.plain("Вторая строка"));
    }

    @Test
    void parse_strongEmAndUnderline_mapToStyles() {
        InlineContent content = InlineMarkupParser.parse("<strong>a</strong><em>b</em><u>c</u>");

        assertThat(content.lines().get(0)).containsExactly(
            new TextRun("a", true, false, false),
            new TextRun("b", false, true, false),
            new TextRun("c", false, false, true));
    }

    @Test
    void parse_nestedStyles_combine() {
        InlineContent content = InlineMarkupParser.parse("<b><i>x</i></b>");

        assertThat(content.lines().get(0)).containsExactly(new TextRun("x", true, true, false));
    }

    @Test
    void parse_inlineCss_mapsToStyles() {
        InlineContent content = InlineMarkupParser.parse(
            "<span style=\"font-weight: 700; text-decoration: underline\">x</span>");

        assertThat(content.lines().get(0)).containsExactly(new TextRun("x", true, false, true));
    }

    @Test
    void parse_adjacentRunsWithSameStyle_areMerged() {
        InlineContent content = InlineMarkupParser.parse("<b>a</b><b>b</b>");

        assertThat(content.lines().get(0)).containsExactly(new TextRun("ab", true, false, false));
    }

    @Test
    void parse_unclosedTag_styleRunsToEnd() {
        InlineContent content = InlineMarkupParser.parse("plain <b>bold");

        assertThat(content.lines().get(0)).containsExactly(
            TextRun.plain("plain "),
            new TextRun("bold", true, false, false));
    }

    @Test
    void parse_blockElements_becomeSeparateLines() {
        InlineContent content = InlineMarkupParser.parse("<p>Один</p><p>Два</p>");

        assertThat(content.plainLines()).containsExactly("Один", "Два");
    }

    @Test
    void parse_unknownTagsAndEntities_keepText() {
        InlineContent content = InlineMarkupParser.parse("<font color=\"red\">A &amp; B</font>");

        assertThat(content.plainText()).isEqualTo("A & B");
        assertThat(content.lines().get(0)).allMatch(run -> !run.bold() && !run.italic() && !run.underline());
    }

    @Test
    void parse_rawNewline_splitsLines() {
        assertThat(InlineMarkupParser.parse("a\nb").plainLines()).containsExactly("a", "b");
    }

    @Test
    void plainFallback_stripsTagsAndKeepsBreaks() {
        InlineContent content = InlineMarkupParser.plainFallback("a<br/>b <x>c</x> &lt;d&gt;");

        assertThat(content.plainLines()).isEqualTo(List.of("a", "b c <d>"));
    }

    @Test
    void withBaseStyle_orsStylesIntoEveryRun() {
        InlineContent content = InlineMarkupParser.parse("a<i>b</i>").withBaseStyle(true, false, false);

        assertThat(content.lines().get(0)).containsExactly(
            new TextRun("a", true, false, false),
            new TextRun("b", true, true, false));
    }
}
