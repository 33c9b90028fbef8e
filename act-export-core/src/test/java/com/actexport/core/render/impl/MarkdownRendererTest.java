package com.actexport.core.render.impl;

import com.actexport.core.ActFixtures;
import com.actexport.core.grid.CellPlacement;
import com.actexport.core.grid.FixedHeaders;
import com.actexport.core.grid.TableGrid;
import com.actexport.core.model.ActData;
import com.actexport.core.model.ActNode;
import com.actexport.core.model.ActTable;
import com.actexport.core.model.TableCell;
import com.actexport.core.render.RenderOptions;
import com.actexport.core.tree.SubtreeOptions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MarkdownRenderer}.
 */
class MarkdownRendererTest {

    private final MarkdownRenderer renderer = new MarkdownRenderer();

    @Test
    void renderFull_sampleAct_producesExpectedMarkdown() {
        // Given
        String expected = String.join("\n\n",
            "# АКТ",
            "## 1. Общие сведения",
            "Проверка проведена.",
            "**Текстовый блок (пункт 1)**",
            "<!-- размер шрифта: 16px, выравнивание: по центру -->",
            "<div align=\"center\">\n\n**Важно** и *срочно*  \nВторая строка\n\n</div>",
            "## 5. Результаты",
            "### 5.1. Проверка",
            "**Таблица (пункт 5.1)**",
            "| A | B |\n| --- | --- |\n| C | D |",
            "**Нарушение (пункт 5.1)**",
            "**Причины:** X",
            "#### 5.1.1. Деталь",
            "**Таблица (пункт 5.1.1)**",
            "```\n[0,0-1]: A\n[1,0]: C\n[1,1]: D\n```",
            "### 5.2. Пусто") + "\n";

        // When
        String markdown = renderer.renderFull(ActFixtures.act(), RenderOptions.defaults());

        // Then
        assertThat(markdown).isEqualTo(expected);
    }

    @Test
    void renderSubtree_startsAtHeadingLevelOne() {
        // When
        Optional<String> markdown = renderer.renderSubtree(ActFixtures.act(), "5.1", SubtreeOptions.full(), null);

        // Then
        assertThat(markdown).isPresent();
        assertThat(markdown.get())
            .startsWith("# 5.1. Проверка\n\n**Таблица (пункт 5.1)**")
            .contains("## 5.1.1. Деталь")
            .doesNotContain("# АКТ");
    }

    @Test
    void renderFull_deepItems_clampHeadingLevel() {
        // Given
        RenderOptions options = new RenderOptions("АКТ", 3, 9, 80, 2, 14, true);

        // When
        String markdown = renderer.renderFull(ActFixtures.act(), options);

        // Then
        assertThat(markdown).contains("### 5.1. Проверка").contains("### 5.1.1. Деталь")
            .doesNotContain("####");
    }

    @Test
    void renderFull_fixedHeaderTable_replacesStoredHeaderRows() {
        // Given
        ActTable metrics = new ActTable("m", List.of(
            List.of(TableCell.header("stored 1")),
            List.of(TableCell.header("stored 2")),
            List.of(TableCell.of("M1"), TableCell.of("Клиенты"))
        ), null, true, false, false, false);
        ActData data = new ActData(ActNode.root(List.of(ActNode.table("n-m", "m"))),
            Map.of("m", metrics), null, null);

        // When
        String markdown = renderer.renderFull(data, RenderOptions.defaults().withCaptions(false));

        // Then
        assertThat(markdown)
            .contains(MarkdownRenderer.pipeRow(FixedHeaders.METRICS))
            .contains("| M1 | Клиенты |  |  |  |  |  |")
            .doesNotContain("stored");
    }

    @Test
    void renderFull_mergedTable_emitsPositionalLinesVerbatim() {
        // Given
        ActData data = new ActData(ActNode.root(List.of(ActNode.table("n-t", "t2"))),
            Map.of("t2", ActFixtures.mergedTable()), null, null);
        List<String> described = TableGrid.toPositionalDescription(ActFixtures.mergedTable().grid()).stream()
            .map(CellPlacement::describe)
            .toList();

        // When
        String markdown = renderer.renderFull(data, RenderOptions.defaults().withCaptions(false));

        // Then
        assertThat(markdown.lines().toList()).containsSubsequence(described);
        assertThat(markdown).contains("```\n" + String.join("\n", described) + "\n```");
    }

    @Test
    void renderFull_mergedCellWithBackticks_usesLongerFence() {
        // Given
        ActTable table = new ActTable("t", List.of(
            List.of(TableCell.of("a ``` b").withSpan(1, 2), TableCell.spannedBy(0, 0))
        ), null, false, false, false, false);
        ActData data = new ActData(ActNode.root(List.of(ActNode.table("n-t", "t"))),
            Map.of("t", table), null, null);

        // When
        String markdown = renderer.renderFull(data, RenderOptions.defaults().withCaptions(false));

        // Then
        assertThat(markdown).contains("````\n[0,0-1]: a ``` b\n````");
    }

    @Test
    void pipeRow_joinsCellsWithPipes() {
        assertThat(MarkdownRenderer.pipeRow(List.of("A", "B"))).isEqualTo("| A | B |");
    }

    @Test
    void escapeCell_escapesPipesAndNewlines() {
        assertThat(MarkdownRenderer.escapeCell("a|b\r\nc")).isEqualTo("a\\|b<br>c");
    }

    @Test
    void renderFull_itemContentWithAsterisk_isEscaped() {
        // Given
        ActData data = ActData.ofTree(ActNode.root(List.of(
            ActNode.item("n1", "1", "Раздел", List.of()).withContent("2*2"))));

        // When
        String markdown = renderer.renderFull(data, null);

        // Then
        assertThat(markdown).contains("2\\*2");
    }
}
