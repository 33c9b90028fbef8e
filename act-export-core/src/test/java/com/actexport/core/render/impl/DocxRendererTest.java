package com.actexport.core.render.impl;

import com.actexport.core.ActFixtures;
import com.actexport.core.model.ActData;
import com.actexport.core.model.ActNode;
import com.actexport.core.model.ActTable;
import com.actexport.core.model.Alignment;
import com.actexport.core.model.TableCell;
import com.actexport.core.render.RenderOptions;
import com.actexport.core.tree.SubtreeOptions;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.junit.jupiter.api.Test;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STMerge;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DocxRenderer}.
 */
class DocxRendererTest {

    private final DocxRenderer renderer = new DocxRenderer();

    @Test
    void renderFull_startsWithTitleParagraph() throws IOException {
        // When
        try (XWPFDocument document = renderer.renderFull(ActFixtures.act(), RenderOptions.defaults())) {
            // Then
            XWPFParagraph title = document.getParagraphs().get(0);
            assertThat(title.getStyle()).isEqualTo("Title");
            assertThat(title.getText()).isEqualTo("АКТ");
        }
    }

    @Test
    void renderFull_itemsUseHeadingStylesByDepth() throws IOException {
        try (XWPFDocument document = renderer.renderFull(ActFixtures.act(), null)) {
            assertThat(styleOf(document, "1. Общие сведения")).isEqualTo("Heading1");
            assertThat(styleOf(document, "5.1. Проверка")).isEqualTo("Heading2");
            assertThat(styleOf(document, "5.1.1. Деталь")).isEqualTo("Heading3");
        }
    }

    @Test
    void renderFull_clampsHeadingLevel() throws IOException {
        // Given
        RenderOptions options = new RenderOptions("АКТ", 6, 2, 80, 2, 14, true);

        // When
        try (XWPFDocument document = renderer.renderFull(ActFixtures.act(), options)) {
            // Then
            assertThat(styleOf(document, "5.1.1. Деталь")).isEqualTo("Heading2");
        }
    }

    @Test
    void renderFull_mergedTable_spansOriginAcrossGrid() throws IOException {
        try (XWPFDocument document = renderer.renderFull(ActFixtures.act(), null)) {
            // Given
            List<XWPFTable> tables = document.getTables();
            assertThat(tables).hasSize(2);
            XWPFTable merged = tables.get(1);

            // When
            CTTcPr origin = merged.getRow(0).getCell(0).getCTTc().getTcPr();

            // Then
            assertThat(origin.getGridSpan().getVal()).isEqualTo(BigInteger.valueOf(2));
            assertThat(origin.isSetHMerge()).isFalse();
            assertThat(merged.getRow(0).getTableCells()).hasSize(1);
            assertThat(merged.getRow(0).getCell(0).getText()).isEqualTo("A");
            assertThat(merged.getRow(1).getTableCells()).hasSize(2);
            assertThat(merged.getRow(1).getCell(1).getText()).isEqualTo("D");
        }
    }

    @Test
    void renderFull_blockSpan_setsGridSpanOnEveryRowAndContinuesVerticalMerge() throws IOException {
        // Given
        ActTable table = ActTable.of("t", List.of(
            List.of(TableCell.of("A").withSpan(2, 2), TableCell.spannedBy(0, 0), TableCell.of("X")),
            List.of(TableCell.spannedBy(0, 0), TableCell.spannedBy(0, 0), TableCell.of("Y")),
            List.of(TableCell.of("P"), TableCell.of("Q").withSpan(1, 2), TableCell.spannedBy(2, 1))));
        ActData data = new ActData(ActNode.root(List.of(ActNode.table("n-t", "t"))), Map.of("t", table), null, null);

        // When
        try (XWPFDocument document = renderer.renderFull(data, RenderOptions.defaults().withCaptions(false))) {
            XWPFTable rendered = document.getTables().get(0);
            CTTcPr top = rendered.getRow(0).getCell(0).getCTTc().getTcPr();
            CTTcPr below = rendered.getRow(1).getCell(0).getCTTc().getTcPr();
            CTTcPr lastRowSpan = rendered.getRow(2).getCell(1).getCTTc().getTcPr();

            // Then
            assertThat(top.getGridSpan().getVal()).isEqualTo(BigInteger.valueOf(2));
            assertThat(top.getVMerge().getVal()).isEqualTo(STMerge.RESTART);
            assertThat(below.getGridSpan().getVal()).isEqualTo(BigInteger.valueOf(2));
            assertThat(below.getVMerge().getVal()).isEqualTo(STMerge.CONTINUE);
            assertThat(rendered.getRow(0).getTableCells()).hasSize(2);
            assertThat(rendered.getRow(0).getCell(1).getText()).isEqualTo("X");
            assertThat(rendered.getRow(1).getCell(1).getText()).isEqualTo("Y");
            assertThat(rendered.getRow(2).getTableCells()).hasSize(2);
            assertThat(rendered.getRow(2).getCell(1).getText()).isEqualTo("Q");
            assertThat(lastRowSpan.getGridSpan().getVal()).isEqualTo(BigInteger.valueOf(2));
        }
    }

    @Test
    void renderFull_simpleTable_keepsCellTexts() throws IOException {
        try (XWPFDocument document = renderer.renderFull(ActFixtures.act(), null)) {
            XWPFTable table = document.getTables().get(0);

            assertThat(table.getNumberOfRows()).isEqualTo(2);
            assertThat(table.getRow(0).getCell(1).getText()).isEqualTo("B");
            assertThat(table.getRow(1).getCell(0).getText()).isEqualTo("C");
            assertThat(table.getRow(0).getCell(0).getParagraphs().get(0).getRuns().get(0).isBold()).isTrue();
        }
    }

    @Test
    void renderFull_textBlock_keepsAlignmentSizeAndEmphasis() throws IOException {
        try (XWPFDocument document = renderer.renderFull(ActFixtures.act(), null)) {
            // Given
            XWPFParagraph paragraph = paragraphContaining(document, "Важно");

            // When
            XWPFRun bold = paragraph.getRuns().stream()
                .filter(run -> "Важно".equals(run.text()))
                .findFirst()
                .orElseThrow();
            XWPFRun italic = paragraph.getRuns().stream()
                .filter(run -> "срочно".equals(run.text()))
                .findFirst()
                .orElseThrow();

            // Then
            assertThat(paragraph.getAlignment()).isEqualTo(ParagraphAlignment.CENTER);
            assertThat(bold.isBold()).isTrue();
            assertThat(bold.getFontSizeAsDouble()).isEqualTo(16.0);
            assertThat(italic.isItalic()).isTrue();
            assertThat(paragraph.getText()).contains("Вторая строка");
        }
    }

    @Test
    void renderFull_captionsAreItalic() throws IOException {
        try (XWPFDocument document = renderer.renderFull(ActFixtures.act(), null)) {
            XWPFParagraph caption = paragraphContaining(document, "Таблица (пункт 5.1)");

            assertThat(caption.getRuns().get(0).isItalic()).isTrue();
        }
    }

    @Test
    void renderSubtree_hasNoTitle() throws IOException {
        // When
        Optional<XWPFDocument> rendered = renderer.renderSubtree(ActFixtures.act(), "5.1", SubtreeOptions.full(), null);

        // Then
        assertThat(rendered).isPresent();
        try (XWPFDocument document = rendered.get()) {
            assertThat(document.getParagraphs().get(0).getText()).isEqualTo("5.1. Проверка");
            assertThat(document.getParagraphs().get(0).getStyle()).isEqualTo("Heading1");
        }
    }

    @Test
    void encode_producesReadableDocument() throws IOException {
        // Given
        byte[] bytes;
        try (XWPFDocument document = renderer.renderFull(ActFixtures.act(), null)) {
            bytes = renderer.encode(document);
        }

        // When
        try (XWPFDocument reread = new XWPFDocument(new ByteArrayInputStream(bytes))) {
            // Then
            assertThat(reread.getParagraphs().get(0).getText()).isEqualTo("АКТ");
            assertThat(reread.getTables()).hasSize(2);
            assertThat(reread.getStyles().styleExist("Heading1")).isTrue();
        }
    }

    @Test
    void paragraphAlignment_justify_mapsToBoth() {
        assertThat(DocxRenderer.paragraphAlignment(Alignment.JUSTIFY)).isEqualTo(ParagraphAlignment.BOTH);
        assertThat(DocxRenderer.paragraphAlignment(Alignment.RIGHT)).isEqualTo(ParagraphAlignment.RIGHT);
    }

    private static String styleOf(XWPFDocument document, String text) {
        return paragraphContaining(document, text).getStyle();
    }

    private static XWPFParagraph paragraphContaining(XWPFDocument document, String text) {
        return document.getParagraphs().stream()
            .filter(paragraph -> paragraph.getText().contains(text))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No paragraph contains: " + text));
    }
}
