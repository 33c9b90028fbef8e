package com.actexport.core.render.impl;

import com.actexport.core.grid.MergeRegion;
import com.actexport.core.grid.TableGrid;
import com.actexport.core.grid.TableLayout;
import com.actexport.core.markup.InlineContent;
import com.actexport.core.markup.InlineMarkupParser;
import com.actexport.core.markup.TextRun;
import com.actexport.core.model.ActNode;
import com.actexport.core.model.ActTable;
import com.actexport.core.model.Alignment;
import com.actexport.core.model.TableCell;
import com.actexport.core.model.TextBlock;
import com.actexport.core.model.TextFormatting;
import com.actexport.core.model.Violation;
import com.actexport.core.render.AbstractActRenderer;
import com.actexport.core.render.DocumentSink;
import com.actexport.core.render.NodeContext;
import com.actexport.core.render.RenderOptions;
import com.actexport.core.tree.ItemHeadings;
import com.actexport.core.violation.ViolationEntry;
import com.actexport.core.violation.ViolationFormatter;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTc;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STMerge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Renders acts as Word documents (DOCX) with Apache POI.
 *
 * <p>Unlike the text targets this one expresses everything natively:
 * <ul>
 *   <li><b>Headings</b> use the {@code Heading1..Heading9} paragraph styles</li>
 *   <li><b>Tables</b> are real grids; column spans become {@code gridSpan} cells and row
 *       spans vertical merge marks, clamped to the grid</li>
 *   <li><b>Text blocks</b> keep bold, italic and underline per run, plus font size and
 *       paragraph alignment</li>
 * </ul>
 *
 * <p>The result is an in-memory {@link XWPFDocument}; {@link #encode(XWPFDocument)}
 * serializes it.
 */
public class DocxRenderer extends AbstractActRenderer<XWPFDocument> {

    private static final Logger log = LoggerFactory.getLogger(DocxRenderer.class);

    private static final String EMPTY_TABLE = "[Пустая таблица]";
    private static final String TABLE_CAPTION = "Таблица";
    private static final String TEXT_BLOCK_CAPTION = "Текстовый блок";
    private static final String VIOLATION_CAPTION = "Нарушение";
    private static final String BULLET = "• ";
    private static final int LIST_INDENT_TWIPS = 360;
    private static final int TITLE_FONT_SIZE = 16;

    @Override
    public String getId() {
        return "docx";
    }

    @Override
    public String getDisplayName() {
        return "Word Document Renderer";
    }

    @Override
    public String getFileExtension() {
        return "docx";
    }

    @Override
    public String getContentType() {
        return "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    }

    @Override
    public byte[] encode(XWPFDocument rendered) throws IOException {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            rendered.write(out);
            return out.toByteArray();
        }
    }

    @Override
    protected DocumentSink<XWPFDocument> createSink(RenderOptions options, boolean full) {
        XWPFDocument document = new XWPFDocument();
        DocxStyles.ensure(document, options.docxMaxHeadingLevel());
        return new DocxSink(document, options);
    }

    /**
     * Maps a text block alignment to a paragraph alignment; justify becomes {@code BOTH}.
     *
     * @param alignment text block alignment
     * @return POI paragraph alignment
     */
    static ParagraphAlignment paragraphAlignment(Alignment alignment) {
        return switch (alignment) {
            case LEFT -> ParagraphAlignment.LEFT;
            case CENTER -> ParagraphAlignment.CENTER;
            case RIGHT -> ParagraphAlignment.RIGHT;
            case JUSTIFY -> ParagraphAlignment.BOTH;
        };
    }

    private static final class DocxSink implements DocumentSink<XWPFDocument> {

        private final XWPFDocument document;
        private final RenderOptions options;

        private DocxSink(XWPFDocument document, RenderOptions options) {
            this.document = document;
            this.options = options;
        }

        @Override
        public void onTitle(String title) {
            XWPFParagraph paragraph = document.createParagraph();
            paragraph.setStyle(DocxStyles.TITLE);
            paragraph.setAlignment(ParagraphAlignment.CENTER);
            XWPFRun run = paragraph.createRun();
            run.setBold(true);
            run.setFontSize(TITLE_FONT_SIZE);
            run.setText(title);
        }

        @Override
        public void onItem(ActNode item, NodeContext context) {
            String heading = ItemHeadings.text(item);
            if (!heading.isEmpty()) {
                int level = Math.min(context.level(), options.docxMaxHeadingLevel());
                XWPFParagraph paragraph = document.createParagraph();
                paragraph.setStyle(DocxStyles.heading(level));
                paragraph.createRun().setText(heading);
            }
            if (item.content() != null && !item.content().isBlank()) {
                addPlainParagraph(item.content().trim());
            }
        }

        @Override
        public void onTable(ActNode node, ActTable table, NodeContext context) {
            addCaption(context.caption(node, TABLE_CAPTION));

            TableLayout layout = TableLayout.of(table);
            int columns = TableGrid.columnCount(table.grid());
            if (layout.kind() == TableLayout.Kind.EMPTY || columns == 0) {
                addPlainParagraph(EMPTY_TABLE);
                return;
            }
            if (layout.kind() == TableLayout.Kind.FIXED_HEADER) {
                writeFixedHeaderTable(layout);
            } else {
                writeGridTable(table.grid(), columns);
            }
            document.createParagraph();
        }

        @Override
        public void onTextBlock(ActNode node, TextBlock textBlock, NodeContext context) {
            addCaption(context.caption(node, TEXT_BLOCK_CAPTION));

            TextFormatting formatting = textBlock.formatting();
            InlineContent content = InlineMarkupParser.parse(textBlock.content())
                .withBaseStyle(formatting.bold(), formatting.italic(), formatting.underline());
            if (content.isBlank()) {
                return;
            }

            XWPFParagraph paragraph = document.createParagraph();
            paragraph.setAlignment(paragraphAlignment(formatting.alignment()));
            List<List<TextRun>> lines = content.lines();
            for (int i = 0; i < lines.size(); i++) {
                if (i > 0) {
                    paragraph.createRun().addBreak();
                }
                for (TextRun textRun : lines.get(i)) {
                    XWPFRun run = paragraph.createRun();
                    run.setText(textRun.text());
                    run.setBold(textRun.bold());
                    run.setItalic(textRun.italic());
                    if (textRun.underline()) {
                        run.setUnderline(UnderlinePatterns.SINGLE);
                    }
                    run.setFontSize(formatting.fontSize());
                }
            }
        }

        @Override
        public void onViolation(ActNode node, Violation violation, NodeContext context) {
            addCaption(context.caption(node, VIOLATION_CAPTION));

            for (ViolationEntry entry : ViolationFormatter.format(violation)) {
                switch (entry.kind()) {
                    case FIELD -> addLabelled(entry.label(), entry.text(), false);
                    case CASE -> addLabelled(entry.label(), entry.text(), true);
                    case IMAGE -> addLabelled(entry.label(), entry.imageReference(), false);
                    case FREE_TEXT -> addPlainParagraph(entry.text());
                    case LIST -> {
                        XWPFParagraph heading = document.createParagraph();
                        XWPFRun label = heading.createRun();
                        label.setBold(true);
                        label.setText(entry.label() + ":");
                        for (String item : entry.items()) {
                            XWPFParagraph paragraph = document.createParagraph();
                            paragraph.setIndentationLeft(LIST_INDENT_TWIPS);
                            paragraph.createRun().setText(BULLET + item);
                        }
                    }
                }
            }
        }

        @Override
        public XWPFDocument finish() {
            return document;
        }

        private void addCaption(String caption) {
            if (options.captions()) {
                XWPFParagraph paragraph = document.createParagraph();
                XWPFRun run = paragraph.createRun();
                run.setItalic(true);
                run.setText(caption);
            }
        }

        private void addPlainParagraph(String text) {
            document.createParagraph().createRun().setText(text);
        }

        private void addLabelled(String label, String text, boolean italicText) {
            XWPFParagraph paragraph = document.createParagraph();
            XWPFRun labelRun = paragraph.createRun();
            labelRun.setBold(true);
            labelRun.setText(label + ": ");
            XWPFRun textRun = paragraph.createRun();
            textRun.setItalic(italicText);
            textRun.setText(text);
        }

        private void writeFixedHeaderTable(TableLayout layout) {
            int columns = layout.header().size();
            for (List<String> row : layout.rows()) {
                columns = Math.max(columns, row.size());
            }
            XWPFTable table = document.createTable(layout.rows().size() + 1, columns);
            table.setWidth("100%");
            for (int c = 0; c < layout.header().size(); c++) {
                setCellText(table.getRow(0).getCell(c), layout.header().get(c), true);
            }
            for (int r = 0; r < layout.rows().size(); r++) {
                List<String> row = layout.rows().get(r);
                for (int c = 0; c < row.size(); c++) {
                    setCellText(table.getRow(r + 1).getCell(c), row.get(c), false);
                }
            }
        }

        private void writeGridTable(List<List<TableCell>> grid, int columns) {
            XWPFTable table = document.createTable(grid.size(), columns);
            table.setWidth("100%");
            for (int r = 0; r < grid.size(); r++) {
                List<TableCell> row = grid.get(r);
                for (int c = 0; c < row.size(); c++) {
                    TableCell cell = row.get(c);
                    if (!cell.spanned()) {
                        setCellText(table.getRow(r).getCell(c), cell.content().trim(), cell.header());
                    }
                }
            }
            // right to left, so removing absorbed cells never shifts a region still to come
            List<MergeRegion> regions = new ArrayList<>(TableGrid.mergeRegions(grid));
            regions.sort(Comparator.comparingInt(MergeRegion::firstCol).reversed());
            for (MergeRegion region : regions) {
                merge(table, region);
            }
        }

        /**
         * Merges one region: the first cell of each covered row takes a {@code gridSpan} of
         * the region width and the cells it absorbs are removed; rows after the first
         * continue the vertical merge started by the origin.
         */
        private static void merge(XWPFTable table, MergeRegion region) {
            log.debug("Merging cells {}", region);
            int width = region.lastCol() - region.firstCol() + 1;
            for (int r = region.firstRow(); r <= region.lastRow(); r++) {
                XWPFTableRow row = table.getRow(r);
                CTTcPr tcPr = properties(row.getCell(region.firstCol()));
                if (region.spansColumns()) {
                    tcPr.addNewGridSpan().setVal(BigInteger.valueOf(width));
                    for (int absorbed = 1; absorbed < width; absorbed++) {
                        row.removeCell(region.firstCol() + 1);
                    }
                }
                if (region.spansRows()) {
                    tcPr.addNewVMerge().setVal(r == region.firstRow() ? STMerge.RESTART : STMerge.CONTINUE);
                }
            }
        }

        private static CTTcPr properties(XWPFTableCell cell) {
            CTTc ctTc = cell.getCTTc();
            return ctTc.isSetTcPr() ? ctTc.getTcPr() : ctTc.addNewTcPr();
        }

        private static void setCellText(XWPFTableCell cell, String text, boolean bold) {
            XWPFParagraph paragraph = cell.getParagraphs().isEmpty()
                ? cell.addParagraph()
                : cell.getParagraphs().get(0);
            String[] lines = text.split("\n", -1);
            XWPFRun run = paragraph.createRun();
            run.setBold(bold);
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    run.addBreak();
                }
                run.setText(lines[i]);
            }
        }
    }
}
