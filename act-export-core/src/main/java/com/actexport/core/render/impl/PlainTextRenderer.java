package com.actexport.core.render.impl;

import com.actexport.core.grid.CellPlacement;
import com.actexport.core.grid.TableLayout;
import com.actexport.core.markup.InlineMarkupParser;
import com.actexport.core.model.ActNode;
import com.actexport.core.model.ActTable;
import com.actexport.core.model.Alignment;
import com.actexport.core.model.TextBlock;
import com.actexport.core.model.TextFormatting;
import com.actexport.core.model.Violation;
import com.actexport.core.render.AbstractActRenderer;
import com.actexport.core.render.DocumentSink;
import com.actexport.core.render.NodeContext;
import com.actexport.core.render.RenderOptions;
import com.actexport.core.tree.ItemHeadings;
import com.actexport.core.util.TextWrap;
import com.actexport.core.violation.ViolationEntry;
import com.actexport.core.violation.ViolationFormatter;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders acts as fixed-width plain text.
 *
 * <h2>Layout</h2>
 * <ul>
 *   <li><b>Title:</b> centered between two {@code =} banners (full renders only)</li>
 *   <li><b>Items:</b> heading underlined with {@code -}, indented by level</li>
 *   <li><b>Tables:</b> box-drawn ASCII grid with a separator under the first row; tables
 *       with merged cells are listed cell by cell using their positional description</li>
 *   <li><b>Text blocks:</b> markup stripped, word-wrapped to the column budget and
 *       aligned line by line; non-default size or alignment is noted in brackets</li>
 *   <li><b>Violations:</b> one {@code Label: text} line per filled section</li>
 * </ul>
 *
 * <p><b>Example output:</b>
 * <pre>
 * 5.1. Проверка
 * -------------
 *   Таблица (пункт 5.1)
 *   +---+---+
 *   | A | B |
 *   +---+---+
 *   | C | D |
 *   +---+---+
 * </pre>
 */
public class PlainTextRenderer extends AbstractActRenderer<String> {

    private static final String TITLE_BANNER = "=";
    private static final String HEADING_UNDERLINE = "-";
    private static final String BULLET = "• ";
    private static final String EMPTY_TABLE = "[Пустая таблица]";
    private static final String TABLE_CAPTION = "Таблица";
    private static final String TEXT_BLOCK_CAPTION = "Текстовый блок";
    private static final String VIOLATION_CAPTION = "Нарушение";

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String getDisplayName() {
        return "Plain Text Renderer";
    }

    @Override
    public String getFileExtension() {
        return "txt";
    }

    @Override
    public String getContentType() {
        return "text/plain";
    }

    @Override
    public byte[] encode(String rendered) {
        return rendered.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected DocumentSink<String> createSink(RenderOptions options, boolean full) {
        return new TextSink(options);
    }

    /**
     * Builds the note shown for text blocks whose size or alignment cannot be expressed
     * in plain text, such as {@code размер шрифта: 16px, выравнивание: по центру}.
     *
     * @param formatting text block formatting
     * @return note text without brackets, empty for default formatting
     */
    static String formattingNote(TextFormatting formatting) {
        List<String> parts = new ArrayList<>();
        if (formatting.fontSize() != TextFormatting.DEFAULT_FONT_SIZE) {
            parts.add("размер шрифта: " + formatting.fontSize() + "px");
        }
        switch (formatting.alignment()) {
            case CENTER -> parts.add("выравнивание: по центру");
            case RIGHT -> parts.add("выравнивание: по правому краю");
            case JUSTIFY -> parts.add("выравнивание: по ширине");
            case LEFT -> {
            }
        }
        return String.join(", ", parts);
    }

    private static final class TextSink implements DocumentSink<String> {

        private final RenderOptions options;
        private final List<String> lines = new ArrayList<>();

        private TextSink(RenderOptions options) {
            this.options = options;
        }

        @Override
        public void onTitle(String title) {
            String banner = TITLE_BANNER.repeat(options.lineWidth());
            lines.add(banner);
            lines.add(TextWrap.align(title, options.lineWidth(), Alignment.CENTER));
            lines.add(banner);
            lines.add("");
        }

        @Override
        public void onItem(ActNode item, NodeContext context) {
            String indent = indent(context);
            String heading = ItemHeadings.text(item);
            if (!heading.isEmpty()) {
                lines.add(indent + heading);
                lines.add(indent + HEADING_UNDERLINE.repeat(heading.length()));
            }
            if (item.content() != null && !item.content().isBlank()) {
                addWrapped(indent, item.content().trim());
            }
            if (!heading.isEmpty() || (item.content() != null && !item.content().isBlank())) {
                lines.add("");
            }
        }

        @Override
        public void onTable(ActNode node, ActTable table, NodeContext context) {
            String indent = indent(context);
            addCaption(indent, context.caption(node, TABLE_CAPTION));

            TableLayout layout = TableLayout.of(table);
            switch (layout.kind()) {
                case EMPTY -> lines.add(indent + EMPTY_TABLE);
                case FIXED_HEADER -> {
                    List<List<String>> rows = new ArrayList<>();
                    rows.add(layout.header());
                    rows.addAll(layout.rows());
                    addAsciiTable(indent, rows);
                }
                case SIMPLE -> addAsciiTable(indent, layout.rows());
                case POSITIONAL -> {
                    for (CellPlacement placement : layout.placements()) {
                        lines.add(indent + placement.describe());
                    }
                }
            }
            lines.add("");
        }

        @Override
        public void onTextBlock(ActNode node, TextBlock textBlock, NodeContext context) {
            String indent = indent(context);
            addCaption(indent, context.caption(node, TEXT_BLOCK_CAPTION));

            TextFormatting formatting = textBlock.formatting();
            if (formatting.isNonDefault()) {
                lines.add(indent + "[" + formattingNote(formatting) + "]");
            }
            int width = width(indent);
            for (String paragraph : InlineMarkupParser.parse(textBlock.content()).plainLines()) {
                if (paragraph.isBlank()) {
                    lines.add("");
                    continue;
                }
                for (String line : TextWrap.wrap(paragraph, width)) {
                    lines.add(indent + TextWrap.align(line, width, formatting.alignment()));
                }
            }
            lines.add("");
        }

        @Override
        public void onViolation(ActNode node, Violation violation, NodeContext context) {
            String indent = indent(context);
            addCaption(indent, context.caption(node, VIOLATION_CAPTION));

            for (ViolationEntry entry : ViolationFormatter.format(violation)) {
                switch (entry.kind()) {
                    case FIELD, CASE -> addWrapped(indent, entry.label() + ": " + entry.text());
                    case LIST -> {
                        lines.add(indent + entry.label() + ":");
                        for (String item : entry.items()) {
                            addWrapped(indent + "  ", BULLET + item);
                        }
                    }
                    case IMAGE -> addWrapped(indent, entry.label() + ": " + entry.imageReference());
                    case FREE_TEXT -> addWrapped(indent, entry.text());
                }
            }
            lines.add("");
        }

        @Override
        public String finish() {
            int end = lines.size();
            while (end > 0 && lines.get(end - 1).isBlank()) {
                end--;
            }
            return String.join("\n", lines.subList(0, end)) + "\n";
        }

        private void addCaption(String indent, String caption) {
            if (options.captions()) {
                lines.add(indent + caption);
            }
        }

        private void addWrapped(String indent, String text) {
            for (String line : TextWrap.wrap(text, width(indent))) {
                lines.add(indent + line);
            }
        }

        private void addAsciiTable(String indent, List<List<String>> rows) {
            int columns = rows.stream().mapToInt(List::size).max().orElse(0);
            int[] widths = new int[columns];
            for (List<String> row : rows) {
                for (int c = 0; c < row.size(); c++) {
                    widths[c] = Math.max(widths[c], flatten(row.get(c)).length());
                }
            }

            StringBuilder border = new StringBuilder("+");
            for (int width : widths) {
                border.append("-".repeat(width + 2)).append('+');
            }

            lines.add(indent + border);
            for (int r = 0; r < rows.size(); r++) {
                List<String> row = rows.get(r);
                StringBuilder line = new StringBuilder("|");
                for (int c = 0; c < columns; c++) {
                    String cell = c < row.size() ? flatten(row.get(c)) : "";
                    line.append(' ').append(TextWrap.padRight(cell, widths[c])).append(" |");
                }
                lines.add(indent + line);
                if (r == 0 || r == rows.size() - 1) {
                    lines.add(indent + border);
                }
            }
        }

        private String indent(NodeContext context) {
            return " ".repeat(options.indentWidth() * Math.max(0, context.level() - 1));
        }

        private int width(String indent) {
            return Math.max(20, options.lineWidth() - indent.length());
        }

        private static String flatten(String cell) {
            return cell.replace("\r", "").replace('\n', ' ');
        }
    }
}
