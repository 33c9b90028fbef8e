package com.actexport.core.render.impl;

import com.actexport.core.grid.CellPlacement;
import com.actexport.core.grid.TableLayout;
import com.actexport.core.markup.InlineContent;
import com.actexport.core.markup.InlineMarkupParser;
import com.actexport.core.markup.MarkdownInline;
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
import com.actexport.core.violation.ViolationEntry;
import com.actexport.core.violation.ViolationFormatter;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders acts as GitHub-flavored Markdown.
 *
 * <h2>Mapping</h2>
 * <ul>
 *   <li><b>Title:</b> {@code # АКТ}; root children start at heading level 2</li>
 *   <li><b>Items:</b> {@code #} headings by depth, clamped to the configured maximum</li>
 *   <li><b>Tables:</b> pipe tables with one separator row after the header row; pipe
 *       syntax cannot merge cells, so merged tables become a fenced code block holding the
 *       same positional lines as the plain-text output, verbatim</li>
 *   <li><b>Text blocks:</b> bold and italic as emphasis, underline dropped, line breaks as
 *       hard breaks; alignment via an HTML {@code div} wrapper, font size as a comment</li>
 *   <li><b>Violations:</b> {@code **Label:** text} paragraphs and bullet lists</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * MarkdownRenderer renderer = new MarkdownRenderer();
 * String markdown = renderer.renderFull(data, RenderOptions.defaults());
 * Optional<String> section = renderer.renderSubtree(data, "5.1", SubtreeOptions.full(), null);
 * }</pre>
 */
public class MarkdownRenderer extends AbstractActRenderer<String> {

    private static final String HEADING = "#";
    private static final String BOLD = "**";
    private static final String PIPE = "|";
    private static final String SEPARATOR_CELL = "---";
    private static final String LIST_ITEM = "- ";
    private static final String LINE_BREAK_TAG = "<br>";
    private static final String CODE_FENCE = "`";
    private static final String EMPTY_TABLE = "*[Пустая таблица]*";
    private static final String TABLE_CAPTION = "Таблица";
    private static final String TEXT_BLOCK_CAPTION = "Текстовый блок";
    private static final String VIOLATION_CAPTION = "Нарушение";

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getDisplayName() {
        return "Markdown Renderer";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public String getContentType() {
        return "text/markdown";
    }

    @Override
    public byte[] encode(String rendered) {
        return rendered.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected DocumentSink<String> createSink(RenderOptions options, boolean full) {
        return new MarkdownSink(options, full ? 1 : 0);
    }

    /**
     * Formats one pipe table row.
     *
     * @param cells cell texts
     * @return row such as {@code | A | B |}
     */
    static String pipeRow(List<String> cells) {
        return PIPE + " " + cells.stream()
            .map(MarkdownRenderer::escapeCell)
            .collect(Collectors.joining(" " + PIPE + " ")) + " " + PIPE;
    }

    /**
     * Escapes a table cell: pipes are escaped, newlines become {@code <br>}.
     *
     * @param text raw cell text
     * @return cell text safe inside a pipe table
     */
    static String escapeCell(String text) {
        return text.replace("|", "\\|")
            .replace("\r", "")
            .replace("\n", LINE_BREAK_TAG);
    }

    private static final class MarkdownSink implements DocumentSink<String> {

        private final RenderOptions options;
        private final int headingOffset;
        private final List<String> blocks = new ArrayList<>();

        private MarkdownSink(RenderOptions options, int headingOffset) {
            this.options = options;
            this.headingOffset = headingOffset;
        }

        @Override
        public void onTitle(String title) {
            blocks.add(HEADING + " " + title);
        }

        @Override
        public void onItem(ActNode item, NodeContext context) {
            String heading = ItemHeadings.text(item);
            if (!heading.isEmpty()) {
                int level = Math.min(context.level() + headingOffset, options.markdownMaxHeadingLevel());
                blocks.add(HEADING.repeat(level) + " " + MarkdownInline.escape(heading));
            }
            if (item.content() != null && !item.content().isBlank()) {
                blocks.add(MarkdownInline.escape(item.content().trim()));
            }
        }

        @Override
        public void onTable(ActNode node, ActTable table, NodeContext context) {
            addCaption(context.caption(node, TABLE_CAPTION));

            TableLayout layout = TableLayout.of(table);
            switch (layout.kind()) {
                case EMPTY -> blocks.add(EMPTY_TABLE);
                case FIXED_HEADER -> blocks.add(pipeTable(layout.header(), layout.rows()));
                case SIMPLE -> blocks.add(pipeTable(layout.rows().get(0),
                    layout.rows().subList(1, layout.rows().size())));
                case POSITIONAL -> blocks.add(codeBlock(layout.placements().stream()
                    .map(CellPlacement::describe)
                    .collect(Collectors.joining("\n"))));
            }
        }

        @Override
        public void onTextBlock(ActNode node, TextBlock textBlock, NodeContext context) {
            addCaption(context.caption(node, TEXT_BLOCK_CAPTION));

            TextFormatting formatting = textBlock.formatting();
            if (formatting.isNonDefault()) {
                blocks.add("<!-- " + PlainTextRenderer.formattingNote(formatting) + " -->");
            }
            InlineContent content = InlineMarkupParser.parse(textBlock.content())
                .withBaseStyle(formatting.bold(), formatting.italic(), formatting.underline());
            if (content.isBlank()) {
                return;
            }
            String body = MarkdownInline.render(content);
            if (formatting.alignment() == Alignment.LEFT) {
                blocks.add(body);
            } else {
                String align = formatting.alignment().name().toLowerCase(Locale.ROOT);
                blocks.add("<div align=\"" + align + "\">\n\n" + body + "\n\n</div>");
            }
        }

        @Override
        public void onViolation(ActNode node, Violation violation, NodeContext context) {
            addCaption(context.caption(node, VIOLATION_CAPTION));

            for (ViolationEntry entry : ViolationFormatter.format(violation)) {
                switch (entry.kind()) {
                    case FIELD, CASE -> blocks.add(label(entry.label()) + " " + MarkdownInline.escape(entry.text()));
                    case LIST -> blocks.add(label(entry.label()) + "\n" + entry.items().stream()
                        .map(item -> LIST_ITEM + MarkdownInline.escape(item))
                        .collect(Collectors.joining("\n")));
                    case IMAGE -> blocks.add(label(entry.label()) + " " + imageLine(entry));
                    case FREE_TEXT -> blocks.add(MarkdownInline.escape(entry.text()));
                }
            }
        }

        @Override
        public String finish() {
            return String.join("\n\n", blocks) + "\n";
        }

        private void addCaption(String caption) {
            if (options.captions()) {
                blocks.add(BOLD + MarkdownInline.escape(caption) + BOLD);
            }
        }

        private static String label(String label) {
            return BOLD + label + ":" + BOLD;
        }

        private static String imageLine(ViolationEntry entry) {
            String name = entry.filename().isBlank() ? entry.url() : entry.filename();
            StringBuilder sb = new StringBuilder();
            if (!name.isBlank()) {
                sb.append('*').append(MarkdownInline.escape(name)).append('*');
            }
            if (!entry.text().isBlank()) {
                sb.append(sb.length() > 0 ? " - " : "").append(MarkdownInline.escape(entry.text()));
            }
            return sb.toString();
        }

        private static String pipeTable(List<String> header, List<List<String>> rows) {
            int columns = header.size();
            List<String> lines = new ArrayList<>();
            lines.add(pipeRow(header));
            lines.add(pipeRow(Collections.nCopies(columns, SEPARATOR_CELL)));
            for (List<String> row : rows) {
                List<String> cells = new ArrayList<>(row);
                while (cells.size() < columns) {
                    cells.add("");
                }
                lines.add(pipeRow(cells));
            }
            return String.join("\n", lines);
        }

        private static String codeBlock(String text) {
            // the fence must be longer than any backtick run inside the block
            int longestRun = 0;
            int run = 0;
            for (int i = 0; i < text.length(); i++) {
                run = text.charAt(i) == '`' ? run + 1 : 0;
                longestRun = Math.max(longestRun, run);
            }
            String fence = CODE_FENCE.repeat(Math.max(3, longestRun + 1));
            return fence + "\n" + text + "\n" + fence;
        }
    }
}
