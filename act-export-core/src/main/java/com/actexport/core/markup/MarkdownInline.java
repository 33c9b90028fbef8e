package com.actexport.core.markup;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes {@link InlineContent} as Markdown.
 *
 * <p>Bold becomes {@code **text**}, italic {@code *text*}. Markdown has no underline,
 * so underline is dropped and the text kept plain. Lines are joined with hard breaks
 * (two trailing spaces).
 */
public final class MarkdownInline {

    /** Markdown hard line break. */
    public static final String HARD_BREAK = "  \n";

    private MarkdownInline() {
    }

    /**
     * Renders content as Markdown.
     *
     * @param content parsed inline content
     * @return Markdown text
     */
    public static String render(InlineContent content) {
        return content.lines().stream()
            .map(MarkdownInline::renderLine)
            .collect(Collectors.joining(HARD_BREAK));
    }

    /**
     * Renders one line of runs.
     *
     * @param runs runs of the line
     * @return Markdown text of the line
     */
    public static String renderLine(List<TextRun> runs) {
        StringBuilder sb = new StringBuilder();
        for (TextRun run : runs) {
            sb.append(renderRun(run));
        }
        return sb.toString();
    }

    private static String renderRun(TextRun run) {
        String text = escape(run.text());
        String marker = marker(run);
        if (marker.isEmpty() || text.isBlank()) {
            return text;
        }
        int start = 0;
        int end = text.length();
        while (start < end && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, start) + marker + text.substring(start, end) + marker + text.substring(end);
    }

    private static String marker(TextRun run) {
        if (run.bold() && run.italic()) {
            return "***";
        }
        if (run.bold()) {
            return "**";
        }
        return run.italic() ? "*" : "";
    }

    /**
     * Escapes characters that would otherwise start emphasis.
     *
     * @param text raw text
     * @return escaped text
     */
    public static String escape(String text) {
        return text.replace("\\", "\\\\").replace("*", "\\*");
    }
}
