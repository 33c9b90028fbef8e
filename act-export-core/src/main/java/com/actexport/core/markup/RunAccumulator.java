package com.actexport.core.markup;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Folds a {@link MarkupEvent} stream into lines of {@link TextRun}s.
 *
 * <p>Style nesting is counted per style, so {@code <b><b>x</b></b>} and stray closing
 * tags do not corrupt the state. Adjacent runs with equal styles are merged.
 */
final class RunAccumulator {

    private final Map<InlineStyle, Integer> depth = new EnumMap<>(InlineStyle.class);
    private final List<List<TextRun>> lines = new ArrayList<>();
    private List<TextRun> current = new ArrayList<>();

    void accept(MarkupEvent event) {
        switch (event.type()) {
            case OPEN -> event.styles().forEach(style -> depth.merge(style, 1, Integer::sum));
            case CLOSE -> event.styles().forEach(style -> depth.computeIfPresent(style,
                (key, count) -> count > 1 ? count - 1 : null));
            case TEXT -> appendText(event.text());
            case LINE_BREAK -> newLine();
            case PARAGRAPH_BREAK -> {
                if (!current.isEmpty()) {
                    newLine();
                }
            }
        }
    }

    InlineContent result() {
        List<List<TextRun>> all = new ArrayList<>(lines);
        all.add(current);
        int start = 0;
        int end = all.size();
        while (start < end && isBlankLine(all.get(start))) {
            start++;
        }
        while (end > start && isBlankLine(all.get(end - 1))) {
            end--;
        }
        return new InlineContent(all.subList(start, end));
    }

    private void appendText(String text) {
        String[] segments = text.replace("\r\n", "\n").split("\n", -1);
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                newLine();
            }
            appendSegment(segments[i]);
        }
    }

    private void appendSegment(String segment) {
        if (segment.isEmpty()) {
            return;
        }
        TextRun run = new TextRun(segment, active(InlineStyle.BOLD), active(InlineStyle.ITALIC),
            active(InlineStyle.UNDERLINE));
        if (!current.isEmpty()) {
            TextRun last = current.get(current.size() - 1);
            if (last.sameStyleAs(run)) {
                current.set(current.size() - 1,
                    new TextRun(last.text() + run.text(), run.bold(), run.italic(), run.underline()));
                return;
            }
        }
        current.add(run);
    }

    private boolean active(InlineStyle style) {
        return depth.getOrDefault(style, 0) > 0;
    }

    private void newLine() {
        lines.add(current);
        current = new ArrayList<>();
    }

    private static boolean isBlankLine(List<TextRun> line) {
        return line.stream().allMatch(run -> run.text().isBlank());
    }
}
