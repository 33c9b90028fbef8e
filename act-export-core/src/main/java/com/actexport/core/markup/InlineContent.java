package com.actexport.core.markup;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of converting inline markup: lines of styled runs separated by explicit breaks.
 *
 * @param lines lines in order; each line is a list of runs
 */
public record InlineContent(
    List<List<TextRun>> lines
) {
    /**
     * Compact constructor copying the lines.
     */
    public InlineContent {
        lines = lines == null ? List.of() : lines.stream().map(List::copyOf).toList();
    }

    public static InlineContent empty() {
        return new InlineContent(List.of());
    }

    /**
     * Returns the text of every line without styles.
     *
     * @return plain lines
     */
    public List<String> plainLines() {
        return lines.stream()
            .map(line -> line.stream().map(TextRun::text).collect(Collectors.joining()))
            .toList();
    }

    /**
     * Returns the plain text, lines joined with {@code \n}.
     *
     * @return plain text
     */
    public String plainText() {
        return String.join("\n", plainLines());
    }

    /**
     * Returns whether there is no visible text.
     *
     * @return true if every run is blank
     */
    public boolean isBlank() {
        return plainText().isBlank();
    }

    /**
     * Applies paragraph-level base styles to every run.
     *
     * @param bold base bold
     * @param italic base italic
     * @param underline base underline
     * @return styled copy
     */
    public InlineContent withBaseStyle(boolean bold, boolean italic, boolean underline) {
        if (!bold && !italic && !underline) {
            return this;
        }
        return new InlineContent(lines.stream()
            .map(line -> line.stream().map(run -> run.withBase(bold, italic, underline)).toList())
            .toList());
    }
}
