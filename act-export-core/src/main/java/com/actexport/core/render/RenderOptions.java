package com.actexport.core.render;

/**
 * Effective settings for one render call.
 *
 * @param title document title of full renders
 * @param markdownMaxHeadingLevel deepest Markdown heading, 1..6
 * @param docxMaxHeadingLevel deepest DOCX heading style, 1..9
 * @param lineWidth plain text column budget
 * @param indentWidth plain text indentation per level
 * @param defaultFontSize DOCX font size when a text block does not set one
 * @param captions whether tables, text blocks and violations get a caption line
 */
public record RenderOptions(
    String title,
    int markdownMaxHeadingLevel,
    int docxMaxHeadingLevel,
    int lineWidth,
    int indentWidth,
    int defaultFontSize,
    boolean captions
) {
    public static final String DEFAULT_TITLE = "АКТ";

    /**
     * Compact constructor clamping every value into its valid range.
     */
    public RenderOptions {
        if (title == null || title.isBlank()) {
            title = DEFAULT_TITLE;
        }
        markdownMaxHeadingLevel = clamp(markdownMaxHeadingLevel, 1, 6);
        docxMaxHeadingLevel = clamp(docxMaxHeadingLevel, 1, 9);
        lineWidth = Math.max(20, lineWidth);
        indentWidth = clamp(indentWidth, 0, 8);
        defaultFontSize = clamp(defaultFontSize, 8, 72);
    }

    /**
     * Returns the built-in defaults.
     *
     * @return default options
     */
    public static RenderOptions defaults() {
        return new RenderOptions(DEFAULT_TITLE, 6, 9, 80, 2, 14, true);
    }

    /**
     * Returns a copy with captions switched on or off.
     *
     * @param enabled caption flag
     * @return new options
     */
    public RenderOptions withCaptions(boolean enabled) {
        return new RenderOptions(title, markdownMaxHeadingLevel, docxMaxHeadingLevel, lineWidth,
            indentWidth, defaultFontSize, enabled);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
