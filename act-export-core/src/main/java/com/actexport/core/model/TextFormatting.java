package com.actexport.core.model;

/**
 * Paragraph-level formatting of a text block.
 *
 * @param fontSize font size in points, clamped to 8..72
 * @param alignment paragraph alignment
 * @param bold base bold flag applied to every run
 * @param italic base italic flag applied to every run
 * @param underline base underline flag applied to every run
 */
public record TextFormatting(
    int fontSize,
    Alignment alignment,
    boolean bold,
    boolean italic,
    boolean underline
) {
    public static final int DEFAULT_FONT_SIZE = 14;
    public static final int MIN_FONT_SIZE = 8;
    public static final int MAX_FONT_SIZE = 72;

    /**
     * Compact constructor clamping the font size.
     */
    public TextFormatting {
        fontSize = Math.max(MIN_FONT_SIZE, Math.min(MAX_FONT_SIZE, fontSize));
        if (alignment == null) {
            alignment = Alignment.LEFT;
        }
    }

    /**
     * Returns the default formatting: 14pt, left aligned, no base styles.
     *
     * @return default formatting
     */
    public static TextFormatting defaults() {
        return new TextFormatting(DEFAULT_FONT_SIZE, Alignment.LEFT, false, false, false);
    }

    /**
     * Returns whether size or alignment differ from the defaults.
     *
     * @return true if a target without native formatting should note the difference
     */
    public boolean isNonDefault() {
        return fontSize != DEFAULT_FONT_SIZE || alignment != Alignment.LEFT;
    }
}
