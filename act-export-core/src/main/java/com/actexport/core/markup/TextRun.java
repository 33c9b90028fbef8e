package com.actexport.core.markup;

/**
 * Contiguous text with one combination of character styles.
 *
 * @param text run text, never null
 * @param bold bold flag
 * @param italic italic flag
 * @param underline underline flag
 */
public record TextRun(
    String text,
    boolean bold,
    boolean italic,
    boolean underline
) {
    /**
     * Compact constructor normalizing text.
     */
    public TextRun {
        if (text == null) {
            text = "";
        }
    }

    public static TextRun plain(String text) {
        return new TextRun(text, false, false, false);
    }

    /**
     * Returns whether both runs carry the same styles.
     *
     * @param other run to compare with
     * @return true if bold, italic and underline flags match
     */
    public boolean sameStyleAs(TextRun other) {
        return bold == other.bold && italic == other.italic && underline == other.underline;
    }

    /**
     * Returns a copy with the given styles OR-ed in.
     *
     * @param addBold bold to add
     * @param addItalic italic to add
     * @param addUnderline underline to add
     * @return styled copy
     */
    public TextRun withBase(boolean addBold, boolean addItalic, boolean addUnderline) {
        return new TextRun(text, bold || addBold, italic || addItalic, underline || addUnderline);
    }
}
