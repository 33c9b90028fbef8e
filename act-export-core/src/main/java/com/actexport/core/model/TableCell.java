package com.actexport.core.model;

/**
 * One cell of a table grid.
 *
 * <p>An origin cell covers {@code rowSpan x colSpan} positions; every other covered
 * position holds a spanned placeholder whose {@code originRow}/{@code originCol}
 * point back to the origin.
 *
 * @param content cell text
 * @param header whether the cell is a header cell
 * @param colSpan number of covered columns, at least 1
 * @param rowSpan number of covered rows, at least 1
 * @param spanned whether this is a placeholder absorbed into another cell's span
 * @param originRow row of the origin cell (placeholders only)
 * @param originCol column of the origin cell (placeholders only)
 */
public record TableCell(
    String content,
    boolean header,
    int colSpan,
    int rowSpan,
    boolean spanned,
    Integer originRow,
    Integer originCol
) {
    /**
     * Compact constructor normalizing content and spans.
     */
    public TableCell {
        if (content == null) {
            content = "";
        }
        colSpan = Math.max(1, colSpan);
        rowSpan = Math.max(1, rowSpan);
    }

    public static TableCell of(String content) {
        return new TableCell(content, false, 1, 1, false, null, null);
    }

    public static TableCell header(String content) {
        return new TableCell(content, true, 1, 1, false, null, null);
    }

    /**
     * Creates a placeholder cell covered by the origin at the given position.
     *
     * @param originRow row of the origin cell
     * @param originCol column of the origin cell
     * @return spanned placeholder
     */
    public static TableCell spannedBy(int originRow, int originCol) {
        return new TableCell("", false, 1, 1, true, originRow, originCol);
    }

    /**
     * Returns a copy with the given spans.
     *
     * @param rows row span
     * @param cols column span
     * @return new cell
     */
    public TableCell withSpan(int rows, int cols) {
        return new TableCell(content, header, cols, rows, spanned, originRow, originCol);
    }

    /**
     * Returns whether this non-placeholder cell covers more than one position.
     *
     * @return true if colSpan or rowSpan is greater than 1
     */
    public boolean isMerged() {
        return !spanned && (colSpan > 1 || rowSpan > 1);
    }
}
