package com.actexport.core.grid;

/**
 * Rectangle of grid positions merged into one physical cell. Bounds are inclusive.
 *
 * @param firstRow first row
 * @param lastRow last row
 * @param firstCol first column
 * @param lastCol last column
 */
public record MergeRegion(
    int firstRow,
    int lastRow,
    int firstCol,
    int lastCol
) {
    /**
     * Returns whether the position lies inside the region.
     *
     * @param row row index
     * @param col column index
     * @return true if covered
     */
    public boolean covers(int row, int col) {
        return row >= firstRow && row <= lastRow && col >= firstCol && col <= lastCol;
    }

    /**
     * Returns whether the region is wider than one column.
     *
     * @return true for a horizontal span
     */
    public boolean spansColumns() {
        return lastCol > firstCol;
    }

    /**
     * Returns whether the region is taller than one row.
     *
     * @return true for a vertical span
     */
    public boolean spansRows() {
        return lastRow > firstRow;
    }
}
