package com.actexport.core.grid;

/**
 * A geometry problem found in a table grid.
 *
 * @param row row of the offending cell, -1 for table-level problems
 * @param col column of the offending cell, -1 for row or table-level problems
 * @param message description
 */
public record GridProblem(
    int row,
    int col,
    String message
) {
    @Override
    public String toString() {
        if (row < 0) {
            return message;
        }
        return col < 0 ? "row " + row + ": " + message : "[" + row + "," + col + "]: " + message;
    }
}
