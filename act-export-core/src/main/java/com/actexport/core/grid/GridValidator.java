package com.actexport.core.grid;

import com.actexport.core.model.ActTable;
import com.actexport.core.model.TableCell;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks table geometry: size limits, column width hints and span consistency.
 *
 * <p>Renderers never require a valid grid; this is used to report problems, not to
 * reject data.
 */
public final class GridValidator {

    public static final int MAX_ROWS = 64;
    public static final int MAX_COLUMNS = 16;

    private GridValidator() {
    }

    /**
     * Validates a table.
     *
     * @param table table to check
     * @return problems found, empty when the table is consistent
     */
    public static List<GridProblem> validate(ActTable table) {
        Objects.requireNonNull(table, "table must not be null");
        List<GridProblem> problems = new ArrayList<>();
        List<List<TableCell>> grid = table.grid();

        if (grid.size() > MAX_ROWS) {
            problems.add(new GridProblem(-1, -1,
                "table has " + grid.size() + " rows, at most " + MAX_ROWS + " allowed"));
        }
        if (table.colWidths().size() > MAX_COLUMNS) {
            problems.add(new GridProblem(-1, -1,
                "table has " + table.colWidths().size() + " column widths, at most " + MAX_COLUMNS + " allowed"));
        }
        for (int i = 0; i < table.colWidths().size(); i++) {
            Integer width = table.colWidths().get(i);
            if (width == null || width <= 0) {
                problems.add(new GridProblem(-1, -1, "column width " + i + " must be positive"));
            }
        }

        for (int r = 0; r < grid.size(); r++) {
            List<TableCell> row = grid.get(r);
            if (row.size() > MAX_COLUMNS) {
                problems.add(new GridProblem(r, -1,
                    "row has " + row.size() + " cells, at most " + MAX_COLUMNS + " allowed"));
            }
            for (int c = 0; c < row.size(); c++) {
                TableCell cell = row.get(c);
                if (cell.spanned()) {
                    checkPlaceholder(grid, r, c, cell, problems);
                } else if (cell.isMerged()) {
                    checkSpan(grid, r, c, cell, problems);
                }
            }
        }
        return problems;
    }

    private static void checkSpan(List<List<TableCell>> grid, int row, int col, TableCell origin,
                                  List<GridProblem> problems) {
        int lastRow = row + origin.rowSpan() - 1;
        int lastCol = col + origin.colSpan() - 1;
        if (lastRow >= grid.size()) {
            problems.add(new GridProblem(row, col, "row span " + origin.rowSpan() + " exceeds the grid"));
        }
        for (int r = row; r <= Math.min(lastRow, grid.size() - 1); r++) {
            List<TableCell> cells = grid.get(r);
            if (lastCol >= cells.size()) {
                problems.add(new GridProblem(row, col,
                    "column span " + origin.colSpan() + " exceeds row " + r));
            }
            for (int c = col; c <= Math.min(lastCol, cells.size() - 1); c++) {
                if (r == row && c == col) {
                    continue;
                }
                TableCell covered = cells.get(c);
                if (!covered.spanned()) {
                    problems.add(new GridProblem(r, c, "cell is covered by the span at [" + row + "," + col
                        + "] but is not a placeholder"));
                } else if (!Objects.equals(covered.originRow(), row) || !Objects.equals(covered.originCol(), col)) {
                    problems.add(new GridProblem(r, c, "placeholder does not point back to [" + row + "," + col + "]"));
                }
            }
        }
    }

    private static void checkPlaceholder(List<List<TableCell>> grid, int row, int col, TableCell placeholder,
                                         List<GridProblem> problems) {
        Integer originRow = placeholder.originRow();
        Integer originCol = placeholder.originCol();
        if (originRow == null || originCol == null) {
            problems.add(new GridProblem(row, col, "placeholder has no origin"));
            return;
        }
        if (originRow < 0 || originRow >= grid.size() || originCol < 0 || originCol >= grid.get(originRow).size()) {
            problems.add(new GridProblem(row, col, "placeholder origin [" + originRow + "," + originCol
                + "] is outside the grid"));
            return;
        }
        TableCell origin = grid.get(originRow).get(originCol);
        boolean covered = !origin.spanned()
            && row >= originRow && row < originRow + origin.rowSpan()
            && col >= originCol && col < originCol + origin.colSpan();
        if (!covered) {
            problems.add(new GridProblem(row, col, "placeholder is not covered by its origin ["
                + originRow + "," + originCol + "]"));
        }
    }
}
