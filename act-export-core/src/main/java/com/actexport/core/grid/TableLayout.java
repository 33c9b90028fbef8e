package com.actexport.core.grid;

import com.actexport.core.model.ActTable;
import com.actexport.core.model.TableCell;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * How a table is laid out by targets that cannot merge cells.
 *
 * <p>Exactly one representation applies per table, chosen in this order: empty grid,
 * fixed domain header, merged cells (positional description), simple matrix.
 *
 * @param kind chosen representation
 * @param header header row (fixed header tables only)
 * @param rows text rows: data rows for fixed header tables, all rows for simple tables
 * @param placements positional description (merged tables only)
 */
public record TableLayout(
    Kind kind,
    List<String> header,
    List<List<String>> rows,
    List<CellPlacement> placements
) {
    /**
     * Representation kinds.
     */
    public enum Kind {
        EMPTY,
        FIXED_HEADER,
        SIMPLE,
        POSITIONAL
    }

    /**
     * Compact constructor with validation.
     */
    public TableLayout {
        Objects.requireNonNull(kind, "kind must not be null");
        header = header == null ? List.of() : List.copyOf(header);
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
        placements = placements == null ? List.of() : List.copyOf(placements);
    }

    /**
     * Chooses the representation of a table.
     *
     * @param table table to lay out
     * @return layout
     */
    public static TableLayout of(ActTable table) {
        Objects.requireNonNull(table, "table must not be null");
        List<List<TableCell>> grid = table.grid();
        if (grid.isEmpty()) {
            return new TableLayout(Kind.EMPTY, null, null, null);
        }
        Optional<List<String>> fixed = FixedHeaders.forTable(table);
        if (fixed.isPresent()) {
            return new TableLayout(Kind.FIXED_HEADER, fixed.get(), fixedHeaderDataRows(grid), null);
        }
        if (TableGrid.hasMergedCells(grid)) {
            return new TableLayout(Kind.POSITIONAL, null, null, TableGrid.toPositionalDescription(grid));
        }
        return new TableLayout(Kind.SIMPLE, null, TableGrid.toDisplayMatrix(grid), null);
    }

    /**
     * Returns rows 2..N of a grid with placeholders dropped; rows left empty are skipped.
     *
     * @param grid cell matrix
     * @return data rows under a fixed header
     */
    public static List<List<String>> fixedHeaderDataRows(List<List<TableCell>> grid) {
        List<List<String>> rows = new ArrayList<>();
        for (int r = FixedHeaders.STORED_HEADER_ROWS; r < grid.size(); r++) {
            List<String> cells = grid.get(r).stream()
                .filter(cell -> !cell.spanned())
                .map(cell -> cell.content().trim())
                .toList();
            if (!cells.isEmpty()) {
                rows.add(cells);
            }
        }
        return rows;
    }
}
