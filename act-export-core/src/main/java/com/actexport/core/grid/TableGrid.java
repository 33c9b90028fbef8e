package com.actexport.core.grid;

import com.actexport.core.model.TableCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Spanning semantics of table grids.
 *
 * <p>A grid is a row-major list of rows; rows may be ragged. Origin cells with
 * {@code colSpan}/{@code rowSpan} greater than one cover a rectangle whose other
 * positions hold spanned placeholders. Every operation here tolerates malformed spans:
 * rectangles are clamped to the grid, never rejected.
 */
public final class TableGrid {

    private static final Logger log = LoggerFactory.getLogger(TableGrid.class);

    private TableGrid() {
    }

    /**
     * Returns whether any non-placeholder cell spans more than one row or column.
     *
     * @param grid cell matrix
     * @return true if the grid has merged cells
     */
    public static boolean hasMergedCells(List<List<TableCell>> grid) {
        Objects.requireNonNull(grid, "grid must not be null");
        return grid.stream()
            .flatMap(List::stream)
            .anyMatch(TableCell::isMerged);
    }

    /**
     * Returns the width of the widest row.
     *
     * @param grid cell matrix
     * @return column count, 0 for an empty grid
     */
    public static int columnCount(List<List<TableCell>> grid) {
        return grid.stream().mapToInt(List::size).max().orElse(0);
    }

    /**
     * Expands a grid into a rectangular matrix of trimmed cell texts.
     *
     * <p>Ragged rows are padded with empty strings up to the widest row; placeholders
     * become empty strings. Row and column counts match the input.
     *
     * @param grid cell matrix
     * @return string matrix
     */
    public static List<List<String>> toDisplayMatrix(List<List<TableCell>> grid) {
        Objects.requireNonNull(grid, "grid must not be null");
        int width = columnCount(grid);
        List<List<String>> matrix = new ArrayList<>(grid.size());
        for (List<TableCell> row : grid) {
            List<String> texts = new ArrayList<>(width);
            for (TableCell cell : row) {
                texts.add(cell.spanned() ? "" : cell.content().trim());
            }
            while (texts.size() < width) {
                texts.add("");
            }
            matrix.add(texts);
        }
        return matrix;
    }

    /**
     * Describes every origin cell with the rectangle it covers.
     *
     * <p>Placeholders are skipped. Ranges are clamped to the grid bounds.
     *
     * @param grid cell matrix
     * @return placements in row-major order
     */
    public static List<CellPlacement> toPositionalDescription(List<List<TableCell>> grid) {
        Objects.requireNonNull(grid, "grid must not be null");
        int rows = grid.size();
        int cols = columnCount(grid);
        List<CellPlacement> placements = new ArrayList<>();
        for (int r = 0; r < rows; r++) {
            List<TableCell> row = grid.get(r);
            for (int c = 0; c < row.size(); c++) {
                TableCell cell = row.get(c);
                if (cell.spanned()) {
                    continue;
                }
                placements.add(new CellPlacement(
                    cell.header() ? CellKind.HEADER : CellKind.DATA,
                    r, clampedEnd(r, cell.rowSpan(), rows),
                    c, clampedEnd(c, cell.colSpan(), cols),
                    cell.content().trim()));
            }
        }
        return placements;
    }

    /**
     * Computes the physical merges needed to reproduce the grid's spans.
     *
     * <p>Each origin with a span yields the rectangle
     * {@code origin .. origin + (rowSpan-1, colSpan-1)} clamped to
     * {@code [0,rowCount) x [0,colCount)}. A rectangle that overlaps an earlier one is
     * dropped, since a physical cell cannot belong to two merges.
     *
     * @param grid cell matrix
     * @return merge regions in row-major order of their origins
     */
    public static List<MergeRegion> mergeRegions(List<List<TableCell>> grid) {
        Objects.requireNonNull(grid, "grid must not be null");
        int rows = grid.size();
        int cols = columnCount(grid);
        boolean[][] claimed = new boolean[rows][cols];
        List<MergeRegion> regions = new ArrayList<>();
        for (int r = 0; r < rows; r++) {
            List<TableCell> row = grid.get(r);
            for (int c = 0; c < row.size(); c++) {
                TableCell cell = row.get(c);
                if (!cell.isMerged()) {
                    continue;
                }
                MergeRegion region = new MergeRegion(
                    r, clampedEnd(r, cell.rowSpan(), rows),
                    c, clampedEnd(c, cell.colSpan(), cols));
                if (region.firstRow() == region.lastRow() && region.firstCol() == region.lastCol()) {
                    continue;
                }
                if (overlaps(region, claimed)) {
                    log.warn("Skipping merge at [{},{}]: overlaps an earlier merged cell", r, c);
                    continue;
                }
                claim(region, claimed);
                regions.add(region);
            }
        }
        return regions;
    }

    private static int clampedEnd(int start, int span, int limit) {
        long end = (long) start + span - 1;
        if (end > limit - 1) {
            log.debug("Clamping span at index {} from {} to grid bound {}", start, span, limit);
            return Math.max(start, limit - 1);
        }
        return (int) end;
    }

    private static boolean overlaps(MergeRegion region, boolean[][] claimed) {
        for (int r = region.firstRow(); r <= region.lastRow(); r++) {
            for (int c = region.firstCol(); c <= region.lastCol(); c++) {
                if (claimed[r][c]) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void claim(MergeRegion region, boolean[][] claimed) {
        for (int r = region.firstRow(); r <= region.lastRow(); r++) {
            for (int c = region.firstCol(); c <= region.lastCol(); c++) {
                claimed[r][c] = true;
            }
        }
    }
}
