package com.actexport.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Table satellite entity.
 *
 * @param id table id
 * @param grid row-major cell matrix; rows may be ragged
 * @param colWidths per-column width hints in pixels
 * @param metricsTable metrics table flag (fixed header override)
 * @param mainMetricsTable main metrics table flag (fixed header override)
 * @param regularRiskTable regular risk table flag
 * @param operationalRiskTable operational risk table flag (fixed header override)
 */
public record ActTable(
    String id,
    List<List<TableCell>> grid,
    List<Integer> colWidths,
    boolean metricsTable,
    boolean mainMetricsTable,
    boolean regularRiskTable,
    boolean operationalRiskTable
) {
    /**
     * Compact constructor with validation.
     */
    public ActTable {
        Objects.requireNonNull(id, "id must not be null");
        grid = grid == null
            ? List.of()
            : grid.stream().map(row -> row == null ? List.<TableCell>of() : List.copyOf(row)).toList();
        colWidths = colWidths == null ? List.of() : List.copyOf(colWidths);
    }

    /**
     * Creates a plain table without domain flags.
     *
     * @param id table id
     * @param grid cell matrix
     * @return table
     */
    public static ActTable of(String id, List<List<TableCell>> grid) {
        return new ActTable(id, grid, List.of(), false, false, false, false);
    }

    /**
     * Returns whether the table has no rows.
     *
     * @return true if the grid is empty
     */
    public boolean isEmpty() {
        return grid.isEmpty();
    }
}
