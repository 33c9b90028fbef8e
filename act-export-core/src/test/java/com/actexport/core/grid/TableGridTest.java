package com.actexport.core.grid;

import com.actexport.core.model.TableCell;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TableGrid}.
 */
class TableGridTest {

    private static final List<List<TableCell>> SIMPLE = List.of(
        List.of(TableCell.header("A"), TableCell.header("B")),
        List.of(TableCell.of(" C "), TableCell.of("D")));

    private static final List<List<TableCell>> COLSPAN = List.of(
        List.of(TableCell.of("A").withSpan(1, 2), TableCell.spannedBy(0, 0)),
        List.of(TableCell.of("C"), TableCell.of("D")));

    @Test
    void hasMergedCells_detectsSpans() {
        assertThat(TableGrid.hasMergedCells(SIMPLE)).isFalse();
        assertThat(TableGrid.hasMergedCells(COLSPAN)).isTrue();
    }

    @Test
    void toDisplayMatrix_noMerges_keepsDimensionsAndTrimsText() {
        // When
        List<List<String>> matrix = TableGrid.toDisplayMatrix(SIMPLE);

        // Then
        assertThat(matrix).containsExactly(List.of("A", "B"), List.of("C", "D"));
    }

    @Test
    void toDisplayMatrix_raggedRows_padsToWidestRow() {
        // Given
        List<List<TableCell>> ragged = List.of(
            List.of(TableCell.of("A"), TableCell.of("B"), TableCell.of("C")),
            List.of(TableCell.of("D")));

        // When
        List<List<String>> matrix = TableGrid.toDisplayMatrix(ragged);

        // Then
        assertThat(matrix).hasSize(2);
        assertThat(matrix.get(1)).containsExactly("D", "", "");
    }

    @Test
    void toDisplayMatrix_placeholders_becomeEmpty() {
        assertThat(TableGrid.toDisplayMatrix(COLSPAN).get(0)).containsExactly("A", "");
    }

    @Test
    void toPositionalDescription_skipsPlaceholdersAndDescribesRanges() {
        // When
        List<CellPlacement> placements = TableGrid.toPositionalDescription(COLSPAN);

        // Then
        assertThat(placements).extracting(CellPlacement::describe)
            .containsExactly("[0,0-1]: A", "[1,0]: C", "[1,1]: D");
    }

    @Test
    void toPositionalDescription_headerCell_prefixesHeader() {
        List<CellPlacement> placements = TableGrid.toPositionalDescription(SIMPLE);

        assertThat(placements.get(0).describe()).isEqualTo("Заголовок [0,0]: A");
        assertThat(placements.get(0).kind()).isEqualTo(CellKind.HEADER);
    }

    @Test
    void toPositionalDescription_spanBeyondGrid_isClamped() {
        // Given
        List<List<TableCell>> overrun = List.of(
            List.of(TableCell.of("A").withSpan(5, 4), TableCell.spannedBy(0, 0)),
            List.of(TableCell.spannedBy(0, 0), TableCell.spannedBy(0, 0)));

        // When
        List<CellPlacement> placements = TableGrid.toPositionalDescription(overrun);

        // Then
        assertThat(placements).singleElement()
            .extracting(CellPlacement::position).isEqualTo("[0-1,0-1]");
    }

    @Test
    void mergeRegions_returnsClampedRectangles() {
        // Given
        List<List<TableCell>> grid = List.of(
            List.of(TableCell.of("A").withSpan(2, 1), TableCell.of("B").withSpan(1, 9)),
            List.of(TableCell.spannedBy(0, 0), TableCell.of("D")));

        // When
        List<MergeRegion> regions = TableGrid.mergeRegions(grid);

        // Then
        assertThat(regions).containsExactly(new MergeRegion(0, 1, 0, 0));
    }

    @Test
    void mergeRegions_coversExactlyTheSpannedPositions() {
        // Given
        List<List<TableCell>> grid = List.of(
            List.of(TableCell.of("A").withSpan(2, 2), TableCell.spannedBy(0, 0), TableCell.of("X")),
            List.of(TableCell.spannedBy(0, 0), TableCell.spannedBy(0, 0), TableCell.of("Y")));

        // When
        MergeRegion region = TableGrid.mergeRegions(grid).get(0);

        // Then
        assertThat(region.covers(0, 0)).isTrue();
        assertThat(region.covers(1, 1)).isTrue();
        assertThat(region.covers(0, 2)).isFalse();
        assertThat(region.spansRows()).isTrue();
        assertThat(region.spansColumns()).isTrue();
    }

    @Test
    void mergeRegions_overlappingSpans_keepsFirst() {
        // Given
        List<List<TableCell>> grid = List.of(
            List.of(TableCell.of("A").withSpan(1, 2), TableCell.of("B").withSpan(2, 1)),
            List.of(TableCell.of("C"), TableCell.of("D")));

        // When
        List<MergeRegion> regions = TableGrid.mergeRegions(grid);

        // Then
        assertThat(regions).containsExactly(new MergeRegion(0, 0, 0, 1));
    }

    @Test
    void mergeRegions_maximalSpanAtLastColumn_clampsWithoutWrapping() {
        // Given
        List<List<TableCell>> grid = List.of(
            List.of(TableCell.of("A"), TableCell.of("B"), TableCell.of("X").withSpan(1, Integer.MAX_VALUE)));

        // When
        List<MergeRegion> regions = TableGrid.mergeRegions(grid);
        List<CellPlacement> placements = TableGrid.toPositionalDescription(grid);

        // Then
        assertThat(regions).isEmpty();
        assertThat(placements.get(2).describe()).isEqualTo("[0,2]: X");
    }

    @Test
    void mergeRegions_maximalRowSpanBelowFirstRow_clampsToLastRow() {
        // Given
        List<List<TableCell>> grid = List.of(
            List.of(TableCell.of("A")),
            List.of(TableCell.of("B").withSpan(Integer.MAX_VALUE, 1)),
            List.of(TableCell.spannedBy(1, 0)));

        // When
        List<MergeRegion> regions = TableGrid.mergeRegions(grid);
        List<CellPlacement> placements = TableGrid.toPositionalDescription(grid);

        // Then
        assertThat(regions).containsExactly(new MergeRegion(1, 2, 0, 0));
        assertThat(placements).extracting(CellPlacement::describe)
            .containsExactly("[0,0]: A", "[1-2,0]: B");
    }

    @Test
    void columnCount_emptyGrid_returnsZero() {
        assertThat(TableGrid.columnCount(List.of())).isZero();
    }
}
