package com.actexport.core.grid;

/**
 * One origin cell of a grid together with the rectangle it covers.
 *
 * <p>Ranges are inclusive and already clamped to the grid bounds.
 *
 * @param kind header or data cell
 * @param firstRow first covered row
 * @param lastRow last covered row
 * @param firstCol first covered column
 * @param lastCol last covered column
 * @param content cell text, trimmed
 */
public record CellPlacement(
    CellKind kind,
    int firstRow,
    int lastRow,
    int firstCol,
    int lastCol,
    String content
) {
    private static final String HEADER_PREFIX = "Заголовок ";

    /**
     * Returns the bracketed position, for example {@code [0,0-1]} or {@code [1-2,3]}.
     *
     * @return position text
     */
    public String position() {
        return "[" + range(firstRow, lastRow) + "," + range(firstCol, lastCol) + "]";
    }

    /**
     * Returns the one-line description used by targets without merged cells, for example
     * {@code [0,0-1]: A} or {@code Заголовок [0,0]: Name}.
     *
     * @return description line
     */
    public String describe() {
        String prefix = kind == CellKind.HEADER ? HEADER_PREFIX : "";
        return prefix + position() + ": " + content;
    }

    private static String range(int from, int to) {
        return from == to ? String.valueOf(from) : from + "-" + to;
    }
}
