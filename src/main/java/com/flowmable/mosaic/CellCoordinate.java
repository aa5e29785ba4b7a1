package com.flowmable.mosaic;

/**
 * Position of a cell in the target grid. Row 0 is the image's top edge.
 *
 * @param column Column index, {@code 0 <= column < columns}
 * @param row    Row index, {@code 0 <= row < rows}
 */
public record CellCoordinate(int column, int row) implements Comparable<CellCoordinate> {

    public CellCoordinate {
        if (column < 0 || row < 0) {
            throw new IllegalArgumentException("Negative cell coordinate: " + column + "," + row);
        }
    }

    /** Column-major order, matching the partitioner's traversal. */
    @Override
    public int compareTo(CellCoordinate o) {
        int c = Integer.compare(column, o.column);
        return c != 0 ? c : Integer.compare(row, o.row);
    }
}
