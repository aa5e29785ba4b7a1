package com.flowmable.mosaic;

/**
 * Which edge row 0 refers to when a placement grid is handed off.
 * <p>
 * The canvas is always {@link #TOP_DOWN}. Schematic formats that build upwards from the
 * ground typically expect {@link #BOTTOM_UP}, where canvas row {@code r} of {@code rows}
 * becomes {@code rows - 1 - r}.
 */
public enum VerticalAxis {
    /** Row 0 is the image's top edge. */
    TOP_DOWN,
    /** Row 0 is the image's bottom edge. */
    BOTTOM_UP;

    /**
     * Convert {@code row}, expressed in this convention, to {@code target}'s convention.
     */
    public int convert(int row, int rows, VerticalAxis target) {
        if (row < 0 || row >= rows) {
            throw new IndexOutOfBoundsException("Row " + row + " outside [0, " + rows + ")");
        }
        return this == target ? row : rows - 1 - row;
    }
}
