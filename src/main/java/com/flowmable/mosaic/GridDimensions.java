package com.flowmable.mosaic;

import java.awt.image.BufferedImage;

/**
 * Number of tile columns and rows covering an image.
 */
public record GridDimensions(int columns, int rows) {

    public GridDimensions {
        if (columns < 0 || rows < 0) {
            throw new IllegalArgumentException("Negative grid size: " + columns + "x" + rows);
        }
    }

    /**
     * Grid for {@code image} using integer division; remainder pixels are ignored.
     */
    public static GridDimensions of(BufferedImage image, int tileSize) {
        return new GridDimensions(image.getWidth() / tileSize, image.getHeight() / tileSize);
    }

    public int cellCount() {
        return columns * rows;
    }

    public boolean contains(CellCoordinate cell) {
        return cell.column() < columns && cell.row() < rows;
    }
}
