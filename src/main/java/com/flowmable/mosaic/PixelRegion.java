package com.flowmable.mosaic;

/**
 * Rectangle in full-resolution pixel space.
 */
public record PixelRegion(int x, int y, int width, int height) {

    public static PixelRegion ofCell(CellCoordinate cell, int tileSize) {
        return new PixelRegion(cell.column() * tileSize, cell.row() * tileSize, tileSize, tileSize);
    }
}
