package com.flowmable.mosaic;

import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output pixel buffer plus the record of which tile went into which cell.
 * <p>
 * Mutated only by the assembler; every cell accepts exactly one paste.
 */
public class MosaicCanvas {

    private final GridDimensions grid;
    private final BufferedImage image;
    private final Map<CellCoordinate, String> placed = new TreeMap<>();

    public MosaicCanvas(GridDimensions grid, int tileSize) {
        this.grid = grid;
        this.image = new BufferedImage(
                Math.max(1, grid.columns() * tileSize),
                Math.max(1, grid.rows() * tileSize),
                BufferedImage.TYPE_INT_RGB);
    }

    /**
     * Paste {@code tile} into {@code region} and record it against {@code cell}.
     *
     * @throws IllegalStateException    if {@code cell} already holds a tile
     * @throws IllegalArgumentException if {@code cell} is outside the grid or the region does not fit the tile
     */
    public void paste(CellCoordinate cell, PixelRegion region, Tile tile) {
        if (!grid.contains(cell)) {
            throw new IllegalArgumentException("Cell " + cell + " outside grid " + grid);
        }
        if (placed.containsKey(cell)) {
            throw new IllegalStateException("Cell " + cell + " already holds " + placed.get(cell));
        }
        int[] pixels = tile.pixels();
        if (region.width() * region.height() != pixels.length) {
            throw new IllegalArgumentException(
                    "Region " + region + " does not fit tile " + tile.identifier() + " of " + pixels.length + " pixels");
        }
        image.setRGB(region.x(), region.y(), region.width(), region.height(), pixels, 0, region.width());
        placed.put(cell, tile.identifier());
    }

    public boolean isPlaced(CellCoordinate cell) {
        return placed.containsKey(cell);
    }

    public int placedCount() {
        return placed.size();
    }

    public boolean isComplete() {
        return placed.size() == grid.cellCount();
    }

    public GridDimensions grid() {
        return grid;
    }

    public BufferedImage image() {
        return image;
    }

    /** Read-only view of cell → tile identifier, in column-major order. */
    public Map<CellCoordinate, String> placements() {
        return Collections.unmodifiableMap(placed);
    }

    public PlacementGrid toPlacementGrid() {
        return PlacementGrid.fromCells(grid, placed);
    }
}
