package com.flowmable.mosaic;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered {@code (column, row, identifier)} triples for a schematic writer, with the grid
 * size and the row convention they are expressed in.
 *
 * @param columns    Grid width in cells
 * @param rows       Grid height in cells
 * @param axis       Row convention of {@code placements}
 * @param placements Sorted by column, then row
 */
public record PlacementGrid(int columns, int rows, VerticalAxis axis, List<Placement> placements) {

    public record Placement(int column, int row, String identifier) {}

    private static final Comparator<Placement> ORDER =
            Comparator.comparingInt(Placement::column).thenComparingInt(Placement::row);

    public PlacementGrid {
        List<Placement> sorted = new ArrayList<>(placements);
        sorted.sort(ORDER);
        placements = List.copyOf(sorted);
    }

    /** Canvas-convention grid from a cell→identifier map. */
    static PlacementGrid fromCells(GridDimensions grid, Map<CellCoordinate, String> cells) {
        List<Placement> placements = new ArrayList<>(cells.size());
        for (Map.Entry<CellCoordinate, String> e : cells.entrySet()) {
            placements.add(new Placement(e.getKey().column(), e.getKey().row(), e.getValue()));
        }
        return new PlacementGrid(grid.columns(), grid.rows(), VerticalAxis.TOP_DOWN, placements);
    }

    /**
     * The same placements expressed in {@code target}'s row convention.
     */
    public PlacementGrid orientedTo(VerticalAxis target) {
        if (target == axis) return this;
        List<Placement> converted = new ArrayList<>(placements.size());
        for (Placement p : placements) {
            converted.add(new Placement(p.column(), axis.convert(p.row(), rows, target), p.identifier()));
        }
        return new PlacementGrid(columns, rows, target, converted);
    }

    public Optional<String> identifierAt(int column, int row) {
        return placements.stream()
                .filter(p -> p.column() == column && p.row() == row)
                .map(Placement::identifier)
                .findFirst();
    }

    public int size() {
        return placements.size();
    }

    /** True when every cell of the grid has a placement. */
    public boolean isComplete() {
        return placements.size() == columns * rows;
    }
}
