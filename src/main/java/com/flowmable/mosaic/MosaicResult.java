package com.flowmable.mosaic;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Outcome of a composition run.
 *
 * @param image          Assembled canvas; cells never pasted stay black
 * @param placements     Cell → tile identifier triples, {@link VerticalAxis#TOP_DOWN}
 * @param unmatchedCells Cells for which no tile could be matched
 * @param cancelled      True if work emission stopped before every cell was queued
 */
public record MosaicResult(
        BufferedImage image,
        PlacementGrid placements,
        List<CellCoordinate> unmatchedCells,
        boolean cancelled
) {
    public MosaicResult {
        unmatchedCells = List.copyOf(unmatchedCells);
    }

    /** Every cell holds exactly one tile. */
    public boolean completed() {
        return !cancelled && unmatchedCells.isEmpty() && placements.isComplete();
    }

    public boolean isPartial() {
        return !completed();
    }

    public int placedCount() {
        return placements.size();
    }

    public int totalCells() {
        return placements.columns() * placements.rows();
    }
}
