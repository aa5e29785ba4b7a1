package com.flowmable.mosaic;

/**
 * Messages on the result channel, from matching workers to the assembler.
 * <p>
 * Completion markers travel on the same channel as results, so a worker's marker
 * can never overtake its own last result.
 */
public sealed interface ResultMessage {

    /** The tile at {@code tileIndex} is the best fit for {@code cell}. */
    record Matched(CellCoordinate cell, PixelRegion region, int tileIndex) implements ResultMessage {
        public Matched {
            if (tileIndex < 0) {
                throw new IllegalArgumentException("Tile index must not be negative: " + tileIndex);
            }
        }
    }

    /** No tile could be matched to {@code cell}. Indicates a defect, never a valid placement. */
    record Unmatched(CellCoordinate cell) implements ResultMessage {}

    /** Worker {@code workerId} has drained the work channel and will send nothing more. */
    record WorkerFinished(int workerId) implements ResultMessage {}
}
