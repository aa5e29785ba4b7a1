package com.flowmable.mosaic;

import java.awt.image.BufferedImage;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Walks a target image's cell grid column by column (rows inner) and yields one
 * {@link WorkItem} per cell. Signatures are extracted lazily as items are pulled,
 * so memory in flight is bounded by the consumer.
 */
public class WorkPartitioner {

    private final MosaicConfig config;
    private final SignatureExtractor extractor;

    public WorkPartitioner(MosaicConfig config) {
        this.config = config;
        this.extractor = new SignatureExtractor(config);
    }

    public GridDimensions grid(BufferedImage target) {
        return GridDimensions.of(target, config.tileSize());
    }

    /**
     * Single-use iterator over every cell of {@code target}, each exactly once.
     * Pixels beyond the last whole tile are ignored.
     */
    public Iterator<WorkItem> partition(BufferedImage target) {
        GridDimensions grid = grid(target);
        int tileSize = config.tileSize();

        return new Iterator<>() {
            private int column = 0;
            private int row = 0;

            @Override
            public boolean hasNext() {
                return grid.rows() > 0 && column < grid.columns();
            }

            @Override
            public WorkItem next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                CellCoordinate cell = new CellCoordinate(column, row);
                PixelRegion region = PixelRegion.ofCell(cell, tileSize);
                Signature signature = extractor.extract(
                        target, region.x(), region.y(), region.width(), region.height());

                if (++row == grid.rows()) {
                    row = 0;
                    column++;
                }
                return new WorkItem(cell, region, signature);
            }
        };
    }
}
