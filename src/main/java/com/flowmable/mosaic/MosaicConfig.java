package com.flowmable.mosaic;

/**
 * Immutable configuration for a mosaic run.
 * <p>
 * The signature grid side is {@code tileSize / matchResolution}; a divisor of 1
 * compares tiles at full resolution, larger divisors trade fit quality for speed.
 *
 * @param tileSize        Height/width of a mosaic tile in pixels (&gt; 0)
 * @param matchResolution Divisor applied to the tile size to get the signature grid side (1..tileSize)
 * @param workerCount     Number of concurrent matching workers (&gt;= 1)
 */
public record MosaicConfig(
        int tileSize,
        int matchResolution,
        int workerCount
) {
    public static final MosaicConfig DEFAULT = new MosaicConfig(
            16, // tileSize
            1,  // matchResolution
            Math.max(Runtime.getRuntime().availableProcessors(), 1)
    );

    public MosaicConfig {
        if (tileSize <= 0) {
            throw new IllegalArgumentException("tileSize must be positive, got: " + tileSize);
        }
        if (matchResolution < 1 || matchResolution > tileSize) {
            throw new IllegalArgumentException(
                    "matchResolution must be in [1, " + tileSize + "], got: " + matchResolution);
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, got: " + workerCount);
        }
    }

    /** Side length S of the S×S signature sample grid. */
    public int signatureSize() {
        return Math.max(1, tileSize / matchResolution);
    }

    /** Number of color samples in every signature (S²). */
    public int signatureLength() {
        int s = signatureSize();
        return s * s;
    }

    public MosaicConfig withTileSize(int tileSize) {
        return new MosaicConfig(tileSize, Math.min(matchResolution, tileSize), workerCount);
    }

    public MosaicConfig withWorkerCount(int workerCount) {
        return new MosaicConfig(tileSize, matchResolution, workerCount);
    }

    /**
     * Applies {@code mosaic.tileSize}, {@code mosaic.matchResolution} and
     * {@code mosaic.workers} system property overrides on top of this config.
     */
    public MosaicConfig withSystemOverrides() {
        int size = Integer.getInteger("mosaic.tileSize", tileSize);
        int resolution = Integer.getInteger("mosaic.matchResolution", Math.min(matchResolution, size));
        int workers = Integer.getInteger("mosaic.workers", workerCount);
        return new MosaicConfig(size, resolution, workers);
    }
}
