package com.flowmable.mosaic;

import java.util.OptionalInt;

/**
 * Nearest-tile search by squared RGB distance with early bail-out.
 * <p>
 * Tiles are scanned in library order and a tile only replaces the current best on a
 * strictly smaller distance, so the first tile reaching the minimum wins ties. A
 * distance computation stops as soon as its running sum exceeds the current best;
 * such a tile could never have won, so the result is identical to a full scan.
 * <p>
 * Stateless apart from the read-only library; one instance may be shared by all workers.
 */
public class TileMatcher {

    private final TileLibrary library;

    public TileMatcher(TileLibrary library) {
        this.library = library;
    }

    /**
     * Index of the best-fitting tile, or empty if the library has no tiles.
     *
     * @throws IllegalArgumentException if {@code signature} and a tile signature differ in length
     */
    public OptionalInt bestMatch(Signature signature) {
        int bestIndex = -1;
        long minDistance = Long.MAX_VALUE;

        for (int i = 0; i < library.size(); i++) {
            long distance = distance(signature, library.signature(i), minDistance);
            if (distance < minDistance) {
                minDistance = distance;
                bestIndex = i;
            }
        }
        return bestIndex < 0 ? OptionalInt.empty() : OptionalInt.of(bestIndex);
    }

    /**
     * Squared RGB distance between two signatures, abandoned once it exceeds
     * {@code bailOut}. A returned value greater than {@code bailOut} is therefore only
     * a lower bound of the true distance.
     */
    static long distance(Signature a, Signature b, long bailOut) {
        int[] x = a.channels;
        int[] y = b.channels;
        if (x.length != y.length) {
            throw new IllegalArgumentException(
                    "Signature length mismatch: " + a.length() + " vs " + b.length());
        }
        long distance = 0;
        for (int i = 0; i < x.length; i += 3) {
            int dr = x[i] - y[i];
            int dg = x[i + 1] - y[i + 1];
            int db = x[i + 2] - y[i + 2];
            distance += dr * dr + dg * dg + db * db;
            if (distance > bailOut) {
                return distance;
            }
        }
        return distance;
    }

    /** Full squared RGB distance. */
    public static long distance(Signature a, Signature b) {
        return distance(a, b, Long.MAX_VALUE);
    }
}
