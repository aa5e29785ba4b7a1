package com.flowmable.mosaic;

import java.util.Objects;

/**
 * A library candidate: identifier, match signature and full-resolution pixels.
 *
 * @param identifier Symbolic placement token, derived from the source file name without extension
 * @param signature  Downsampled color signature used for matching
 * @param pixels     Row-major packed {@code 0xRRGGBB} pixels, {@code tileSize²} entries
 */
public record Tile(String identifier, Signature signature, int[] pixels) {

    public Tile {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(signature, "signature");
        pixels = pixels.clone();
    }

    @Override
    public int[] pixels() {
        return pixels.clone();
    }
}
