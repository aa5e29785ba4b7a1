package com.flowmable.mosaic;

import java.util.Arrays;

/**
 * Fixed-length, row-major sequence of RGB samples describing a downsampled region.
 * <p>
 * Channels are stored flattened as {@code [r0, g0, b0, r1, g1, b1, ...]}, each 0–255.
 * Instances are immutable and safe to share between threads.
 */
public final class Signature {

    final int[] channels;

    private Signature(int[] channels) {
        this.channels = channels;
    }

    /**
     * Build a signature from packed {@code 0xRRGGBB} samples (alpha ignored).
     */
    public static Signature ofPacked(int[] rgb) {
        int[] channels = new int[rgb.length * 3];
        for (int i = 0; i < rgb.length; i++) {
            int p = rgb[i];
            channels[i * 3] = (p >> 16) & 0xFF;
            channels[i * 3 + 1] = (p >> 8) & 0xFF;
            channels[i * 3 + 2] = p & 0xFF;
        }
        return new Signature(channels);
    }

    /**
     * Build a signature of {@code length} identical samples.
     */
    public static Signature uniform(int length, int r, int g, int b) {
        int[] channels = new int[length * 3];
        for (int i = 0; i < length; i++) {
            channels[i * 3] = clamp(r);
            channels[i * 3 + 1] = clamp(g);
            channels[i * 3 + 2] = clamp(b);
        }
        return new Signature(channels);
    }

    /** Number of RGB samples. */
    public int length() {
        return channels.length / 3;
    }

    public int red(int index) {
        return channels[index * 3];
    }

    public int green(int index) {
        return channels[index * 3 + 1];
    }

    public int blue(int index) {
        return channels[index * 3 + 2];
    }

    /** Sample at {@code index} packed as {@code 0xRRGGBB}. */
    public int packed(int index) {
        return (red(index) << 16) | (green(index) << 8) | blue(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Signature other)) return false;
        return Arrays.equals(channels, other.channels);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(channels);
    }

    @Override
    public String toString() {
        return "Signature[length=" + length() + "]";
    }

    private static int clamp(int v) {
        return Math.min(255, Math.max(0, v));
    }
}
