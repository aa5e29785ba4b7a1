package com.flowmable.mosaic;

import java.awt.image.BufferedImage;

/**
 * Reduces an image region to an S×S {@link Signature} by area-weighted averaging.
 * <p>
 * Each output sample is the exact coverage-weighted mean of the source pixels it
 * overlaps, computed in integer arithmetic, so the same region always yields the
 * same signature regardless of platform rendering pipelines.
 */
public class SignatureExtractor {

    private final int size;

    public SignatureExtractor(MosaicConfig config) {
        this.size = config.signatureSize();
    }

    /** Side length S of the produced sample grid. */
    public int size() {
        return size;
    }

    public Signature extract(BufferedImage image) {
        return extract(image, 0, 0, image.getWidth(), image.getHeight());
    }

    /**
     * Extract the signature of the {@code width × height} region at {@code (x, y)}.
     */
    public Signature extract(BufferedImage image, int x, int y, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Region must be non-empty, got: " + width + "x" + height);
        }
        int[] src = image.getRGB(x, y, width, height, null, 0, width);
        return Signature.ofPacked(areaAverage(src, width, height, size));
    }

    /**
     * Area-weighted resample of packed RGB pixels to {@code s × s}.
     * <p>
     * Coordinates are scaled so that a source pixel spans {@code s} units and an output
     * pixel spans {@code w} (or {@code h}) units; overlap lengths are then exact integers.
     */
    static int[] areaAverage(int[] src, int w, int h, int s) {
        long[] sumR = new long[s * s];
        long[] sumG = new long[s * s];
        long[] sumB = new long[s * s];

        for (int sy = 0; sy < h; sy++) {
            int y1 = sy * s, y2 = y1 + s;
            int oyFirst = y1 / h;
            int oyLast = (y2 - 1) / h;
            for (int sx = 0; sx < w; sx++) {
                int x1 = sx * s, x2 = x1 + s;
                int oxFirst = x1 / w;
                int oxLast = (x2 - 1) / w;
                int p = src[sy * w + sx];
                int r = (p >> 16) & 0xFF;
                int g = (p >> 8) & 0xFF;
                int b = p & 0xFF;
                for (int oy = oyFirst; oy <= oyLast; oy++) {
                    int wy = overlap(y1, y2, oy * h, (oy + 1) * h);
                    for (int ox = oxFirst; ox <= oxLast; ox++) {
                        long weight = (long) wy * overlap(x1, x2, ox * w, (ox + 1) * w);
                        int idx = oy * s + ox;
                        sumR[idx] += weight * r;
                        sumG[idx] += weight * g;
                        sumB[idx] += weight * b;
                    }
                }
            }
        }

        long area = (long) w * h;
        int[] out = new int[s * s];
        for (int i = 0; i < out.length; i++) {
            int r = (int) ((2 * sumR[i] + area) / (2 * area));
            int g = (int) ((2 * sumG[i] + area) / (2 * area));
            int b = (int) ((2 * sumB[i] + area) / (2 * area));
            out[i] = (Math.min(r, 255) << 16) | (Math.min(g, 255) << 8) | Math.min(b, 255);
        }
        return out;
    }

    private static int overlap(int a, int b, int c, int d) {
        int from = Math.max(a, c);
        int to = Math.min(b, d);
        return from < to ? to - from : 0;
    }
}
