package com.flowmable.mosaic;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Image decoding and geometric helpers around {@link ImageIO} and {@link Graphics2D}.
 * <p>
 * All returned images are {@code TYPE_INT_RGB}; alpha is discarded.
 */
public final class ImageOps {

    private ImageOps() {}

    /**
     * Decode an image file.
     *
     * @throws IOException if the file cannot be read or is not a decodable image
     */
    public static BufferedImage decode(Path file) throws IOException {
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("Failed to decode image: " + file);
        }
        return toRgb(image);
    }

    /**
     * Convert to {@code TYPE_INT_RGB}, returning the input unchanged if it already is.
     */
    public static BufferedImage toRgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_RGB) return src;
        BufferedImage converted = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g2 = converted.createGraphics();
        g2.drawImage(src, 0, 0, null);
        g2.dispose();
        return converted;
    }

    /**
     * Bicubic resample to exactly {@code width × height}.
     */
    public static BufferedImage resample(BufferedImage src, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target size must be positive, got: " + width + "x" + height);
        }
        if (src.getWidth() == width && src.getHeight() == height) {
            return toRgb(src);
        }
        BufferedImage dst = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2 = dst.createGraphics();
        g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        g2.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g2.drawImage(src, 0, 0, width, height, null);
        g2.dispose();
        return dst;
    }

    /**
     * Crop the largest centered square out of {@code src}.
     */
    public static BufferedImage centerCropToSquare(BufferedImage src) {
        int w = src.getWidth();
        int h = src.getHeight();
        int side = Math.min(w, h);
        return crop(src, (w - side) / 2, (h - side) / 2, side, side);
    }

    /**
     * Scale {@code src} to {@code heightInTiles * tileSize} pixels high, preserving the
     * aspect ratio, then center-crop both dimensions down to whole multiples of
     * {@code tileSize}. The result is never smaller than one tile in either dimension.
     */
    public static BufferedImage fitToTileGrid(BufferedImage src, int heightInTiles, int tileSize) {
        if (heightInTiles < 1) {
            throw new IllegalArgumentException("heightInTiles must be at least 1, got: " + heightInTiles);
        }
        int h = heightInTiles * tileSize;
        int w = Math.max(tileSize, (int) Math.round(src.getWidth() * ((double) h / src.getHeight())));
        BufferedImage scaled = resample(src, w, h);

        int croppedW = (w / tileSize) * tileSize;
        int croppedH = (h / tileSize) * tileSize;
        if (croppedW == w && croppedH == h) return scaled;
        return crop(scaled, (w - croppedW) / 2, (h - croppedH) / 2, croppedW, croppedH);
    }

    /**
     * Copy of a rectangular region. The copy does not share a raster with {@code src}.
     */
    public static BufferedImage crop(BufferedImage src, int x, int y, int width, int height) {
        BufferedImage dst = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] rgb = src.getRGB(x, y, width, height, null, 0, width);
        dst.setRGB(0, 0, width, height, rgb, 0, width);
        return dst;
    }

    /** Row-major packed {@code 0xRRGGBB} pixels of the whole image. */
    public static int[] pixels(BufferedImage src) {
        int w = src.getWidth();
        int h = src.getHeight();
        int[] argb = src.getRGB(0, 0, w, h, null, 0, w);
        for (int i = 0; i < argb.length; i++) {
            argb[i] &= 0xFFFFFF;
        }
        return argb;
    }
}
