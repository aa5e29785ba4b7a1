package com.flowmable.mosaic;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Something a tile can be loaded from.
 */
public interface TileSource {

    /** Identifier the resulting tile carries. */
    String identifier();

    /**
     * Load the source image.
     *
     * @throws IOException if the source is unreadable, corrupt or not an image
     */
    BufferedImage load() throws IOException;

    static TileSource ofPath(Path file) {
        String identifier = stripExtension(file.getFileName().toString());
        return new TileSource() {
            @Override
            public String identifier() {
                return identifier;
            }

            @Override
            public BufferedImage load() throws IOException {
                return ImageOps.decode(file);
            }

            @Override
            public String toString() {
                return file.toString();
            }
        };
    }

    static TileSource ofImage(String identifier, BufferedImage image) {
        return new TileSource() {
            @Override
            public String identifier() {
                return identifier;
            }

            @Override
            public BufferedImage load() {
                return image;
            }

            @Override
            public String toString() {
                return identifier;
            }
        };
    }

    /** {@code "stone_bricks.png"} becomes {@code "stone_bricks"}; names without a dot are kept. */
    static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
