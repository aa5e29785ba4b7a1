package com.flowmable.mosaic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TileLibraryTest {

    private final MosaicConfig config = new MosaicConfig(8, 2, 1);

    private static TileSource failing(String name) {
        return new TileSource() {
            @Override
            public String identifier() {
                return name;
            }

            @Override
            public BufferedImage load() throws IOException {
                throw new IOException("corrupt " + name);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }

    @Test
    void failedSources_areSkippedAndReported() {
        TileLibrary.BuildResult result = TileLibrary.build(List.of(
                TileSource.ofImage("red", TestImages.solidColor(8, 8, 255, 0, 0)),
                failing("broken"),
                TileSource.ofImage("blue", TestImages.solidColor(8, 8, 0, 0, 255))), config);

        TileLibrary library = result.library();
        assertEquals(2, library.size());
        assertEquals("red", library.get(0).identifier());
        assertEquals("blue", library.get(1).identifier());
        assertEquals(1, result.failures().size());
        assertEquals("broken", result.failures().get(0).source());
        assertTrue(result.failures().get(0).reason().contains("corrupt"));
    }

    @Test
    void signaturesAndPixels_stayIndexAligned() {
        TileLibrary library = TileLibrary.build(List.of(
                failing("a"),
                TileSource.ofImage("green", TestImages.solidColor(8, 8, 0, 255, 0)),
                failing("b"),
                TileSource.ofImage("white", TestImages.solidColor(8, 8, 255, 255, 255))), config).library();

        for (int i = 0; i < library.size(); i++) {
            Tile tile = library.get(i);
            assertSame(tile.signature(), library.signature(i));
            assertEquals(tile.signature().packed(0), tile.pixels()[0]);
        }
    }

    @Test
    void allSourcesFail_yieldsEmptyLibrary() {
        TileLibrary.BuildResult result = TileLibrary.build(List.of(failing("x"), failing("y")), config);

        assertTrue(result.library().isEmpty());
        assertEquals(2, result.failures().size());
    }

    @Test
    void tile_isCenterCroppedAndScaledToTileSize() {
        // 24x8: left and right thirds black, centre square green
        BufferedImage wide = TestImages.cells(3, 1, 8,
                TestImages.rgb(0, 0, 0), TestImages.rgb(0, 255, 0), TestImages.rgb(0, 0, 0));
        Tile tile = TileLibrary.build(List.of(TileSource.ofImage("wide", wide)), config).library().get(0);

        assertEquals(64, tile.pixels().length);
        assertEquals(config.signatureLength(), tile.signature().length());
        assertEquals(Signature.uniform(config.signatureLength(), 0, 255, 0), tile.signature());
    }

    @Test
    void scanDirectory_loadsImagesRecursively_skipsNonImages(@TempDir Path dir) throws IOException {
        Path nested = Files.createDirectories(dir.resolve("blocks"));
        ImageIO.write(TestImages.solidColor(16, 16, 255, 0, 0), "png", dir.resolve("red_wool.png").toFile());
        ImageIO.write(TestImages.solidColor(16, 16, 0, 0, 255), "png", nested.resolve("blue_wool.png").toFile());
        Files.writeString(dir.resolve("notes.txt"), "not an image");

        List<TileSource> sources = TileLibrary.scanDirectory(dir);
        assertEquals(3, sources.size());

        TileLibrary.BuildResult result = TileLibrary.build(sources, config);
        assertEquals(2, result.library().size());
        assertEquals(1, result.failures().size());
        assertTrue(result.failures().get(0).source().endsWith("notes.txt"));

        List<String> ids = result.library().tiles().stream().map(Tile::identifier).toList();
        assertTrue(ids.contains("red_wool"));
        assertTrue(ids.contains("blue_wool"));
    }

    @Test
    void stripExtension_removesOnlyLastExtension() {
        assertEquals("stone_bricks", TileSource.stripExtension("stone_bricks.png"));
        assertEquals("archive.tar", TileSource.stripExtension("archive.tar.gz"));
        assertEquals("README", TileSource.stripExtension("README"));
        assertEquals(".hidden", TileSource.stripExtension(".hidden"));
    }

    @Test
    void tiles_areDefensivelyCopied() {
        int[] pixels = {1, 2, 3, 4};
        Tile tile = new Tile("t", Signature.uniform(1, 0, 0, 0), pixels);
        pixels[0] = 99;
        tile.pixels()[1] = 99;

        assertArrayEquals(new int[]{1, 2, 3, 4}, tile.pixels());
    }

    @Test
    void failureWhileProcessingLoadedImage_isReportedNotThrown() {
        // loads fine but fails as soon as cropping inspects it
        BufferedImage unreadablePixels = new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB) {
            @Override
            public int getWidth() {
                throw new IllegalStateException("raster unavailable");
            }
        };

        TileLibrary.BuildResult result = TileLibrary.build(List.of(
                TileSource.ofImage("bad-raster", unreadablePixels),
                TileSource.ofImage("red", TestImages.solidColor(8, 8, 255, 0, 0))), config);

        assertEquals(1, result.library().size());
        assertEquals("red", result.library().get(0).identifier());
        assertEquals(1, result.failures().size());
        assertEquals("bad-raster", result.failures().get(0).source());
        assertEquals("raster unavailable", result.failures().get(0).reason());
    }
}
