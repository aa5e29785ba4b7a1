package com.flowmable.mosaic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MosaicDriverTest {

    @Test
    void missingArguments_failWithUsage() {
        assertEquals(1, MosaicDriver.run(new String[]{"only-one"}));
    }

    @Test
    void missingImageOrTileDirectory_fail(@TempDir Path dir) throws IOException {
        Path tiles = Files.createDirectories(dir.resolve("tiles"));
        Path image = dir.resolve("target.png");
        ImageIO.write(TestImages.solidColor(32, 32, 0, 0, 0), "png", image.toFile());

        assertEquals(1, MosaicDriver.run(new String[]{dir.resolve("absent.png").toString(), tiles.toString(), "2"}));
        assertEquals(1, MosaicDriver.run(new String[]{image.toString(), dir.resolve("absent").toString(), "2"}));
        assertEquals(1, MosaicDriver.run(new String[]{image.toString(), tiles.toString(), "two"}));
    }

    @Test
    void emptyTileDirectory_failsBeforeMatching(@TempDir Path dir) throws IOException {
        Path tiles = Files.createDirectories(dir.resolve("tiles"));
        Files.writeString(tiles.resolve("readme.txt"), "no images here");
        Path image = dir.resolve("target.png");
        ImageIO.write(TestImages.solidColor(32, 32, 0, 0, 0), "png", image.toFile());
        Path out = dir.resolve("out");

        assertEquals(1, MosaicDriver.run(new String[]{image.toString(), tiles.toString(), "2", out.toString()}));
        assertFalse(Files.exists(out.resolve("target_mosaic.png")));
    }

    @Test
    void writesMosaicPng(@TempDir Path dir) throws IOException {
        Path tiles = Files.createDirectories(dir.resolve("tiles"));
        ImageIO.write(TestImages.solidColor(16, 16, 255, 0, 0), "png", tiles.resolve("red_wool.png").toFile());
        ImageIO.write(TestImages.solidColor(16, 16, 0, 0, 255), "png", tiles.resolve("blue_wool.png").toFile());
        Path image = dir.resolve("photo.png");
        ImageIO.write(TestImages.cells(2, 2, 16, 0xE01010, 0x1010E0, 0x1010E0, 0xE01010), "png", image.toFile());
        Path out = dir.resolve("out");

        assertEquals(0, MosaicDriver.run(new String[]{image.toString(), tiles.toString(), "2", out.toString()}));

        BufferedImage mosaic = ImageIO.read(out.resolve("photo_mosaic.png").toFile());
        assertNotNull(mosaic);
        assertEquals(32, mosaic.getWidth());
        assertEquals(32, mosaic.getHeight());
        assertEquals(0xFF0000, mosaic.getRGB(4, 4) & 0xFFFFFF);
        assertEquals(0x0000FF, mosaic.getRGB(4, 20) & 0xFFFFFF);
    }

    private static String captureOut(Runnable action) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        try {
            action.run();
        } finally {
            System.setOut(original);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static MosaicResult resultWith(int placed, boolean cancelled) {
        List<PlacementGrid.Placement> placements = List.of(
                new PlacementGrid.Placement(0, 0, "red"),
                new PlacementGrid.Placement(0, 1, "blue"),
                new PlacementGrid.Placement(1, 0, "red"),
                new PlacementGrid.Placement(1, 1, "blue")).subList(0, placed);
        return new MosaicResult(new BufferedImage(32, 32, BufferedImage.TYPE_INT_RGB),
                new PlacementGrid(2, 2, VerticalAxis.TOP_DOWN, placements), List.of(), cancelled);
    }

    @Test
    void report_partialMosaic_returnsTwoAndSaysPartial() {
        AtomicInteger status = new AtomicInteger(-1);
        String out = captureOut(() -> status.set(MosaicDriver.report(resultWith(2, true), Path.of("out", "p_mosaic.png"))));

        assertEquals(2, status.get());
        assertTrue(out.contains("Grid: 2 x 2 cells, 2 placed"), out);
        assertTrue(out.contains("Partial mosaic (2 of 4 cells)"), out);
    }

    @Test
    void report_completeMosaic_returnsZero() {
        AtomicInteger status = new AtomicInteger(-1);
        String out = captureOut(() -> status.set(MosaicDriver.report(resultWith(4, false), Path.of("p_mosaic.png"))));

        assertEquals(0, status.get());
        assertTrue(out.contains("Finished, output is"), out);
        assertFalse(out.contains("Partial"), out);
    }

    @Test
    void shutdownHook_cancelsThenHaltsWithReportedStatusOnlyAfterReport() throws Exception {
        MosaicConfig config = new MosaicConfig(16, 4, 1);
        MosaicComposer composer = new MosaicComposer(config, TestImages.primaries(config));
        AtomicInteger haltedWith = new AtomicInteger(-1);
        CountDownLatch halted = new CountDownLatch(1);
        MosaicDriver.PartialSave partialSave = new MosaicDriver.PartialSave(composer, code -> {
            haltedWith.set(code);
            halted.countDown();
        });

        Thread hook = new Thread(partialSave::awaitAndHalt);
        hook.start();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!composer.isCancelled() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(composer.isCancelled());
        assertFalse(halted.await(200, TimeUnit.MILLISECONDS), "must wait for the partial report");

        partialSave.finished(2);
        assertTrue(halted.await(5, TimeUnit.SECONDS));
        hook.join(5000);
        assertEquals(2, haltedWith.get());
    }
}
