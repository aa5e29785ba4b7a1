package com.flowmable.mosaic;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * CLI driver: builds a tile mosaic of one image and writes it next to the output directory.
 * <p>
 * Usage: {@code MosaicDriver <image> <tiles directory> <height in tiles> [output directory]}
 * <p>
 * Ctrl-C stops matching new cells; the partially assembled mosaic is still written.
 */
public class MosaicDriver {

    private static final String DEFAULT_OUTPUT_DIR = "imgs";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 3) {
            showError("Usage: MosaicDriver <image> <tiles directory> <height in tiles> [output directory]");
            return 1;
        }
        Path imageFile = Path.of(args[0]);
        Path tilesDir = Path.of(args[1]);
        Path outputDir = Path.of(args.length > 3 ? args[3] : DEFAULT_OUTPUT_DIR);

        int heightInTiles;
        try {
            heightInTiles = Integer.parseInt(args[2]);
        } catch (NumberFormatException e) {
            showError("Height must be a whole number of tiles, got '" + args[2] + "'");
            return 1;
        }
        if (heightInTiles < 1) {
            showError("Height must be at least 1 tile, got " + heightInTiles);
            return 1;
        }
        if (!Files.isRegularFile(imageFile)) {
            showError("Unable to find image file '" + imageFile + "'");
            return 1;
        }
        if (!Files.isDirectory(tilesDir)) {
            showError("Unable to find tile directory '" + tilesDir + "'");
            return 1;
        }

        MosaicConfig config;
        try {
            config = MosaicConfig.DEFAULT.withSystemOverrides();
        } catch (IllegalArgumentException e) {
            showError("Invalid configuration: " + e.getMessage());
            return 1;
        }

        try {
            return compose(imageFile, tilesDir, heightInTiles, outputDir, config);
        } catch (IOException e) {
            showError(e.getMessage());
            return 1;
        }
    }

    private static int compose(Path imageFile, Path tilesDir, int heightInTiles,
                               Path outputDir, MosaicConfig config) throws IOException {
        System.out.println("Processing main image...");
        BufferedImage target = ImageOps.fitToTileGrid(ImageOps.decode(imageFile), heightInTiles, config.tileSize());
        System.out.printf("Main image processed: %dx%d px%n", target.getWidth(), target.getHeight());

        List<TileSource> sources = TileLibrary.scanDirectory(tilesDir);
        TileLibrary.BuildResult built = TileLibrary.build(sources, config);
        System.out.printf("Processed %d tiles (%d skipped).%n",
                built.library().size(), built.failures().size());

        MosaicComposer composer;
        try {
            composer = new MosaicComposer(config, built.library());
        } catch (EmptyTileLibraryException e) {
            showError("No images found in tiles directory '" + tilesDir + "'");
            return 1;
        }

        PartialSave partialSave = new PartialSave(composer, Runtime.getRuntime()::halt);
        Thread hook = new Thread(partialSave::awaitAndHalt, "mosaic-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        int status = 1;
        try {
            System.out.println("Building mosaic, press Ctrl-C to abort...");
            MosaicResult result = composer.compose(target, (placed, total) ->
                    System.out.printf("Progress: %04.1f%%\r", 100.0 * placed / total));
            status = report(result, write(result, imageFile, outputDir));
        } catch (IOException e) {
            showError(e.getMessage());
        } finally {
            // the report must be printed before a pending shutdown hook may halt the JVM
            partialSave.finished(status);
            removeHook(hook);
        }
        return status;
    }

    /**
     * Print the run summary.
     *
     * @return 0 for a complete mosaic, 2 for a partial one
     */
    static int report(MosaicResult result, Path output) {
        PlacementGrid placements = result.placements();
        System.out.println();
        System.out.printf("Grid: %d x %d cells, %d placed%n", placements.columns(), placements.rows(), placements.size());
        if (!result.unmatchedCells().isEmpty()) {
            System.err.println("  ❌ " + result.unmatchedCells().size() + " cells had no matching tile");
        }
        if (result.completed()) {
            System.out.println("Finished, output is " + output);
            return 0;
        }
        System.out.printf("Partial mosaic (%d of %d cells) saved to %s%n",
                result.placedCount(), result.totalCells(), output);
        return 2;
    }

    /**
     * Shutdown-hook side of a run. On Ctrl-C or SIGTERM the hook cancels matching, waits
     * until the main thread has written and reported the partial mosaic, then halts with
     * the reported status. {@code System.exit} would block while hooks are running.
     */
    static final class PartialSave {

        private final MosaicComposer composer;
        private final IntConsumer halt;
        private final CountDownLatch reported = new CountDownLatch(1);
        private final AtomicInteger status = new AtomicInteger(1);

        PartialSave(MosaicComposer composer, IntConsumer halt) {
            this.composer = composer;
            this.halt = halt;
        }

        void awaitAndHalt() {
            System.out.println("\nHalting, saving partial image please wait...");
            composer.cancel();
            try {
                reported.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            halt.accept(status.get());
        }

        /** Called by the main thread once output is written and the summary printed. */
        void finished(int exitStatus) {
            status.set(exitStatus);
            reported.countDown();
        }
    }

    private static Path write(MosaicResult result, Path imageFile, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        String name = TileSource.stripExtension(imageFile.getFileName().toString());
        Path output = outputDir.resolve(name + "_mosaic.png");
        if (!ImageIO.write(result.image(), "png", output.toFile())) {
            throw new IOException("No PNG writer available for " + output);
        }
        return output;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            System.out.println("Shutdown in progress, partial output kept.");
        }
    }

    private static void showError(String msg) {
        System.err.println("ERROR: " + msg);
    }
}
