package com.flowmable.mosaic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

/**
 * Dense, index-aligned, immutable collection of {@link Tile}s.
 * <p>
 * Index {@code i} always yields the signature and pixels of the same tile: a source
 * that fails to load contributes nothing, so partial insertion cannot misalign them.
 */
public final class TileLibrary {

    private static final Logger log = LoggerFactory.getLogger(TileLibrary.class);

    private final List<Tile> tiles;
    private final Signature[] signatures;

    private TileLibrary(List<Tile> tiles) {
        this.tiles = List.copyOf(tiles);
        this.signatures = new Signature[this.tiles.size()];
        for (int i = 0; i < signatures.length; i++) {
            signatures[i] = this.tiles.get(i).signature();
        }
    }

    public static TileLibrary of(List<Tile> tiles) {
        return new TileLibrary(tiles);
    }

    /**
     * A load failure for one source. Never fatal to the batch.
     *
     * @param source Description of the failed source
     * @param reason Failure message
     */
    public record TileLoadFailure(String source, String reason) {}

    /**
     * Outcome of {@link #build}: the surviving tiles and every skipped source.
     */
    public record BuildResult(TileLibrary library, List<TileLoadFailure> failures) {
        public BuildResult {
            failures = List.copyOf(failures);
        }
    }

    /**
     * Load every source, center-crop it to a square, scale it to the tile size and
     * extract its signature. Sources that fail to load are skipped and reported.
     * An empty library is a valid result; rejecting it is the caller's decision.
     */
    public static BuildResult build(Collection<? extends TileSource> sources, MosaicConfig config) {
        SignatureExtractor extractor = new SignatureExtractor(config);
        int tileSize = config.tileSize();
        List<Tile> tiles = new ArrayList<>(sources.size());
        List<TileLoadFailure> failures = new ArrayList<>();

        for (TileSource source : sources) {
            try {
                BufferedImage image = source.load();
                if (image == null) {
                    throw new IOException("No image data");
                }
                BufferedImage square = ImageOps.centerCropToSquare(image);
                BufferedImage full = ImageOps.resample(square, tileSize, tileSize);
                Signature signature = extractor.extract(full);
                tiles.add(new Tile(source.identifier(), signature, ImageOps.pixels(full)));
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping tile source {}: {}", source, e.getMessage());
                failures.add(new TileLoadFailure(source.toString(), String.valueOf(e.getMessage())));
            }
        }

        log.info("Processed {} tiles ({} sources skipped)", tiles.size(), failures.size());
        return new BuildResult(new TileLibrary(tiles), failures);
    }

    /**
     * Every regular file below {@code directory}, recursively, as a tile source,
     * in path order so that library order is stable between runs.
     */
    public static List<TileSource> scanDirectory(Path directory) throws IOException {
        log.info("Reading tiles from {}", directory);
        try (Stream<Path> stream = Files.walk(directory)) {
            return stream
                    .filter(Files::isRegularFile)
                    .sorted()
                    .map(TileSource::ofPath)
                    .toList();
        }
    }

    public int size() {
        return tiles.size();
    }

    public boolean isEmpty() {
        return tiles.isEmpty();
    }

    public Tile get(int index) {
        return tiles.get(index);
    }

    public Signature signature(int index) {
        return signatures[index];
    }

    public List<Tile> tiles() {
        return tiles;
    }
}
