package com.flowmable.mosaic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * Single consumer of the result channel. Pastes matched tiles into the canvas in
 * whatever order they arrive and stops once every worker has reported completion.
 */
class MosaicAssembler {

    private static final Logger log = LoggerFactory.getLogger(MosaicAssembler.class);

    private final TileLibrary library;
    private final MosaicCanvas canvas;
    private final CompletionTracker completion;
    private final ProgressListener progress;
    private final List<CellCoordinate> unmatched = new ArrayList<>();

    MosaicAssembler(TileLibrary library, MosaicCanvas canvas, int workers, ProgressListener progress) {
        this.library = library;
        this.canvas = canvas;
        this.completion = new CompletionTracker(workers);
        this.progress = progress;
    }

    /**
     * Consume {@code results} until all workers have finished.
     */
    MosaicCanvas drain(BlockingQueue<ResultMessage> results) throws InterruptedException {
        boolean done = false;
        while (!done) {
            done = accept(results.take());
        }
        return canvas;
    }

    /**
     * Apply one message.
     *
     * @return true once the last completion marker has been received
     */
    boolean accept(ResultMessage message) {
        if (message instanceof ResultMessage.WorkerFinished finished) {
            CompletionTracker.State state = completion.workerFinished();
            log.debug("Worker {} reported, {} still active", finished.workerId(), completion.activeWorkers());
            return state == CompletionTracker.State.DONE;
        }
        if (message instanceof ResultMessage.Matched matched) {
            Tile tile = library.get(matched.tileIndex());
            canvas.paste(matched.cell(), matched.region(), tile);
            progress.cellPlaced(canvas.placedCount(), canvas.grid().cellCount());
        } else if (message instanceof ResultMessage.Unmatched miss) {
            log.error("No tile matched cell {}", miss.cell());
            unmatched.add(miss.cell());
        }
        return false;
    }

    boolean isDone() {
        return completion.state() == CompletionTracker.State.DONE;
    }

    MosaicCanvas canvas() {
        return canvas;
    }

    List<CellCoordinate> unmatchedCells() {
        return Collections.unmodifiableList(unmatched);
    }
}
