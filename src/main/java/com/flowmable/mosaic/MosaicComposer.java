package com.flowmable.mosaic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.Iterator;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Top-level entry point for building a mosaic.
 * <p>
 * PIPELINE
 * 1. The calling thread partitions the target into cells and feeds a work channel
 *    bounded at one item per worker, blocking when it is full.
 * 2. {@code workerCount} matchers drain the work channel into an unbounded result channel.
 * 3. One assembler pastes results into the canvas until every worker has reported.
 * <p>
 * {@link #cancel()} (or interrupting the calling thread) stops work emission; queued
 * cells are still matched and the partial canvas is returned.
 * <p>
 * A composer is single-use once cancelled: later {@code compose} calls emit no work
 * and return an empty partial result.
 * <p>
 * If every worker dies, work emission stops instead of blocking on the full work channel.
 * <p>
 * The result channel grows without limit if matching ever outpaces assembly. Pasting
 * is far cheaper than matching, so in practice it stays near empty.
 */
public class MosaicComposer {

    private static final Logger log = LoggerFactory.getLogger(MosaicComposer.class);

    /** How often a blocked producer re-checks cancellation and worker liveness. */
    private static final long OFFER_POLL_MILLIS = 50;

    private final MosaicConfig config;
    private final TileLibrary library;
    private final TileMatcher matcher;
    private final WorkPartitioner partitioner;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * @throws EmptyTileLibraryException if {@code library} has no tiles to match against
     * @throws IllegalArgumentException  if a tile signature was built for a different configuration
     */
    public MosaicComposer(MosaicConfig config, TileLibrary library) throws EmptyTileLibraryException {
        if (library.isEmpty()) {
            throw new EmptyTileLibraryException("No tiles available to match against");
        }
        int expected = config.signatureLength();
        for (int i = 0; i < library.size(); i++) {
            int length = library.signature(i).length();
            if (length != expected) {
                throw new IllegalArgumentException("Tile " + library.get(i).identifier()
                        + " has signature length " + length + ", configuration expects " + expected);
            }
        }
        this.config = config;
        this.library = library;
        this.matcher = new TileMatcher(library);
        this.partitioner = new WorkPartitioner(config);
    }

    /**
     * Stop emitting new work. Safe to call from any thread, including a shutdown hook.
     */
    public void cancel() {
        if (!cancelled.getAndSet(true)) {
            log.warn("Cancellation requested, finishing queued cells");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public MosaicResult compose(BufferedImage target) {
        return compose(target, ProgressListener.NONE);
    }

    /**
     * Build a mosaic of {@code target}, which should already be cropped to whole tiles.
     */
    public MosaicResult compose(BufferedImage target, ProgressListener progress) {
        return compose(partitioner.partition(target), partitioner.grid(target), progress);
    }

    MosaicResult compose(Iterator<WorkItem> items, GridDimensions grid, ProgressListener progress) {
        int workers = config.workerCount();
        BlockingQueue<WorkMessage> work = new ArrayBlockingQueue<>(workers);
        BlockingQueue<ResultMessage> results = new LinkedBlockingQueue<>();
        AtomicInteger liveWorkers = new AtomicInteger(workers);
        MosaicAssembler assembler = new MosaicAssembler(
                library, new MosaicCanvas(grid, config.tileSize()), workers, progress);

        if (cancelled.get()) {
            log.warn("Composer was already cancelled, no cells will be matched");
        }
        log.info("Composing {}x{} cells from {} tiles with {} workers",
                grid.columns(), grid.rows(), library.size(), workers);

        ExecutorService assemblerExecutor = Executors.newSingleThreadExecutor(namedThreads("mosaic-assembler"));
        ExecutorService workerPool = Executors.newFixedThreadPool(workers, namedThreads("mosaic-worker"));
        boolean interrupted = false;
        try {
            Future<MosaicCanvas> assembled = assemblerExecutor.submit(() -> assembler.drain(results));
            for (int i = 0; i < workers; i++) {
                workerPool.execute(new MatchWorker(i, matcher, work, results, liveWorkers, this::cancel));
            }

            boolean exhausted;
            try {
                exhausted = produce(items, work, liveWorkers);
            } catch (InterruptedException e) {
                interrupted = true;
                exhausted = false;
                cancel();
            }
            interrupted |= signalDone(work, workers, liveWorkers);

            MosaicCanvas canvas;
            try {
                canvas = awaitUninterruptibly(assembled);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Mosaic assembly failed", e.getCause());
            }
            // interrupt seen while awaiting assembly; restored in finally
            interrupted |= Thread.interrupted();

            MosaicResult result = new MosaicResult(
                    canvas.image(), canvas.toPlacementGrid(), assembler.unmatchedCells(), !exhausted);
            if (result.completed()) {
                log.info("Mosaic complete: {} cells placed", result.placedCount());
            } else {
                log.warn("Mosaic partial: {} of {} cells placed", result.placedCount(), result.totalCells());
            }
            return result;
        } finally {
            workerPool.shutdown();
            assemblerExecutor.shutdown();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Feed work items until exhausted, cancelled, or no worker is left to take them.
     *
     * @return true if every item was emitted
     */
    private boolean produce(Iterator<WorkItem> items, BlockingQueue<WorkMessage> work,
                            AtomicInteger liveWorkers) throws InterruptedException {
        while (items.hasNext()) {
            if (cancelled.get()) {
                return false;
            }
            WorkMessage message = new WorkMessage.Work(items.next());
            while (!work.offer(message, OFFER_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (liveWorkers.get() == 0) {
                    log.error("All workers stopped, abandoning remaining cells");
                    cancel();
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * One {@link WorkMessage.Done} per worker. Must not be abandoned on interrupt, or
     * workers and the assembler would wait forever. Stops early once no worker is
     * alive to receive it; dead workers have already posted their completion markers.
     *
     * @return true if the thread was interrupted while signalling
     */
    private static boolean signalDone(BlockingQueue<WorkMessage> work, int workers, AtomicInteger liveWorkers) {
        boolean interrupted = false;
        int sent = 0;
        while (sent < workers && liveWorkers.get() > 0) {
            try {
                if (work.offer(WorkMessage.Done.INSTANCE, OFFER_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    sent++;
                }
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        return interrupted;
    }

    private static <T> T awaitUninterruptibly(Future<T> future) throws ExecutionException {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
