package com.flowmable.mosaic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drains the work channel, matching each cell, until it receives {@link WorkMessage.Done}.
 * <p>
 * Always posts exactly one {@link ResultMessage.WorkerFinished} as its last message,
 * including when matching fails unexpectedly, so the assembler can always terminate.
 * A failure also runs {@code onFailure}, and every exit decrements {@code liveWorkers}
 * so the producer can tell when nobody is left to take work.
 */
class MatchWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MatchWorker.class);

    private final int id;
    private final TileMatcher matcher;
    private final BlockingQueue<WorkMessage> work;
    private final BlockingQueue<ResultMessage> results;
    private final AtomicInteger liveWorkers;
    private final Runnable onFailure;

    MatchWorker(int id, TileMatcher matcher,
                BlockingQueue<WorkMessage> work, BlockingQueue<ResultMessage> results,
                AtomicInteger liveWorkers, Runnable onFailure) {
        this.id = id;
        this.matcher = matcher;
        this.work = work;
        this.results = results;
        this.liveWorkers = liveWorkers;
        this.onFailure = onFailure;
    }

    @Override
    public void run() {
        int matched = 0;
        try {
            while (true) {
                WorkMessage message = work.take();
                if (!(message instanceof WorkMessage.Work w)) {
                    break;
                }
                results.add(match(w.item()));
                matched++;
            }
        } catch (InterruptedException e) {
            log.warn("Worker {} interrupted after {} cells", id, matched);
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Worker {} failed after {} cells", id, matched, e);
            onFailure.run();
        } finally {
            log.debug("Worker {} finished, {} cells matched", id, matched);
            results.add(new ResultMessage.WorkerFinished(id));
            liveWorkers.decrementAndGet();
        }
    }

    private ResultMessage match(WorkItem item) {
        OptionalInt best = matcher.bestMatch(item.signature());
        if (best.isEmpty()) {
            return new ResultMessage.Unmatched(item.cell());
        }
        return new ResultMessage.Matched(item.cell(), item.region(), best.getAsInt());
    }
}
