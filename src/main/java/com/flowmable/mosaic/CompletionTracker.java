package com.flowmable.mosaic;

/**
 * Counts worker completion markers: {@code RUNNING(n)} steps down to {@code RUNNING(n - 1)}
 * on each marker and becomes {@code DONE} at zero. A marker after {@code DONE} is a defect.
 * <p>
 * Owned by the assembler thread; not thread-safe.
 */
final class CompletionTracker {

    enum State {
        RUNNING,
        DONE
    }

    private int activeWorkers;

    CompletionTracker(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("At least one worker required, got: " + workers);
        }
        this.activeWorkers = workers;
    }

    State workerFinished() {
        if (activeWorkers == 0) {
            throw new IllegalStateException("Completion marker received after all workers finished");
        }
        activeWorkers--;
        return state();
    }

    State state() {
        return activeWorkers == 0 ? State.DONE : State.RUNNING;
    }

    int activeWorkers() {
        return activeWorkers;
    }
}
