package com.flowmable.mosaic;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CompletionTrackerTest {

    @Test
    void countsDownToDone() {
        CompletionTracker tracker = new CompletionTracker(3);
        assertEquals(CompletionTracker.State.RUNNING, tracker.state());

        assertEquals(CompletionTracker.State.RUNNING, tracker.workerFinished());
        assertEquals(CompletionTracker.State.RUNNING, tracker.workerFinished());
        assertEquals(1, tracker.activeWorkers());
        assertEquals(CompletionTracker.State.DONE, tracker.workerFinished());
        assertEquals(0, tracker.activeWorkers());
    }

    @Test
    void markerAfterDone_isRejected() {
        CompletionTracker tracker = new CompletionTracker(1);
        tracker.workerFinished();
        assertThrows(IllegalStateException.class, tracker::workerFinished);
    }

    @Test
    void requiresAtLeastOneWorker() {
        assertThrows(IllegalArgumentException.class, () -> new CompletionTracker(0));
    }
}
