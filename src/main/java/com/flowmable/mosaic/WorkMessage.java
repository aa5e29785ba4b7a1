package com.flowmable.mosaic;

/**
 * Messages on the bounded work channel.
 */
public sealed interface WorkMessage {

    record Work(WorkItem item) implements WorkMessage {}

    /** No more work; the receiving worker must report and stop. */
    enum Done implements WorkMessage {
        INSTANCE
    }
}
