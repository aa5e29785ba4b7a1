package com.flowmable.mosaic;

/**
 * Notified on the assembler thread after every tile paste.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (placed, total) -> {};

    void cellPlaced(int placed, int total);
}
