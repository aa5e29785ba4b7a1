package com.flowmable.mosaic;

/**
 * Thrown before any matching starts when no tile survived loading.
 */
public class EmptyTileLibraryException extends Exception {

    public EmptyTileLibraryException(String message) {
        super(message);
    }
}
