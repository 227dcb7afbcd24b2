package de.bsommerfeld.stockroom.db;

/**
 * The store could not be opened or its schema could not be applied. There is
 * nothing to recover at the API level; the process should stop.
 */
public class StoreBootstrapException extends RuntimeException {

    public StoreBootstrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
