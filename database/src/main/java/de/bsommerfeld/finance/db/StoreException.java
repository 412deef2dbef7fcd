package de.bsommerfeld.finance.db;

/**
 * Thrown by the store operations that must not fail silently: schema
 * creation and id compaction.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
