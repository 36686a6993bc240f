package org.smileyface.harvester.store;

/**
 * Raised when a document store operation fails. Mid-run failures are treated as transient by callers.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
