package org.smileyface.harvester.store;

/**
 * A unique index rejected an insert.
 */
public class DuplicateKeyStoreException extends StoreException {

    public DuplicateKeyStoreException(String message) {
        super(message);
    }

    public DuplicateKeyStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
