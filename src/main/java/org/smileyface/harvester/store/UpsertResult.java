package org.smileyface.harvester.store;

/**
 * Outcome of {@link DocumentStore#upsert}.
 */
public enum UpsertResult {
    /** No document matched; a new one was created. */
    INSERTED,

    /** An existing document had at least one field changed. */
    MODIFIED,

    /** An existing document already held the given values. */
    UNCHANGED
}
