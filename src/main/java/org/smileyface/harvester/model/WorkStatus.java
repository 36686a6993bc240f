package org.smileyface.harvester.model;

/**
 * Lifecycle of a {@link WorkItem} in the shared queue.
 */
public enum WorkStatus {
    /** Waiting to be claimed. */
    PENDING,

    /** Held by one worker until {@code expiresAt}. */
    CLAIMED,

    /** Processed successfully. */
    DONE,

    /** Processed and failed; not retried automatically. */
    FAILED
}
