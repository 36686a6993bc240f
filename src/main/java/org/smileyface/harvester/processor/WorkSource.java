package org.smileyface.harvester.processor;

import java.time.Duration;

/**
 * Shared, thread-safe supply of work items for a {@link WorkerPool}.
 */
public interface WorkSource<T> {

    /**
     * Next item, waiting at most {@code timeout}; null when none arrived in time.
     */
    T poll(Duration timeout) throws InterruptedException;

    /**
     * True when no item is currently available and none is expected from outside this process.
     * Workers exit only when the source is drained and no sibling is still handling an item.
     */
    boolean isDrained();

    /**
     * Puts an item back for another attempt.
     *
     * @return false when the item has used up its redeliveries and was dropped
     */
    boolean requeue(T item, String reason);
}
