package org.smileyface.harvester.processor;

import org.smileyface.harvester.render.PageRenderer;

/**
 * Per-worker view handed to an {@link ItemHandler}.
 */
public interface WorkerContext<T> {

    String workerId();

    /**
     * The renderer session owned by this worker, or null when the pool was started without a factory.
     */
    PageRenderer renderer();

    /**
     * Counters local to this worker.
     */
    WorkerStats stats();

    boolean requeue(T item, String reason);

    /**
     * Asks every worker of the pool to finish after its current item.
     */
    void stopPool();
}
