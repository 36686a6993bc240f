package org.smileyface.harvester.processor;

/**
 * Processes one item on a worker thread. Exceptions thrown by {@link #handle} are counted as failures of that
 * item and never stop the worker.
 */
public interface ItemHandler<T> {

    void handle(T item, WorkerContext<T> context) throws Exception;

    /**
     * Called after {@link #handle} threw; use it to record the failure against the item.
     */
    default void onFailure(T item, Exception error, WorkerContext<T> context) {
    }

    default String describe(T item) {
        return String.valueOf(item);
    }
}
