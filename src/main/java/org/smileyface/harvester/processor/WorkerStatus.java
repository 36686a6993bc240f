package org.smileyface.harvester.processor;

import java.time.Instant;

/**
 * Immutable snapshot of a worker's status.
 */
public final class WorkerStatus {
    private final String id;
    private final WorkerState state;
    private final long processedCount;
    private final long failedCount;
    private final String lastItem;
    private final String lastError;
    private final Instant startedAt;
    private final Instant finishedAt;

    public WorkerStatus(String id, WorkerState state, long processedCount, long failedCount, String lastItem,
                        String lastError, Instant startedAt, Instant finishedAt) {
        this.id = id;
        this.state = state;
        this.processedCount = processedCount;
        this.failedCount = failedCount;
        this.lastItem = lastItem;
        this.lastError = lastError;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public String getId() { return id; }
    public WorkerState getState() { return state; }
    public long getProcessedCount() { return processedCount; }
    public long getFailedCount() { return failedCount; }
    public String getLastItem() { return lastItem; }
    public String getLastError() { return lastError; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }

    @Override
    public String toString() {
        return "WorkerStatus{id='" + id + "', state=" + state + ", processed=" + processedCount
                + ", failed=" + failedCount + ", lastItem='" + lastItem + "'}";
    }
}
