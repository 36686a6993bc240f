package org.smileyface.harvester.processor;

/**
 * Lifecycle state of a {@link Worker}.
 */
public enum WorkerState {
    NEW,
    RUNNING,
    STOPPED,
    COMPLETED,
    ERROR
}
