package org.neuralchilli.cellflow.domain;

/**
 * Lifecycle status of a task within one pipeline run.
 */
public enum TaskStatus {
    /**
     * Task created, waiting for its predecessors to complete
     */
    PENDING,

    /**
     * Stage function is executing (or waiting at the resource gate)
     */
    RUNNING,

    /**
     * Task completed successfully, either computed or reused from cache
     */
    COMPLETED,

    /**
     * Stage function raised
     */
    FAILED,

    /**
     * Task never ran because a predecessor failed
     */
    SKIPPED;

    /**
     * Check if this is a terminal state (task finished)
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    public boolean isSuccessful() {
        return this == COMPLETED;
    }
}
