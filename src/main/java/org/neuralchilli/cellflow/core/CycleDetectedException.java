package org.neuralchilli.cellflow.core;

/**
 * Thrown when adding a dependency would close a cycle in the task graph.
 * Extends RuntimeException as this is a construction error raised before
 * anything is submitted, not during execution.
 */
public class CycleDetectedException extends RuntimeException {

    public CycleDetectedException(String message) {
        super(message);
    }

    public CycleDetectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
