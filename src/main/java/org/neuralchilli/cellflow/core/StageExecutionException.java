package org.neuralchilli.cellflow.core;

/**
 * A stage function raised while running a task.
 * Carries the name of the task that failed so dependents can tell their own
 * failure apart from an upstream one.
 */
public class StageExecutionException extends RuntimeException {

    private final String taskName;

    public StageExecutionException(String taskName, String message) {
        super(message);
        this.taskName = taskName;
    }

    public StageExecutionException(String taskName, String message, Throwable cause) {
        super(message, cause);
        this.taskName = taskName;
    }

    /**
     * Name of the failed task, or null when the failure is not tied to one.
     */
    public String taskName() {
        return taskName;
    }
}
