package org.neuralchilli.cellflow.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Status of a single task within one run.
 * Immutable; every transition returns a new instance.
 */
public record TaskExecution(
        String taskName,
        StageName stage,
        TaskStatus status,
        String threadName,
        Instant startedAt,
        Instant completedAt,
        boolean cached,
        Artifact artifact,
        String error
) {

    public TaskExecution {
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("Task name cannot be null or empty");
        }
        if (stage == null) {
            throw new IllegalArgumentException("Stage cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
    }

    public static TaskExecution pending(TaskNode task) {
        return new TaskExecution(
                task.name(), task.stage(), TaskStatus.PENDING,
                null, null, null, false, null, null
        );
    }

    /**
     * Mark as running
     */
    public TaskExecution start(String threadName) {
        return new TaskExecution(
                taskName, stage, TaskStatus.RUNNING, threadName,
                Instant.now(), null, false, null, null
        );
    }

    /**
     * Mark as completed, either computed now or reused from a previous run
     */
    public TaskExecution complete(Artifact result, boolean fromCache) {
        return new TaskExecution(
                taskName, stage, TaskStatus.COMPLETED, threadName,
                startedAt, Instant.now(), fromCache, result, null
        );
    }

    /**
     * Mark as failed
     */
    public TaskExecution fail(String errorMessage) {
        return new TaskExecution(
                taskName, stage, TaskStatus.FAILED, threadName,
                startedAt, Instant.now(), false, null, errorMessage
        );
    }

    /**
     * Mark as skipped because a predecessor did not complete
     */
    public TaskExecution skip(String reason) {
        return new TaskExecution(
                taskName, stage, TaskStatus.SKIPPED, threadName,
                startedAt, Instant.now(), false, null, reason
        );
    }

    public boolean isFinished() {
        return status.isTerminal();
    }

    public Duration getDuration() {
        return startedAt != null && completedAt != null
                ? Duration.between(startedAt, completedAt)
                : Duration.ZERO;
    }
}
