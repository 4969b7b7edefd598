package org.neuralchilli.cellflow.domain;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of one pipeline run.
 *
 * @param files      per-file outcomes in file order
 * @param summary    run-level summary, absent if no file succeeded
 * @param executions final status of every task, by task name
 */
public record RunReport(
        List<FileOutcome> files,
        Artifact summary,
        Map<String, TaskExecution> executions,
        Duration duration
) {
    public RunReport {
        files = files != null ? List.copyOf(files) : List.of();
        executions = executions != null ? Map.copyOf(executions) : Map.of();
        if (duration == null) {
            duration = Duration.ZERO;
        }
    }

    public Optional<Artifact> summaryArtifact() {
        return Optional.ofNullable(summary);
    }

    public List<String> succeededFiles() {
        return files.stream()
                .filter(FileOutcome::isSuccess)
                .map(FileOutcome::fileId)
                .collect(Collectors.toList());
    }

    public List<String> failedFiles() {
        return files.stream()
                .filter(outcome -> !outcome.isSuccess())
                .map(FileOutcome::fileId)
                .collect(Collectors.toList());
    }

    public long countByStatus(TaskStatus status) {
        return executions.values().stream()
                .filter(execution -> execution.status() == status)
                .count();
    }

    public long cachedTasks() {
        return executions.values().stream()
                .filter(TaskExecution::cached)
                .count();
    }

    public TaskExecution execution(String taskName) {
        TaskExecution execution = executions.get(taskName);
        if (execution == null) {
            throw new IllegalArgumentException("No execution recorded for task: " + taskName);
        }
        return execution;
    }
}
