package org.neuralchilli.cellflow.core;

import org.neuralchilli.cellflow.config.PipelineConfig;
import org.neuralchilli.cellflow.domain.Artifact;
import org.neuralchilli.cellflow.domain.StageArguments;
import org.neuralchilli.cellflow.domain.StageName;
import org.neuralchilli.cellflow.domain.TaskNode;

import java.nio.file.Path;
import java.util.List;

/**
 * What a stage function is called with: the task being run and the
 * artifacts of its predecessors, in predecessor order.
 */
public record StageInvocation(
        TaskNode task,
        List<Artifact> inputs
) {
    public StageInvocation {
        if (task == null) {
            throw new IllegalArgumentException("Task cannot be null");
        }
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
    }

    public StageName stage() {
        return task.stage();
    }

    /**
     * File being processed, or null for file-independent stages.
     */
    public String fileId() {
        return task.fileId();
    }

    public Path output() {
        return task.output();
    }

    public PipelineConfig config() {
        return task.arguments().config();
    }

    public StageArguments arguments() {
        return task.arguments();
    }
}
