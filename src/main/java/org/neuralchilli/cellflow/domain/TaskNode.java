package org.neuralchilli.cellflow.domain;

import org.neuralchilli.cellflow.core.ResourceGate;
import org.neuralchilli.cellflow.core.StageFunction;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Represents a node in the task DAG: one invocation of a stage for one file
 * (and channel, where the stage has one).
 * <p>
 * The node name is unique within a graph and is what the DAG compares on;
 * (stage, cache key) is the identity used for result reuse across runs.
 */
public record TaskNode(
        String name,
        StageName stage,
        String fileId,
        StageArguments arguments,
        CacheKey cacheKey,
        Path output,
        StageFunction function
) {

    public TaskNode {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name cannot be null or empty");
        }
        if (stage == null) {
            throw new IllegalArgumentException("Stage cannot be null for task " + name);
        }
        if (arguments == null) {
            throw new IllegalArgumentException("Arguments cannot be null for task " + name);
        }
        if (cacheKey == null) {
            throw new IllegalArgumentException("Cache key cannot be null for task " + name);
        }
        if (output == null) {
            throw new IllegalArgumentException("Output path cannot be null for task " + name);
        }
        if (function == null) {
            throw new IllegalArgumentException("Stage function cannot be null for task " + name);
        }
    }

    /**
     * Whether this task holds the resource gate while its stage function runs.
     */
    public boolean isGated() {
        return arguments.gate() != null;
    }

    public ResourceGate gate() {
        return arguments.gate();
    }

    /**
     * Artifact this task produces once it completes.
     */
    public Artifact artifact() {
        return Artifact.of(stage, output);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        TaskNode that = (TaskNode) obj;
        // Equality based on task name only (for graph operations)
        return Objects.equals(this.name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format("TaskNode[%s key=%s]", name, cacheKey.shortForm());
    }
}
