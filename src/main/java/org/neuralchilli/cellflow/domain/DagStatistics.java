package org.neuralchilli.cellflow.domain;

import javax.annotation.Nonnull;

/**
 * Statistics about a task DAG structure.
 * Logged when a run's graph is built.
 */
public record DagStatistics(
        int totalTasks,
        int rootTasks,
        int leafTasks,
        int executionLevels,
        int maxParallelism
) {
    public DagStatistics {
        if (totalTasks < 0) {
            throw new IllegalArgumentException("Total tasks cannot be negative");
        }
        if (rootTasks < 0) {
            throw new IllegalArgumentException("Root tasks cannot be negative");
        }
        if (leafTasks < 0) {
            throw new IllegalArgumentException("Leaf tasks cannot be negative");
        }
        if (executionLevels < 0) {
            throw new IllegalArgumentException("Execution levels cannot be negative");
        }
        if (maxParallelism < 0) {
            throw new IllegalArgumentException("Max parallelism cannot be negative");
        }
    }

    /**
     * Depth of the DAG (number of sequential execution levels)
     */
    public int depth() {
        return executionLevels;
    }

    /**
     * Width of the DAG (tasks that could run at once on the widest level)
     */
    public int width() {
        return maxParallelism;
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "DagStatistics[tasks=%d, levels=%d, max_parallel=%d, roots=%d, leaves=%d]",
                totalTasks, executionLevels, maxParallelism, rootTasks, leafTasks
        );
    }
}
