package com.taskweave.core.model;

/**
 * Shape statistics of a dependency graph.
 */
public record DagStatistics(
        int totalTasks,
        int rootTasks,
        int leafTasks,
        int executionLevels,
        int maxParallelism
) {
    public DagStatistics {
        if (totalTasks < 0 || rootTasks < 0 || leafTasks < 0 || executionLevels < 0 || maxParallelism < 0) {
            throw new IllegalArgumentException("DAG statistics cannot be negative");
        }
    }

    public boolean hasParallelism() {
        return maxParallelism > 1;
    }
}
