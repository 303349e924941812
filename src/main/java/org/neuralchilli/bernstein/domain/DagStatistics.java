package org.neuralchilli.bernstein.domain;

/**
 * Statistics about the dependency structure of a task system.
 * Logged after runs and transforms to show how much parallelism a graph exposes.
 */
public record DagStatistics(
        int totalTasks,
        int dependencyEdges,
        int rootTasks,
        int leafTasks,
        int executionLevels,
        int maxParallelism
) {
    public DagStatistics {
        if (totalTasks < 0) {
            throw new IllegalArgumentException("Total tasks cannot be negative");
        }
        if (dependencyEdges < 0) {
            throw new IllegalArgumentException("Dependency edges cannot be negative");
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
     * Check if the system has any parallelism opportunity
     */
    public boolean hasParallelism() {
        return maxParallelism > 1;
    }

    /**
     * Check if the system is a single chain (no parallelism)
     */
    public boolean isLinear() {
        return maxParallelism == 1;
    }

    /**
     * Number of sequential execution levels
     */
    public int depth() {
        return executionLevels;
    }

    /**
     * Maximum number of tasks runnable at the same time
     */
    public int width() {
        return maxParallelism;
    }

    @Override
    public String toString() {
        return String.format(
                "DagStatistics[tasks=%d, edges=%d, levels=%d, max_parallel=%d, roots=%d, leaves=%d]",
                totalTasks, dependencyEdges, executionLevels, maxParallelism, rootTasks, leafTasks
        );
    }
}
