package org.neuralchilli.bernstein.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.bernstein.domain.DagStatistics;
import org.neuralchilli.bernstein.domain.Task;
import org.neuralchilli.bernstein.domain.TaskStatus;
import org.neuralchilli.bernstein.domain.TaskSystem;
import org.neuralchilli.bernstein.service.CycleDetectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Service for building and analyzing task system DAGs using JGraphT.
 * Vertices are task names; an edge goes from a dependency to the task that depends on it.
 */
@ApplicationScoped
public class JGraphTService {

    private static final Logger log = LoggerFactory.getLogger(JGraphTService.class);

    /**
     * Build a DAG from a task system.
     *
     * @param system The task system
     * @return DirectedAcyclicGraph with task name vertices
     * @throws CycleDetectedException if the dependencies contain a cycle
     */
    public DirectedAcyclicGraph<String, DefaultEdge> buildDAG(TaskSystem system) {
        log.debug("Building DAG for system: {}", system.name());

        DirectedAcyclicGraph<String, DefaultEdge> dag =
                new DirectedAcyclicGraph<>(DefaultEdge.class);

        // First pass: Create all vertices
        for (Task task : system.tasks()) {
            dag.addVertex(task.name());
        }

        // Second pass: Create edges for dependencies
        for (Task task : system.tasks()) {
            for (String dependency : task.dependencies()) {
                try {
                    // Edge direction: from dependency to dependent
                    dag.addEdge(dependency, task.name());
                    log.trace("Added edge: {} -> {}", dependency, task.name());
                } catch (IllegalArgumentException e) {
                    // JGraphT throws this if adding the edge would create a cycle
                    throw new CycleDetectedException(
                            "Adding dependency '" + dependency + "' -> '" + task.name() +
                                    "' would create a cycle in system '" + system.name() + "'",
                            e
                    );
                }
            }
        }

        log.debug("DAG built successfully: {} vertices, {} edges",
                dag.vertexSet().size(),
                dag.edgeSet().size()
        );

        return dag;
    }

    /**
     * Find tasks that are ready to execute based on current state.
     * A task is ready if it is PENDING and all of its dependencies are COMPLETED.
     */
    public Set<String> findReadyTasks(
            DirectedAcyclicGraph<String, DefaultEdge> dag,
            Map<String, TaskStatus> currentState
    ) {
        Set<String> ready = new HashSet<>();

        for (String node : dag.vertexSet()) {
            TaskStatus status = currentState.getOrDefault(node, TaskStatus.PENDING);

            // Only consider pending tasks
            if (status != TaskStatus.PENDING) {
                continue;
            }

            if (allDependenciesCompleted(dag, node, currentState)) {
                ready.add(node);
            }
        }

        log.trace("Found {} ready tasks", ready.size());
        return ready;
    }

    private boolean allDependenciesCompleted(
            DirectedAcyclicGraph<String, DefaultEdge> dag,
            String node,
            Map<String, TaskStatus> currentState
    ) {
        for (DefaultEdge edge : dag.incomingEdgesOf(node)) {
            String dependency = dag.getEdgeSource(edge);
            if (currentState.getOrDefault(dependency, TaskStatus.PENDING) != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    /**
     * Get all dependencies of a task (immediate predecessors).
     */
    public Set<String> getDependencies(
            DirectedAcyclicGraph<String, DefaultEdge> dag,
            String node
    ) {
        return dag.incomingEdgesOf(node).stream()
                .map(dag::getEdgeSource)
                .collect(Collectors.toSet());
    }

    /**
     * Get a topological order of all tasks.
     * Among tasks with no remaining constraint between them, the comparator decides.
     */
    public List<String> getTopologicalOrder(
            DirectedAcyclicGraph<String, DefaultEdge> dag,
            Comparator<String> tieBreak
    ) {
        List<String> order = new ArrayList<>();
        TopologicalOrderIterator<String, DefaultEdge> iterator =
                new TopologicalOrderIterator<>(dag, tieBreak);

        while (iterator.hasNext()) {
            order.add(iterator.next());
        }

        return order;
    }

    /**
     * Find all root tasks (tasks with no dependencies).
     */
    public Set<String> getRootTasks(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        return dag.vertexSet().stream()
                .filter(node -> dag.incomingEdgesOf(node).isEmpty())
                .collect(Collectors.toSet());
    }

    /**
     * Find all leaf tasks (tasks with no dependents).
     */
    public Set<String> getLeafTasks(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        return dag.vertexSet().stream()
                .filter(node -> dag.outgoingEdgesOf(node).isEmpty())
                .collect(Collectors.toSet());
    }

    /**
     * Get execution levels (tasks that can execute in parallel).
     * Each level contains tasks whose dependencies all sit in earlier levels.
     */
    public List<Set<String>> getExecutionLevels(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        List<Set<String>> levels = new ArrayList<>();
        Set<String> processed = new HashSet<>();
        Set<String> remaining = new HashSet<>(dag.vertexSet());

        while (!remaining.isEmpty()) {
            Set<String> currentLevel = new TreeSet<>();

            for (String node : remaining) {
                if (processed.containsAll(getDependencies(dag, node))) {
                    currentLevel.add(node);
                }
            }

            if (currentLevel.isEmpty()) {
                // Should not happen in a valid DAG
                throw new IllegalStateException(
                        "Could not determine execution levels - possible cycle or invalid state"
                );
            }

            levels.add(currentLevel);
            processed.addAll(currentLevel);
            remaining.removeAll(currentLevel);
        }

        log.debug("Graph has {} execution levels", levels.size());
        return levels;
    }

    /**
     * Get statistics about the DAG.
     */
    public DagStatistics getStatistics(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        List<Set<String>> levels = getExecutionLevels(dag);
        int maxParallelism = levels.stream()
                .mapToInt(Set::size)
                .max()
                .orElse(0);

        return new DagStatistics(
                dag.vertexSet().size(),
                dag.edgeSet().size(),
                getRootTasks(dag).size(),
                getLeafTasks(dag).size(),
                levels.size(),
                maxParallelism
        );
    }
}
