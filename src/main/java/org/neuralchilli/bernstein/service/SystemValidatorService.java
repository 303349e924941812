package org.neuralchilli.bernstein.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.bernstein.domain.Task;
import org.neuralchilli.bernstein.domain.TaskSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Structural checks on task systems: dependency cycles and determinism.
 */
@ApplicationScoped
public class SystemValidatorService {

    private static final Logger log = LoggerFactory.getLogger(SystemValidatorService.class);

    private enum Color { WHITE, GRAY, BLACK }

    /**
     * Two interfering tasks that no dependency path orders
     */
    public record UnorderedInterference(String first, String second) {
        @Override
        public String toString() {
            return first + " <-> " + second;
        }
    }

    /**
     * Detect a cycle in the dependency graph.
     * DFS colouring: a dependency that is still on the recursion stack (GRAY) closes a cycle.
     */
    public boolean isCyclic(TaskSystem system) {
        return findCycleStart(system).isPresent();
    }

    /**
     * Fail if the system's dependencies contain a cycle.
     *
     * @throws CycleDetectedException if a cycle exists
     */
    public void requireAcyclic(TaskSystem system) {
        Optional<String> cycleStart = findCycleStart(system);
        if (cycleStart.isPresent()) {
            throw new CycleDetectedException(
                    "Circular dependency detected in system '" + system.name() +
                            "' involving task: " + cycleStart.get()
            );
        }
    }

    private Optional<String> findCycleStart(TaskSystem system) {
        Map<String, Color> colors = new HashMap<>();
        for (Task task : system.tasks()) {
            colors.put(task.name(), Color.WHITE);
        }

        for (Task task : system.tasks()) {
            if (colors.get(task.name()) == Color.WHITE) {
                Optional<String> found = visit(system, task.name(), colors);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<String> visit(TaskSystem system, String taskName, Map<String, Color> colors) {
        colors.put(taskName, Color.GRAY);

        for (String dependency : system.task(taskName).dependencies()) {
            Color color = colors.get(dependency);
            if (color == Color.GRAY) {
                return Optional.of(dependency); // Back edge
            }
            if (color == Color.WHITE) {
                Optional<String> found = visit(system, dependency, colors);
                if (found.isPresent()) {
                    return found;
                }
            }
        }

        colors.put(taskName, Color.BLACK);
        return Optional.empty();
    }

    /**
     * A system is deterministic when every pair of interfering tasks is ordered by a
     * dependency path, so no schedule can change the variable histories.
     */
    public boolean isDeterministic(TaskSystem system) {
        return findUnorderedInterferences(system).isEmpty();
    }

    /**
     * Pairs of tasks that interfere but may run concurrently, in registration order.
     */
    public List<UnorderedInterference> findUnorderedInterferences(TaskSystem system) {
        List<UnorderedInterference> result = new ArrayList<>();
        List<Task> tasks = system.tasks();

        for (int i = 0; i < tasks.size(); i++) {
            for (int j = i + 1; j < tasks.size(); j++) {
                Task first = tasks.get(i);
                Task second = tasks.get(j);
                if (first.isInterfering(second) && !system.isConnected(first.name(), second.name())) {
                    result.add(new UnorderedInterference(first.name(), second.name()));
                }
            }
        }

        if (!result.isEmpty()) {
            log.debug("System '{}' has {} unordered interfering pairs: {}",
                    system.name(), result.size(), result);
        }
        return result;
    }
}
