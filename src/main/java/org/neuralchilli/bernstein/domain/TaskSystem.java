package org.neuralchilli.bernstein.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A named system of tasks.
 * Tasks are held in an arena keyed by name and dependency edges are name lists, so
 * copying a system never has to follow object cycles. A system may contain a dependency
 * cycle; it is rejected when it is run or transformed, not when it is built.
 */
public final class TaskSystem {

    private final String name;
    private final TaskRegistry registry = new TaskRegistry();
    private final Map<String, Set<String>> ancestorCache = new ConcurrentHashMap<>();

    /**
     * @throws DuplicateTaskException if two tasks share a name
     * @throws IllegalArgumentException if a dependency names a task outside the system
     */
    public TaskSystem(String name, List<Task> tasks) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("System name cannot be null or empty");
        }
        this.name = name;

        if (tasks != null) {
            tasks.forEach(registry::register);
        }

        // Check that all dependencies refer to tasks that exist in this system
        for (Task task : registry.tasks()) {
            for (String dependency : task.dependencies()) {
                if (!registry.contains(dependency)) {
                    throw new IllegalArgumentException(
                            "Task '" + task.name() + "' depends on '" + dependency +
                                    "' which is not defined in system '" + name + "'"
                    );
                }
            }
        }
    }

    /**
     * Build a system from every task of a registry, in registration order.
     */
    public static TaskSystem of(String name, TaskRegistry tasks) {
        return new TaskSystem(name, tasks.tasks());
    }

    public String name() {
        return name;
    }

    /**
     * Tasks in registration order
     */
    public List<Task> tasks() {
        return registry.tasks();
    }

    public Task task(String taskName) {
        return registry.lookup(taskName).orElseThrow(() -> new IllegalArgumentException(
                "Task '" + taskName + "' is not defined in system '" + name + "'"
        ));
    }

    public List<String> getTaskNames() {
        return tasks().stream()
                .map(Task::name)
                .toList();
    }

    /**
     * Registration position, used as the stable tie-break between unordered tasks
     */
    public int indexOf(String taskName) {
        return registry.indexOf(taskName);
    }

    public int size() {
        return registry.size();
    }

    public int edgeCount() {
        return tasks().stream()
                .mapToInt(task -> task.dependencies().size())
                .sum();
    }

    /**
     * Every variable read or written by any task, sorted by name
     */
    public Set<String> memoryCells() {
        Set<String> cells = new TreeSet<>();
        for (Task task : registry.tasks()) {
            cells.addAll(task.memoryCells());
        }
        return cells;
    }

    /**
     * All tasks reachable from {@code taskName} through dependency edges
     * (everything that must complete before it). Memoized per task.
     */
    public Set<String> ancestorsOf(String taskName) {
        Set<String> cached = ancestorCache.get(taskName);
        if (cached != null) {
            return cached;
        }

        // BFS through all transitive dependencies
        Queue<String> queue = new LinkedList<>(task(taskName).dependencies());
        Set<String> visited = new HashSet<>();

        while (!queue.isEmpty()) {
            String dependency = queue.poll();
            if (!visited.add(dependency)) {
                continue; // Already visited
            }
            queue.addAll(task(dependency).dependencies());
        }

        Set<String> ancestors = Collections.unmodifiableSet(visited);
        ancestorCache.put(taskName, ancestors);
        return ancestors;
    }

    /**
     * True if a dependency path links the two tasks, in either direction.
     */
    public boolean isConnected(String first, String second) {
        return ancestorsOf(first).contains(second) || ancestorsOf(second).contains(first);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        TaskSystem that = (TaskSystem) obj;
        return Objects.equals(this.name, that.name) &&
                Objects.equals(this.tasks(), that.tasks());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, tasks());
    }

    @Override
    public String toString() {
        return "TaskSystem[" +
                "name=" + name + ", " +
                "tasks=" + getTaskNames() + ']';
    }

    /**
     * Builder for creating systems fluently
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private final List<Task> tasks = new ArrayList<>();

        public Builder(String name) {
            this.name = name;
        }

        public Builder task(Task task) {
            this.tasks.add(task);
            return this;
        }

        public Builder tasks(List<Task> tasks) {
            this.tasks.addAll(tasks);
            return this;
        }

        public TaskSystem build() {
            return new TaskSystem(name, tasks);
        }
    }
}
