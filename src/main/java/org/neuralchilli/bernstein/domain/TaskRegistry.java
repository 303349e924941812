package org.neuralchilli.bernstein.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tasks keyed by name, in registration order.
 * Registration order is the stable tie-break used when ordering tasks.
 */
public final class TaskRegistry {

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, Integer> positions = new LinkedHashMap<>();

    /**
     * Register a task.
     *
     * @throws DuplicateTaskException if a task with the same name is already registered
     */
    public Task register(Task task) {
        if (tasks.containsKey(task.name())) {
            throw new DuplicateTaskException(task.name());
        }
        positions.put(task.name(), tasks.size());
        tasks.put(task.name(), task);
        return task;
    }

    public Optional<Task> lookup(String name) {
        return Optional.ofNullable(tasks.get(name));
    }

    public boolean contains(String name) {
        return tasks.containsKey(name);
    }

    /**
     * Position of the task in registration order, or -1 if unknown
     */
    public int indexOf(String name) {
        return positions.getOrDefault(name, -1);
    }

    /**
     * Name for the next task declared without one: T1, T2, ...
     * Skips names already taken.
     */
    public String nextName() {
        int id = tasks.size() + 1;
        while (tasks.containsKey("T" + id)) {
            id++;
        }
        return "T" + id;
    }

    public List<Task> tasks() {
        return new ArrayList<>(tasks.values());
    }

    public int size() {
        return tasks.size();
    }
}
