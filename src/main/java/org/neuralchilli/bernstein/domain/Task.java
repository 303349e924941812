package org.neuralchilli.bernstein.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A named, ordered sequence of instructions with the names of the tasks that must
 * complete before it may start.
 * Immutable: the graph transforms build new tasks through {@link #withDependencies(List)}.
 */
public final class Task {

    private final String name;
    private final List<Instruction> instructions;
    private final List<String> dependencies;
    private final Set<String> readDomain;
    private final Set<String> writeDomain;

    public Task(String name, List<Instruction> instructions, List<String> dependencies) {
        // Validation
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name cannot be null or empty");
        }

        if (!name.matches("^[A-Za-z0-9_-]+$")) {
            throw new IllegalArgumentException(
                    "Task name must match pattern ^[A-Za-z0-9_-]+$, got: " + name
            );
        }

        List<String> deps = dependencies != null ? List.copyOf(dependencies) : List.of();
        if (Set.copyOf(deps).size() != deps.size()) {
            throw new IllegalArgumentException("Task '" + name + "' lists a dependency more than once: " + deps);
        }

        this.name = name;
        this.instructions = instructions != null ? List.copyOf(instructions) : List.of();
        this.dependencies = deps;

        // Domains never change once the instruction list is fixed
        Set<String> reads = new TreeSet<>();
        Set<String> writes = new TreeSet<>();
        for (Instruction instruction : this.instructions) {
            reads.addAll(instruction.reads());
            writes.addAll(instruction.writes());
        }
        this.readDomain = Collections.unmodifiableSet(reads);
        this.writeDomain = Collections.unmodifiableSet(writes);
    }

    public String name() {
        return name;
    }

    public List<Instruction> instructions() {
        return instructions;
    }

    /**
     * Names of the tasks that must complete before this one starts
     */
    public List<String> dependencies() {
        return dependencies;
    }

    public Set<String> readDomain() {
        return readDomain;
    }

    public Set<String> writeDomain() {
        return writeDomain;
    }

    /**
     * Every variable this task touches (read or write)
     */
    public Set<String> memoryCells() {
        Set<String> cells = new TreeSet<>(readDomain);
        cells.addAll(writeDomain);
        return cells;
    }

    /**
     * Bernstein's conditions: two tasks interfere when one writes a variable the other
     * reads or writes.
     *
     * @return true if running both concurrently could change the outcome
     */
    public boolean isInterfering(Task other) {
        return !Collections.disjoint(writeDomain, other.readDomain)
                || !Collections.disjoint(writeDomain, other.writeDomain)
                || !Collections.disjoint(readDomain, other.writeDomain);
    }

    /**
     * Copy of this task with another dependency list. Instructions are immutable and shared.
     */
    public Task withDependencies(List<String> newDependencies) {
        return new Task(name, instructions, newDependencies);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        Task that = (Task) obj;
        return Objects.equals(this.name, that.name) &&
                Objects.equals(this.instructions, that.instructions) &&
                Objects.equals(this.dependencies, that.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, instructions, dependencies);
    }

    @Override
    public String toString() {
        return "Task[" +
                "name=" + name + ", " +
                "instructions=" + instructions + ", " +
                "dependencies=" + dependencies + ']';
    }

    /**
     * Builder for creating tasks fluently
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private final List<Instruction> instructions = new ArrayList<>();
        private List<String> dependsOn = List.of();

        public Builder(String name) {
            this.name = name;
        }

        public Builder instruction(Instruction instruction) {
            this.instructions.add(instruction);
            return this;
        }

        public Builder instructions(List<Instruction> instructions) {
            this.instructions.addAll(instructions);
            return this;
        }

        public Builder dependsOn(String... dependsOn) {
            this.dependsOn = List.of(dependsOn);
            return this;
        }

        public Builder dependsOn(List<String> dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        public Task build() {
            return new Task(name, instructions, dependsOn);
        }
    }
}
