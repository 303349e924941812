package org.neuralchilli.bernstein.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A named mutable integer cell.
 * Every assignment is appended to the history; the first history entry is the
 * initial state (unset unless the variable was initialized).
 */
public final class Variable {

    private final String name;
    private OptionalInt initialValue = OptionalInt.empty();
    private final List<OptionalInt> history = new ArrayList<>();

    public Variable(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name cannot be null or empty");
        }
        this.name = name;
        this.history.add(initialValue);
    }

    public String name() {
        return name;
    }

    /**
     * Current value, i.e. the most recent history entry.
     */
    public synchronized OptionalInt value() {
        return history.get(history.size() - 1);
    }

    public synchronized void assign(int value) {
        history.add(OptionalInt.of(value));
    }

    /**
     * Set the value the variable starts with on every reset, and reset it.
     */
    public synchronized void initialize(int value) {
        initialize(OptionalInt.of(value));
    }

    /**
     * Same as {@link #initialize(int)}; an empty value makes the variable start unset.
     */
    public synchronized void initialize(OptionalInt value) {
        this.initialValue = value;
        reset();
    }

    public synchronized OptionalInt initialValue() {
        return initialValue;
    }

    /**
     * Drop every assignment, keeping only the initial state.
     */
    public synchronized void reset() {
        history.clear();
        history.add(initialValue);
    }

    public synchronized List<OptionalInt> history() {
        return List.copyOf(history);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        Variable that = (Variable) obj;
        // Variables are identified by name only
        return Objects.equals(this.name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        OptionalInt current = value();
        return "Variable[" + name + "=" + (current.isPresent() ? current.getAsInt() : "unset") + "]";
    }
}
