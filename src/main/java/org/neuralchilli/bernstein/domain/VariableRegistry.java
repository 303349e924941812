package org.neuralchilli.bernstein.domain;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Store of named variables shared by the systems evaluated in one invocation.
 * Variables are created on first lookup and never removed.
 * Each invocation (or test) owns its own registry, so systems can be evaluated in isolation.
 */
public final class VariableRegistry {

    private final ConcurrentMap<String, Variable> variables = new ConcurrentHashMap<>();

    /**
     * Return the variable with this name, creating it (unset) if it does not exist yet.
     */
    public Variable lookupOrCreate(String name) {
        return variables.computeIfAbsent(name, Variable::new);
    }

    public void assign(String name, int value) {
        lookupOrCreate(name).assign(value);
    }

    public OptionalInt valueOf(String name) {
        return lookupOrCreate(name).value();
    }

    /**
     * Reset every variable to its initial state.
     */
    public void reset() {
        variables.values().forEach(Variable::reset);
    }

    /**
     * Initial value of every variable, keyed and sorted by name.
     */
    public Map<String, OptionalInt> initialValues() {
        Map<String, OptionalInt> result = new TreeMap<>();
        variables.forEach((name, variable) -> result.put(name, variable.initialValue()));
        return result;
    }

    /**
     * Put back initial values taken with {@link #initialValues()} and reset every variable.
     * Variables missing from the snapshot start unset.
     */
    public void restore(Map<String, OptionalInt> initialValues) {
        variables.forEach((name, variable) ->
                variable.initialize(initialValues.getOrDefault(name, OptionalInt.empty())));
    }

    public Set<String> names() {
        return new TreeSet<>(variables.keySet());
    }

    /**
     * Snapshot of the histories of the given variables, keyed and sorted by name.
     */
    public Map<String, List<OptionalInt>> histories(Collection<String> names) {
        Map<String, List<OptionalInt>> result = new TreeMap<>();
        for (String name : names) {
            result.put(name, lookupOrCreate(name).history());
        }
        return result;
    }

    @Override
    public String toString() {
        return "VariableRegistry[" + new TreeMap<>(variables).values() + "]";
    }
}
