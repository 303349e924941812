package org.neuralchilli.bernstein.domain;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of one execution of a system: the history of every variable it touches
 * and the lines its print instructions produced.
 */
public record ExecutionResult(
        String systemName,
        int run,
        Map<String, List<OptionalInt>> histories,
        List<String> transcript,
        Duration elapsed
) {
    public ExecutionResult {
        if (systemName == null || systemName.isBlank()) {
            throw new IllegalArgumentException("System name cannot be null or empty");
        }
        if (run < 1) {
            throw new IllegalArgumentException("Run number must be >= 1, got: " + run);
        }
        histories = histories != null ? Map.copyOf(histories) : Map.of();
        transcript = transcript != null ? List.copyOf(transcript) : List.of();
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    public List<OptionalInt> historyOf(String variable) {
        List<OptionalInt> history = histories.get(variable);
        if (history == null) {
            throw new IllegalArgumentException("Variable '" + variable + "' is not used by system '" + systemName + "'");
        }
        return history;
    }

    /**
     * Final value of a variable after the run
     */
    public OptionalInt finalValue(String variable) {
        List<OptionalInt> history = historyOf(variable);
        return history.get(history.size() - 1);
    }

    /**
     * True if both results hold identical histories for every variable
     */
    public boolean sameHistories(ExecutionResult other) {
        return histories.equals(other.histories);
    }

    /**
     * True if both results hold identical histories for every variable they share
     */
    public boolean sameSharedHistories(ExecutionResult other) {
        Set<String> shared = new TreeSet<>(histories.keySet());
        shared.retainAll(other.histories.keySet());
        for (String variable : shared) {
            if (!histories.get(variable).equals(other.histories.get(variable))) {
                return false;
            }
        }
        return true;
    }
}
