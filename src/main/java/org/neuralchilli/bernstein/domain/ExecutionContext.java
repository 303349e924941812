package org.neuralchilli.bernstein.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State available to instructions while a system runs: the variable registry and
 * the transcript of printed lines.
 */
public final class ExecutionContext {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

    private final VariableRegistry variables;
    private final boolean verbose;
    private final List<String> transcript = Collections.synchronizedList(new ArrayList<>());

    public ExecutionContext(VariableRegistry variables, boolean verbose) {
        if (variables == null) {
            throw new IllegalArgumentException("Variable registry cannot be null");
        }
        this.variables = variables;
        this.verbose = verbose;
    }

    public VariableRegistry variables() {
        return variables;
    }

    public boolean verbose() {
        return verbose;
    }

    /**
     * Record a line produced by a print instruction.
     */
    public void emit(String line) {
        transcript.add(line);
        log.info("> {}", line);
    }

    public List<String> transcript() {
        synchronized (transcript) {
            return List.copyOf(transcript);
        }
    }
}
