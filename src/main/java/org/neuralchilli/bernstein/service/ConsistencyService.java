package org.neuralchilli.bernstein.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.bernstein.config.BernsteinConfig;
import org.neuralchilli.bernstein.domain.ExecutionResult;
import org.neuralchilli.bernstein.domain.TaskSystem;
import org.neuralchilli.bernstein.domain.VariableRegistry;
import org.neuralchilli.bernstein.worker.SystemExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Random;

/**
 * Dynamic checks that compare variable histories across executions.
 * These are statistical: equal histories support determinism but do not prove it.
 */
@ApplicationScoped
public class ConsistencyService {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyService.class);

    @Inject
    BernsteinConfig config;

    @Inject
    SystemExecutor executor;

    @Inject
    ParallelizerService parallelizer;

    /**
     * Give every variable the system touches a random initial value in [0, random-bound).
     * Variables are visited in name order, so a seeded Random gives reproducible values.
     */
    public void randomizeVariables(TaskSystem system, VariableRegistry variables, Random random) {
        for (String name : system.memoryCells()) {
            int value = random.nextInt(config.randomBound());
            variables.lookupOrCreate(name).initialize(value);
            log.debug("Initialized {} with {}", name, value);
        }
    }

    /**
     * Execute the system several times from the same initial state and check that every
     * variable ends up with the same history each time.
     */
    public boolean areHistoriesEqual(TaskSystem system, VariableRegistry variables) {
        return areHistoriesEqual(system, variables, config.historyRuns());
    }

    public boolean areHistoriesEqual(TaskSystem system, VariableRegistry variables, int runs) {
        List<ExecutionResult> results = executor.run(system, variables, runs, false);
        ExecutionResult first = results.get(0);

        for (ExecutionResult result : results.subList(1, results.size())) {
            if (!result.sameHistories(first)) {
                log.warn("{}: run {} diverged from run 1: {} vs {}",
                        system.name(), result.run(), result.histories(), first.histories());
                return false;
            }
        }
        return true;
    }

    /**
     * Execute both systems from the same initial state and compare the histories of every
     * variable they share.
     */
    public boolean isEquivalent(TaskSystem system, TaskSystem other, VariableRegistry variables) {
        ExecutionResult left = executor.runOnce(system, variables, false);
        ExecutionResult right = executor.runOnce(other, variables, false);

        boolean equivalent = left.sameSharedHistories(right);
        if (!equivalent) {
            log.warn("'{}' and '{}' are not equivalent: {} vs {}",
                    system.name(), other.name(), left.histories(), right.histories());
        }
        return equivalent;
    }

    /**
     * Randomized consistency test: parallelize the system, then for each round randomize
     * the variables and check that the parallelized system has stable histories and
     * matches the source system. The variables' initial values are restored afterwards.
     */
    public ConsistencyReport checkConsistency(TaskSystem system, VariableRegistry variables, Random random) {
        return checkConsistency(system, variables, random, config.testRounds());
    }

    public ConsistencyReport checkConsistency(
            TaskSystem system,
            VariableRegistry variables,
            Random random,
            int rounds
    ) {
        if (rounds < 1) {
            throw new IllegalArgumentException("rounds must be >= 1, got: " + rounds);
        }

        TaskSystem parallel = parallelizer.parallelize(system);
        List<String> failures = new ArrayList<>();

        // Rounds overwrite the initial values
        Map<String, OptionalInt> initialValues = variables.initialValues();
        try {
            for (int round = 1; round <= rounds; round++) {
                randomizeVariables(system, variables, random);

                if (!areHistoriesEqual(parallel, variables)) {
                    failures.add("round " + round + ": histories of '" + parallel.name() + "' differ between runs");
                } else if (!isEquivalent(system, parallel, variables)) {
                    failures.add("round " + round + ": '" + parallel.name() + "' is not equivalent to '" + system.name() + "'");
                }
            }
        } finally {
            variables.restore(initialValues);
        }

        ConsistencyReport report = new ConsistencyReport(parallel.name(), rounds, failures);
        log.info("{}", report);
        return report;
    }

    /**
     * Outcome of a randomized consistency test.
     */
    public record ConsistencyReport(String systemName, int rounds, List<String> failures) {
        public ConsistencyReport {
            failures = List.copyOf(failures);
        }

        public boolean isValid() {
            return failures.isEmpty();
        }

        @Override
        public String toString() {
            return isValid()
                    ? String.format("Consistency test of '%s' is valid (%d rounds)", systemName, rounds)
                    : String.format("Consistency test of '%s' is INVALID (%d/%d rounds failed): %s",
                    systemName, failures.size(), rounds, failures);
        }
    }
}
