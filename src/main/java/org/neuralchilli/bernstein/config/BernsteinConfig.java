package org.neuralchilli.bernstein.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Invocation options. Set in application.properties, as -Dbernstein.* system
 * properties or as BERNSTEIN_* environment variables.
 */
@ConfigMapping(prefix = "bernstein")
public interface BernsteinConfig {

    /**
     * YAML system definition; the bundled demo system when absent
     */
    Optional<String> definition();

    /**
     * Seed for randomized variables; epoch seconds when absent
     */
    OptionalLong seed();

    @WithDefault("1")
    int loops();

    @WithDefault("true")
    boolean verbose();

    /**
     * Run the system as declared
     */
    @WithDefault("false")
    boolean run();

    @WithDefault("false")
    boolean parallelize();

    @WithDefault("false")
    boolean sequential();

    /**
     * Randomized consistency test of the parallelized system
     */
    @WithDefault("false")
    boolean test();

    /**
     * Give every variable a random initial value before running
     */
    @WithDefault("false")
    boolean randomize();

    @WithName("worker-threads")
    @WithDefault("4")
    int workerThreads();

    /**
     * Executions compared when checking that histories are stable
     */
    @WithName("history-runs")
    @WithDefault("3")
    int historyRuns();

    @WithName("test-rounds")
    @WithDefault("10")
    int testRounds();

    /**
     * Exclusive upper bound of randomized initial values
     */
    @WithName("random-bound")
    @WithDefault("100")
    int randomBound();

    Render render();

    interface Render {

        @WithDefault("false")
        boolean enabled();

        @WithDefault("graphs")
        String directory();
    }
}
