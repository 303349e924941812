package org.neuralchilli.bernstein.worker;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.bernstein.config.BernsteinConfig;
import org.neuralchilli.bernstein.core.JGraphTService;
import org.neuralchilli.bernstein.domain.ExecutionContext;
import org.neuralchilli.bernstein.domain.ExecutionResult;
import org.neuralchilli.bernstein.domain.TaskStatus;
import org.neuralchilli.bernstein.domain.TaskSystem;
import org.neuralchilli.bernstein.domain.VariableRegistry;
import org.neuralchilli.bernstein.service.SystemValidatorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs task systems on a fixed pool of worker threads.
 *
 * A task is submitted as soon as all of its dependencies have completed in the current
 * execution, so independent tasks run concurrently. Variables are not locked: for a
 * deterministic system the dependency edges already keep conflicting tasks apart.
 */
@ApplicationScoped
public class SystemExecutor {

    private static final Logger log = LoggerFactory.getLogger(SystemExecutor.class);

    @Inject
    BernsteinConfig config;

    @Inject
    JGraphTService jGraphTService;

    @Inject
    SystemValidatorService validator;

    @Inject
    TaskExecutor taskExecutor;

    private ExecutorService executorService;

    @PostConstruct
    void init() {
        int threads = config.workerThreads();
        if (threads < 1) {
            throw new IllegalArgumentException("bernstein.worker-threads must be >= 1, got: " + threads);
        }
        executorService = Executors.newFixedThreadPool(threads, new WorkerThreadFactory("task-worker"));
        log.info("SystemExecutor initialized with {} worker threads", threads);
    }

    /**
     * Execute the system {@code loops} times, each time from the variables' initial state.
     *
     * @return one result per execution, in order
     * @throws org.neuralchilli.bernstein.service.CycleDetectedException if the system is cyclic
     */
    public List<ExecutionResult> run(TaskSystem system, VariableRegistry variables, int loops, boolean verbose) {
        if (loops < 1) {
            throw new IllegalArgumentException("loops must be >= 1, got: " + loops);
        }

        validator.requireAcyclic(system);
        if (!validator.isDeterministic(system)) {
            log.warn("System '{}' is not deterministic: variable histories may differ between runs",
                    system.name());
        }

        DirectedAcyclicGraph<String, DefaultEdge> dag = jGraphTService.buildDAG(system);
        system.memoryCells().forEach(variables::lookupOrCreate);

        List<ExecutionResult> results = new ArrayList<>();
        for (int run = 1; run <= loops; run++) {
            if (verbose) {
                log.info("──────── {} (run {}/{}) ────────", system.name(), run, loops);
            }
            results.add(runOnce(system, dag, variables, run, verbose));
        }

        log.info("{}: {}", system.name(), jGraphTService.getStatistics(dag));
        return results;
    }

    /**
     * Execute the system once.
     */
    public ExecutionResult runOnce(TaskSystem system, VariableRegistry variables, boolean verbose) {
        return run(system, variables, 1, verbose).get(0);
    }

    private ExecutionResult runOnce(
            TaskSystem system,
            DirectedAcyclicGraph<String, DefaultEdge> dag,
            VariableRegistry variables,
            int run,
            boolean verbose
    ) {
        variables.reset();
        ExecutionContext context = new ExecutionContext(variables, verbose);

        Map<String, TaskStatus> state = new HashMap<>();
        system.getTaskNames().forEach(name -> state.put(name, TaskStatus.PENDING));

        CompletionService<TaskExecutor.TaskResult> completion =
                new ExecutorCompletionService<>(executorService);
        Comparator<String> registrationOrder = Comparator.comparingInt(system::indexOf);

        Instant start = Instant.now();
        int completed = 0;
        int skipped = 0;

        try {
            while (completed < system.size()) {
                // Submit every task whose dependencies are all done
                List<String> ready = new ArrayList<>(jGraphTService.findReadyTasks(dag, state));
                ready.sort(registrationOrder);
                for (String name : ready) {
                    state.put(name, TaskStatus.RUNNING);
                    completion.submit(() -> taskExecutor.execute(system.task(name), context));
                }

                TaskExecutor.TaskResult result = await(completion);
                state.put(result.taskName(), TaskStatus.COMPLETED);
                skipped += result.skipped();
                completed++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Execution of system '" + system.name() + "' was interrupted", e);
        }

        Duration elapsed = Duration.between(start, Instant.now());
        if (skipped > 0) {
            log.debug("{}: {} instructions skipped in run {}", system.name(), skipped, run);
        }
        log.debug("{}: run {} finished in {}ms", system.name(), run, elapsed.toMillis());

        return new ExecutionResult(
                system.name(),
                run,
                variables.histories(system.memoryCells()),
                context.transcript(),
                elapsed
        );
    }

    private TaskExecutor.TaskResult await(CompletionService<TaskExecutor.TaskResult> completion)
            throws InterruptedException {
        Future<TaskExecutor.TaskResult> done = completion.take();
        try {
            return done.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task execution failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    /**
     * Stop the worker pool gracefully.
     */
    @PreDestroy
    void stop() {
        if (executorService == null) {
            return;
        }

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate in 10 seconds, forcing shutdown");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("Worker pool stopped");
    }

    /**
     * Thread factory for creating named worker threads.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);
        private final String prefix;

        WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName(prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
