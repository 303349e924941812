package org.neuralchilli.bernstein;

import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.neuralchilli.bernstein.config.BernsteinConfig;
import org.neuralchilli.bernstein.config.YamlParser;
import org.neuralchilli.bernstein.domain.CompositionException;
import org.neuralchilli.bernstein.domain.DuplicateTaskException;
import org.neuralchilli.bernstein.domain.ExecutionResult;
import org.neuralchilli.bernstein.domain.TaskSystem;
import org.neuralchilli.bernstein.domain.VariableRegistry;
import org.neuralchilli.bernstein.render.DotRenderer;
import org.neuralchilli.bernstein.service.ConsistencyService;
import org.neuralchilli.bernstein.service.CycleDetectedException;
import org.neuralchilli.bernstein.service.ParallelizerService;
import org.neuralchilli.bernstein.service.SequentializerService;
import org.neuralchilli.bernstein.service.SystemValidatorService;
import org.neuralchilli.bernstein.worker.SystemExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;
import java.util.Random;
import java.util.TreeMap;

/**
 * Command-mode entry point.
 * Loads a system definition (first argument, bernstein.definition, or the bundled demo),
 * then runs, parallelizes, sequentializes and/or tests it as configured.
 */
@QuarkusMain
public class BernsteinApplication implements QuarkusApplication {

    private static final Logger log = LoggerFactory.getLogger(BernsteinApplication.class);

    static final String DEMO_SYSTEM = "systems/demo.yaml";

    @Inject
    BernsteinConfig config;

    @Inject
    YamlParser yamlParser;

    @Inject
    SystemValidatorService validator;

    @Inject
    SystemExecutor executor;

    @Inject
    ParallelizerService parallelizer;

    @Inject
    SequentializerService sequentializer;

    @Inject
    ConsistencyService consistency;

    @Inject
    DotRenderer renderer;

    @Override
    public int run(String... args) {
        if (config.loops() < 1) {
            log.error("ERROR: bernstein.loops must be > 0, got: {}", config.loops());
            return 1;
        }

        long seed = config.seed().orElse(System.currentTimeMillis() / 1000);
        Random random = new Random(seed);
        VariableRegistry variables = new VariableRegistry();

        try {
            TaskSystem system = loadSystem(args);
            validator.requireAcyclic(system);
            log.info("Loaded system '{}' with {} tasks (deterministic: {})",
                    system.name(), system.size(), validator.isDeterministic(system));

            if (config.randomize()) {
                consistency.randomizeVariables(system, variables, random);
            }
            render(system);

            if (config.test()) {
                log.info("──────── Test ────────");
                ConsistencyService.ConsistencyReport report = consistency.checkConsistency(system, variables, random);
                if (!report.isValid()) {
                    return 2;
                }
            }

            if (config.run()) {
                report(executor.run(system, variables, config.loops(), config.verbose()));
            }

            if (config.parallelize()) {
                TaskSystem parallel = parallelizer.parallelize(system);
                render(parallel);
                report(executor.run(parallel, variables, config.loops(), config.verbose()));
            }

            if (config.sequential()) {
                TaskSystem sequential = sequentializer.sequentialize(system);
                render(sequential);
                report(executor.run(sequential, variables, config.loops(), config.verbose()));
            }

            return 0;

        } catch (CycleDetectedException | DuplicateTaskException | CompositionException
                 | IllegalArgumentException | IllegalStateException | IOException e) {
            log.error("ERROR: {}", e.getMessage(), e);
            return 1;
        } finally {
            log.info("Seed: {}", seed);
        }
    }

    private TaskSystem loadSystem(String... args) throws IOException {
        if (args.length > 0) {
            return loadFile(Path.of(args[0]));
        }
        if (config.definition().isPresent()) {
            return loadFile(Path.of(config.definition().get()));
        }

        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(DEMO_SYSTEM)) {
            if (in == null) {
                throw new IOException("Bundled system definition not found: " + DEMO_SYSTEM);
            }
            log.info("No definition given, using bundled {}", DEMO_SYSTEM);
            return yamlParser.parseSystem(in);
        }
    }

    private TaskSystem loadFile(Path path) throws IOException {
        log.debug("Loading system from: {}", path);
        return yamlParser.parseSystem(Files.readString(path));
    }

    private void render(TaskSystem system) throws IOException {
        if (config.render().enabled()) {
            renderer.write(system, Path.of(config.render().directory()));
        }
    }

    private void report(List<ExecutionResult> results) {
        ExecutionResult last = results.get(results.size() - 1);
        log.info("{}: {} run(s), last took {}ms", last.systemName(), results.size(), last.elapsed().toMillis());
        new TreeMap<>(last.histories()).forEach((name, history) -> log.info("  {} : {}", name, format(history)));
    }

    private static String format(List<OptionalInt> history) {
        StringBuilder out = new StringBuilder("[");
        for (int i = 0; i < history.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            OptionalInt value = history.get(i);
            out.append(value.isPresent() ? Integer.toString(value.getAsInt()) : "unset");
        }
        return out.append(']').toString();
    }
}
