package org.neuralchilli.bernstein.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jgrapht.alg.TransitiveReduction;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.bernstein.core.JGraphTService;
import org.neuralchilli.bernstein.domain.Task;
import org.neuralchilli.bernstein.domain.TaskSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rewrites a task system so that it keeps only the dependency edges needed for determinism.
 *
 * A task keeps an ordering constraint on an ancestor only when the two interfere
 * (Bernstein's conditions). The constraint graph is then transitively reduced, giving
 * the smallest edge set with the same reachability. Pairs the source system left unordered
 * stay unordered.
 */
@ApplicationScoped
public class ParallelizerService {

    private static final Logger log = LoggerFactory.getLogger(ParallelizerService.class);

    public static final String SUFFIX = " - Parallelized";

    @Inject
    JGraphTService jGraphTService;

    @Inject
    SystemValidatorService validator;

    /**
     * @return a new system; the source system is left untouched
     * @throws CycleDetectedException if the source system is cyclic
     */
    public TaskSystem parallelize(TaskSystem system) {
        validator.requireAcyclic(system);
        if (!validator.isDeterministic(system)) {
            log.warn("Parallelizing non-deterministic system '{}': unordered interfering pairs stay unordered",
                    system.name());
        }

        DirectedAcyclicGraph<String, DefaultEdge> dag = jGraphTService.buildDAG(system);

        // Keep an edge ancestor -> task only where the two interfere
        DirectedAcyclicGraph<String, DefaultEdge> constraints =
                new DirectedAcyclicGraph<>(DefaultEdge.class);
        system.getTaskNames().forEach(constraints::addVertex);

        for (Task task : system.tasks()) {
            for (String ancestor : dag.getAncestors(task.name())) {
                if (task.isInterfering(system.task(ancestor))) {
                    constraints.addEdge(ancestor, task.name());
                }
            }
        }

        TransitiveReduction.INSTANCE.reduce(constraints);

        Comparator<String> registrationOrder = Comparator.comparingInt(system::indexOf);
        List<Task> copies = new ArrayList<>();
        for (Task task : system.tasks()) {
            List<String> dependencies = jGraphTService.getDependencies(constraints, task.name()).stream()
                    .sorted(registrationOrder)
                    .toList();
            copies.add(task.withDependencies(dependencies));
        }

        TaskSystem parallelized = new TaskSystem(system.name() + SUFFIX, copies);
        log.info("Parallelized '{}': {} -> {} dependency edges",
                system.name(), system.edgeCount(), parallelized.edgeCount());
        return parallelized;
    }
}
