package org.neuralchilli.bernstein.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
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
 * Rewrites a task system into a single chain following one topological order.
 * Ties between tasks with no remaining constraint go to the one registered first.
 */
@ApplicationScoped
public class SequentializerService {

    private static final Logger log = LoggerFactory.getLogger(SequentializerService.class);

    public static final String SUFFIX = " - Sequential";

    @Inject
    JGraphTService jGraphTService;

    @Inject
    SystemValidatorService validator;

    /**
     * @return a new system whose tasks each depend on exactly the previous one
     * @throws CycleDetectedException if the source system is cyclic
     */
    public TaskSystem sequentialize(TaskSystem system) {
        validator.requireAcyclic(system);

        DirectedAcyclicGraph<String, DefaultEdge> dag = jGraphTService.buildDAG(system);
        List<String> order = jGraphTService.getTopologicalOrder(
                dag,
                Comparator.comparingInt(system::indexOf)
        );

        List<Task> chain = new ArrayList<>();
        String previous = null;
        for (String name : order) {
            List<String> dependencies = previous == null ? List.of() : List.of(previous);
            chain.add(system.task(name).withDependencies(dependencies));
            previous = name;
        }

        TaskSystem sequential = new TaskSystem(system.name() + SUFFIX, chain);
        log.info("Sequentialized '{}': {}", system.name(), String.join(" -> ", order));
        return sequential;
    }
}
