package org.neuralchilli.bernstein.render;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.dot.DOTExporter;
import org.neuralchilli.bernstein.core.JGraphTService;
import org.neuralchilli.bernstein.domain.Instruction;
import org.neuralchilli.bernstein.domain.Task;
import org.neuralchilli.bernstein.domain.TaskSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders a task system as a Graphviz DOT digraph: one node per task, labelled with the
 * task name and its instructions, and one edge per dependency (dependency -> dependent).
 * Read-only with respect to the system.
 */
@ApplicationScoped
public class DotRenderer {

    private static final Logger log = LoggerFactory.getLogger(DotRenderer.class);

    @Inject
    JGraphTService jGraphTService;

    /**
     * Render the system as DOT text.
     */
    public String render(TaskSystem system) {
        StringWriter writer = new StringWriter();
        export(system, writer);
        return writer.toString();
    }

    /**
     * Write the system to {@code <directory>/<sanitized name>.gv}.
     *
     * @return the written file
     */
    public Path write(TaskSystem system, Path directory) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(fileName(system.name()));
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            export(system, writer);
        }
        log.info("Rendered '{}' to {}", system.name(), file);
        return file;
    }

    /**
     * File name for a system: anything outside [A-Za-z0-9._-] becomes an underscore.
     */
    public static String fileName(String systemName) {
        return systemName.replaceAll("[^A-Za-z0-9._-]+", "_") + ".gv";
    }

    private void export(TaskSystem system, Writer writer) {
        DirectedAcyclicGraph<String, DefaultEdge> dag = jGraphTService.buildDAG(system);

        DOTExporter<String, DefaultEdge> exporter = new DOTExporter<>(name -> "\"" + name + "\"");
        exporter.setGraphIdProvider(() -> "\"" + system.name() + "\"");
        exporter.setVertexAttributeProvider(name -> {
            Map<String, Attribute> attributes = new LinkedHashMap<>();
            attributes.put("shape", DefaultAttribute.createAttribute("box"));
            attributes.put("label", DefaultAttribute.createAttribute(label(system.task(name))));
            return attributes;
        });
        exporter.exportGraph(dag, writer);
    }

    private String label(Task task) {
        StringBuilder label = new StringBuilder(task.name());
        for (Instruction instruction : task.instructions()) {
            label.append("\\n").append(instruction);
        }
        return label.toString();
    }
}
