package org.neuralchilli.bernstein.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.bernstein.domain.*;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.InputStream;
import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Parses YAML system definitions into {@link TaskSystem}s.
 *
 * <pre>
 * name: demo
 * tasks:
 *   - name: T1
 *     instructions:
 *       - assign: x
 *         value: {add: [10, 30]}
 *       - sleep: 1
 *   - name: T2
 *     depends_on: [T1]
 *     instructions:
 *       - print: x
 * </pre>
 *
 * Instruction nodes: an integer is a constant, a string reads a variable, a map holds
 * one of assign/add/sub/mul/div/sleep/print.
 */
@ApplicationScoped
public class YamlParser {

    private static final Set<String> OPERATORS = Set.of("add", "sub", "mul", "div");

    private final Yaml yaml = new Yaml();

    /**
     * Parse a system definition from YAML string
     */
    public TaskSystem parseSystem(String yamlContent) {
        return parseSystemFromMap(load(() -> yaml.load(yamlContent)));
    }

    /**
     * Parse a system definition from InputStream
     */
    public TaskSystem parseSystem(InputStream inputStream) {
        return parseSystemFromMap(load(() -> yaml.load(inputStream)));
    }

    /**
     * Parse a single instruction node
     */
    public Instruction parseInstruction(Object node) {
        if (node instanceof Integer) {
            return Instruction.constant((Integer) node);
        }
        if (node instanceof String) {
            return Instruction.read((String) node);
        }
        if (!(node instanceof Map)) {
            throw new IllegalArgumentException("Unsupported instruction: " + node);
        }

        Map<String, Object> map = asStringMap((Map<?, ?>) node);

        if (map.containsKey("assign")) {
            String variable = getString(map, "assign", true);
            if (!map.containsKey("value")) {
                throw new IllegalArgumentException("Missing required field: value (assign to '" + variable + "')");
            }
            return Instruction.assign(variable, parseInstruction(map.get("value")));
        }

        if (map.containsKey("sleep")) {
            return Instruction.sleep(getInt(map, "sleep", 0));
        }

        if (map.containsKey("print")) {
            return Instruction.print(parseInstruction(map.get("print")));
        }

        Optional<String> operator = map.keySet().stream().filter(OPERATORS::contains).findFirst();
        if (operator.isPresent()) {
            Object operands = map.get(operator.get());
            if (!(operands instanceof List) || ((List<?>) operands).size() != 2) {
                throw new IllegalArgumentException(
                        "Operator '" + operator.get() + "' needs a list of exactly 2 operands, got: " + operands
                );
            }
            List<?> list = (List<?>) operands;
            return new Instruction.Arithmetic(
                    Operator.fromString(operator.get()),
                    parseInstruction(list.get(0)),
                    parseInstruction(list.get(1))
            );
        }

        throw new IllegalArgumentException("Unknown instruction: " + map.keySet());
    }

    private Map<String, Object> load(Supplier<Object> loader) {
        Object document;
        try {
            document = loader.get();
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Malformed system definition: " + e.getMessage(), e);
        }

        if (document == null) {
            throw new IllegalArgumentException("System definition is empty");
        }
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("System definition must be a map, got: " + document);
        }
        return asStringMap((Map<?, ?>) document);
    }

    @SuppressWarnings("unchecked")
    private TaskSystem parseSystemFromMap(Map<String, Object> data) {

        String name = getString(data, "name", true);
        Object tasksNode = data.get("tasks");
        if (!(tasksNode instanceof List)) {
            throw new IllegalArgumentException("System '" + name + "' must have a list of tasks");
        }

        TaskRegistry registry = new TaskRegistry();
        for (Object taskNode : (List<Object>) tasksNode) {
            if (!(taskNode instanceof Map)) {
                throw new IllegalArgumentException("Task definition must be a map, got: " + taskNode);
            }
            registry.register(parseTaskFromMap(asStringMap((Map<?, ?>) taskNode), registry));
        }

        return TaskSystem.of(name, registry);
    }

    private Task parseTaskFromMap(Map<String, Object> data, TaskRegistry registry) {
        String name = getString(data, "name", false);
        if (name == null) {
            name = registry.nextName();
        }

        List<String> dependsOn = getStringList(data, "depends_on", List.of());

        List<Instruction> instructions = new ArrayList<>();
        Object instructionsNode = data.get("instructions");
        if (instructionsNode instanceof List) {
            for (Object node : (List<?>) instructionsNode) {
                instructions.add(parseInstruction(node));
            }
        } else if (instructionsNode != null) {
            throw new IllegalArgumentException("Instructions of task '" + name + "' must be a list");
        }

        return new Task(name, instructions, dependsOn);
    }

    // Helper methods for type-safe extraction

    private Map<String, Object> asStringMap(Map<?, ?> raw) {
        Map<String, Object> result = new LinkedHashMap<>();
        raw.forEach((k, v) -> result.put(k.toString(), v));
        return result;
    }

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    private List<String> getStringList(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream()
                    .map(Object::toString)
                    .collect(Collectors.toList());
        }
        // A single dependency may be written without a list
        return List.of(value.toString());
    }
}
