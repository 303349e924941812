package org.neuralchilli.bernstein.config;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.neuralchilli.bernstein.TestSystems;
import org.neuralchilli.bernstein.domain.CompositionException;
import org.neuralchilli.bernstein.domain.DuplicateTaskException;
import org.neuralchilli.bernstein.domain.Instruction;
import org.neuralchilli.bernstein.domain.TaskSystem;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.neuralchilli.bernstein.domain.Instruction.*;

/**
 * Tests for YamlParser.
 */
@QuarkusTest
class YamlParserTest {

    @Inject
    YamlParser yamlParser;

    @Test
    void shouldParseBundledDemo() throws Exception {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("systems/demo.yaml")) {
            TaskSystem system = yamlParser.parseSystem(in);

            assertThat(system).isEqualTo(TestSystems.demo());
        }
    }

    @Test
    void shouldParseInstructions() {
        // Given: One task using every instruction form
        String yaml = """
                name: all-forms
                tasks:
                  - name: T1
                    instructions:
                      - assign: x
                        value: 3
                      - assign: y
                        value: {div: [x, 2]}
                      - sleep: 2
                      - print: {sub: [y, 1]}
                """;

        // When: Parse
        TaskSystem system = yamlParser.parseSystem(yaml);

        // Then: Instructions are built in order
        assertThat(system.name()).isEqualTo("all-forms");
        assertThat(system.task("T1").instructions()).containsExactly(
                assign("x", 3),
                assign("y", div(read("x"), constant(2))),
                sleep(2),
                print(sub(read("y"), constant(1)))
        );
    }

    @Test
    void shouldNameTasksWithoutName() {
        String yaml = """
                name: unnamed
                tasks:
                  - instructions:
                      - assign: x
                        value: 1
                  - depends_on: T1
                    instructions:
                      - print: x
                """;

        TaskSystem system = yamlParser.parseSystem(yaml);

        assertThat(system.getTaskNames()).containsExactly("T1", "T2");
        assertThat(system.task("T2").dependencies()).containsExactly("T1");
    }

    @Test
    void shouldRejectDuplicateTaskNames() {
        String yaml = """
                name: dup
                tasks:
                  - name: T1
                  - name: T1
                """;

        assertThatThrownBy(() -> yamlParser.parseSystem(yaml))
                .isInstanceOf(DuplicateTaskException.class)
                .hasMessage("Task 'T1' already exists");
    }

    @Test
    void shouldRejectSleepAsValue() {
        String yaml = """
                name: bad
                tasks:
                  - name: T1
                    instructions:
                      - assign: x
                        value: {sleep: 1}
                """;

        assertThatThrownBy(() -> yamlParser.parseSystem(yaml))
                .isInstanceOf(CompositionException.class);
    }

    @Test
    void shouldRejectUnknownDependency() {
        String yaml = """
                name: missing
                tasks:
                  - name: T1
                    depends_on: [ghost]
                """;

        assertThatThrownBy(() -> yamlParser.parseSystem(yaml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void shouldRejectMissingName() {
        assertThatThrownBy(() -> yamlParser.parseSystem("tasks: []"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing required field: name");
    }

    @Test
    void shouldRejectEmptyDocument() {
        assertThatThrownBy(() -> yamlParser.parseSystem(""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void shouldRejectListDocument() {
        assertThatThrownBy(() -> yamlParser.parseSystem("- a\n- b\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be a map");
    }

    @Test
    void shouldRejectSyntaxError() {
        assertThatThrownBy(() -> yamlParser.parseSystem("name: [\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed system definition")
                .hasCauseInstanceOf(YAMLException.class);
    }

    @Test
    void shouldRejectMalformedOperator() {
        assertThatThrownBy(() -> yamlParser.parseInstruction(Map.of("add", List.of(1))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exactly 2 operands");
    }

    @Test
    void shouldRejectUnknownInstruction() {
        assertThatThrownBy(() -> yamlParser.parseInstruction(Map.of("jump", 3)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown instruction");
    }

    @Test
    void shouldParseScalarNodes() {
        Instruction constant = yamlParser.parseInstruction(42);
        Instruction variable = yamlParser.parseInstruction("x");

        assertThat(constant).isEqualTo(constant(42));
        assertThat(variable).isEqualTo(read("x"));
    }
}
