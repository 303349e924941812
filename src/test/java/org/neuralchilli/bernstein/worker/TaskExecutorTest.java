package org.neuralchilli.bernstein.worker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.bernstein.domain.ExecutionContext;
import org.neuralchilli.bernstein.domain.Task;
import org.neuralchilli.bernstein.domain.VariableRegistry;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.bernstein.domain.Instruction.*;

class TaskExecutorTest {

    private final TaskExecutor executor = new TaskExecutor();

    private VariableRegistry variables;

    @BeforeEach
    void setup() {
        variables = new VariableRegistry();
    }

    @Test
    void shouldExecuteInstructionsInOrder() {
        Task task = Task.builder("T1")
                .instruction(assign("x", 1))
                .instruction(assign("x", add(read("x"), constant(1))))
                .instruction(sleep(1))
                .instruction(print(read("x")))
                .build();
        ExecutionContext context = new ExecutionContext(variables, false);

        TaskExecutor.TaskResult result = executor.execute(task, context);

        assertThat(result.taskName()).isEqualTo("T1");
        assertThat(result.executed()).isEqualTo(4);
        assertThat(result.hasSkipped()).isFalse();
        assertThat(variables.valueOf("x")).hasValue(2);
        assertThat(context.transcript()).containsExactly("x = 2");
    }

    @Test
    void shouldSkipInstructionReadingUnsetVariable() {
        Task task = Task.builder("T1")
                .instruction(assign("y", read("x")))
                .instruction(assign("z", 5))
                .build();

        TaskExecutor.TaskResult result = executor.execute(task, new ExecutionContext(variables, false));

        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.executed()).isEqualTo(1);
        assertThat(variables.valueOf("y")).isEmpty();
        assertThat(variables.valueOf("z")).hasValue(5);
    }

    @Test
    void shouldSkipDivisionByZero() {
        Task task = Task.builder("T1").instruction(assign("q", div(constant(4), constant(0)))).build();

        TaskExecutor.TaskResult result = executor.execute(task, new ExecutionContext(variables, true));

        assertThat(result.hasSkipped()).isTrue();
        assertThat(variables.lookupOrCreate("q").history()).hasSize(1);
    }
}
