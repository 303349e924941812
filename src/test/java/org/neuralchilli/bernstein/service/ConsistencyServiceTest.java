package org.neuralchilli.bernstein.service;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.neuralchilli.bernstein.TestSystems;
import org.neuralchilli.bernstein.config.BernsteinConfig;
import org.neuralchilli.bernstein.domain.ExecutionResult;
import org.neuralchilli.bernstein.domain.Task;
import org.neuralchilli.bernstein.domain.TaskSystem;
import org.neuralchilli.bernstein.domain.VariableRegistry;
import org.neuralchilli.bernstein.worker.SystemExecutor;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.bernstein.domain.Instruction.*;

@QuarkusTest
class ConsistencyServiceTest {

    @Inject
    ConsistencyService consistency;

    @Inject
    SystemExecutor executor;

    @Inject
    BernsteinConfig config;

    @Test
    void shouldRandomizeReproduciblyFromSeed() {
        VariableRegistry first = new VariableRegistry();
        VariableRegistry second = new VariableRegistry();

        consistency.randomizeVariables(TestSystems.demo(), first, new Random(7));
        consistency.randomizeVariables(TestSystems.demo(), second, new Random(7));

        for (String name : List.of("n", "x", "y", "z")) {
            assertThat(first.valueOf(name)).isPresent();
            assertThat(first.valueOf(name).getAsInt()).isBetween(0, 99);
            assertThat(first.valueOf(name)).isEqualTo(second.valueOf(name));
        }
    }

    @Test
    void shouldFindStableHistoriesForDeterministicSystem() {
        VariableRegistry variables = new VariableRegistry();
        consistency.randomizeVariables(TestSystems.demo(), variables, new Random(1));

        assertThat(consistency.areHistoriesEqual(TestSystems.demo(), variables, 5)).isTrue();
    }

    @Test
    void shouldFindSourceEquivalentToItself() {
        assertThat(consistency.isEquivalent(TestSystems.demo(), TestSystems.demo(), new VariableRegistry())).isTrue();
    }

    @Test
    void shouldDetectDifferentHistories() {
        TaskSystem once = TaskSystem.builder("once")
                .task(Task.builder("A").instruction(assign("x", 1)).build())
                .build();
        TaskSystem twice = TaskSystem.builder("twice")
                .task(Task.builder("A").instruction(assign("x", 1)).build())
                .task(Task.builder("B").instruction(assign("x", 2)).dependsOn("A").build())
                .build();

        assertThat(consistency.isEquivalent(once, twice, new VariableRegistry())).isFalse();
    }

    @Test
    void shouldValidateDemo() {
        ConsistencyService.ConsistencyReport report =
                consistency.checkConsistency(TestSystems.demo(), new VariableRegistry(), new Random(42));

        assertThat(report.isValid()).isTrue();
        assertThat(report.systemName()).isEqualTo("demo - Parallelized");
        assertThat(report.rounds()).isEqualTo(config.testRounds());
        assertThat(report.rounds()).isGreaterThanOrEqualTo(10);
        assertThat(report.toString()).contains("is valid");
    }

    @Test
    void shouldLeaveUnsetVariablesUnsetAfterTest() {
        VariableRegistry variables = new VariableRegistry();
        ExecutionResult before = executor.runOnce(TestSystems.demo(), variables, false);

        consistency.checkConsistency(TestSystems.demo(), variables, new Random(42), 3);
        ExecutionResult after = executor.runOnce(TestSystems.demo(), variables, false);

        assertThat(after.historyOf("x")).containsExactly(OptionalInt.empty(), OptionalInt.of(40));
        assertThat(after.sameHistories(before)).isTrue();
    }

    @Test
    void shouldKeepSeededValuesAfterTest() {
        VariableRegistry variables = new VariableRegistry();
        consistency.randomizeVariables(TestSystems.demo(), variables, new Random(7));
        Map<String, OptionalInt> seeded = variables.initialValues();

        consistency.checkConsistency(TestSystems.demo(), variables, new Random(42), 3);

        assertThat(variables.initialValues()).isEqualTo(seeded);
        assertThat(variables.valueOf("y")).isEqualTo(seeded.get("y"));
    }

    @Test
    void shouldRejectZeroRounds() {
        assertThatThrownBy(() -> consistency.checkConsistency(
                TestSystems.demo(), new VariableRegistry(), new Random(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDescribeFailedReport() {
        ConsistencyService.ConsistencyReport report = new ConsistencyService.ConsistencyReport(
                "s", 2, List.of("round 1: histories differ"));

        assertThat(report.isValid()).isFalse();
        assertThat(report.toString()).contains("INVALID").contains("1/2");
    }
}
