package org.neuralchilli.bernstein.service;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.neuralchilli.bernstein.TestSystems;
import org.neuralchilli.bernstein.domain.Task;
import org.neuralchilli.bernstein.domain.TaskSystem;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.bernstein.domain.Instruction.*;

@QuarkusTest
class SequentializerServiceTest {

    @Inject
    SequentializerService sequentializer;

    @Inject
    SystemValidatorService validator;

    @Test
    void shouldChainTasksInRegistrationOrderWhenUnconstrained() {
        TaskSystem system = TaskSystem.builder("free")
                .task(Task.builder("C").instruction(assign("z", 1)).build())
                .task(Task.builder("A").instruction(assign("x", 1)).build())
                .task(Task.builder("B").instruction(assign("y", 1)).build())
                .build();

        TaskSystem sequential = sequentializer.sequentialize(system);

        assertThat(sequential.name()).isEqualTo("free - Sequential");
        assertThat(sequential.task("C").dependencies()).isEmpty();
        assertThat(sequential.task("A").dependencies()).containsExactly("C");
        assertThat(sequential.task("B").dependencies()).containsExactly("A");
    }

    @Test
    void shouldFollowDependencies() {
        // Registered B before A, but B depends on A
        TaskSystem system = TaskSystem.builder("ordered")
                .task(Task.builder("B").instruction(print(read("x"))).dependsOn("A").build())
                .task(Task.builder("A").instruction(assign("x", 1)).build())
                .build();

        TaskSystem sequential = sequentializer.sequentialize(system);

        assertThat(sequential.task("A").dependencies()).isEmpty();
        assertThat(sequential.task("B").dependencies()).containsExactly("A");
    }

    @Test
    void shouldProduceDeterministicChain() {
        TaskSystem sequential = sequentializer.sequentialize(TestSystems.unorderedIncrement());

        assertThat(sequential.edgeCount()).isEqualTo(1);
        assertThat(validator.isCyclic(sequential)).isFalse();
        assertThat(validator.isDeterministic(sequential)).isTrue();
    }

    @Test
    void shouldKeepDemoChain() {
        TaskSystem sequential = sequentializer.sequentialize(TestSystems.demo());

        assertThat(sequential.task("T2").dependencies()).containsExactly("T1");
        assertThat(sequential.task("T3").dependencies()).containsExactly("T2");
        assertThat(sequential.task("T4").dependencies()).containsExactly("T3");
        assertThat(sequential.task("T4").instructions()).isEqualTo(TestSystems.demo().task("T4").instructions());
    }

    @Test
    void shouldHandleEmptySystem() {
        TaskSystem sequential = sequentializer.sequentialize(TaskSystem.builder("empty").build());

        assertThat(sequential.size()).isZero();
    }

    @Test
    void shouldRejectCyclicSystem() {
        assertThatThrownBy(() -> sequentializer.sequentialize(TestSystems.cyclic()))
                .isInstanceOf(CycleDetectedException.class);
    }
}
