package org.neuralchilli.bernstein.render;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.neuralchilli.bernstein.TestSystems;
import org.neuralchilli.bernstein.service.CycleDetectedException;
import org.neuralchilli.bernstein.service.ParallelizerService;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@QuarkusTest
class DotRendererTest {

    @Inject
    DotRenderer renderer;

    @Inject
    ParallelizerService parallelizer;

    @Test
    void shouldRenderNodesAndEdges() {
        String dot = renderer.render(TestSystems.demo());

        assertThat(dot).contains("digraph \"demo\"");
        assertThat(dot).contains("\"T1\" -> \"T2\"");
        assertThat(dot).contains("\"T3\" -> \"T4\"");
        assertThat(dot).contains("shape=\"box\"");
        assertThat(dot).contains("T1\\nx = (10 + 30)\\nsleep(1)");
    }

    @Test
    void shouldWriteSanitizedFile() throws Exception {
        Path directory = Files.createTempDirectory("graphs");
        Path file = renderer.write(parallelizer.parallelize(TestSystems.demo()), directory);

        assertThat(file.getFileName().toString()).isEqualTo("demo_-_Parallelized.gv");
        String dot = Files.readString(file);
        assertThat(dot).contains("\"T2\" -> \"T4\"");
        assertThat(dot).doesNotContain("\"T1\" -> \"T2\"");
    }

    @Test
    void shouldSanitizeFileName() {
        assertThat(DotRenderer.fileName("demo - Sequential")).isEqualTo("demo_-_Sequential.gv");
        assertThat(DotRenderer.fileName("a/b")).isEqualTo("a_b.gv");
    }

    @Test
    void shouldRejectCyclicSystem() {
        assertThatThrownBy(() -> renderer.render(TestSystems.cyclic()))
                .isInstanceOf(CycleDetectedException.class);
    }
}
