package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.testutil.TestGraphs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CycleEnumeratorTest {

    private final SccDecomposer decomposer = new SccDecomposer();

    private CycleReport enumerate(CausalGraph graph, int maxSaved) {
        return new CycleEnumerator(maxSaved, 1_000).enumerate(graph, decomposer.decompose(graph));
    }

    // ==================== Counting ====================

    @Test
    @DisplayName("A ring has exactly one cycle through every member")
    void ring() {
        var report = enumerate(TestGraphs.ring("A", "B", "C", "D", "E"), 10);

        assertThat(report.totalCycles()).isEqualTo(1);
        assertThat(report.participation())
                .extracting(CycleReport.NodeParticipation::cycleCount)
                .containsOnly(1L)
                .hasSize(5);
        assertThat(report.samples()).singleElement()
                .satisfies(cycle -> assertThat(cycle.asPath()).isEqualTo("A -> B -> C -> D -> E -> A"));
    }

    @Test
    @DisplayName("Complete digraph on 3 nodes has 5 cycles")
    void completeThree() {
        var report = enumerate(TestGraphs.complete(3), 10);

        assertThat(report.totalCycles()).isEqualTo(5);
        assertThat(report.lengthHistogram()).containsEntry(2, 3L).containsEntry(3, 2L);
        assertThat(report.participation())
                .extracting(CycleReport.NodeParticipation::cycleCount)
                .containsOnly(4L);
    }

    @Test
    @DisplayName("Complete digraph on 4 nodes has 20 cycles with exact participation")
    void completeFour() {
        var report = enumerate(TestGraphs.complete(4), 100);

        assertThat(report.totalCycles()).isEqualTo(20);
        assertThat(report.lengthHistogram())
                .containsEntry(2, 6L).containsEntry(3, 8L).containsEntry(4, 6L);
        assertThat(report.participation())
                .allSatisfy(row -> assertThat(row.cycleCount()).isEqualTo(15L));
        assertThat(report.samples()).hasSize(20);
    }

    @Test
    @DisplayName("Disjoint SCCs are enumerated separately and merged")
    void separateComponents() {
        var report = enumerate(separateComponentsGraph(), 10);

        assertThat(report.components()).hasSize(2);
        assertThat(report.totalsByComponent().values()).containsExactly(1L, 1L);
        assertThat(report.lengthHistogram()).containsEntry(2, 1L).containsEntry(3, 1L);
    }

    @Test
    @DisplayName("A DAG has no cycles")
    void dag() {
        var graph = CausalGraph.builder().exposure("X").outcome("Y").edge("X", "Y").build();

        var report = enumerate(graph, 10);

        assertThat(report.totalCycles()).isZero();
        assertThat(report.components()).isEmpty();
    }

    // ==================== Invariants ====================

    static Stream<Arguments> invariantGraphs() {
        return Stream.of(
                Arguments.of("ring", TestGraphs.ring("A", "B", "C", "D", "E")),
                Arguments.of("K3", TestGraphs.complete(3)),
                Arguments.of("K4", TestGraphs.complete(4)),
                Arguments.of("separate components", separateComponentsGraph()),
                Arguments.of("literature graph", TestGraphs.literatureGraph()),
                Arguments.of("DAG with a self-loop", CausalGraph.builder().exposure("X").outcome("Y")
                        .edge("X", "Y").edge("Y", "Y").build())
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("invariantGraphs")
    @DisplayName("Participation sums to total cycle length and is_dag holds exactly when no cycle is found")
    void participationAndDagInvariants(String name, CausalGraph graph) {
        var partition = decomposer.decompose(graph);
        var report = new CycleEnumerator(1, 1_000).enumerate(graph, partition);

        long participationSum = report.participation().stream()
                .mapToLong(CycleReport.NodeParticipation::cycleCount)
                .sum();
        long lengthSum = report.lengthHistogram().entrySet().stream()
                .mapToLong(entry -> entry.getKey() * entry.getValue())
                .sum();

        assertThat(participationSum).isEqualTo(lengthSum);
        assertThat(partition.isDag()).isEqualTo(report.totalCycles() == 0);
    }

    // ==================== Sampling ====================

    @Test
    @DisplayName("Samples are capped while counts stay exact")
    void samplesCapped() {
        var report = enumerate(TestGraphs.complete(4), 5);

        assertThat(report.totalCycles()).isEqualTo(20);
        assertThat(report.samples()).hasSize(5);
        assertThat(report.samples()).isSortedAccordingTo(
                (a, b) -> Long.compare(a.sequence(), b.sequence()));
    }

    @Test
    @DisplayName("Per-length quota spreads samples over every cycle length")
    void samplesCoverLengths() {
        var report = enumerate(TestGraphs.complete(4), 6);

        assertThat(report.samples())
                .extracting(CycleRecord::length)
                .containsOnly(2, 3, 4);
    }

    @Test
    @DisplayName("A zero cap still counts every cycle")
    void zeroCap() {
        var report = enumerate(TestGraphs.complete(3), 0);

        assertThat(report.totalCycles()).isEqualTo(5);
        assertThat(report.samples()).isEmpty();
    }

    @Test
    @DisplayName("Invalid limits are rejected")
    void invalidLimits() {
        assertThatThrownBy(() -> new CycleEnumerator(-1, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CycleEnumerator(10, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static CausalGraph separateComponentsGraph() {
        return CausalGraph.builder().exposure("X").outcome("Y")
                .edge("A", "B").edge("B", "A")
                .edge("C", "D").edge("D", "E").edge("E", "C")
                .build();
    }
}
