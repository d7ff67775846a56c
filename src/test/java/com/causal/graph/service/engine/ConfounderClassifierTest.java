package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.testutil.TestGraphs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConfounderClassifierTest {

    private final ConfounderClassifier classifier = new ConfounderClassifier(3);
    private CausalGraph graph;

    /**
     * C1 returns through X -> M -> C1 (round trip 3), C2 through Y -> P -> Q -> R -> C2
     * (round trip 5), C3 has no return path and D is a child of X.
     */
    @BeforeEach
    void setUp() {
        graph = CausalGraph.builder()
                .exposure("X")
                .outcome("Y")
                .edge("C1", "X").edge("C1", "Y")
                .edge("C2", "X").edge("C2", "Y")
                .edge("C3", "X").edge("C3", "Y")
                .edge("D", "X").edge("D", "Y").edge("X", "D")
                .edge("X", "M").edge("M", "C1")
                .edge("Y", "P").edge("P", "Q").edge("Q", "R").edge("R", "C2")
                .build();
    }

    // ==================== Discovery ====================

    @Test
    @DisplayName("Candidates are the common parents; children of X or Y are invalid")
    void discovery() {
        var analysis = classifier.classify(graph);

        assertThat(analysis.candidates()).containsExactly("C1", "C2", "C3", "D");
        assertThat(analysis.validConfounders()).containsExactly("C1", "C2", "C3");
        assertThat(analysis.exposureParentCount()).isEqualTo(4);
        assertThat(analysis.records()).filteredOn(r -> r.node().equals("D")).singleElement()
                .satisfies(record -> {
                    assertThat(record.valid()).isFalse();
                    assertThat(record.childOfExposure()).isTrue();
                    assertThat(record.childOfOutcome()).isFalse();
                });
    }

    @Test
    @DisplayName("Grandparents of X and Y are not confounders")
    void grandparentsIgnored() {
        var analysis = classifier.classify(TestGraphs.grandparentConfounder());

        assertThat(analysis.validConfounders()).containsExactly("C1", "C2");
        assertThat(analysis.validRecords())
                .extracting(ConfounderRecord::classification)
                .containsOnly(ConfounderClassification.PURE_CONFOUNDER);
    }

    // ==================== Classification ====================

    @Test
    @DisplayName("Shortest round trip decides between tight, long and pure")
    void classification() {
        var analysis = classifier.classify(graph);

        var c1 = record(analysis, "C1");
        assertThat(c1.exposureCycleLength()).isEqualTo(3);
        assertThat(c1.minCycleLength()).isEqualTo(3);
        assertThat(c1.classification()).isEqualTo(ConfounderClassification.TIGHT_FEEDBACK);

        var c2 = record(analysis, "C2");
        assertThat(c2.distanceFromOutcome()).isEqualTo(4);
        assertThat(c2.outcomeCycleLength()).isEqualTo(5);
        assertThat(c2.minCycleLength()).isEqualTo(5);
        assertThat(c2.classification()).isEqualTo(ConfounderClassification.LONG_FEEDBACK);

        var c3 = record(analysis, "C3");
        assertThat(c3.hasFeedback()).isFalse();
        assertThat(c3.distanceFromExposure()).isNull();
        assertThat(c3.classification()).isEqualTo(ConfounderClassification.PURE_CONFOUNDER);

        assertThat(analysis.countsByClassification())
                .containsEntry(ConfounderClassification.TIGHT_FEEDBACK, 1L)
                .containsEntry(ConfounderClassification.LONG_FEEDBACK, 1L)
                .containsEntry(ConfounderClassification.PURE_CONFOUNDER, 1L);
    }

    @Test
    @DisplayName("Threshold is inclusive")
    void threshold() {
        assertThat(classifier.classificationFor(null)).isEqualTo(ConfounderClassification.PURE_CONFOUNDER);
        assertThat(classifier.classificationFor(2)).isEqualTo(ConfounderClassification.TIGHT_FEEDBACK);
        assertThat(classifier.classificationFor(3)).isEqualTo(ConfounderClassification.TIGHT_FEEDBACK);
        assertThat(classifier.classificationFor(4)).isEqualTo(ConfounderClassification.LONG_FEEDBACK);
    }

    // ==================== Paths and Subgraphs ====================

    @Test
    @DisplayName("Shortest paths are null or empty when unreachable")
    void shortestPaths() {
        var paths = ShortestPaths.from(graph, "Y");

        assertThat(paths.pathTo("C2")).containsExactly("Y", "P", "Q", "R", "C2");
        assertThat(paths.pathTo("Y")).containsExactly("Y");
        assertThat(paths.distanceTo("C3")).isNull();
        assertThat(paths.pathTo("C3")).isEmpty();
    }

    @Test
    @DisplayName("Confounder subgraph holds the return paths and their internal edges")
    void subgraph() {
        var subgraph = new ConfounderSubgraphExtractor().extract(graph, "C1");

        assertThat(subgraph.nodes()).startsWith("C1", "X", "Y", "M");
        assertThat(subgraph.edges()).extracting(Object::toString)
                .contains("C1 -> X", "C1 -> Y", "X -> M", "M -> C1")
                .doesNotContain("C3 -> X");
    }

    @Test
    @DisplayName("Subgraphs are extracted only for confounders present in the graph")
    void subgraphsSkipMissing() {
        var subgraphs = new ConfounderSubgraphExtractor()
                .extractAll(TestGraphs.grandparentConfounder(), List.of("C1", "Ghost"));

        assertThat(subgraphs).singleElement().satisfies(subgraph -> {
            assertThat(subgraph.nodes()).containsExactly("C1", "X", "Y");
            assertThat(subgraph.edges()).hasSize(2);
        });
    }

    private static ConfounderRecord record(ConfounderAnalysis analysis, String node) {
        return analysis.records().stream()
                .filter(r -> r.node().equals(node))
                .findFirst()
                .orElseThrow();
    }
}
