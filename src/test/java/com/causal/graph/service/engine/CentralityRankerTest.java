package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CentralityRankerTest {

    private final CentralityRanker ranker = new CentralityRanker(100);

    @Test
    @DisplayName("The middle of a chain carries the only shortest path")
    void chainBetweenness() {
        var graph = CausalGraph.builder().exposure("X").outcome("Y")
                .edge("X", "A").edge("A", "Y")
                .build();

        var table = ranker.rank(graph);

        assertThat(table.get("A")).get().extracting(NodeCentrality::betweenness).isEqualTo(1.0);
        assertThat(table.get("X")).get().extracting(NodeCentrality::betweenness).isEqualTo(0.0);
        assertThat(table.get("Y")).get().extracting(NodeCentrality::betweenness).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Parallel shortest paths split betweenness evenly")
    void diamondBetweenness() {
        var graph = CausalGraph.builder().exposure("X").outcome("Y")
                .edge("X", "A").edge("A", "Y")
                .edge("X", "B").edge("B", "Y")
                .build();

        var table = ranker.rank(graph);

        assertThat(table.get("A").orElseThrow().betweenness()).isCloseTo(0.5, within(1e-9));
        assertThat(table.get("B").orElseThrow().betweenness()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Self-loops count toward degree but not betweenness")
    void selfLoops() {
        var graph = CausalGraph.builder().exposure("X").outcome("Y")
                .edge("X", "A").edge("A", "A").edge("A", "Y")
                .build();

        var row = ranker.rank(graph).get("A").orElseThrow();

        assertThat(row.inDegree()).isEqualTo(2);
        assertThat(row.outDegree()).isEqualTo(2);
        assertThat(row.totalDegree()).isEqualTo(4);
        assertThat(row.betweenness()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Rankings sort descending and keep graph order on ties")
    void rankingOrder() {
        var graph = CausalGraph.builder().exposure("X").outcome("Y")
                .edge("H", "X").edge("H", "Y").edge("H", "A").edge("A", "H")
                .edge("B", "Y")
                .build();

        var table = ranker.rank(graph);

        assertThat(table.topByDegree(2)).extracting(NodeCentrality::node).containsExactly("H", "Y");
        assertThat(table.byDegree()).extracting(NodeCentrality::node)
                .containsExactly("H", "Y", "A", "X", "B");
        assertThat(table.topByBetweenness(1)).extracting(NodeCentrality::node).containsExactly("H");
        assertThat(table.topByBetweenness(10)).hasSize(5);
    }

    @Test
    @DisplayName("Graph statistics report density, self-loops and SCC figures")
    void statistics() {
        var graph = CausalGraph.builder().exposure("X").outcome("Y")
                .edge("X", "Y").edge("Y", "X").edge("Z", "Z")
                .build();

        var stats = GraphStatistics.of(graph, new SccDecomposer().decompose(graph));

        assertThat(stats.nodeCount()).isEqualTo(3);
        assertThat(stats.edgeCount()).isEqualTo(3);
        assertThat(stats.density()).isCloseTo(0.5, within(1e-9));
        assertThat(stats.selfLoops()).isEqualTo(1);
        assertThat(stats.largeComponentCount()).isEqualTo(1);
        assertThat(stats.isDag()).isFalse();
        assertThat(stats.exposureOutDegree()).isEqualTo(1);
    }
}
