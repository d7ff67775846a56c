package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.graph.GraphEdge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CycleBreakerTest {

    private final CausalGraph graph = CausalGraph.builder()
            .exposure("X")
            .outcome("Y")
            .edge("C1", "X").edge("C1", "Y")
            .edge("X", "C1").edge("Y", "C1")
            .edge("C2", "X").edge("X", "C2")
            .edge("X", "Y")
            .build();

    @Test
    @DisplayName("Only the exposure and outcome feedback edges of strong confounders are removed")
    void removesFeedbackEdges() {
        var breaker = new CycleBreaker(List.of("C1", "Missing"));

        var result = breaker.breakCycles(graph);

        assertThat(result.removedEdges()).containsExactly(GraphEdge.of("X", "C1"), GraphEdge.of("Y", "C1"));
        assertThat(result.confoundersPresent()).containsExactly("C1");
        assertThat(result.confoundersMissing()).containsExactly("Missing");
        assertThat(result.graph().hasEdge("C1", "X")).isTrue();
        assertThat(result.graph().hasEdge("X", "C2")).isTrue();
        assertThat(result.graph().edgeCount()).isEqualTo(graph.edgeCount() - 2);
    }

    @Test
    @DisplayName("Running twice removes nothing the second time")
    void idempotent() {
        var breaker = new CycleBreaker(List.of("C1", "Missing"));

        var first = breaker.breakCycles(graph);
        var second = breaker.breakCycles(first.graph());

        assertThat(second.removedCount()).isZero();
        assertThat(second.graph()).isEqualTo(first.graph());
    }

    @Test
    @DisplayName("The exposure or outcome listed as a strong confounder is skipped")
    void protectedNodesSkipped() {
        var result = new CycleBreaker(List.of("X", "Y")).breakCycles(graph);

        assertThat(result.removedCount()).isZero();
        assertThat(result.confoundersPresent()).isEmpty();
        assertThat(result.confoundersMissing()).isEmpty();
    }

    @Test
    @DisplayName("An empty list leaves the graph unchanged")
    void emptyList() {
        var result = new CycleBreaker(List.of()).breakCycles(graph);

        assertThat(result.graph()).isEqualTo(graph);
    }
}
