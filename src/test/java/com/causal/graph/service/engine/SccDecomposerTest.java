package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.testutil.TestGraphs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SccDecomposerTest {

    private final SccDecomposer decomposer = new SccDecomposer();

    @Test
    @DisplayName("A ring forms one large component; isolated nodes are singletons")
    void ringIsOneComponent() {
        var partition = decomposer.decompose(TestGraphs.ring("A", "B", "C"));

        assertThat(partition.componentCount()).isEqualTo(3);
        assertThat(partition.largeComponents()).singleElement()
                .satisfies(component -> assertThat(component.members()).containsExactly("A", "B", "C"));
        assertThat(partition.componentOf("A")).isEqualTo(partition.componentOf("C"));
        assertThat(partition.componentOf("X")).isNotEqualTo(partition.componentOf("Y"));
        assertThat(partition.isDag()).isFalse();
        assertThat(partition.sizeHistogram()).containsEntry(1, 2).containsEntry(3, 1);
    }

    @Test
    @DisplayName("Component ids start at 1 and follow first-node order")
    void componentIdsFollowGraphOrder() {
        var graph = CausalGraph.builder().exposure("X").outcome("Y")
                .edge("B", "C").edge("C", "B")
                .edge("X", "A").edge("A", "X")
                .build();

        var partition = decomposer.decompose(graph);

        assertThat(partition.componentOf("X")).isEqualTo(1);
        assertThat(partition.componentOf("A")).isEqualTo(1);
        assertThat(partition.componentOf("Y")).isEqualTo(2);
        assertThat(partition.componentOf("B")).isEqualTo(3);
        assertThat(partition.nodesInLargeComponents()).isEqualTo(4);
    }

    @Test
    @DisplayName("A self-loop does not make a large component")
    void selfLoopIsNotLarge() {
        var graph = CausalGraph.builder().exposure("X").outcome("Y")
                .edge("X", "Y").edge("Z", "Z")
                .build();

        assertThat(decomposer.isDag(graph)).isTrue();
        assertThat(SccStats.of(decomposer.decompose(graph)))
                .isEqualTo(new SccStats(0, 0, 1, true));
    }

    @Test
    @DisplayName("Two cycles joined by a one-way edge stay separate")
    void oneWayBridge() {
        var graph = CausalGraph.builder().exposure("X").outcome("Y")
                .edge("A", "B").edge("B", "A")
                .edge("B", "C")
                .edge("C", "D").edge("D", "C")
                .build();

        var partition = decomposer.decompose(graph);

        assertThat(partition.largeComponents()).hasSize(2);
        assertThat(partition.componentOf("A")).isNotEqualTo(partition.componentOf("C"));
    }

    @Test
    @DisplayName("Long chains and rings do not overflow the stack")
    void deepGraph() {
        var builder = CausalGraph.builder().exposure("N0").outcome("Y");
        int length = 50_000;
        for (int i = 0; i < length; i++) {
            builder.edge("N" + i, "N" + (i + 1));
        }
        builder.edge("N" + length, "N0");

        var partition = decomposer.decompose(builder.build());

        assertThat(partition.largestComponentSize()).isEqualTo(length + 1);
        assertThat(partition.largeComponents()).hasSize(1);
    }
}
