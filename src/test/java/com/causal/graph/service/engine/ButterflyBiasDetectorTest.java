package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.testutil.TestGraphs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ButterflyBiasDetectorTest {

    private final ButterflyBiasDetector detector = new ButterflyBiasDetector();

    /**
     * P1, P2, B and S all confound X -> Y. B has both P1 and P2 as parents, S only P1,
     * and B carries a self-loop.
     */
    private final CausalGraph graph = CausalGraph.builder()
            .exposure("X")
            .outcome("Y")
            .edge("P1", "X").edge("P1", "Y")
            .edge("P2", "X").edge("P2", "Y")
            .edge("B", "X").edge("B", "Y")
            .edge("S", "X").edge("S", "Y")
            .edge("P1", "B").edge("P2", "B").edge("B", "B")
            .edge("P1", "S")
            .build();

    @Test
    @DisplayName("Confounders are grouped by how many confounder parents they have")
    void categories() {
        var analysis = detector.detect(StructuralGraph.of(graph), List.of("P1", "P2", "B", "S", "Ghost"));

        assertThat(analysis.independent()).containsExactly("P1", "P2");
        assertThat(analysis.singleParent()).containsExactly("S");
        assertThat(analysis.butterflies()).containsExactly("B");
        assertThat(analysis.safeToAdjust()).containsExactly("P1", "P2", "S");
        assertThat(analysis.in(ButterflyCategory.BUTTERFLY)).singleElement()
                .satisfies(record -> assertThat(record.confounderParents()).containsExactly("P1", "P2"));
    }

    @Test
    @DisplayName("Parents that are not confounders do not count")
    void nonConfounderParents() {
        var analysis = detector.detect(StructuralGraph.of(graph), List.of("B", "S"));

        assertThat(analysis.independent()).containsExactly("B", "S");
        assertThat(analysis.butterflies()).isEmpty();
    }

    @Test
    @DisplayName("A grandparent of the exposure and outcome leaves both confounders independent")
    void grandparentConfounder() {
        var graph = TestGraphs.grandparentConfounder();
        var valid = new ConfounderClassifier(3).classify(graph).validConfounders();

        var analysis = detector.detect(StructuralGraph.of(graph), valid);

        assertThat(valid).containsExactly("C1", "C2");
        assertThat(analysis.independent()).containsExactly("C1", "C2");
        assertThat(analysis.records()).allSatisfy(record -> {
            assertThat(record.confounderParentCount()).isZero();
            assertThat(record.isButterfly()).isFalse();
        });
    }

    @Test
    @DisplayName("Adding confounder parents never lowers the count and the flag stays set from two on")
    void monotoneInConfounderParents() {
        var builder = CausalGraph.builder().exposure("X").outcome("Y")
                .edge("C", "X").edge("C", "Y");
        var valid = new ArrayList<String>(List.of("C"));
        int previousCount = 0;
        boolean flagged = false;

        for (int i = 1; i <= 4; i++) {
            var parent = "P" + i;
            builder.edge(parent, "X").edge(parent, "Y").edge(parent, "C");
            valid.add(parent);

            var record = detector.detect(StructuralGraph.of(builder.build()), valid).records().stream()
                    .filter(r -> r.confounder().equals("C"))
                    .findFirst()
                    .orElseThrow();

            assertThat(record.confounderParentCount()).isEqualTo(i).isGreaterThanOrEqualTo(previousCount);
            assertThat(record.isButterfly()).isEqualTo(i >= 2);
            if (flagged) {
                assertThat(record.isButterfly()).isTrue();
            }
            flagged = record.isButterfly();
            previousCount = record.confounderParentCount();
        }
        assertThat(flagged).isTrue();
    }

    @Test
    @DisplayName("Structural confounders exclude children of exposure or outcome")
    void structuralConfounders() {
        var withFeedback = CausalGraph.builder()
                .exposure("X").outcome("Y")
                .edge("A", "X").edge("A", "Y")
                .edge("F", "X").edge("F", "Y").edge("Y", "F")
                .build();

        var structural = detector.structuralConfounders(StructuralGraph.of(withFeedback));

        assertThat(structural).containsExactly("A");
    }

    @Test
    @DisplayName("Comparison lists what each side found alone")
    void comparison() {
        var comparison = detector.compare(List.of("A", "B"), List.of("B", "C"));

        assertThat(comparison.both()).containsExactly("B");
        assertThat(comparison.pipelineOnly()).containsExactly("A");
        assertThat(comparison.structuralOnly()).containsExactly("C");
        assertThat(comparison.agrees()).isFalse();
        assertThat(detector.compare(List.of("A"), List.of("A")).agrees()).isTrue();
    }

    @Test
    @DisplayName("Structural graph answers queries by original name and exports safe ids")
    void structuralGraphNames() {
        var named = CausalGraph.builder()
                .exposure("High blood pressure")
                .outcome("Alzheimer's disease")
                .edge("Type 2 diabetes", "High blood pressure")
                .edge("Type 2 diabetes", "Alzheimer's disease")
                .build();

        var structural = StructuralGraph.of(named);

        assertThat(structural.parents("Alzheimer's disease")).containsExactly("Type 2 diabetes");
        assertThat(structural.children("Type 2 diabetes"))
                .containsExactly("High blood pressure", "Alzheimer's disease");
        assertThat(structural.toDagitty())
                .contains("High_blood_pressure [exposure]")
                .contains("Alzheimer_s_disease [outcome]")
                .contains("Type_2_diabetes -> High_blood_pressure");
    }
}
