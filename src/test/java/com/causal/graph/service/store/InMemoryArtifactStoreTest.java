package com.causal.graph.service.store;

import com.causal.graph.service.config.MetricsConfig;
import com.causal.graph.service.error.MissingPrerequisiteException;
import com.causal.graph.service.testutil.TestGraphs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class InMemoryArtifactStoreTest {

    private static final String ANALYSIS_ID = "ring-analysis";

    private SimpleMeterRegistry registry;
    private InMemoryArtifactStore store;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        store = new InMemoryArtifactStore(new MetricsConfig(registry));
        store.init();
    }

    @Test
    @DisplayName("Graphs and tables are stored per stage and versioned on every put")
    void putAndVersion() {
        var graph = TestGraphs.ring("A", "B");
        store.putGraph(ANALYSIS_ID, AnalysisStage.INGEST, graph);
        store.putGraph(ANALYSIS_ID, AnalysisStage.INGEST, graph);
        store.putTable(ANALYSIS_ID, AnalysisStage.CYCLES, "scc_summary",
                ArtifactTable.builder("scc_id", "size").row(1, 2).build());

        assertThat(store.getGraph(ANALYSIS_ID, AnalysisStage.INGEST)).isEqualTo(graph);
        assertThat(store.findGraph(ANALYSIS_ID, AnalysisStage.PRUNING)).isEmpty();
        assertThat(store.listArtifacts(ANALYSIS_ID))
                .extracting(ArtifactStore.ArtifactMetadata::key, ArtifactStore.ArtifactMetadata::version,
                        ArtifactStore.ArtifactMetadata::rowCount)
                .containsExactly(
                        tuple("graph", 2, 2),
                        tuple("scc_summary", 1, 1));
    }

    @Test
    @DisplayName("Reading a missing artifact names the stage that produces it")
    void missingPrerequisite() {
        assertThatThrownBy(() -> store.getTable(ANALYSIS_ID, AnalysisStage.CENTRALITY, "top_by_degree"))
                .isInstanceOf(MissingPrerequisiteException.class)
                .hasMessageContaining("ring-analysis/02_centrality/top_by_degree")
                .hasMessageContaining("CENTRALITY");
    }

    @Test
    @DisplayName("The graph key cannot be used for tables")
    void reservedKey() {
        var table = ArtifactTable.builder("a").build();

        assertThatThrownBy(() -> store.putTable(ANALYSIS_ID, AnalysisStage.INGEST, "graph", table))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Delete removes every artifact and the gauge follows the analysis count")
    void deleteAndGauge() {
        store.putGraph(ANALYSIS_ID, AnalysisStage.INGEST, TestGraphs.ring("A", "B"));
        store.putGraph("other", AnalysisStage.INGEST, TestGraphs.ring("A", "B"));

        assertThat(registry.get("causal.store.analyses.count").gauge().value()).isEqualTo(2.0);
        assertThat(store.delete(ANALYSIS_ID)).isTrue();
        assertThat(store.delete(ANALYSIS_ID)).isFalse();
        assertThat(store.exists(ANALYSIS_ID)).isFalse();
        assertThat(store.analysisIds()).containsExactly("other");
        assertThat(registry.get("causal.store.analyses.count").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Table cells format nulls, doubles and lists consistently")
    void tableFormatting() {
        var table = ArtifactTable.builder("node", "distance", "betweenness", "members")
                .row("A", null, 1.0 / 3, List.of("B", "C"))
                .build();

        assertThat(table.asMaps()).singleElement().satisfies(row -> {
            assertThat(row).containsEntry("distance", ArtifactTable.INFINITY);
            assertThat(row).containsEntry("betweenness", "0.333333");
            assertThat(row).containsEntry("members", "B;C");
        });
    }

    @Test
    @DisplayName("Rows with the wrong width are rejected")
    void rowWidth() {
        var builder = ArtifactTable.builder("a", "b").row("only-one");

        assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class);
    }
}
