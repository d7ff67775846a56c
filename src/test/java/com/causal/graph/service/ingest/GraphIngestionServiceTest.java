package com.causal.graph.service.ingest;

import com.causal.graph.service.config.MetricsConfig;
import com.causal.graph.service.error.InvalidAnalysisIdException;
import com.causal.graph.service.store.AnalysisStage;
import com.causal.graph.service.store.FileSystemArtifactStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphIngestionServiceTest {

    private static final String SMALL_GRAPH = "dag { X [exposure]\n Y [outcome]\n X -> Y }";

    @TempDir
    Path workDir;

    private Path outputDir;
    private Path keptFile;
    private FileSystemArtifactStore store;
    private GraphIngestionService service;

    @BeforeEach
    void setUp() throws Exception {
        outputDir = Files.createDirectories(workDir.resolve("output"));
        keptFile = Files.writeString(workDir.resolve("keep.txt"), "keep");
        var metrics = new MetricsConfig(new SimpleMeterRegistry());
        store = new FileSystemArtifactStore(outputDir, metrics);
        service = new GraphIngestionService(store, new DagittyParser(), metrics);
    }

    @ParameterizedTest
    @ValueSource(strings = {"..", ".", "../x", "../output", "a/b", "x y"})
    @DisplayName("Ingesting under an id outside the store is refused before anything is deleted")
    void refusesUnsafeIds(String analysisId) {
        assertThatThrownBy(() -> service.ingestDagitty(analysisId, 2, SMALL_GRAPH))
                .isInstanceOf(InvalidAnalysisIdException.class)
                .hasMessageContaining(analysisId);

        assertThat(keptFile).exists();
        assertThat(outputDir).exists().isEmptyDirectory();
    }

    @Test
    @DisplayName("A blank id is replaced by one derived from exposure, outcome and degree")
    void derivesId() {
        var id = service.ingestDagitty(" ", 3, SMALL_GRAPH);

        assertThat(id).isEqualTo("X_Y_degree3");
        assertThat(store.findGraph(id, AnalysisStage.INGEST)).isPresent();
    }

    @Test
    @DisplayName("Re-ingesting replaces the graph and drops downstream artifacts")
    void reingestReplaces() {
        service.ingestDagitty("run-1", 2, SMALL_GRAPH);
        store.putGraph("run-1", AnalysisStage.PRUNING, store.getGraph("run-1", AnalysisStage.INGEST));

        service.ingestDagitty("run-1", 2, "dag { X [exposure]\n Y [outcome]\n Z -> X\n Z -> Y }");

        assertThat(store.getGraph("run-1", AnalysisStage.INGEST).nodeCount()).isEqualTo(3);
        assertThat(store.findGraph("run-1", AnalysisStage.PRUNING)).isEmpty();
        assertThat(keptFile).exists();
    }
}
