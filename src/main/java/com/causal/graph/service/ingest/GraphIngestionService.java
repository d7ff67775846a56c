package com.causal.graph.service.ingest;

import com.causal.graph.service.config.AnalysisConfig;
import com.causal.graph.service.config.MetricsConfig;
import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.graph.NameInterner;
import com.causal.graph.service.store.AnalysisIds;
import com.causal.graph.service.store.AnalysisStage;
import com.causal.graph.service.store.ArtifactStore;
import com.causal.graph.service.store.ArtifactTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Validates incoming graphs and stores them as the first stage of an analysis.
 * Re-ingesting under an existing id discards every downstream artifact.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphIngestionService {

    public static final String METADATA_KEY = "metadata";

    private final ArtifactStore artifactStore;
    private final DagittyParser dagittyParser;
    private final MetricsConfig metricsConfig;

    /**
     * Parses DAGitty text and stores it.
     *
     * @param analysisId id to store under, or {@code null} to derive it from the graph
     * @return the id the graph was stored under
     */
    public String ingestDagitty(String analysisId, int degree, String text) {
        var graph = dagittyParser.parse(text);
        return ingest(analysisId, degree, graph, "dagitty");
    }

    public String ingest(String analysisId, int degree, CausalGraph graph, String source) {
        var id = AnalysisIds.requireValid(
                analysisId != null && !analysisId.isBlank() ? analysisId : deriveId(graph, degree));

        if (artifactStore.delete(id)) {
            log.info("Replacing existing analysis {}", id);
        }
        artifactStore.putGraph(id, AnalysisStage.INGEST, graph);
        artifactStore.putTable(id, AnalysisStage.INGEST, METADATA_KEY, metadata(graph, degree, source));
        metricsConfig.getGraphsIngested().increment();

        log.info("Graph ingested: {} (nodes={}, edges={}, exposure={}, outcome={})",
                id, graph.nodeCount(), graph.edgeCount(), graph.exposure(), graph.outcome());
        return id;
    }

    static String deriveId(CausalGraph graph, int degree) {
        return AnalysisConfig.analysisId(
                NameInterner.sanitize(graph.exposure()),
                NameInterner.sanitize(graph.outcome()),
                degree);
    }

    private ArtifactTable metadata(CausalGraph graph, int degree, String source) {
        return ArtifactTable.builder("exposure", "outcome", "degree", "node_count", "edge_count", "source")
                .row(graph.exposure(), graph.outcome(), degree, graph.nodeCount(), graph.edgeCount(), source)
                .build();
    }
}
