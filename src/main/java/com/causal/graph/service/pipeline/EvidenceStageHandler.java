package com.causal.graph.service.pipeline;

import com.causal.graph.service.enrichment.EvidenceProvider;
import com.causal.graph.service.graph.GraphEdge;
import com.causal.graph.service.store.AnalysisStage;
import com.causal.graph.service.store.ArtifactStore;
import com.causal.graph.service.store.ArtifactTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

/**
 * Attaches literature citations to the edges of every confounder subgraph.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvidenceStageHandler implements StageHandler {

    public static final String EVIDENCE = "confounder_evidence";
    static final String SENTENCE_SEPARATOR = " | ";

    private final ArtifactStore artifactStore;
    private final EvidenceProvider evidenceProvider;

    @Override
    public Map<String, Object> run(String analysisId) {
        var subgraphEdges = artifactStore.getTable(analysisId, AnalysisStage.CONFOUNDERS,
                ConfoundersStageHandler.SUBGRAPH_EDGES);
        var edges = new LinkedHashSet<GraphEdge>();
        for (Map<String, String> row : subgraphEdges.asMaps()) {
            edges.add(GraphEdge.of(row.get("from"), row.get("to")));
        }

        var citations = evidenceProvider.citationsFor(edges);
        var builder = ArtifactTable.builder("from", "to", "pmid", "pmid_url", "sentence_count", "sentences");
        citations.forEach(c -> builder.row(c.from(), c.to(), c.pmid(), c.url(),
                c.sentences().size(), String.join(SENTENCE_SEPARATOR, c.sentences())));
        artifactStore.putTable(analysisId, getStage(), EVIDENCE, builder.build());

        long edgesWithEvidence = citations.stream()
                .map(c -> GraphEdge.of(c.from(), c.to()))
                .distinct()
                .count();
        var summary = new LinkedHashMap<String, Object>();
        summary.put("edges", edges.size());
        summary.put("edgesWithEvidence", edgesWithEvidence);
        summary.put("citations", citations.size());
        return summary;
    }

    @Override
    public AnalysisStage getStage() {
        return AnalysisStage.EVIDENCE;
    }
}
