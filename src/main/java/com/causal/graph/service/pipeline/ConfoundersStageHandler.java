package com.causal.graph.service.pipeline;

import com.causal.graph.service.engine.ConfounderClassifier;
import com.causal.graph.service.engine.ConfounderRecord;
import com.causal.graph.service.engine.ConfounderSubgraph;
import com.causal.graph.service.engine.ConfounderSubgraphExtractor;
import com.causal.graph.service.store.AnalysisStage;
import com.causal.graph.service.store.ArtifactStore;
import com.causal.graph.service.store.ArtifactTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds common parents of exposure and outcome, classifies their feedback and keeps
 * the valid ones along with their local subgraphs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfoundersStageHandler implements StageHandler {

    public static final String CLASSIFICATION = "confounder_classification";
    public static final String VALID = "valid_confounders";
    public static final String SUBGRAPH_EDGES = "confounder_subgraph_edges";

    private final ArtifactStore artifactStore;
    private final ConfounderClassifier confounderClassifier;
    private final ConfounderSubgraphExtractor subgraphExtractor;

    @Override
    public Map<String, Object> run(String analysisId) {
        var graph = artifactStore.getGraph(analysisId, AnalysisStage.PRUNING);
        var analysis = confounderClassifier.classify(graph);
        var valid = analysis.validConfounders();
        var subgraphs = subgraphExtractor.extractAll(graph, valid);

        artifactStore.putTable(analysisId, getStage(), CLASSIFICATION, classificationTable(analysis.records()));
        var validTable = ArtifactTable.builder("node");
        valid.forEach(validTable::row);
        artifactStore.putTable(analysisId, getStage(), VALID, validTable.build());
        artifactStore.putTable(analysisId, getStage(), SUBGRAPH_EDGES, subgraphTable(subgraphs));

        var summary = new LinkedHashMap<String, Object>();
        summary.put("exposureParents", analysis.exposureParentCount());
        summary.put("outcomeParents", analysis.outcomeParentCount());
        summary.put("candidates", analysis.records().size());
        summary.put("valid", valid.size());
        analysis.countsByClassification().forEach((type, count) -> summary.put(type.getLabel(), count));
        return summary;
    }

    @Override
    public AnalysisStage getStage() {
        return AnalysisStage.CONFOUNDERS;
    }

    private ArtifactTable classificationTable(List<ConfounderRecord> records) {
        var builder = ArtifactTable.builder(
                "node", "child_of_exposure", "child_of_outcome", "dist_from_exposure", "dist_from_outcome",
                "exposure_cycle_length", "outcome_cycle_length", "min_cycle_length", "classification", "valid");
        for (ConfounderRecord r : records) {
            builder.row(r.node(), r.childOfExposure(), r.childOfOutcome(),
                    r.distanceFromExposure(), r.distanceFromOutcome(),
                    r.exposureCycleLength(), r.outcomeCycleLength(), r.minCycleLength(),
                    r.classification().getLabel(), r.valid());
        }
        return builder.build();
    }

    private ArtifactTable subgraphTable(List<ConfounderSubgraph> subgraphs) {
        var builder = ArtifactTable.builder("confounder", "from", "to");
        for (ConfounderSubgraph subgraph : subgraphs) {
            subgraph.edges().forEach(edge -> builder.row(subgraph.confounder(), edge.from(), edge.to()));
        }
        return builder.build();
    }
}
