package com.causal.graph.service.pipeline;

import com.causal.graph.service.config.MetricsConfig;
import com.causal.graph.service.engine.CycleBreaker;
import com.causal.graph.service.engine.SccDecomposer;
import com.causal.graph.service.store.AnalysisStage;
import com.causal.graph.service.store.ArtifactStore;
import com.causal.graph.service.store.ArtifactTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class CycleBreakingStageHandler implements StageHandler {

    public static final String REMOVED_EDGES = "removed_edges";

    private final ArtifactStore artifactStore;
    private final CycleBreaker cycleBreaker;
    private final SccDecomposer sccDecomposer;
    private final MetricsConfig metricsConfig;

    @Override
    public Map<String, Object> run(String analysisId) {
        var graph = artifactStore.getGraph(analysisId, AnalysisStage.PRUNING);
        var result = cycleBreaker.breakCycles(graph);
        metricsConfig.getEdgesBroken().increment(result.removedCount());

        artifactStore.putGraph(analysisId, getStage(), result.graph());
        var table = ArtifactTable.builder("from", "to");
        result.removedEdges().forEach(edge -> table.row(edge.from(), edge.to()));
        artifactStore.putTable(analysisId, getStage(), REMOVED_EDGES, table.build());

        boolean dagAfter = sccDecomposer.isDag(result.graph());
        if (!dagAfter) {
            log.info("Graph {} still contains cycles after breaking strong confounder feedback", analysisId);
        }

        var summary = new LinkedHashMap<String, Object>();
        summary.put("edgesRemoved", result.removedCount());
        summary.put("confoundersPresent", result.confoundersPresent());
        summary.put("confoundersMissing", result.confoundersMissing());
        summary.put("isDagAfter", dagAfter);
        return summary;
    }

    @Override
    public AnalysisStage getStage() {
        return AnalysisStage.CYCLE_BREAKING;
    }
}
