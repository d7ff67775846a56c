package com.causal.graph.service.pipeline;

import com.causal.graph.service.engine.ButterflyAnalysis;
import com.causal.graph.service.engine.ButterflyBiasDetector;
import com.causal.graph.service.engine.ConfounderComparison;
import com.causal.graph.service.engine.StructuralGraph;
import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.store.AnalysisStage;
import com.causal.graph.service.store.ArtifactStore;
import com.causal.graph.service.store.ArtifactTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checks the valid confounders for butterfly structures on the cycle-broken graph and
 * emits a DAGitty definition with identifier-safe names.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ButterflyStageHandler implements StageHandler {

    public static final String ANALYSIS = "butterfly_analysis";
    public static final String BUTTERFLY_NODES = "butterfly_nodes";
    public static final String INDEPENDENT = "independent_confounders";
    public static final String COMPARISON = "confounder_comparison";
    public static final String DAG_DEFINITION = "dag_definition";
    public static final String NAME_MAPPING = "name_mapping";

    private final ArtifactStore artifactStore;
    private final ButterflyBiasDetector detector;

    @Override
    public Map<String, Object> run(String analysisId) {
        var graph = sourceGraph(analysisId);
        var confounders = artifactStore.getTable(analysisId, AnalysisStage.CONFOUNDERS,
                ConfoundersStageHandler.VALID).column("node");

        var structural = StructuralGraph.of(graph);
        var analysis = detector.detect(structural, confounders);
        var comparison = detector.compare(confounders, detector.structuralConfounders(structural));

        artifactStore.putTable(analysisId, getStage(), ANALYSIS, analysisTable(analysis));
        artifactStore.putTable(analysisId, getStage(), BUTTERFLY_NODES, nodeTable(analysis.butterflies()));
        artifactStore.putTable(analysisId, getStage(), INDEPENDENT, nodeTable(analysis.independent()));
        artifactStore.putTable(analysisId, getStage(), COMPARISON, comparisonTable(comparison));
        artifactStore.putTable(analysisId, getStage(), DAG_DEFINITION, dagTable(structural.toDagitty()));
        var mapping = ArtifactTable.builder("original", "safe_id");
        structural.names().changedNames().forEach(m -> mapping.row(m.original(), m.safeId()));
        artifactStore.putTable(analysisId, getStage(), NAME_MAPPING, mapping.build());

        if (!comparison.agrees()) {
            log.warn("Confounder sets disagree for {}: pipeline-only={}, structural-only={}",
                    analysisId, comparison.pipelineOnly(), comparison.structuralOnly());
        }

        var summary = new LinkedHashMap<String, Object>();
        summary.put("confounders", analysis.records().size());
        summary.put("independent", analysis.independent().size());
        summary.put("singleParent", analysis.singleParent().size());
        summary.put("butterflies", analysis.butterflies().size());
        summary.put("safeToAdjust", analysis.safeToAdjust());
        summary.put("setsAgree", comparison.agrees());
        return summary;
    }

    @Override
    public AnalysisStage getStage() {
        return AnalysisStage.BUTTERFLY;
    }

    private CausalGraph sourceGraph(String analysisId) {
        var broken = artifactStore.findGraph(analysisId, AnalysisStage.CYCLE_BREAKING);
        if (broken.isPresent()) {
            return broken.get();
        }
        log.warn("No cycle-broken graph for {}, falling back to the pruned graph", analysisId);
        return artifactStore.getGraph(analysisId, AnalysisStage.PRUNING);
    }

    // ==================== Tables ====================

    private ArtifactTable analysisTable(ButterflyAnalysis analysis) {
        var builder = ArtifactTable.builder(
                "confounder", "confounder_parent_count", "confounder_parents", "is_butterfly",
                "category", "recommendation");
        analysis.records().forEach(r -> builder.row(r.confounder(), r.confounderParentCount(),
                r.confounderParents(), r.isButterfly(), r.category().name(), r.category().getRecommendation()));
        return builder.build();
    }

    private ArtifactTable nodeTable(Iterable<String> nodes) {
        var builder = ArtifactTable.builder("node");
        nodes.forEach(builder::row);
        return builder.build();
    }

    private ArtifactTable comparisonTable(ConfounderComparison comparison) {
        var builder = ArtifactTable.builder("node", "status");
        comparison.both().forEach(node -> builder.row(node, "both"));
        comparison.pipelineOnly().forEach(node -> builder.row(node, "pipeline_only"));
        comparison.structuralOnly().forEach(node -> builder.row(node, "structural_only"));
        return builder.build();
    }

    private ArtifactTable dagTable(String dagitty) {
        var builder = ArtifactTable.builder("line");
        dagitty.lines().forEach(builder::row);
        return builder.build();
    }
}
