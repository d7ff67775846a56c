package com.causal.graph.service.pipeline;

import com.causal.graph.service.config.AnalysisConfig;
import com.causal.graph.service.config.MetricsConfig;
import com.causal.graph.service.engine.HubPruner;
import com.causal.graph.service.engine.LeafRemover;
import com.causal.graph.service.engine.PruningReport;
import com.causal.graph.service.engine.RemovalImpact;
import com.causal.graph.service.store.AnalysisStage;
import com.causal.graph.service.store.ArtifactStore;
import com.causal.graph.service.store.ArtifactTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prunes generic hubs using the centrality tables, optionally trims leaves, and
 * records the before/after impact on the SCC structure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PruningStageHandler implements StageHandler {

    public static final String IMPACT = "node_removal_impact";
    public static final String SUMMARY = "node_removal_summary";
    public static final String PRUNED_NODES = "pruned_nodes";
    public static final String REMOVED_LEAVES = "removed_leaves";

    private final ArtifactStore artifactStore;
    private final HubPruner hubPruner;
    private final LeafRemover leafRemover;
    private final AnalysisConfig analysisConfig;
    private final MetricsConfig metricsConfig;

    @Override
    public Map<String, Object> run(String analysisId) {
        var graph = artifactStore.getGraph(analysisId, AnalysisStage.INGEST);
        var topByDegree = artifactStore.getTable(analysisId, AnalysisStage.CENTRALITY,
                CentralityStageHandler.TOP_BY_DEGREE).column("node");
        var topByBetweenness = artifactStore.getTable(analysisId, AnalysisStage.CENTRALITY,
                CentralityStageHandler.TOP_BY_BETWEENNESS).column("node");
        var betweenness = betweennessByNode(artifactStore.getTable(analysisId, AnalysisStage.CENTRALITY,
                CentralityStageHandler.ALL_NODES));

        var report = hubPruner.prune(graph, topByDegree, topByBetweenness, betweenness);
        var pruned = report.prunedGraph();
        metricsConfig.getNodesPruned().increment(report.candidates().size());

        int leavesRemoved = 0;
        if (analysisConfig.getPruning().isRemoveLeaves()) {
            var leaves = leafRemover.removeLeaves(pruned);
            pruned = leaves.graph();
            leavesRemoved = leaves.removedNodes().size();
            var table = ArtifactTable.builder("node");
            leaves.removedNodes().forEach(table::row);
            artifactStore.putTable(analysisId, getStage(), REMOVED_LEAVES, table.build());
        }

        artifactStore.putGraph(analysisId, getStage(), pruned);
        artifactStore.putTable(analysisId, getStage(), IMPACT, impactTable(report.individual()));
        artifactStore.putTable(analysisId, getStage(), SUMMARY, summaryTable(report));
        artifactStore.putTable(analysisId, getStage(), PRUNED_NODES, statusTable(report));

        var summary = new LinkedHashMap<String, Object>();
        summary.put("pruned", report.candidates());
        summary.put("leavesRemoved", leavesRemoved);
        summary.put("sccNodesBefore", report.baseline().nodesInLargeComponents());
        summary.put("sccNodesAfter", report.combined().after().nodesInLargeComponents());
        summary.put("isDagAfter", report.combined().isDagAfter());
        summary.put("nodesAfter", pruned.nodeCount());
        summary.put("edgesAfter", pruned.edgeCount());
        return summary;
    }

    @Override
    public AnalysisStage getStage() {
        return AnalysisStage.PRUNING;
    }

    // ==================== Tables ====================

    private ArtifactTable impactTable(List<RemovalImpact> impacts) {
        var builder = ArtifactTable.builder(
                "node", "in_degree", "out_degree", "total_degree", "betweenness", "edges_removed",
                "scc_nodes_before", "scc_nodes_after", "scc_node_reduction", "reduction_pct",
                "large_sccs_after", "largest_scc_after", "is_dag_after");
        impacts.forEach(impact -> builder.row(
                impact.label(), impact.inDegree(), impact.outDegree(), impact.totalDegree(),
                impact.betweenness(), impact.edgesRemoved(),
                impact.before().nodesInLargeComponents(), impact.after().nodesInLargeComponents(),
                impact.sccNodeReduction(), impact.reductionPercent(),
                impact.after().largeComponentCount(), impact.after().largestComponentSize(),
                impact.isDagAfter()));
        return builder.build();
    }

    private ArtifactTable summaryTable(PruningReport report) {
        var baseline = report.baseline();
        var combined = report.combined();
        return ArtifactTable.builder(
                        "scenario", "nodes_removed", "edges_removed", "large_sccs", "scc_nodes",
                        "largest_scc", "scc_node_reduction", "reduction_pct", "is_dag")
                .row("baseline", "", 0, baseline.largeComponentCount(), baseline.nodesInLargeComponents(),
                        baseline.largestComponentSize(), 0, 0.0, baseline.isDag())
                .row("all_candidates", combined.nodes(), combined.edgesRemoved(),
                        combined.after().largeComponentCount(), combined.after().nodesInLargeComponents(),
                        combined.after().largestComponentSize(), combined.sccNodeReduction(),
                        combined.reductionPercent(), combined.isDagAfter())
                .build();
    }

    private ArtifactTable statusTable(PruningReport report) {
        var builder = ArtifactTable.builder("node", "status");
        report.candidates().forEach(node -> builder.row(node, "pruned"));
        report.notInTopN().forEach(node -> builder.row(node, "not_in_top_n"));
        report.protectedSkipped().forEach(node -> builder.row(node, "protected"));
        report.absent().forEach(node -> builder.row(node, "absent"));
        return builder.build();
    }

    private Map<String, Double> betweennessByNode(ArtifactTable table) {
        var nodes = table.column("node");
        var values = table.column("betweenness");
        var result = new HashMap<String, Double>();
        for (int i = 0; i < nodes.size(); i++) {
            result.put(nodes.get(i), Double.parseDouble(values.get(i)));
        }
        return result;
    }
}
