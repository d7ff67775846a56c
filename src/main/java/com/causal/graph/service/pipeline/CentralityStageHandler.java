package com.causal.graph.service.pipeline;

import com.causal.graph.service.engine.CentralityRanker;
import com.causal.graph.service.engine.GraphStatistics;
import com.causal.graph.service.engine.HubPruner;
import com.causal.graph.service.engine.NodeCentrality;
import com.causal.graph.service.engine.SccDecomposer;
import com.causal.graph.service.config.AnalysisConfig;
import com.causal.graph.service.enrichment.SemanticTypeLookup;
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
 * Ranks nodes of the ingested graph by degree and betweenness and records basic
 * graph statistics.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CentralityStageHandler implements StageHandler {

    public static final String ALL_NODES = "all_nodes_centrality";
    public static final String TOP_BY_DEGREE = "top_by_degree";
    public static final String TOP_BY_BETWEENNESS = "top_by_betweenness";
    public static final String GRAPH_STATISTICS = "graph_statistics";

    private static final String[] RANKED_COLUMNS = {
            "rank", "node", "total_degree", "in_degree", "out_degree", "betweenness", "is_generic", "semantic_type"
    };

    private final ArtifactStore artifactStore;
    private final CentralityRanker centralityRanker;
    private final SccDecomposer sccDecomposer;
    private final HubPruner hubPruner;
    private final SemanticTypeLookup semanticTypeLookup;
    private final AnalysisConfig analysisConfig;

    @Override
    public Map<String, Object> run(String analysisId) {
        var graph = artifactStore.getGraph(analysisId, AnalysisStage.INGEST);
        var table = centralityRanker.rank(graph);
        var statistics = GraphStatistics.of(graph, sccDecomposer.decompose(graph));
        int topN = analysisConfig.getPruning().getTopN();

        artifactStore.putTable(analysisId, getStage(), ALL_NODES, allNodesTable(table.rows()));
        artifactStore.putTable(analysisId, getStage(), TOP_BY_DEGREE, rankedTable(table.topByDegree(topN)));
        artifactStore.putTable(analysisId, getStage(), TOP_BY_BETWEENNESS, rankedTable(table.topByBetweenness(topN)));
        artifactStore.putTable(analysisId, getStage(), GRAPH_STATISTICS, statisticsTable(statistics));

        var summary = new LinkedHashMap<String, Object>();
        summary.put("nodes", statistics.nodeCount());
        summary.put("edges", statistics.edgeCount());
        summary.put("isDag", statistics.isDag());
        summary.put("largeSccs", statistics.largeComponentCount());
        summary.put("topByDegree", firstNode(table.topByDegree(1)));
        summary.put("topByBetweenness", firstNode(table.topByBetweenness(1)));
        return summary;
    }

    @Override
    public AnalysisStage getStage() {
        return AnalysisStage.CENTRALITY;
    }

    // ==================== Tables ====================

    private ArtifactTable allNodesTable(List<NodeCentrality> rows) {
        var builder = ArtifactTable.builder(
                "node", "in_degree", "out_degree", "total_degree", "betweenness", "is_generic", "semantic_type");
        rows.forEach(row -> builder.row(row.node(), row.inDegree(), row.outDegree(), row.totalDegree(),
                row.betweenness(), hubPruner.isGeneric(row.node()), semanticType(row.node())));
        return builder.build();
    }

    private ArtifactTable rankedTable(List<NodeCentrality> ranked) {
        var builder = ArtifactTable.builder(RANKED_COLUMNS);
        for (int i = 0; i < ranked.size(); i++) {
            var row = ranked.get(i);
            builder.row(i + 1, row.node(), row.totalDegree(), row.inDegree(), row.outDegree(),
                    row.betweenness(), hubPruner.isGeneric(row.node()), semanticType(row.node()));
        }
        return builder.build();
    }

    private ArtifactTable statisticsTable(GraphStatistics statistics) {
        return ArtifactTable.builder("metric", "value")
                .row("node_count", statistics.nodeCount())
                .row("edge_count", statistics.edgeCount())
                .row("density", statistics.density())
                .row("self_loops", statistics.selfLoops())
                .row("scc_count", statistics.componentCount())
                .row("large_scc_count", statistics.largeComponentCount())
                .row("nodes_in_large_sccs", statistics.nodesInLargeComponents())
                .row("largest_scc_size", statistics.largestComponentSize())
                .row("is_dag", statistics.isDag())
                .row("exposure_in_degree", statistics.exposureInDegree())
                .row("exposure_out_degree", statistics.exposureOutDegree())
                .row("outcome_in_degree", statistics.outcomeInDegree())
                .row("outcome_out_degree", statistics.outcomeOutDegree())
                .build();
    }

    private String semanticType(String node) {
        return semanticTypeLookup.categoryOf(node).orElse("");
    }

    private String firstNode(List<NodeCentrality> rows) {
        return rows.isEmpty() ? "" : rows.get(0).node();
    }
}
