package com.causal.graph.service.persistence;

import com.causal.graph.service.engine.SccDecomposer;
import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.graph.GraphEdge;
import com.causal.graph.service.store.AnalysisStage;
import com.causal.graph.service.store.ArtifactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds Cypher statements for one stage graph of an analysis. Nodes carry their role
 * and SCC id so cycle structure can be queried in Neo4j.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CypherBuilder {

    static final String NODE_LABEL = ":CausalNode";
    static final String EDGE_TYPE = ":CAUSES";

    private final ArtifactStore artifactStore;
    private final SccDecomposer sccDecomposer;

    // ==================== Public API ====================

    /**
     * Builds Cypher statements for a stored stage graph.
     *
     * @throws com.causal.graph.service.error.MissingPrerequisiteException if the stage has no graph
     */
    public List<String> buildCypher(String analysisId, AnalysisStage stage) {
        return buildCypher(analysisId, stage, artifactStore.getGraph(analysisId, stage));
    }

    public List<String> buildCypher(String analysisId, AnalysisStage stage, CausalGraph graph) {
        var partition = sccDecomposer.decompose(graph);
        var statements = new ArrayList<String>();
        statements.add(buildAnalysisStatement(analysisId, stage, graph));
        for (String node : graph.nodes()) {
            statements.add(buildNodeStatement(analysisId, stage, node,
                    graph.roleOf(node).name(), partition.componentOf(node)));
        }
        for (GraphEdge edge : graph.edges()) {
            statements.add(buildEdgeStatement(analysisId, stage, edge));
        }
        log.debug("Generated {} Cypher statements for {} at {}", statements.size(), analysisId, stage);
        return statements;
    }

    // ==================== Statement Building ====================

    private String buildAnalysisStatement(String analysisId, AnalysisStage stage, CausalGraph graph) {
        return """
            MERGE (a:CausalAnalysis {analysisId: '%s', stage: '%s'}) \
            SET a.exposure = '%s', a.outcome = '%s', a.nodeCount = %d, a.edgeCount = %d, a.updatedAt = timestamp()"""
                .formatted(
                        escape(analysisId), stage.name(),
                        escape(graph.exposure()), escape(graph.outcome()),
                        graph.nodeCount(), graph.edgeCount()
                );
    }

    private String buildNodeStatement(String analysisId, AnalysisStage stage, String node, String role, int sccId) {
        return """
            MERGE (n%s {name: '%s', analysisId: '%s', stage: '%s'}) \
            SET n.role = '%s', n.sccId = %d"""
                .formatted(NODE_LABEL, escape(node), escape(analysisId), stage.name(), role, sccId);
    }

    private String buildEdgeStatement(String analysisId, AnalysisStage stage, GraphEdge edge) {
        return """
            MATCH (s%1$s {name: '%2$s', analysisId: '%4$s', stage: '%5$s'}), \
            (t%1$s {name: '%3$s', analysisId: '%4$s', stage: '%5$s'}) \
            MERGE (s)-[%6$s]->(t)"""
                .formatted(NODE_LABEL, escape(edge.from()), escape(edge.to()),
                        escape(analysisId), stage.name(), EDGE_TYPE);
    }

    // ==================== Utility Methods ====================

    private String escape(String value) {
        return value == null ? "" : value.replace("\\", "\\\\").replace("'", "\\'");
    }
}
