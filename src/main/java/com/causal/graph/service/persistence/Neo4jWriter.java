package com.causal.graph.service.persistence;

import com.causal.graph.service.store.AnalysisStage;

import java.util.List;

/**
 * Interface for Neo4j export operations.
 *
 * Provides both Cypher generation and direct push capabilities.
 */
public interface Neo4jWriter {

    /**
     * Generates Cypher statements for one stage graph of an analysis.
     */
    List<String> generateCypher(String analysisId, AnalysisStage stage);

    /**
     * Pushes a stage graph to Neo4j on the calling thread.
     */
    ExportResult pushToNeo4j(String analysisId, AnalysisStage stage);

    boolean isConnected();

    /**
     * Result of an export operation.
     */
    record ExportResult(
            String analysisId,
            boolean success,
            int nodesExported,
            int edgesExported,
            long durationMs,
            String errorMessage
    ) {
        public static ExportResult success(String analysisId, int nodes, int edges, long durationMs) {
            return new ExportResult(analysisId, true, nodes, edges, durationMs, null);
        }

        public static ExportResult failure(String analysisId, String error) {
            return new ExportResult(analysisId, false, 0, 0, 0, error);
        }
    }
}
