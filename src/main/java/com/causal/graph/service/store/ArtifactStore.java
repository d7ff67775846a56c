package com.causal.graph.service.store;

import com.causal.graph.service.error.MissingPrerequisiteException;
import com.causal.graph.service.graph.CausalGraph;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Versioned store for stage outputs: one graph snapshot and any number of named tables
 * per (analysis, stage). Every put bumps the artifact's version.
 */
public interface ArtifactStore {

    String GRAPH_KEY = "graph";

    void putGraph(String analysisId, AnalysisStage stage, CausalGraph graph);

    Optional<CausalGraph> findGraph(String analysisId, AnalysisStage stage);

    /**
     * @throws MissingPrerequisiteException naming {@code stage} if it has not stored a graph
     */
    default CausalGraph getGraph(String analysisId, AnalysisStage stage) {
        return findGraph(analysisId, stage)
                .orElseThrow(() -> new MissingPrerequisiteException(
                        describe(analysisId, stage, GRAPH_KEY), stage.describe()));
    }

    void putTable(String analysisId, AnalysisStage stage, String key, ArtifactTable table);

    Optional<ArtifactTable> findTable(String analysisId, AnalysisStage stage, String key);

    /**
     * @throws MissingPrerequisiteException naming {@code stage} if the table is absent
     */
    default ArtifactTable getTable(String analysisId, AnalysisStage stage, String key) {
        return findTable(analysisId, stage, key)
                .orElseThrow(() -> new MissingPrerequisiteException(
                        describe(analysisId, stage, key), stage.describe()));
    }

    Collection<String> analysisIds();

    boolean exists(String analysisId);

    /**
     * Deletes every artifact of an analysis.
     *
     * @return true if anything was deleted
     */
    boolean delete(String analysisId);

    int count();

    List<ArtifactMetadata> listArtifacts(String analysisId);

    default String describe(String analysisId, AnalysisStage stage, String key) {
        return "%s/%s/%s".formatted(analysisId, stage.getDirectoryName(), key);
    }

    /**
     * Bookkeeping for one stored artifact. {@code rowCount} is the edge count for graphs.
     */
    record ArtifactMetadata(
            String analysisId,
            AnalysisStage stage,
            String key,
            int version,
            int rowCount,
            long updatedAtEpochMs
    ) {}
}
