package com.causal.graph.service.store;

import com.causal.graph.service.config.MetricsConfig;
import com.causal.graph.service.graph.CausalGraph;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of ArtifactStore.
 * Thread-safe; artifacts live for the lifetime of the process.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "causal.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryArtifactStore implements ArtifactStore {

    private final MetricsConfig metricsConfig;

    private final Map<String, Map<ArtifactKey, StoredArtifact>> analyses = new ConcurrentHashMap<>();

    // ==================== Lifecycle ====================

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "causal.store.analyses.count",
                "Number of analyses in the artifact store",
                this::count
        );
        log.info("InMemoryArtifactStore initialized");
    }

    // ==================== ArtifactStore Interface ====================

    @Override
    public void putGraph(String analysisId, AnalysisStage stage, CausalGraph graph) {
        store(analysisId, new ArtifactKey(stage, GRAPH_KEY), graph, graph.edgeCount());
        log.debug("Stored graph {} (nodes={}, edges={})",
                describe(analysisId, stage, GRAPH_KEY), graph.nodeCount(), graph.edgeCount());
    }

    @Override
    public Optional<CausalGraph> findGraph(String analysisId, AnalysisStage stage) {
        return find(analysisId, new ArtifactKey(stage, GRAPH_KEY))
                .map(artifact -> (CausalGraph) artifact.value());
    }

    @Override
    public void putTable(String analysisId, AnalysisStage stage, String key, ArtifactTable table) {
        if (GRAPH_KEY.equals(key)) {
            throw new IllegalArgumentException("Table key '" + GRAPH_KEY + "' is reserved");
        }
        store(analysisId, new ArtifactKey(stage, key), table, table.rowCount());
        log.debug("Stored table {} ({} rows)", describe(analysisId, stage, key), table.rowCount());
    }

    @Override
    public Optional<ArtifactTable> findTable(String analysisId, AnalysisStage stage, String key) {
        return find(analysisId, new ArtifactKey(stage, key))
                .filter(artifact -> artifact.value() instanceof ArtifactTable)
                .map(artifact -> (ArtifactTable) artifact.value());
    }

    @Override
    public Collection<String> analysisIds() {
        return analyses.keySet().stream().sorted().toList();
    }

    @Override
    public boolean exists(String analysisId) {
        return analyses.containsKey(analysisId);
    }

    @Override
    public boolean delete(String analysisId) {
        var removed = analyses.remove(analysisId);
        if (removed != null) {
            log.info("Analysis deleted: {} ({} artifacts)", analysisId, removed.size());
            return true;
        }
        return false;
    }

    @Override
    public int count() {
        return analyses.size();
    }

    @Override
    public List<ArtifactMetadata> listArtifacts(String analysisId) {
        return analyses.getOrDefault(analysisId, Map.of()).entrySet().stream()
                .map(entry -> new ArtifactMetadata(
                        analysisId,
                        entry.getKey().stage(),
                        entry.getKey().key(),
                        entry.getValue().version(),
                        entry.getValue().rowCount(),
                        entry.getValue().updatedAtEpochMs()))
                .sorted(Comparator.comparing(ArtifactMetadata::stage).thenComparing(ArtifactMetadata::key))
                .toList();
    }

    // ==================== Entry Management ====================

    private void store(String analysisId, ArtifactKey key, Object value, int rowCount) {
        analyses.computeIfAbsent(analysisId, id -> new ConcurrentHashMap<>())
                .compute(key, (k, existing) -> new StoredArtifact(
                        value,
                        existing == null ? 1 : existing.version() + 1,
                        rowCount,
                        Instant.now().toEpochMilli()));
    }

    private Optional<StoredArtifact> find(String analysisId, ArtifactKey key) {
        return Optional.ofNullable(analyses.get(analysisId))
                .map(artifacts -> artifacts.get(key));
    }

    // ==================== Inner Types ====================

    private record ArtifactKey(AnalysisStage stage, String key) {}

    private record StoredArtifact(Object value, int version, int rowCount, long updatedAtEpochMs) {}
}
