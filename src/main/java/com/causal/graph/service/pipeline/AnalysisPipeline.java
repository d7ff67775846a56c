package com.causal.graph.service.pipeline;

import com.causal.graph.service.config.MetricsConfig;
import com.causal.graph.service.error.AnalysisNotFoundException;
import com.causal.graph.service.store.AnalysisIds;
import com.causal.graph.service.store.AnalysisStage;
import com.causal.graph.service.store.ArtifactStore;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs analysis stages synchronously on the calling thread, one at a time, in the
 * order of {@link AnalysisStage}. Ingestion is not a runnable stage here; graphs enter
 * through {@code GraphIngestionService}.
 */
@Slf4j
@Service
public class AnalysisPipeline {

    private final ArtifactStore artifactStore;
    private final MetricsConfig metricsConfig;
    private final Map<AnalysisStage, StageHandler> handlers = new EnumMap<>(AnalysisStage.class);

    public AnalysisPipeline(ArtifactStore artifactStore, MetricsConfig metricsConfig, List<StageHandler> stageHandlers) {
        this.artifactStore = artifactStore;
        this.metricsConfig = metricsConfig;
        for (StageHandler handler : stageHandlers) {
            var previous = handlers.put(handler.getStage(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for stage " + handler.getStage());
            }
        }
        log.info("Analysis pipeline initialized with stages {}", handlers.keySet());
    }

    public List<AnalysisStage> runnableStages() {
        return List.copyOf(handlers.keySet());
    }

    /**
     * Runs every stage after ingestion in order, stopping at the first failure.
     */
    public List<StageResult> runAll(String analysisId) {
        requireAnalysis(analysisId);
        log.info("Running full pipeline for {}", analysisId);
        var results = new ArrayList<StageResult>();
        for (AnalysisStage stage : AnalysisStage.values()) {
            if (handlers.containsKey(stage)) {
                results.add(runStage(analysisId, stage));
            }
        }
        log.info("Pipeline finished for {}: {} stages in {}ms", analysisId, results.size(),
                results.stream().mapToLong(StageResult::durationMs).sum());
        return results;
    }

    public StageResult runStage(String analysisId, AnalysisStage stage) {
        requireAnalysis(analysisId);
        var handler = handlers.get(stage);
        if (handler == null) {
            throw new IllegalArgumentException("Stage %s cannot be run directly; runnable stages are %s"
                    .formatted(stage, Arrays.toString(handlers.keySet().toArray())));
        }

        log.info("Stage {} started for {}", stage, analysisId);
        long startTime = System.currentTimeMillis();
        var sample = Timer.start(metricsConfig.getRegistry());
        try {
            var summary = handler.run(analysisId);
            metricsConfig.stageCompleted(stage).increment();
            long duration = System.currentTimeMillis() - startTime;
            log.info("Stage {} finished for {} in {}ms: {}", stage, analysisId, duration, summary);
            return new StageResult(analysisId, stage, duration, artifactsOf(analysisId, stage), summary);
        } catch (RuntimeException e) {
            metricsConfig.stageFailed(stage).increment();
            log.error("Stage {} failed for {}: {}", stage, analysisId, e.getMessage());
            throw e;
        } finally {
            sample.stop(metricsConfig.stageTimer(stage));
        }
    }

    private Map<String, Integer> artifactsOf(String analysisId, AnalysisStage stage) {
        var artifacts = new LinkedHashMap<String, Integer>();
        artifactStore.listArtifacts(analysisId).stream()
                .filter(meta -> meta.stage() == stage)
                .forEach(meta -> artifacts.put(meta.key(), meta.rowCount()));
        return artifacts;
    }

    private void requireAnalysis(String analysisId) {
        if (!artifactStore.exists(AnalysisIds.requireValid(analysisId))) {
            throw new AnalysisNotFoundException(analysisId);
        }
    }
}
