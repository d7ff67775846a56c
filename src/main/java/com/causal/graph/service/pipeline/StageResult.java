package com.causal.graph.service.pipeline;

import com.causal.graph.service.store.AnalysisStage;

import java.util.Map;

/**
 * Result of running one stage.
 *
 * @param artifacts artifact key to row count (edge count for graphs)
 */
public record StageResult(
        String analysisId,
        AnalysisStage stage,
        long durationMs,
        Map<String, Integer> artifacts,
        Map<String, Object> summary
) {}
