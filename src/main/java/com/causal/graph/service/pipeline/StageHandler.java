package com.causal.graph.service.pipeline;

import com.causal.graph.service.error.MissingPrerequisiteException;
import com.causal.graph.service.store.AnalysisStage;

import java.util.Map;

/**
 * One pipeline stage. A handler reads its inputs from the artifact store, runs its
 * engine component and writes its outputs back.
 */
public interface StageHandler {

    /**
     * Runs the stage for an analysis.
     *
     * @param analysisId the analysis to process
     * @return headline figures for logging and the REST response
     * @throws MissingPrerequisiteException if an upstream artifact is missing
     */
    Map<String, Object> run(String analysisId);

    /**
     * Gets the stage this handler implements.
     */
    AnalysisStage getStage();
}
