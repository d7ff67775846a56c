package com.causal.graph.service.error;

/**
 * Thrown when an analysis id is not known to the artifact store.
 */
public class AnalysisNotFoundException extends CausalAnalysisException {

    public static final String ERROR_CODE = "ANALYSIS_NOT_FOUND";

    public AnalysisNotFoundException(String analysisId) {
        super("Analysis not found: " + analysisId, analysisId, ERROR_CODE);
    }
}
