package com.causal.graph.service.error;

/**
 * Thrown when an analysis id is not a single safe name: letters, digits, {@code _},
 * {@code .} and {@code -}, and neither {@code .} nor {@code ..}.
 */
public class InvalidAnalysisIdException extends CausalAnalysisException {

    public static final String ERROR_CODE = "INVALID_ANALYSIS_ID";

    public InvalidAnalysisIdException(String analysisId) {
        super("Invalid analysis id: '" + analysisId + "'", analysisId, ERROR_CODE);
    }
}
