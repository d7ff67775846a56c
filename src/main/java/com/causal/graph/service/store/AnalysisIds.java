package com.causal.graph.service.store;

import com.causal.graph.service.error.InvalidAnalysisIdException;

import java.util.regex.Pattern;

/**
 * Analysis ids double as directory names in the file-system store, so they are
 * limited to one path segment.
 */
public final class AnalysisIds {

    private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9_.-]+");

    private AnalysisIds() {
    }

    public static boolean isValid(String analysisId) {
        return analysisId != null
                && SAFE.matcher(analysisId).matches()
                && !analysisId.equals(".")
                && !analysisId.equals("..");
    }

    /**
     * @throws InvalidAnalysisIdException if the id is not a safe single name
     */
    public static String requireValid(String analysisId) {
        if (!isValid(analysisId)) {
            throw new InvalidAnalysisIdException(analysisId);
        }
        return analysisId;
    }
}
