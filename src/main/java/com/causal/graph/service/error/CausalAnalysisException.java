package com.causal.graph.service.error;

/**
 * Base exception for failures in graph ingestion and analysis stages.
 *
 * Carries the id of the entity involved (node, analysis, artifact) and a stable
 * error code that the REST layer maps to an HTTP status.
 */
public class CausalAnalysisException extends RuntimeException {

    private final String entityId;
    private final String errorCode;

    public CausalAnalysisException(String message) {
        super(message);
        this.entityId = null;
        this.errorCode = "ANALYSIS_ERROR";
    }

    public CausalAnalysisException(String message, Throwable cause) {
        super(message, cause);
        this.entityId = null;
        this.errorCode = "ANALYSIS_ERROR";
    }

    public CausalAnalysisException(String message, String entityId, String errorCode) {
        super(message);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public CausalAnalysisException(String message, String entityId, String errorCode, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
