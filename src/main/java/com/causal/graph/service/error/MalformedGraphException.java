package com.causal.graph.service.error;

/**
 * Thrown when an input graph cannot be accepted: missing exposure or outcome,
 * unparsable edge lines or an unterminated {@code dag} block.
 */
public class MalformedGraphException extends CausalAnalysisException {

    public static final String ERROR_CODE = "MALFORMED_GRAPH";

    public MalformedGraphException(String message) {
        super(message, null, ERROR_CODE);
    }

    public MalformedGraphException(String message, String entityId) {
        super(message, entityId, ERROR_CODE);
    }

    public MalformedGraphException(String message, String entityId, Throwable cause) {
        super(message, entityId, ERROR_CODE, cause);
    }
}
