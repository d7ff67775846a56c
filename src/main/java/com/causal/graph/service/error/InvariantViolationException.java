package com.causal.graph.service.error;

/**
 * Thrown when a graph edit would remove the exposure or outcome node.
 */
public class InvariantViolationException extends CausalAnalysisException {

    public static final String ERROR_CODE = "INVARIANT_VIOLATION";

    public InvariantViolationException(String message, String nodeId) {
        super(message, nodeId, ERROR_CODE);
    }
}
