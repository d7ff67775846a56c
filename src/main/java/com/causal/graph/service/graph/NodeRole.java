package com.causal.graph.service.graph;

/**
 * Role of a node in a causal graph. Each graph has exactly one exposure and one outcome.
 */
public enum NodeRole {
    EXPOSURE,
    OUTCOME,
    REGULAR;

    public boolean isProtected() {
        return this != REGULAR;
    }
}
