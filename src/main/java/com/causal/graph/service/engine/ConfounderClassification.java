package com.causal.graph.service.engine;

/**
 * Feedback class of a confounder, by the shortest round trip through the exposure or outcome.
 */
public enum ConfounderClassification {
    PURE_CONFOUNDER("Pure Confounder"),
    TIGHT_FEEDBACK("Tight Feedback"),
    LONG_FEEDBACK("Long Feedback");

    private final String label;

    ConfounderClassification(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
