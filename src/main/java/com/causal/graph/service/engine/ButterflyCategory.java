package com.causal.graph.service.engine;

/**
 * Adjustment advice for a confounder given how many of its parents are confounders too.
 */
public enum ButterflyCategory {
    INDEPENDENT("Safe to adjust directly"),
    SINGLE_PARENT("Monitor: one confounder parent"),
    BUTTERFLY("Avoid direct adjustment; adjust for its confounder parents");

    private final String recommendation;

    ButterflyCategory(String recommendation) {
        this.recommendation = recommendation;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public static ButterflyCategory forParentCount(int count) {
        if (count >= 2) return BUTTERFLY;
        return count == 1 ? SINGLE_PARENT : INDEPENDENT;
    }
}
