package com.causal.graph.service.engine;

import java.util.List;

/**
 * Butterfly status of every valid confounder, partitioned by adjustment advice.
 */
public record ButterflyAnalysis(List<ButterflyRecord> records) {

    public ButterflyAnalysis {
        records = List.copyOf(records);
    }

    public List<ButterflyRecord> in(ButterflyCategory category) {
        return records.stream().filter(r -> r.category() == category).toList();
    }

    public List<String> independent() {
        return names(ButterflyCategory.INDEPENDENT);
    }

    public List<String> singleParent() {
        return names(ButterflyCategory.SINGLE_PARENT);
    }

    public List<String> butterflies() {
        return names(ButterflyCategory.BUTTERFLY);
    }

    /**
     * Confounders that can enter an adjustment set without opening a butterfly collider.
     */
    public List<String> safeToAdjust() {
        return records.stream()
                .filter(r -> !r.isButterfly())
                .map(ButterflyRecord::confounder)
                .toList();
    }

    private List<String> names(ButterflyCategory category) {
        return in(category).stream().map(ButterflyRecord::confounder).toList();
    }
}
