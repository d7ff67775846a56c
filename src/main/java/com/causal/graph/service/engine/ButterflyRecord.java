package com.causal.graph.service.engine;

import java.util.List;

/**
 * @param confounderParents parents of the confounder that are valid confounders themselves
 */
public record ButterflyRecord(String confounder, List<String> confounderParents) {

    public ButterflyRecord {
        confounderParents = List.copyOf(confounderParents);
    }

    public int confounderParentCount() {
        return confounderParents.size();
    }

    public boolean isButterfly() {
        return confounderParents.size() >= 2;
    }

    public ButterflyCategory category() {
        return ButterflyCategory.forParentCount(confounderParents.size());
    }
}
