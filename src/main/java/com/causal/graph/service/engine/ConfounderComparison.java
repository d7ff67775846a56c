package com.causal.graph.service.engine;

import java.util.List;

/**
 * Agreement between the confounder list carried through the pipeline and the one
 * recomputed on the structural graph.
 */
public record ConfounderComparison(List<String> both, List<String> pipelineOnly, List<String> structuralOnly) {

    public ConfounderComparison {
        both = List.copyOf(both);
        pipelineOnly = List.copyOf(pipelineOnly);
        structuralOnly = List.copyOf(structuralOnly);
    }

    public boolean agrees() {
        return pipelineOnly.isEmpty() && structuralOnly.isEmpty();
    }
}
