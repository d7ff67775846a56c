package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;

import java.util.List;

/**
 * Outcome of generic hub pruning.
 *
 * @param candidates        generic nodes that rank in a top-N table and were removed
 * @param notInTopN         generic nodes present in the graph but not ranked high enough
 * @param protectedSkipped  generic nodes left alone because they are the exposure or outcome
 * @param absent            generic nodes that do not occur in the graph
 * @param individual        per-candidate impact, largest SCC reduction first
 * @param combined          impact of removing all candidates at once
 * @param prunedGraph       input graph without the candidates
 */
public record PruningReport(
        List<String> candidates,
        List<String> notInTopN,
        List<String> protectedSkipped,
        List<String> absent,
        SccStats baseline,
        List<RemovalImpact> individual,
        RemovalImpact combined,
        CausalGraph prunedGraph
) {

    public PruningReport {
        candidates = List.copyOf(candidates);
        notInTopN = List.copyOf(notInTopN);
        protectedSkipped = List.copyOf(protectedSkipped);
        absent = List.copyOf(absent);
        individual = List.copyOf(individual);
    }
}
