package com.causal.graph.service.engine;

/**
 * Cycle-related size figures of a graph, used for before/after pruning audits.
 */
public record SccStats(
        int largeComponentCount,
        int nodesInLargeComponents,
        int largestComponentSize,
        boolean isDag
) {

    public static SccStats of(SccPartition partition) {
        return new SccStats(
                partition.largeComponents().size(),
                partition.nodesInLargeComponents(),
                partition.largestComponentSize(),
                partition.isDag()
        );
    }
}
