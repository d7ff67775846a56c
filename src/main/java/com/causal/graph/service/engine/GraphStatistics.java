package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.graph.Direction;
import com.causal.graph.service.graph.GraphEdge;

/**
 * Basic structural figures of a graph.
 */
public record GraphStatistics(
        int nodeCount,
        int edgeCount,
        double density,
        int selfLoops,
        int componentCount,
        int largeComponentCount,
        int nodesInLargeComponents,
        int largestComponentSize,
        boolean isDag,
        int exposureInDegree,
        int exposureOutDegree,
        int outcomeInDegree,
        int outcomeOutDegree
) {

    public static GraphStatistics of(CausalGraph graph, SccPartition partition) {
        int n = graph.nodeCount();
        double density = n > 1 ? graph.edgeCount() / ((double) n * (n - 1)) : 0.0;
        int selfLoops = (int) graph.edges().stream().filter(GraphEdge::isSelfLoop).count();

        return new GraphStatistics(
                n,
                graph.edgeCount(),
                density,
                selfLoops,
                partition.componentCount(),
                partition.largeComponents().size(),
                partition.nodesInLargeComponents(),
                partition.largestComponentSize(),
                partition.isDag(),
                graph.degree(graph.exposure(), Direction.IN),
                graph.degree(graph.exposure(), Direction.OUT),
                graph.degree(graph.outcome(), Direction.IN),
                graph.degree(graph.outcome(), Direction.OUT)
        );
    }
}
