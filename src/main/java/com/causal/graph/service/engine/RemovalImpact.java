package com.causal.graph.service.engine;

import java.util.List;

/**
 * Effect of deleting one or more nodes on the cycle structure of a graph.
 *
 * @param nodes             nodes removed together
 * @param edgesRemoved      incident edges dropped with them
 * @param before            SCC figures of the input graph
 * @param after             SCC figures once the nodes are gone
 * @param betweenness       betweenness of the single removed node, 0 for combined removals
 */
public record RemovalImpact(
        List<String> nodes,
        int inDegree,
        int outDegree,
        int totalDegree,
        double betweenness,
        int edgesRemoved,
        SccStats before,
        SccStats after
) {

    public RemovalImpact {
        nodes = List.copyOf(nodes);
    }

    /**
     * Drop in the number of nodes that still sit in some cycle.
     */
    public int sccNodeReduction() {
        return before.nodesInLargeComponents() - after.nodesInLargeComponents();
    }

    public double reductionPercent() {
        int baseline = before.nodesInLargeComponents();
        return baseline == 0 ? 0.0 : 100.0 * sccNodeReduction() / baseline;
    }

    public boolean isDagAfter() {
        return after.isDag();
    }

    public String label() {
        return String.join(", ", nodes);
    }
}
