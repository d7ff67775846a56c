package com.causal.graph.service.engine;

import com.causal.graph.service.graph.GraphEdge;

import java.util.List;

/**
 * Neighbourhood of one confounder used for evidence review.
 */
public record ConfounderSubgraph(String confounder, List<String> nodes, List<GraphEdge> edges) {

    public ConfounderSubgraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }
}
