package com.causal.graph.service.enrichment;

import com.causal.graph.service.graph.GraphEdge;

import java.util.Collection;
import java.util.List;

/**
 * Supplies literature citations for causal edges.
 */
public interface EvidenceProvider {

    List<Citation> citationsFor(Collection<GraphEdge> edges);
}
