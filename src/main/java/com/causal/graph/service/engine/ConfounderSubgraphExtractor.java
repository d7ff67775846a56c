package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Builds the subgraph induced by a confounder, the exposure, the outcome and the
 * shortest return paths from exposure and outcome to the confounder.
 */
public class ConfounderSubgraphExtractor {

    public List<ConfounderSubgraph> extractAll(CausalGraph graph, Collection<String> confounders) {
        var fromExposure = ShortestPaths.from(graph, graph.exposure());
        var fromOutcome = ShortestPaths.from(graph, graph.outcome());
        return confounders.stream()
                .filter(graph::contains)
                .map(confounder -> extract(graph, confounder, fromExposure, fromOutcome))
                .toList();
    }

    public ConfounderSubgraph extract(CausalGraph graph, String confounder) {
        return extract(graph, confounder,
                ShortestPaths.from(graph, graph.exposure()),
                ShortestPaths.from(graph, graph.outcome()));
    }

    private ConfounderSubgraph extract(CausalGraph graph, String confounder,
                                       ShortestPaths fromExposure, ShortestPaths fromOutcome) {
        var members = new LinkedHashSet<String>();
        members.add(confounder);
        members.add(graph.exposure());
        members.add(graph.outcome());
        members.addAll(fromExposure.pathTo(confounder));
        members.addAll(fromOutcome.pathTo(confounder));

        var edges = graph.edges().stream()
                .filter(edge -> members.contains(edge.from()) && members.contains(edge.to()))
                .toList();
        return new ConfounderSubgraph(confounder, List.copyOf(members), edges);
    }
}
