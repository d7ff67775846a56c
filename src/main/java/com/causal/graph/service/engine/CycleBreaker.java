package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.graph.GraphEdge;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes the feedback edges {@code exposure -> C} and {@code outcome -> C} for each
 * vetted strong confounder {@code C} in the graph. No other edge is touched, so running
 * it again on its own output removes nothing.
 */
@Slf4j
public class CycleBreaker {

    private final List<String> strongConfounders;

    public CycleBreaker(List<String> strongConfounders) {
        this.strongConfounders = List.copyOf(strongConfounders);
    }

    public List<String> getStrongConfounders() {
        return strongConfounders;
    }

    public Result breakCycles(CausalGraph graph) {
        var present = new ArrayList<String>();
        var missing = new ArrayList<String>();
        var removed = new ArrayList<GraphEdge>();

        for (String confounder : strongConfounders) {
            if (!graph.contains(confounder)) {
                missing.add(confounder);
                continue;
            }
            if (graph.isProtected(confounder)) {
                log.warn("Strong confounder '{}' is the exposure or outcome, skipping", confounder);
                continue;
            }
            present.add(confounder);
            collectFeedbackEdge(graph, graph.exposure(), confounder, removed);
            collectFeedbackEdge(graph, graph.outcome(), confounder, removed);
        }

        if (!missing.isEmpty()) {
            log.warn("Strong confounders not in graph: {}", missing);
        }
        log.info("Cycle breaking: removed {} feedback edges for {} strong confounders",
                removed.size(), present.size());
        return new Result(graph.deleteEdges(removed), removed, present, missing);
    }

    private void collectFeedbackEdge(CausalGraph graph, String from, String confounder, List<GraphEdge> removed) {
        if (graph.hasEdge(from, confounder)) {
            var edge = GraphEdge.of(from, confounder);
            removed.add(edge);
            log.debug("Removing feedback edge {}", edge);
        }
    }

    public record Result(
            CausalGraph graph,
            List<GraphEdge> removedEdges,
            List<String> confoundersPresent,
            List<String> confoundersMissing
    ) {

        public Result {
            removedEdges = List.copyOf(removedEdges);
            confoundersPresent = List.copyOf(confoundersPresent);
            confoundersMissing = List.copyOf(confoundersMissing);
        }

        public int removedCount() {
            return removedEdges.size();
        }
    }
}
