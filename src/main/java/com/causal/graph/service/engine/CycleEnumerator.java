package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.graph.IndexedDigraph;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;

/**
 * Finds every simple cycle of length two or more inside each large SCC.
 *
 * A search seeded at index {@code s} only extends to nodes with a larger index, so each
 * cycle is reported once, from its smallest member. The search is exhaustive and can
 * be exponential in SCC size; shrink SCCs with {@link HubPruner} first when that matters.
 */
@Slf4j
public class CycleEnumerator {

    private final int maxCyclesToSave;
    private final long progressInterval;

    public CycleEnumerator(int maxCyclesToSave, long progressInterval) {
        if (maxCyclesToSave < 0) {
            throw new IllegalArgumentException("maxCyclesToSave must be >= 0");
        }
        if (progressInterval < 1) {
            throw new IllegalArgumentException("progressInterval must be >= 1");
        }
        this.maxCyclesToSave = maxCyclesToSave;
        this.progressInterval = progressInterval;
    }

    public CycleReport enumerate(CausalGraph graph, SccPartition partition) {
        var results = new ArrayList<SccCycleResult>();
        for (SccPartition.Component component : partition.largeComponents()) {
            results.add(enumerateComponent(graph, component));
        }
        var report = new CycleReport(results);
        log.info("Cycle enumeration finished: {} cycles across {} SCCs",
                report.totalCycles(), results.size());
        return report;
    }

    public SccCycleResult enumerateComponent(CausalGraph graph, SccPartition.Component component) {
        var digraph = graph.inducedSubgraph(component.members());
        log.info("Enumerating cycles in SCC {} ({} nodes)", component.id(), digraph.size());

        var accumulator = new CycleAccumulator(digraph, component.id(), maxCyclesToSave, progressInterval);
        var search = new SearchState(digraph.size());
        for (int start = 0; start < digraph.size(); start++) {
            search(digraph, start, search, accumulator);
        }

        log.info("SCC {}: {} cycles", component.id(), accumulator.total());
        return accumulator.result();
    }

    // ==================== Search ====================

    private void search(IndexedDigraph digraph, int start, SearchState state, CycleAccumulator accumulator) {
        int depth = 0;
        state.path[depth] = start;
        state.cursor[depth] = 0;
        state.onPath[start] = true;
        depth++;

        while (depth > 0) {
            int v = state.path[depth - 1];
            int[] successors = digraph.successors(v);

            if (state.cursor[depth - 1] < successors.length) {
                int w = successors[state.cursor[depth - 1]++];
                if (w == start) {
                    if (depth >= 2) {
                        accumulator.record(state.path, depth);
                    }
                } else if (w > start && !state.onPath[w]) {
                    state.path[depth] = w;
                    state.cursor[depth] = 0;
                    state.onPath[w] = true;
                    depth++;
                }
            } else {
                state.onPath[v] = false;
                depth--;
            }
        }
    }

    /**
     * Reusable buffers for one component; {@code onPath} is all false between searches.
     */
    private static final class SearchState {
        final int[] path;
        final int[] cursor;
        final boolean[] onPath;

        SearchState(int size) {
            path = new int[size];
            cursor = new int[size];
            onPath = new boolean[size];
        }
    }
}
