package com.causal.graph.service.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Cycle statistics merged across all large SCCs of a graph.
 */
public record CycleReport(List<SccCycleResult> components) {

    public CycleReport {
        components = List.copyOf(components);
    }

    public long totalCycles() {
        return components.stream().mapToLong(SccCycleResult::totalCycles).sum();
    }

    /**
     * Participation per node, most-cycled first. Nodes outside every cycle are omitted.
     */
    public List<NodeParticipation> participation() {
        var merged = new LinkedHashMap<String, NodeParticipation>();
        for (SccCycleResult result : components) {
            result.participation().forEach((node, count) -> {
                if (count == 0) return;
                merged.merge(node, new NodeParticipation(node, count, List.of(result.sccId())),
                        NodeParticipation::combine);
            });
        }
        var rows = new ArrayList<>(merged.values());
        rows.sort((a, b) -> Long.compare(b.cycleCount(), a.cycleCount()));
        return rows;
    }

    public SortedMap<Integer, Long> lengthHistogram() {
        var merged = new TreeMap<Integer, Long>();
        components.forEach(result -> result.lengthHistogram().forEach(
                (length, count) -> merged.merge(length, count, Long::sum)));
        return Collections.unmodifiableSortedMap(merged);
    }

    public List<CycleRecord> samples() {
        return components.stream().flatMap(result -> result.samples().stream()).toList();
    }

    public Map<Integer, Long> totalsByComponent() {
        var totals = new LinkedHashMap<Integer, Long>();
        components.forEach(result -> totals.put(result.sccId(), result.totalCycles()));
        return totals;
    }

    public record NodeParticipation(String node, long cycleCount, List<Integer> sccIds) {

        NodeParticipation combine(NodeParticipation other) {
            var ids = new ArrayList<>(sccIds);
            ids.addAll(other.sccIds);
            return new NodeParticipation(node, cycleCount + other.cycleCount, ids);
        }
    }
}
