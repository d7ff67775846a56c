package com.causal.graph.service.engine;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Exhaustive cycle counts for one SCC plus a bounded sample of concrete cycles.
 *
 * @param participation node to number of distinct cycles through it
 * @param lengthHistogram cycle length to number of cycles of that length
 */
public record SccCycleResult(
        int sccId,
        int sccSize,
        long totalCycles,
        Map<String, Long> participation,
        SortedMap<Integer, Long> lengthHistogram,
        List<CycleRecord> samples
) {

    public SccCycleResult {
        participation = Collections.unmodifiableMap(participation);
        lengthHistogram = Collections.unmodifiableSortedMap(lengthHistogram);
        samples = List.copyOf(samples);
    }
}
