package com.causal.graph.service.engine;

import com.causal.graph.service.graph.IndexedDigraph;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.TreeMap;

/**
 * Collects counts and sampled paths for the cycles of one SCC as the search finds them.
 *
 * Counts are exact. Samples are capped at {@code maxSaved}: each cycle length gets a
 * quota of {@code ceil(maxSaved / (n - 1))} slots, and cycles beyond their length's
 * quota go to a reserve that fills any unused slots at the end.
 */
@Slf4j
final class CycleAccumulator {

    private final IndexedDigraph component;
    private final int sccId;
    private final int maxSaved;
    private final int perLengthQuota;
    private final long progressInterval;

    private final long[] participation;
    private final long[] byLength;
    private final int[] savedByLength;
    private final List<CycleRecord> primary = new ArrayList<>();
    private final List<CycleRecord> reserve = new ArrayList<>();
    private long total;

    CycleAccumulator(IndexedDigraph component, int sccId, int maxSaved, long progressInterval) {
        int n = component.size();
        this.component = component;
        this.sccId = sccId;
        this.maxSaved = maxSaved;
        this.progressInterval = progressInterval;
        this.perLengthQuota = (int) Math.ceil(maxSaved / (double) Math.max(n - 1, 1));
        this.participation = new long[n];
        this.byLength = new long[n + 1];
        this.savedByLength = new int[n + 1];
    }

    /**
     * Records the cycle held in the first {@code length} slots of {@code path}.
     */
    void record(int[] path, int length) {
        total++;
        byLength[length]++;
        for (int i = 0; i < length; i++) {
            participation[path[i]]++;
        }
        sample(path, length);

        if (total % progressInterval == 0) {
            log.info("SCC {} ({} nodes): {} cycles found so far", sccId, component.size(), total);
        }
    }

    long total() {
        return total;
    }

    SccCycleResult result() {
        var counts = new LinkedHashMap<String, Long>();
        for (int i = 0; i < participation.length; i++) {
            counts.put(component.nodeAt(i), participation[i]);
        }
        var histogram = new TreeMap<Integer, Long>();
        for (int length = 2; length < byLength.length; length++) {
            if (byLength[length] > 0) {
                histogram.put(length, byLength[length]);
            }
        }
        return new SccCycleResult(sccId, component.size(), total, counts, histogram, samples());
    }

    // ==================== Sampling ====================

    private void sample(int[] path, int length) {
        if (maxSaved == 0) return;

        if (savedByLength[length] < perLengthQuota && primary.size() < maxSaved) {
            savedByLength[length]++;
            primary.add(toRecord(path, length));
        } else if (reserve.size() < maxSaved) {
            reserve.add(toRecord(path, length));
        }
    }

    private List<CycleRecord> samples() {
        var samples = new ArrayList<>(primary);
        int missing = maxSaved - samples.size();
        reserve.stream().limit(Math.max(missing, 0)).forEach(samples::add);
        samples.sort(Comparator.comparingLong(CycleRecord::sequence));
        return samples;
    }

    private CycleRecord toRecord(int[] path, int length) {
        var nodes = new ArrayList<String>(length);
        for (int i = 0; i < length; i++) {
            nodes.add(component.nodeAt(path[i]));
        }
        return new CycleRecord(sccId, total, nodes);
    }
}
