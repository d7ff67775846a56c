package com.causal.graph.service.engine;

import java.util.List;

/**
 * One concrete simple cycle {@code v0 -> ... -> vk-1 -> v0}, starting at the member with
 * the smallest index in its SCC.
 *
 * @param sccId    component the cycle lives in
 * @param sequence discovery order within the component, starting at 1
 * @param nodes    the cycle's nodes; the closing edge back to the first is implicit
 */
public record CycleRecord(int sccId, long sequence, List<String> nodes) {

    public CycleRecord {
        nodes = List.copyOf(nodes);
    }

    public int length() {
        return nodes.size();
    }

    public String asPath() {
        return String.join(" -> ", nodes) + " -> " + nodes.get(0);
    }
}
