package com.causal.graph.service.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Centrality of every node in graph order, with ranked views.
 * Ties keep graph order.
 */
public final class CentralityTable {

    private final List<NodeCentrality> rows;
    private final Map<String, NodeCentrality> byNode = new LinkedHashMap<>();

    public CentralityTable(List<NodeCentrality> rows) {
        this.rows = List.copyOf(rows);
        rows.forEach(row -> byNode.put(row.node(), row));
    }

    public List<NodeCentrality> rows() {
        return rows;
    }

    public Optional<NodeCentrality> get(String node) {
        return Optional.ofNullable(byNode.get(node));
    }

    public List<NodeCentrality> byDegree() {
        return sorted(Comparator.comparingInt(NodeCentrality::totalDegree).reversed());
    }

    public List<NodeCentrality> byBetweenness() {
        return sorted(Comparator.comparingDouble(NodeCentrality::betweenness).reversed());
    }

    public List<NodeCentrality> topByDegree(int n) {
        return byDegree().stream().limit(n).toList();
    }

    public List<NodeCentrality> topByBetweenness(int n) {
        return byBetweenness().stream().limit(n).toList();
    }

    private List<NodeCentrality> sorted(Comparator<NodeCentrality> order) {
        var copy = new ArrayList<>(rows);
        copy.sort(order);
        return copy;
    }
}
