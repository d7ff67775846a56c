package com.causal.graph.service.graph;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Integer-indexed adjacency view of a node subset, used by the traversal algorithms.
 * Node indices follow the insertion order of the source graph and successor arrays
 * are sorted ascending.
 */
public final class IndexedDigraph {

    private final List<String> nodes;
    private final Map<String, Integer> indexByNode;
    private final int[][] successors;

    IndexedDigraph(List<String> nodes, int[][] successors) {
        this.nodes = List.copyOf(nodes);
        this.successors = successors;
        this.indexByNode = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            indexByNode.put(nodes.get(i), i);
        }
    }

    public int size() {
        return nodes.size();
    }

    public String nodeAt(int index) {
        return nodes.get(index);
    }

    public int indexOf(String node) {
        Integer index = indexByNode.get(node);
        return index == null ? -1 : index;
    }

    public int[] successors(int index) {
        return successors[index];
    }

    public List<String> nodes() {
        return nodes;
    }
}
