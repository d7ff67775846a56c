package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Breadth-first shortest directed paths from one source node. Ties go to the
 * neighbor met first in graph order.
 */
public final class ShortestPaths {

    private final String source;
    private final Map<String, Integer> distance = new HashMap<>();
    private final Map<String, String> predecessor = new HashMap<>();

    private ShortestPaths(String source) {
        this.source = source;
    }

    public static ShortestPaths from(CausalGraph graph, String source) {
        var paths = new ShortestPaths(source);
        var queue = new ArrayDeque<String>();
        paths.distance.put(source, 0);
        queue.add(source);

        while (!queue.isEmpty()) {
            var v = queue.poll();
            int next = paths.distance.get(v) + 1;
            for (String w : graph.children(v)) {
                if (!paths.distance.containsKey(w)) {
                    paths.distance.put(w, next);
                    paths.predecessor.put(w, v);
                    queue.add(w);
                }
            }
        }
        return paths;
    }

    /**
     * Number of edges on a shortest path from the source, or {@code null} when unreachable.
     */
    public Integer distanceTo(String target) {
        return distance.get(target);
    }

    public boolean reaches(String target) {
        return distance.containsKey(target);
    }

    /**
     * Nodes on a shortest path from the source to {@code target}, both included;
     * empty when unreachable.
     */
    public List<String> pathTo(String target) {
        if (!reaches(target)) return List.of();

        var path = new ArrayList<String>();
        for (String node = target; node != null; node = predecessor.get(node)) {
            path.add(node);
            if (node.equals(source)) break;
        }
        Collections.reverse(path);
        return path;
    }
}
