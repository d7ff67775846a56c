package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.graph.IndexedDigraph;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Tarjan's strongly connected components, run with an explicit call stack so deep
 * graphs cannot overflow the thread stack.
 */
@Slf4j
public class SccDecomposer {

    private static final int UNVISITED = -1;

    public SccPartition decompose(CausalGraph graph) {
        var digraph = graph.indexed();
        var raw = tarjan(digraph);
        var partition = toPartition(digraph, raw);
        log.debug("SCC decomposition: {} components, {} large, largest={}",
                partition.componentCount(), partition.largeComponents().size(),
                partition.largestComponentSize());
        return partition;
    }

    public boolean isDag(CausalGraph graph) {
        return decompose(graph).isDag();
    }

    // ==================== Tarjan ====================

    private List<int[]> tarjan(IndexedDigraph digraph) {
        int n = digraph.size();
        int[] index = new int[n];
        int[] low = new int[n];
        int[] cursor = new int[n];
        boolean[] onStack = new boolean[n];
        int[] stack = new int[n];
        int[] callStack = new int[n];
        Arrays.fill(index, UNVISITED);

        var components = new ArrayList<int[]>();
        int counter = 0;
        int sp = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] != UNVISITED) continue;

            int csp = 0;
            index[root] = low[root] = counter++;
            stack[sp++] = root;
            onStack[root] = true;
            callStack[csp++] = root;

            while (csp > 0) {
                int v = callStack[csp - 1];
                int[] successors = digraph.successors(v);

                if (cursor[v] < successors.length) {
                    int w = successors[cursor[v]++];
                    if (index[w] == UNVISITED) {
                        index[w] = low[w] = counter++;
                        stack[sp++] = w;
                        onStack[w] = true;
                        callStack[csp++] = w;
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }

                csp--;
                if (low[v] == index[v]) {
                    components.add(popComponent(stack, sp, v, onStack));
                    sp -= components.get(components.size() - 1).length;
                }
                if (csp > 0) {
                    int parent = callStack[csp - 1];
                    low[parent] = Math.min(low[parent], low[v]);
                }
            }
        }
        return components;
    }

    private int[] popComponent(int[] stack, int sp, int root, boolean[] onStack) {
        int start = sp - 1;
        while (stack[start] != root) {
            start--;
        }
        int[] members = Arrays.copyOfRange(stack, start, sp);
        for (int member : members) {
            onStack[member] = false;
        }
        Arrays.sort(members);
        return members;
    }

    // ==================== Partition Building ====================

    private SccPartition toPartition(IndexedDigraph digraph, List<int[]> raw) {
        raw.sort(Comparator.comparingInt(members -> members[0]));

        var componentOf = new LinkedHashMap<String, Integer>();
        var components = new ArrayList<SccPartition.Component>();
        for (int i = 0; i < raw.size(); i++) {
            int id = i + 1;
            var members = Arrays.stream(raw.get(i))
                    .mapToObj(digraph::nodeAt)
                    .toList();
            members.forEach(node -> componentOf.put(node, id));
            components.add(new SccPartition.Component(id, members));
        }

        var ordered = new LinkedHashMap<String, Integer>();
        digraph.nodes().forEach(node -> ordered.put(node, componentOf.get(node)));
        return new SccPartition(ordered, components);
    }
}
