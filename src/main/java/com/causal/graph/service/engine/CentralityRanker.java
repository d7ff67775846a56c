package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.graph.Direction;
import com.causal.graph.service.graph.IndexedDigraph;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * Degree and betweenness centrality over the whole directed graph.
 *
 * Betweenness uses Brandes' algorithm on unweighted directed shortest paths and is not
 * normalized. Runtime is O(V * E); progress is logged every {@code progressInterval}
 * source nodes.
 */
@Slf4j
public class CentralityRanker {

    private final int progressInterval;

    public CentralityRanker(int progressInterval) {
        this.progressInterval = Math.max(progressInterval, 1);
    }

    public CentralityTable rank(CausalGraph graph) {
        long startTime = System.currentTimeMillis();
        var digraph = graph.indexed();
        double[] betweenness = betweenness(digraph);

        var rows = new ArrayList<NodeCentrality>(digraph.size());
        for (int i = 0; i < digraph.size(); i++) {
            var node = digraph.nodeAt(i);
            rows.add(new NodeCentrality(
                    node,
                    graph.degree(node, Direction.IN),
                    graph.degree(node, Direction.OUT),
                    graph.degree(node, Direction.ALL),
                    betweenness[i]
            ));
        }

        log.info("Centrality computed for {} nodes in {}ms",
                rows.size(), System.currentTimeMillis() - startTime);
        return new CentralityTable(rows);
    }

    // ==================== Brandes ====================

    double[] betweenness(IndexedDigraph digraph) {
        int n = digraph.size();
        double[] centrality = new double[n];
        double[] sigma = new double[n];
        double[] delta = new double[n];
        int[] distance = new int[n];
        int[] order = new int[n];
        int[] queue = new int[n];
        int[][] predecessors = new int[n][];
        int[] predecessorCount = new int[n];
        for (int v = 0; v < n; v++) {
            predecessors[v] = new int[4];
        }

        for (int s = 0; s < n; s++) {
            Arrays.fill(sigma, 0);
            Arrays.fill(delta, 0);
            Arrays.fill(distance, -1);
            Arrays.fill(predecessorCount, 0);
            sigma[s] = 1;
            distance[s] = 0;

            int head = 0;
            int tail = 0;
            int visited = 0;
            queue[tail++] = s;

            while (head < tail) {
                int v = queue[head++];
                order[visited++] = v;
                for (int w : digraph.successors(v)) {
                    if (w == v) continue;
                    if (distance[w] < 0) {
                        distance[w] = distance[v] + 1;
                        queue[tail++] = w;
                    }
                    if (distance[w] == distance[v] + 1) {
                        sigma[w] += sigma[v];
                        predecessors[w] = append(predecessors[w], predecessorCount[w]++, v);
                    }
                }
            }

            for (int i = visited - 1; i >= 0; i--) {
                int w = order[i];
                for (int p = 0; p < predecessorCount[w]; p++) {
                    int v = predecessors[w][p];
                    delta[v] += sigma[v] / sigma[w] * (1 + delta[w]);
                }
                if (w != s) {
                    centrality[w] += delta[w];
                }
            }

            if ((s + 1) % progressInterval == 0) {
                log.info("Betweenness: processed {}/{} source nodes", s + 1, n);
            }
        }
        return centrality;
    }

    private static int[] append(int[] values, int position, int value) {
        var target = position < values.length ? values : Arrays.copyOf(values, values.length * 2);
        target[position] = value;
        return target;
    }
}
