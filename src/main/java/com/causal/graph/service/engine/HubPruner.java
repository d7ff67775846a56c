package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.graph.Direction;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Removes generic hub nodes to shrink the SCCs of a graph.
 *
 * A node is pruned only when it is on the generic-node list AND ranks in the top-N by
 * degree or by betweenness. The exposure and outcome are never pruned.
 */
@Slf4j
public class HubPruner {

    private final List<String> genericNodes;
    private final int topN;
    private final SccDecomposer decomposer;

    public HubPruner(List<String> genericNodes, int topN, SccDecomposer decomposer) {
        this.genericNodes = List.copyOf(new LinkedHashSet<>(genericNodes));
        this.topN = topN;
        this.decomposer = decomposer;
    }

    public List<String> getGenericNodes() {
        return genericNodes;
    }

    public boolean isGeneric(String node) {
        return genericNodes.contains(node);
    }

    public PruningReport prune(CausalGraph graph, CentralityTable centrality) {
        var betweenness = centrality.rows().stream()
                .collect(Collectors.toMap(NodeCentrality::node, NodeCentrality::betweenness));
        return prune(graph, names(centrality.topByDegree(topN)),
                names(centrality.topByBetweenness(topN)), betweenness);
    }

    /**
     * Prunes using previously computed top-N node lists.
     *
     * @param betweenness betweenness by node, used only for reporting
     */
    public PruningReport prune(CausalGraph graph, Collection<String> topByDegree,
                               Collection<String> topByBetweenness, Map<String, Double> betweenness) {
        var ranked = new LinkedHashSet<>(topByDegree);
        ranked.addAll(topByBetweenness);

        var candidates = new ArrayList<String>();
        var notInTop = new ArrayList<String>();
        var protectedSkipped = new ArrayList<String>();
        var absent = new ArrayList<String>();

        for (String generic : genericNodes) {
            if (!graph.contains(generic)) {
                absent.add(generic);
            } else if (!ranked.contains(generic)) {
                notInTop.add(generic);
            } else if (graph.isProtected(generic)) {
                log.warn("Generic node '{}' is the {} and will not be pruned",
                        generic, graph.roleOf(generic).name().toLowerCase());
                protectedSkipped.add(generic);
            } else {
                candidates.add(generic);
            }
        }
        log.info("Hub pruning: {} candidates {}, {} generic nodes outside top {}",
                candidates.size(), candidates, notInTop.size(), topN);

        var baseline = SccStats.of(decomposer.decompose(graph));
        var individual = candidates.stream()
                .map(node -> singleImpact(graph, node, baseline, betweenness.getOrDefault(node, 0.0)))
                .sorted(Comparator.comparingInt(RemovalImpact::sccNodeReduction).reversed())
                .toList();

        var pruned = graph.deleteNodes(candidates);
        var combined = new RemovalImpact(candidates, 0, 0, 0, 0.0,
                graph.edgeCount() - pruned.edgeCount(), baseline,
                SccStats.of(decomposer.decompose(pruned)));
        logCombined(combined);

        return new PruningReport(candidates, notInTop, protectedSkipped, absent,
                baseline, individual, combined, pruned);
    }

    // ==================== Impact ====================

    private RemovalImpact singleImpact(CausalGraph graph, String node, SccStats baseline, double betweenness) {
        var after = graph.deleteNodes(List.of(node));
        var impact = new RemovalImpact(
                List.of(node),
                graph.degree(node, Direction.IN),
                graph.degree(node, Direction.OUT),
                graph.degree(node, Direction.ALL),
                betweenness,
                graph.incidentEdges(node).size(),
                baseline,
                SccStats.of(decomposer.decompose(after))
        );
        log.debug("Removing '{}': {} edges, SCC nodes {} -> {}", node, impact.edgesRemoved(),
                baseline.nodesInLargeComponents(), impact.after().nodesInLargeComponents());
        return impact;
    }

    private void logCombined(RemovalImpact combined) {
        log.info("Removing all candidates: {} edges, SCC nodes {} -> {} ({}% reduction), DAG after: {}",
                combined.edgesRemoved(),
                combined.before().nodesInLargeComponents(),
                combined.after().nodesInLargeComponents(),
                String.format("%.1f", combined.reductionPercent()),
                combined.isDagAfter());
    }

    private static List<String> names(List<NodeCentrality> rows) {
        return rows.stream().map(NodeCentrality::node).toList();
    }
}
