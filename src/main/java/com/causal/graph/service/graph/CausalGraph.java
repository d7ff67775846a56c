package com.causal.graph.service.graph;

import com.causal.graph.service.error.InvariantViolationException;
import com.causal.graph.service.error.MalformedGraphException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable directed causal graph with exactly one exposure and one outcome node.
 *
 * Node order is insertion order and is stable across derived graphs, so index-based
 * algorithms produce deterministic output. Duplicate edges are ignored. Every edit
 * returns a new instance; edits that would drop the exposure or outcome are refused.
 */
@Slf4j
public final class CausalGraph {

    private final Map<String, NodeRole> roles;
    private final List<GraphEdge> edges;
    private final Map<String, Set<String>> successors;
    private final Map<String, Set<String>> predecessors;
    private final String exposure;
    private final String outcome;

    private CausalGraph(Map<String, NodeRole> roles, Collection<GraphEdge> edges,
                        String exposure, String outcome) {
        this.roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles));
        this.edges = List.copyOf(new LinkedHashSet<>(edges));
        this.exposure = exposure;
        this.outcome = outcome;
        this.successors = new LinkedHashMap<>();
        this.predecessors = new LinkedHashMap<>();
        indexEdges();
    }

    // ==================== Factories ====================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a graph from a node list, edge list and the ids of the exposure and outcome.
     * Edge endpoints missing from {@code nodes} are added as regular nodes.
     *
     * @throws MalformedGraphException if exposure or outcome is absent or they are the same node
     */
    public static CausalGraph of(Collection<String> nodes, Collection<GraphEdge> edges,
                                 String exposureId, String outcomeId) {
        var builder = builder();
        nodes.forEach(builder::node);
        edges.forEach(builder::edge);
        if (exposureId == null || !builder.roles.containsKey(exposureId)) {
            throw new MalformedGraphException("Exposure node not present in graph: " + exposureId, exposureId);
        }
        if (outcomeId == null || !builder.roles.containsKey(outcomeId)) {
            throw new MalformedGraphException("Outcome node not present in graph: " + outcomeId, outcomeId);
        }
        if (exposureId.equals(outcomeId)) {
            throw new MalformedGraphException("Exposure and outcome must be different nodes", exposureId);
        }
        builder.roles.put(exposureId, NodeRole.EXPOSURE);
        builder.roles.put(outcomeId, NodeRole.OUTCOME);
        return builder.build();
    }

    // ==================== Queries ====================

    public String exposure() {
        return exposure;
    }

    public String outcome() {
        return outcome;
    }

    public List<String> nodes() {
        return List.copyOf(roles.keySet());
    }

    public List<GraphEdge> edges() {
        return edges;
    }

    public int nodeCount() {
        return roles.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean contains(String node) {
        return roles.containsKey(node);
    }

    public NodeRole roleOf(String node) {
        return roles.get(requireNode(node));
    }

    public boolean isProtected(String node) {
        return node.equals(exposure) || node.equals(outcome);
    }

    public boolean hasEdge(String from, String to) {
        var out = successors.get(from);
        return out != null && out.contains(to);
    }

    public List<String> neighbors(String node, Direction direction) {
        requireNode(node);
        return switch (direction) {
            case OUT -> List.copyOf(successors.get(node));
            case IN -> List.copyOf(predecessors.get(node));
            case ALL -> {
                var all = new LinkedHashSet<>(successors.get(node));
                all.addAll(predecessors.get(node));
                yield List.copyOf(all);
            }
        };
    }

    public List<String> parents(String node) {
        return neighbors(node, Direction.IN);
    }

    public List<String> children(String node) {
        return neighbors(node, Direction.OUT);
    }

    /**
     * Degree in the given direction. {@link Direction#ALL} is in-degree plus out-degree,
     * so a self-loop counts twice.
     */
    public int degree(String node, Direction direction) {
        requireNode(node);
        return switch (direction) {
            case OUT -> successors.get(node).size();
            case IN -> predecessors.get(node).size();
            case ALL -> successors.get(node).size() + predecessors.get(node).size();
        };
    }

    public Map<String, List<String>> adjacency(Direction direction) {
        var adjacency = new LinkedHashMap<String, List<String>>();
        roles.keySet().forEach(node -> adjacency.put(node, neighbors(node, direction)));
        return Collections.unmodifiableMap(adjacency);
    }

    /**
     * Integer-indexed view over the given node subset, keeping only edges with both
     * endpoints inside it.
     */
    public IndexedDigraph inducedSubgraph(Collection<String> nodeSet) {
        var members = new HashSet<>(nodeSet);
        var ordered = roles.keySet().stream()
                .filter(members::contains)
                .toList();
        var index = new LinkedHashMap<String, Integer>();
        for (int i = 0; i < ordered.size(); i++) {
            index.put(ordered.get(i), i);
        }
        int[][] adjacency = new int[ordered.size()][];
        for (int i = 0; i < ordered.size(); i++) {
            adjacency[i] = successors.get(ordered.get(i)).stream()
                    .map(index::get)
                    .filter(Objects::nonNull)
                    .mapToInt(Integer::intValue)
                    .sorted()
                    .toArray();
        }
        return new IndexedDigraph(ordered, adjacency);
    }

    public IndexedDigraph indexed() {
        return inducedSubgraph(roles.keySet());
    }

    // ==================== Edits ====================

    /**
     * Removes the given nodes and every incident edge.
     *
     * @throws InvariantViolationException if the exposure or outcome is among them
     */
    public CausalGraph deleteNodes(Collection<String> nodeIds) {
        for (String node : nodeIds) {
            if (isProtected(node)) {
                throw new InvariantViolationException(
                        "Refusing to delete %s node '%s'".formatted(roleOf(node).name().toLowerCase(), node),
                        node);
            }
        }
        var removed = new HashSet<>(nodeIds);
        var keptRoles = new LinkedHashMap<>(roles);
        keptRoles.keySet().removeAll(removed);
        var keptEdges = edges.stream()
                .filter(edge -> !removed.contains(edge.from()) && !removed.contains(edge.to()))
                .toList();
        return new CausalGraph(keptRoles, keptEdges, exposure, outcome);
    }

    public CausalGraph deleteEdges(Collection<GraphEdge> toRemove) {
        var removed = new HashSet<>(toRemove);
        var keptEdges = edges.stream()
                .filter(edge -> !removed.contains(edge))
                .toList();
        return new CausalGraph(roles, keptEdges, exposure, outcome);
    }

    /**
     * Edges touching the given node, each counted once.
     */
    public List<GraphEdge> incidentEdges(String node) {
        requireNode(node);
        return edges.stream().filter(edge -> edge.touches(node)).toList();
    }

    // ==================== Internals ====================

    private void indexEdges() {
        roles.keySet().forEach(node -> {
            successors.put(node, new LinkedHashSet<>());
            predecessors.put(node, new LinkedHashSet<>());
        });
        for (GraphEdge edge : edges) {
            successors.get(edge.from()).add(edge.to());
            predecessors.get(edge.to()).add(edge.from());
        }
    }

    private String requireNode(String node) {
        if (!roles.containsKey(node)) {
            throw new IllegalArgumentException("Unknown node: " + node);
        }
        return node;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof CausalGraph that)) return false;
        return roles.equals(that.roles)
                && new HashSet<>(edges).equals(new HashSet<>(that.edges));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(new Object[]{roles, new HashSet<>(edges)});
    }

    @Override
    public String toString() {
        return "CausalGraph[exposure=%s, outcome=%s, nodes=%d, edges=%d]"
                .formatted(exposure, outcome, nodeCount(), edgeCount());
    }

    // ==================== Builder ====================

    /**
     * Accumulates nodes and edges in encounter order. A node flagged as exposure or
     * outcome more than once keeps the first flag; later ones are demoted with a warning.
     */
    public static final class Builder {

        private final Map<String, NodeRole> roles = new LinkedHashMap<>();
        private final List<GraphEdge> edges = new ArrayList<>();

        private Builder() {
        }

        public Builder node(String id) {
            return node(id, NodeRole.REGULAR);
        }

        public Builder node(String id, NodeRole role) {
            var existing = roles.get(id);
            if (existing == null || existing == NodeRole.REGULAR) {
                roles.put(id, role);
            }
            return this;
        }

        public Builder exposure(String id) {
            return node(id, NodeRole.EXPOSURE);
        }

        public Builder outcome(String id) {
            return node(id, NodeRole.OUTCOME);
        }

        public Builder edge(String from, String to) {
            return edge(GraphEdge.of(from, to));
        }

        public Builder edge(GraphEdge edge) {
            roles.putIfAbsent(edge.from(), NodeRole.REGULAR);
            roles.putIfAbsent(edge.to(), NodeRole.REGULAR);
            edges.add(edge);
            return this;
        }

        /**
         * @throws MalformedGraphException if no exposure or no outcome was flagged
         */
        public CausalGraph build() {
            var resolved = new LinkedHashMap<>(roles);
            String exposure = resolveRole(resolved, NodeRole.EXPOSURE);
            String outcome = resolveRole(resolved, NodeRole.OUTCOME);
            if (exposure == null) {
                throw new MalformedGraphException("Graph has no exposure node");
            }
            if (outcome == null) {
                throw new MalformedGraphException("Graph has no outcome node");
            }
            return new CausalGraph(resolved, edges, exposure, outcome);
        }

        private static String resolveRole(Map<String, NodeRole> resolved, NodeRole role) {
            String winner = null;
            for (var entry : resolved.entrySet()) {
                if (entry.getValue() != role) continue;
                if (winner == null) {
                    winner = entry.getKey();
                } else {
                    log.warn("Multiple {} nodes flagged, keeping '{}' and treating '{}' as regular",
                            role.name().toLowerCase(), winner, entry.getKey());
                    entry.setValue(NodeRole.REGULAR);
                }
            }
            return winner;
        }
    }
}
