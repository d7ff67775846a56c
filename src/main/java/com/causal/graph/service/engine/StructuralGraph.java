package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.graph.GraphEdge;
import com.causal.graph.service.graph.NameInterner;
import com.causal.graph.service.ingest.DagittyWriter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parent/child view of a possibly cyclic graph keyed by safe identifiers.
 *
 * Only direct adjacency is answered; nothing here assumes acyclicity. Queries take and
 * return original node names, translated through the {@link NameInterner} built once
 * for this graph.
 */
public final class StructuralGraph {

    private final CausalGraph source;
    private final NameInterner names;
    private final Map<String, List<String>> parentsBySafeId = new LinkedHashMap<>();
    private final Map<String, List<String>> childrenBySafeId = new LinkedHashMap<>();

    private StructuralGraph(CausalGraph source) {
        this.source = source;
        this.names = NameInterner.of(source.nodes());
        source.nodes().forEach(node -> {
            parentsBySafeId.put(names.safeId(node), new ArrayList<>());
            childrenBySafeId.put(names.safeId(node), new ArrayList<>());
        });
        for (GraphEdge edge : source.edges()) {
            var from = names.safeId(edge.from());
            var to = names.safeId(edge.to());
            childrenBySafeId.get(from).add(to);
            parentsBySafeId.get(to).add(from);
        }
    }

    public static StructuralGraph of(CausalGraph graph) {
        return new StructuralGraph(graph);
    }

    public String exposure() {
        return source.exposure();
    }

    public String outcome() {
        return source.outcome();
    }

    public boolean contains(String node) {
        return source.contains(node);
    }

    public List<String> parents(String node) {
        return toOriginals(parentsBySafeId.get(names.safeId(node)));
    }

    public List<String> children(String node) {
        return toOriginals(childrenBySafeId.get(names.safeId(node)));
    }

    public NameInterner names() {
        return names;
    }

    /**
     * DAGitty definition using safe identifiers, with exposure and outcome flagged.
     */
    public String toDagitty() {
        return new DagittyWriter().write(source, names::safeId);
    }

    private List<String> toOriginals(List<String> safeIds) {
        return safeIds.stream()
                .map(id -> names.original(id).orElseThrow())
                .toList();
    }
}
