package com.causal.graph.service.graph;

import java.util.Objects;

/**
 * Directed causal assertion {@code from -> to}. Carries no weight or payload.
 */
public record GraphEdge(String from, String to) {

    public GraphEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public static GraphEdge of(String from, String to) {
        return new GraphEdge(from, to);
    }

    public boolean isSelfLoop() {
        return from.equals(to);
    }

    public boolean touches(String node) {
        return from.equals(node) || to.equals(node);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
