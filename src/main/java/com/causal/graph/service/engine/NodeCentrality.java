package com.causal.graph.service.engine;

/**
 * Degree and betweenness of a single node.
 */
public record NodeCentrality(
        String node,
        int inDegree,
        int outDegree,
        int totalDegree,
        double betweenness
) {}
