package com.causal.graph.service.graph;

/**
 * Edge direction used for neighbor and degree queries.
 */
public enum Direction {
    IN,
    OUT,
    ALL
}
