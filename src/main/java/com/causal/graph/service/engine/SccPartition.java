package com.causal.graph.service.engine;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Strongly connected components of a graph. Component ids start at 1 and follow the
 * position of each component's first node in graph order.
 */
public final class SccPartition {

    private final Map<String, Integer> componentOf;
    private final List<Component> components;

    SccPartition(Map<String, Integer> componentOf, List<Component> components) {
        this.componentOf = Collections.unmodifiableMap(componentOf);
        this.components = List.copyOf(components);
    }

    public int componentOf(String node) {
        Integer id = componentOf.get(node);
        if (id == null) {
            throw new IllegalArgumentException("Unknown node: " + node);
        }
        return id;
    }

    public Map<String, Integer> componentIds() {
        return componentOf;
    }

    public List<Component> components() {
        return components;
    }

    public int componentCount() {
        return components.size();
    }

    /**
     * Components with more than one node; the only places cycles of length two or more live.
     */
    public List<Component> largeComponents() {
        return components.stream().filter(Component::isLarge).toList();
    }

    public boolean isDag() {
        return components.stream().noneMatch(Component::isLarge);
    }

    public int nodesInLargeComponents() {
        return largeComponents().stream().mapToInt(Component::size).sum();
    }

    public int largestComponentSize() {
        return components.stream().mapToInt(Component::size).max().orElse(0);
    }

    /**
     * Component size to number of components with that size.
     */
    public SortedMap<Integer, Integer> sizeHistogram() {
        var histogram = new TreeMap<Integer, Integer>();
        components.forEach(c -> histogram.merge(c.size(), 1, Integer::sum));
        return histogram;
    }

    public record Component(int id, List<String> members) {

        public Component {
            members = List.copyOf(members);
        }

        public int size() {
            return members.size();
        }

        public boolean isLarge() {
            return members.size() > 1;
        }
    }
}
