package com.causal.graph.service.ingest;

import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.graph.GraphEdge;
import com.causal.graph.service.graph.NodeRole;

import java.util.function.Function;

/**
 * Writes graphs back out in the DAGitty syntax read by {@link DagittyParser}.
 */
public class DagittyWriter {

    private static final String INDENT = " ";

    public String write(CausalGraph graph) {
        return write(graph, Function.identity());
    }

    /**
     * Writes the graph with every node id passed through {@code names}, which lets callers
     * emit identifiers that are safe for external tools.
     */
    public String write(CausalGraph graph, Function<String, String> names) {
        var out = new StringBuilder("dag {\n");
        for (String node : graph.nodes()) {
            out.append(INDENT).append(names.apply(node));
            var role = graph.roleOf(node);
            if (role != NodeRole.REGULAR) {
                out.append(" [").append(role.name().toLowerCase()).append(']');
            }
            out.append('\n');
        }
        for (GraphEdge edge : graph.edges()) {
            out.append(INDENT)
                    .append(names.apply(edge.from()))
                    .append(" -> ")
                    .append(names.apply(edge.to()))
                    .append('\n');
        }
        return out.append("}\n").toString();
    }

    /**
     * Wraps a {@code dag { ... }} definition in the R assignment used by the graph files.
     */
    public String wrapAsRScript(String dagDefinition) {
        return "g <- dagitty('" + dagDefinition.stripTrailing() + "')\n";
    }
}
