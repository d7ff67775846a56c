package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.graph.Direction;
import com.causal.graph.service.graph.GraphEdge;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Repeatedly strips nodes whose total degree is one, after dropping self-loops.
 * Such nodes cannot lie on a cycle or a confounding path. The exposure and outcome stay.
 */
@Slf4j
public class LeafRemover {

    public Result removeLeaves(CausalGraph graph) {
        var selfLoops = graph.edges().stream().filter(GraphEdge::isSelfLoop).toList();
        var current = graph.deleteEdges(selfLoops);
        var removed = new ArrayList<String>();
        int rounds = 0;

        while (true) {
            var snapshot = current;
            var leaves = snapshot.nodes().stream()
                    .filter(node -> !snapshot.isProtected(node))
                    .filter(node -> snapshot.degree(node, Direction.ALL) == 1)
                    .toList();
            if (leaves.isEmpty()) break;

            rounds++;
            removed.addAll(leaves);
            current = snapshot.deleteNodes(leaves);
            log.debug("Leaf removal round {}: {} nodes", rounds, leaves.size());
        }

        log.info("Leaf removal: {} nodes in {} rounds, {} self-loops dropped",
                removed.size(), rounds, selfLoops.size());
        return new Result(current, removed, selfLoops.size(), rounds);
    }

    public record Result(CausalGraph graph, List<String> removedNodes, int selfLoopsRemoved, int rounds) {

        public Result {
            removedNodes = List.copyOf(removedNodes);
        }
    }
}
