package com.causal.graph.service.enrichment;

import java.util.Optional;

/**
 * Resolves a node name to the semantic category of its controlled-vocabulary concept.
 */
public interface SemanticTypeLookup {

    /**
     * @param nodeName node name as it appears in the graph
     * @return the semantic category, empty when the name is not in the vocabulary
     */
    Optional<String> categoryOf(String nodeName);
}
