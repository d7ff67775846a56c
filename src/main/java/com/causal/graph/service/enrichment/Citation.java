package com.causal.graph.service.enrichment;

import java.util.List;

/**
 * Literature reference supporting one causal edge.
 */
public record Citation(String from, String to, String pmid, String url, List<String> sentences) {

    public Citation {
        sentences = List.copyOf(sentences);
    }
}
