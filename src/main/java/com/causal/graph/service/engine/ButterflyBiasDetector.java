package com.causal.graph.service.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Flags confounders with two or more confounder parents. Adjusting for such a node
 * opens a collider path between its parents, so the parents should be adjusted for instead.
 */
@Slf4j
public class ButterflyBiasDetector {

    public ButterflyAnalysis detect(StructuralGraph graph, Collection<String> validConfounders) {
        var confounders = new LinkedHashSet<String>();
        for (String confounder : validConfounders) {
            if (graph.contains(confounder)) {
                confounders.add(confounder);
            } else {
                log.warn("Confounder '{}' is not in the graph, skipping", confounder);
            }
        }

        var records = new ArrayList<ButterflyRecord>();
        for (String confounder : confounders) {
            var confounderParents = graph.parents(confounder).stream()
                    .filter(parent -> !parent.equals(confounder))
                    .filter(confounders::contains)
                    .toList();
            records.add(new ButterflyRecord(confounder, confounderParents));
        }

        var analysis = new ButterflyAnalysis(records);
        log.info("Butterfly analysis: {} confounders, {} independent, {} single-parent, {} butterfly",
                records.size(), analysis.independent().size(), analysis.singleParent().size(),
                analysis.butterflies().size());
        return analysis;
    }

    /**
     * Common parents of exposure and outcome that are not children of either, computed
     * on the structural graph alone.
     */
    public List<String> structuralConfounders(StructuralGraph graph) {
        var outcomeParents = new HashSet<>(graph.parents(graph.outcome()));
        var children = new HashSet<>(graph.children(graph.exposure()));
        children.addAll(graph.children(graph.outcome()));
        return graph.parents(graph.exposure()).stream()
                .filter(outcomeParents::contains)
                .filter(node -> !children.contains(node))
                .toList();
    }

    public ConfounderComparison compare(Collection<String> pipelineConfounders, Collection<String> structural) {
        var structuralSet = new LinkedHashSet<>(structural);
        var pipelineSet = new LinkedHashSet<>(pipelineConfounders);
        var both = pipelineSet.stream().filter(structuralSet::contains).toList();
        var pipelineOnly = pipelineSet.stream().filter(n -> !structuralSet.contains(n)).toList();
        var structuralOnly = structuralSet.stream().filter(n -> !pipelineSet.contains(n)).toList();
        if (!pipelineOnly.isEmpty() || !structuralOnly.isEmpty()) {
            log.warn("Confounder lists differ: pipeline-only {}, structural-only {}", pipelineOnly, structuralOnly);
        }
        return new ConfounderComparison(both, pipelineOnly, structuralOnly);
    }
}
