package com.causal.graph.service.enrichment;

import com.causal.graph.service.error.CausalAnalysisException;
import com.causal.graph.service.error.MissingPrerequisiteException;
import com.causal.graph.service.graph.GraphEdge;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * {@link EvidenceProvider} backed by the assertions file written by the graph generation
 * tool. Edges are matched on normalized subject and object names.
 */
@Slf4j
public class AssertionFileEvidenceProvider implements EvidenceProvider {

    static final String PUBMED_URL = "https://pubmed.ncbi.nlm.nih.gov/%s";

    private final Map<String, List<Assertion>> assertionsByEdge = new HashMap<>();
    private final Map<String, List<String>> sentencesByPmid;

    public AssertionFileEvidenceProvider(AssertionsDocument document) {
        for (Assertion assertion : document.getAssertions()) {
            assertionsByEdge.computeIfAbsent(key(assertion.getSubj(), assertion.getObj()), k -> new ArrayList<>())
                    .add(assertion);
        }
        this.sentencesByPmid = Map.copyOf(document.getPmidSentences());
    }

    public static AssertionFileEvidenceProvider empty() {
        return new AssertionFileEvidenceProvider(new AssertionsDocument());
    }

    /**
     * @throws MissingPrerequisiteException if the file does not exist
     */
    public static AssertionFileEvidenceProvider load(Path file, ObjectMapper objectMapper) {
        if (!Files.exists(file)) {
            throw new MissingPrerequisiteException(file.toString(), "graph generation tool (assertions export)");
        }
        try {
            var document = objectMapper.readValue(file.toFile(), AssertionsDocument.class);
            log.info("Loaded {} assertions and {} PMID sentence sets from {}",
                    document.getAssertions().size(), document.getPmidSentences().size(), file);
            return new AssertionFileEvidenceProvider(document);
        } catch (IOException e) {
            throw new CausalAnalysisException("Failed to read assertions file: " + file,
                    file.toString(), "IO_ERROR", e);
        }
    }

    @Override
    public List<Citation> citationsFor(Collection<GraphEdge> edges) {
        var citations = new ArrayList<Citation>();
        for (GraphEdge edge : new LinkedHashSet<>(edges)) {
            var pmids = new LinkedHashSet<String>();
            assertionsByEdge.getOrDefault(key(edge.from(), edge.to()), List.of())
                    .forEach(assertion -> pmids.addAll(assertion.getPmidRefs()));
            for (String pmid : pmids) {
                citations.add(new Citation(edge.from(), edge.to(), pmid, PUBMED_URL.formatted(pmid),
                        sentencesByPmid.getOrDefault(pmid, List.of())));
            }
        }
        log.debug("Found {} citations for {} edges", citations.size(), edges.size());
        return citations;
    }

    private static String key(String subject, String object) {
        return NameNormalizer.normalize(subject) + "->" + NameNormalizer.normalize(object);
    }

    // ==================== File Model ====================

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AssertionsDocument {
        private List<Assertion> assertions = new ArrayList<>();

        @JsonProperty("pmid_sentences")
        private Map<String, List<String>> pmidSentences = new HashMap<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Assertion {
        private String subj;

        @JsonProperty("subj_cui")
        private String subjCui;

        private String obj;

        @JsonProperty("obj_cui")
        private String objCui;

        @JsonProperty("pmid_refs")
        private List<String> pmidRefs = new ArrayList<>();
    }
}
