package com.causal.graph.service.enrichment;

import com.causal.graph.service.error.CausalAnalysisException;
import com.causal.graph.service.error.MissingPrerequisiteException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SemanticTypeLookup} over an exported vocabulary: node name to concept id, and
 * concept id to semantic category. Names are matched after {@link NameNormalizer#normalize}.
 *
 * <pre>
 * { "names": { "Hypertension": "C0020538" }, "categories": { "C0020538": "Disease or Syndrome" } }
 * </pre>
 */
@Slf4j
public class VocabularySemanticTypeLookup implements SemanticTypeLookup {

    private final Map<String, String> conceptByName = new HashMap<>();
    private final Map<String, String> categoryByConcept;

    public VocabularySemanticTypeLookup(Map<String, String> conceptByName, Map<String, String> categoryByConcept) {
        conceptByName.forEach((name, concept) -> this.conceptByName.put(NameNormalizer.normalize(name), concept));
        this.categoryByConcept = Map.copyOf(categoryByConcept);
    }

    public static VocabularySemanticTypeLookup empty() {
        return new VocabularySemanticTypeLookup(Map.of(), Map.of());
    }

    /**
     * @throws MissingPrerequisiteException if the file does not exist
     */
    public static VocabularySemanticTypeLookup load(Path file, ObjectMapper objectMapper) {
        if (!Files.exists(file)) {
            throw new MissingPrerequisiteException(file.toString(), "graph generation tool (vocabulary export)");
        }
        try {
            var document = objectMapper.readValue(file.toFile(), VocabularyDocument.class);
            log.info("Loaded vocabulary from {}: {} names, {} categories",
                    file, document.getNames().size(), document.getCategories().size());
            return new VocabularySemanticTypeLookup(document.getNames(), document.getCategories());
        } catch (IOException e) {
            throw new CausalAnalysisException("Failed to read vocabulary file: " + file,
                    file.toString(), "IO_ERROR", e);
        }
    }

    @Override
    public Optional<String> categoryOf(String nodeName) {
        return Optional.ofNullable(conceptByName.get(NameNormalizer.normalize(nodeName)))
                .map(categoryByConcept::get);
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class VocabularyDocument {
        private Map<String, String> names = new HashMap<>();
        private Map<String, String> categories = new HashMap<>();
    }
}
