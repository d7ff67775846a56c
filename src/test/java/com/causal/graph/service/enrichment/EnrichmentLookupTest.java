package com.causal.graph.service.enrichment;

import com.causal.graph.service.error.MissingPrerequisiteException;
import com.causal.graph.service.graph.GraphEdge;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnrichmentLookupTest {

    private static final Path ASSERTIONS = Path.of("src/test/resources/fixtures/assertions.json");
    private static final Path VOCABULARY = Path.of("src/test/resources/fixtures/vocabulary.json");

    private final ObjectMapper objectMapper = new ObjectMapper();

    // ==================== Evidence ====================

    @Test
    @DisplayName("Citations are matched on normalized names and deduplicated per edge")
    void citations() {
        var provider = AssertionFileEvidenceProvider.load(ASSERTIONS, objectMapper);

        var citations = provider.citationsFor(List.of(
                GraphEdge.of("Diabetes", "Hypertension"),
                GraphEdge.of("Diabetes", "Alzheimers")));

        assertThat(citations).extracting(Citation::pmid).containsExactly("111", "222");
        assertThat(citations.get(0).url()).isEqualTo("https://pubmed.ncbi.nlm.nih.gov/111");
        assertThat(citations.get(0).sentences()).hasSize(2);
        assertThat(citations.get(1).sentences()).containsExactly("Glycemic control lowered systolic pressure.");
    }

    @Test
    @DisplayName("PMIDs without stored sentences still produce a citation")
    void citationWithoutSentences() {
        var provider = AssertionFileEvidenceProvider.load(ASSERTIONS, objectMapper);

        var citations = provider.citationsFor(List.of(GraphEdge.of("Obesity", "Stroke")));

        assertThat(citations).singleElement().satisfies(citation -> {
            assertThat(citation.pmid()).isEqualTo("333");
            assertThat(citation.sentences()).isEmpty();
        });
    }

    @Test
    @DisplayName("A missing assertions file is a missing prerequisite")
    void missingAssertions() {
        assertThatThrownBy(() -> AssertionFileEvidenceProvider.load(Path.of("does/not/exist.json"), objectMapper))
                .isInstanceOf(MissingPrerequisiteException.class)
                .hasMessageContaining("graph generation tool");
    }

    @Test
    @DisplayName("The empty provider finds nothing")
    void emptyProvider() {
        assertThat(AssertionFileEvidenceProvider.empty()
                .citationsFor(List.of(GraphEdge.of("Diabetes", "Hypertension")))).isEmpty();
    }

    // ==================== Semantic Types ====================

    @Test
    @DisplayName("Semantic categories resolve through the concept id")
    void semanticTypes() {
        var lookup = VocabularySemanticTypeLookup.load(VOCABULARY, objectMapper);

        assertThat(lookup.categoryOf("Diabetes")).contains("Disease or Syndrome");
        assertThat(lookup.categoryOf("Sleep_apnea")).contains("Disease or Syndrome");
        assertThat(lookup.categoryOf("Stroke")).isEmpty();
    }

    @Test
    @DisplayName("Names normalize to lower-case underscore form")
    void normalize() {
        assertThat(NameNormalizer.normalize("  Sleep Apnea (obstructive) ")).isEqualTo("sleep_apnea_obstructive");
        assertThat(NameNormalizer.normalize(null)).isEmpty();
    }
}
