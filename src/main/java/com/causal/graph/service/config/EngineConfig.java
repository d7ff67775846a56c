package com.causal.graph.service.config;

import com.causal.graph.service.engine.ButterflyBiasDetector;
import com.causal.graph.service.engine.CentralityRanker;
import com.causal.graph.service.engine.ConfounderClassifier;
import com.causal.graph.service.engine.ConfounderSubgraphExtractor;
import com.causal.graph.service.engine.CycleBreaker;
import com.causal.graph.service.engine.CycleEnumerator;
import com.causal.graph.service.engine.HubPruner;
import com.causal.graph.service.engine.LeafRemover;
import com.causal.graph.service.engine.SccDecomposer;
import com.causal.graph.service.enrichment.AssertionFileEvidenceProvider;
import com.causal.graph.service.enrichment.EvidenceProvider;
import com.causal.graph.service.enrichment.SemanticTypeLookup;
import com.causal.graph.service.enrichment.VocabularySemanticTypeLookup;
import com.causal.graph.service.ingest.DagittyParser;
import com.causal.graph.service.ingest.DagittyWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Configuration for the analysis engine beans.
 *
 * The engine classes are framework-free; this is where they receive their policy
 * parameters from {@link AnalysisConfig}.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public DagittyParser dagittyParser() {
        log.info("Initializing DagittyParser");
        return new DagittyParser();
    }

    @Bean
    public DagittyWriter dagittyWriter() {
        return new DagittyWriter();
    }

    /**
     * SCC decomposition, the cheap acyclicity gate in front of cycle enumeration.
     */
    @Bean
    public SccDecomposer sccDecomposer() {
        log.info("Initializing SccDecomposer");
        return new SccDecomposer();
    }

    @Bean
    public CycleEnumerator cycleEnumerator(AnalysisConfig config) {
        var cycles = config.getCycles();
        log.info("Initializing CycleEnumerator (maxCyclesToSave={}, progressInterval={})",
                cycles.getMaxCyclesToSave(), cycles.getProgressInterval());
        return new CycleEnumerator(cycles.getMaxCyclesToSave(), cycles.getProgressInterval());
    }

    @Bean
    public CentralityRanker centralityRanker(AnalysisConfig config) {
        log.info("Initializing CentralityRanker");
        return new CentralityRanker(config.getCentrality().getProgressInterval());
    }

    /**
     * Generic hub pruning; prunes allow-listed nodes that rank in the top-N tables.
     */
    @Bean
    public HubPruner hubPruner(AnalysisConfig config, SccDecomposer sccDecomposer) {
        var pruning = config.getPruning();
        log.info("Initializing HubPruner (topN={}, genericNodes={})",
                pruning.getTopN(), pruning.getGenericNodes());
        return new HubPruner(pruning.getGenericNodes(), pruning.getTopN(), sccDecomposer);
    }

    @Bean
    public LeafRemover leafRemover() {
        return new LeafRemover();
    }

    @Bean
    public ConfounderClassifier confounderClassifier(AnalysisConfig config) {
        int threshold = config.getClassification().getTightFeedbackMaxLength();
        log.info("Initializing ConfounderClassifier (tightFeedbackMaxLength={})", threshold);
        return new ConfounderClassifier(threshold);
    }

    @Bean
    public ConfounderSubgraphExtractor confounderSubgraphExtractor() {
        return new ConfounderSubgraphExtractor();
    }

    @Bean
    public CycleBreaker cycleBreaker(AnalysisConfig config) {
        var strong = config.getConfounders().getStrongConfounders();
        log.info("Initializing CycleBreaker ({} strong confounders)", strong.size());
        return new CycleBreaker(strong);
    }

    @Bean
    public ButterflyBiasDetector butterflyBiasDetector() {
        log.info("Initializing ButterflyBiasDetector");
        return new ButterflyBiasDetector();
    }

    // ==================== Enrichment ====================

    @Bean
    public SemanticTypeLookup semanticTypeLookup(EnrichmentConfig config, ObjectMapper objectMapper) {
        if (config.getVocabularyFile() == null || config.getVocabularyFile().isBlank()) {
            log.info("No vocabulary file configured, semantic types disabled");
            return VocabularySemanticTypeLookup.empty();
        }
        return VocabularySemanticTypeLookup.load(Path.of(config.getVocabularyFile()), objectMapper);
    }

    @Bean
    public EvidenceProvider evidenceProvider(EnrichmentConfig config, ObjectMapper objectMapper) {
        if (config.getAssertionsFile() == null || config.getAssertionsFile().isBlank()) {
            log.info("No assertions file configured, evidence lookup disabled");
            return AssertionFileEvidenceProvider.empty();
        }
        return AssertionFileEvidenceProvider.load(Path.of(config.getAssertionsFile()), objectMapper);
    }
}
