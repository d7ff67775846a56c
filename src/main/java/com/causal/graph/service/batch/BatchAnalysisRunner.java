package com.causal.graph.service.batch;

import com.causal.graph.service.config.AnalysisConfig;
import com.causal.graph.service.error.MalformedGraphException;
import com.causal.graph.service.error.MissingPrerequisiteException;
import com.causal.graph.service.ingest.DagittyParser;
import com.causal.graph.service.ingest.GraphIngestionService;
import com.causal.graph.service.pipeline.AnalysisPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs the whole pipeline once at startup on the graph file named by the configured
 * exposure, outcome and degree.
 *
 * Enable with {@code causal.features.batch-enabled=true}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "causal.features", name = "batch-enabled", havingValue = "true")
@RequiredArgsConstructor
public class BatchAnalysisRunner implements ApplicationRunner {

    private final AnalysisConfig analysisConfig;
    private final DagittyParser dagittyParser;
    private final GraphIngestionService ingestionService;
    private final AnalysisPipeline pipeline;

    @Override
    public void run(ApplicationArguments args) {
        var input = resolveInput();
        log.info("=== Batch analysis: {} -> {} (degree {}) from {} ===",
                analysisConfig.getExposure(), analysisConfig.getOutcome(), analysisConfig.getDegree(), input);

        var graph = dagittyParser.parse(input);
        if (!graph.exposure().equals(analysisConfig.getExposure())
                || !graph.outcome().equals(analysisConfig.getOutcome())) {
            throw new MalformedGraphException(
                    "Graph declares exposure '%s' and outcome '%s' but '%s' and '%s' are configured".formatted(
                            graph.exposure(), graph.outcome(),
                            analysisConfig.getExposure(), analysisConfig.getOutcome()),
                    input.toString());
        }

        var analysisId = ingestionService.ingest(
                analysisConfig.analysisId(), analysisConfig.getDegree(), graph, input.getFileName().toString());
        var results = pipeline.runAll(analysisId);
        log.info("=== Batch analysis {} finished: {} stages ===", analysisId, results.size());
    }

    Path resolveInput() {
        var input = Path.of(analysisConfig.getInputDir()).resolve(analysisConfig.inputFileName());
        if (!Files.isRegularFile(input)) {
            throw new MissingPrerequisiteException(input.toString(), "graph generation");
        }
        return input;
    }
}
