package com.causal.graph.service.api.controller;

import com.causal.graph.service.api.dto.ApiResponse;
import com.causal.graph.service.error.AnalysisNotFoundException;
import com.causal.graph.service.ingest.DagittyWriter;
import com.causal.graph.service.persistence.Neo4jWriter;
import com.causal.graph.service.store.AnalysisIds;
import com.causal.graph.service.store.AnalysisStage;
import com.causal.graph.service.store.ArtifactStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for exporting stage graphs as DAGitty text or to Neo4j.
 */
@Slf4j
@RestController
@RequestMapping("/export")
@Tag(name = "Graph Export", description = "Endpoints for exporting graphs to external tools")
@RequiredArgsConstructor
public class ExportController {

    private final ArtifactStore artifactStore;
    private final DagittyWriter dagittyWriter;
    private final Neo4jWriter neo4jWriter;

    /**
     * Exports a stage graph as a DAGitty definition.
     *
     * @param format "dag" for the bare definition, "r" for an R script wrapping it
     */
    @GetMapping(value = "/dagitty/{analysisId}", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Export graph as DAGitty", description = "Returns the DAGitty definition of a stage graph")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Definition returned"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Analysis not found")
    })
    public ResponseEntity<String> exportDagitty(
            @Parameter(description = "Analysis ID") @PathVariable String analysisId,
            @Parameter(description = "Stage whose graph to export") @RequestParam(defaultValue = "ingest") String stage,
            @Parameter(description = "Output format: 'dag' or 'r'") @RequestParam(defaultValue = "dag") String format) {
        var graph = artifactStore.getGraph(requireAnalysis(analysisId), AnalysisStage.fromPath(stage));
        var definition = dagittyWriter.write(graph);
        var body = switch (format.toLowerCase()) {
            case "dag" -> definition;
            case "r" -> dagittyWriter.wrapAsRScript(definition);
            default -> throw new IllegalArgumentException("Unknown format: " + format);
        };
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(body);
    }

    /**
     * Exports a stage graph to Neo4j.
     *
     * @param mode "cypher" to return Cypher statements, "push" to push directly to Neo4j
     */
    @GetMapping("/neo4j/{analysisId}")
    @Operation(summary = "Export graph to Neo4j",
               description = "Generates Cypher statements or pushes the stage graph directly to Neo4j")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Export completed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Analysis not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Neo4j unavailable")
    })
    public ResponseEntity<ApiResponse<Object>> exportToNeo4j(
            @Parameter(description = "Analysis ID") @PathVariable String analysisId,
            @Parameter(description = "Stage whose graph to export") @RequestParam(defaultValue = "ingest") String stage,
            @Parameter(description = "Export mode: 'cypher' or 'push'") @RequestParam(defaultValue = "cypher") String mode) {
        var analysisStage = AnalysisStage.fromPath(stage);
        requireAnalysis(analysisId);
        log.debug("Export request: analysisId={}, stage={}, mode={}", analysisId, analysisStage, mode);

        if ("push".equalsIgnoreCase(mode)) {
            return handlePushMode(analysisId, analysisStage);
        }
        return handleCypherMode(analysisId, analysisStage);
    }

    private ResponseEntity<ApiResponse<Object>> handleCypherMode(String analysisId, AnalysisStage stage) {
        var statements = neo4jWriter.generateCypher(analysisId, stage);
        log.info("Generated {} Cypher statements for analysis: {}", statements.size(), analysisId);
        return ResponseEntity.ok(ApiResponse.success(new CypherExportResponse(analysisId, stage.name(), statements)));
    }

    private ResponseEntity<ApiResponse<Object>> handlePushMode(String analysisId, AnalysisStage stage) {
        if (!neo4jWriter.isConnected()) {
            log.warn("Neo4j not connected, cannot push analysis: {}", analysisId);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiResponse.error("Neo4j not connected", "NEO4J_UNAVAILABLE"));
        }

        var result = neo4jWriter.pushToNeo4j(analysisId, stage);
        if (!result.success()) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(ApiResponse.error("Neo4j export failed", "NEO4J_EXPORT_FAILED", result.errorMessage()));
        }
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    private String requireAnalysis(String analysisId) {
        if (!artifactStore.exists(AnalysisIds.requireValid(analysisId))) {
            throw new AnalysisNotFoundException(analysisId);
        }
        return analysisId;
    }

    /**
     * Response for Cypher export mode.
     */
    record CypherExportResponse(String analysisId, String stage, List<String> cypherStatements) {}
}
