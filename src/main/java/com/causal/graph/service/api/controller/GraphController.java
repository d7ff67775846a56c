package com.causal.graph.service.api.controller;

import com.causal.graph.service.api.dto.ApiResponse;
import com.causal.graph.service.api.dto.GraphDetailResponse;
import com.causal.graph.service.api.dto.GraphDetailResponse.EdgeResponse;
import com.causal.graph.service.api.dto.GraphDetailResponse.NodeResponse;
import com.causal.graph.service.api.dto.GraphIngestRequest;
import com.causal.graph.service.api.dto.GraphSummaryResponse;
import com.causal.graph.service.error.AnalysisNotFoundException;
import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.graph.Direction;
import com.causal.graph.service.graph.NodeRole;
import com.causal.graph.service.ingest.GraphIngestionService;
import com.causal.graph.service.store.AnalysisIds;
import com.causal.graph.service.store.AnalysisStage;
import com.causal.graph.service.store.ArtifactStore;
import com.causal.graph.service.store.ArtifactStore.ArtifactMetadata;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Controller for graph ingestion, retrieval and deletion.
 */
@Slf4j
@RestController
@Tag(name = "Graph Management", description = "Endpoints for ingesting and querying causal graphs")
@RequiredArgsConstructor
public class GraphController {

    private final GraphIngestionService ingestionService;
    private final ArtifactStore artifactStore;

    // ==================== Endpoints ====================

    @PostMapping("/graphs")
    @Operation(summary = "Ingest a graph", description = "Stores a causal graph given as node and edge lists")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Graph stored"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Malformed graph")
    })
    public ResponseEntity<ApiResponse<String>> ingestGraph(@Valid @RequestBody GraphIngestRequest request) {
        log.debug("Received graph ingestion request: nodes={}, edges={}",
                request.getNodes().size(), request.getEdges().size());

        var graph = toGraph(request);
        var analysisId = ingestionService.ingest(request.getAnalysisId(), request.getDegree(), graph, "api");
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(analysisId));
    }

    @PostMapping(value = "/graphs/dagitty", consumes = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Ingest a DAGitty graph",
               description = "Parses a DAGitty definition, optionally wrapped in an R script, and stores it")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Graph stored"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Malformed graph")
    })
    public ResponseEntity<ApiResponse<String>> ingestDagitty(
            @Parameter(description = "Optional analysis id") @RequestParam(required = false) String analysisId,
            @Parameter(description = "Expansion degree") @RequestParam(defaultValue = "2") int degree,
            @RequestBody String body) {
        var id = ingestionService.ingestDagitty(analysisId, degree, body);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(id));
    }

    @GetMapping("/graphs")
    @Operation(summary = "List analyses", description = "Returns a summary of every stored analysis")
    public ResponseEntity<ApiResponse<List<GraphSummaryResponse>>> getAllGraphs() {
        var summaries = artifactStore.analysisIds().stream()
                .sorted()
                .map(this::toSummary)
                .toList();

        log.info("Returning {} analysis summaries", summaries.size());
        return ResponseEntity.ok(ApiResponse.success(summaries));
    }

    @GetMapping("/graphs/{analysisId}")
    @Operation(summary = "Get graph", description = "Returns the graph snapshot of one stage, the ingested graph by default")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Graph found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Analysis not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Stage has not run")
    })
    public ResponseEntity<ApiResponse<GraphDetailResponse>> getGraph(
            @Parameter(description = "Analysis ID") @PathVariable String analysisId,
            @Parameter(description = "Stage whose graph to return")
            @RequestParam(defaultValue = "ingest") String stage) {
        var analysisStage = AnalysisStage.fromPath(stage);
        requireAnalysis(analysisId);
        var graph = artifactStore.getGraph(analysisId, analysisStage);
        return ResponseEntity.ok(ApiResponse.success(toDetail(analysisId, analysisStage, graph)));
    }

    @DeleteMapping("/graphs/{analysisId}")
    @Operation(summary = "Delete analysis", description = "Deletes the graph and every artifact derived from it")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "204", description = "Analysis deleted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid analysis id"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Analysis not found")
    })
    public ResponseEntity<Void> deleteGraph(@Parameter(description = "Analysis ID") @PathVariable String analysisId) {
        if (!artifactStore.delete(AnalysisIds.requireValid(analysisId))) {
            throw new AnalysisNotFoundException(analysisId);
        }
        log.info("Deleted analysis {}", analysisId);
        return ResponseEntity.noContent().build();
    }

    // ==================== Conversion ====================

    private CausalGraph toGraph(GraphIngestRequest request) {
        var builder = CausalGraph.builder();
        for (var node : request.getNodes()) {
            builder.node(node.getNodeId(), parseRole(node.getRole()));
        }
        for (var edge : request.getEdges()) {
            builder.edge(edge.getSource(), edge.getTarget());
        }
        return builder.build();
    }

    private NodeRole parseRole(String role) {
        if (role == null || role.isBlank()) {
            return NodeRole.REGULAR;
        }
        try {
            return NodeRole.valueOf(role.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown node role: " + role, e);
        }
    }

    private GraphSummaryResponse toSummary(String analysisId) {
        var artifacts = artifactStore.listArtifacts(analysisId);
        var lastUpdated = artifacts.stream().mapToLong(ArtifactMetadata::updatedAtEpochMs).max();
        var builder = GraphSummaryResponse.builder()
                .analysisId(analysisId)
                .completedStages(artifacts.stream()
                        .map(ArtifactMetadata::stage)
                        .distinct()
                        .sorted()
                        .map(AnalysisStage::name)
                        .toList())
                .lastUpdatedAt(lastUpdated.isPresent() ? Instant.ofEpochMilli(lastUpdated.getAsLong()) : null);

        artifactStore.findGraph(analysisId, AnalysisStage.INGEST).ifPresent(graph -> builder
                .exposure(graph.exposure())
                .outcome(graph.outcome())
                .nodeCount(graph.nodeCount())
                .edgeCount(graph.edgeCount()));
        return builder.build();
    }

    private GraphDetailResponse toDetail(String analysisId, AnalysisStage stage, CausalGraph graph) {
        return GraphDetailResponse.builder()
                .analysisId(analysisId)
                .stage(stage.name())
                .exposure(graph.exposure())
                .outcome(graph.outcome())
                .nodes(graph.nodes().stream()
                        .map(node -> NodeResponse.builder()
                                .nodeId(node)
                                .role(graph.roleOf(node).name())
                                .inDegree(graph.degree(node, Direction.IN))
                                .outDegree(graph.degree(node, Direction.OUT))
                                .build())
                        .toList())
                .edges(graph.edges().stream()
                        .map(edge -> new EdgeResponse(edge.from(), edge.to()))
                        .toList())
                .build();
    }

    private void requireAnalysis(String analysisId) {
        if (!artifactStore.exists(AnalysisIds.requireValid(analysisId))) {
            throw new AnalysisNotFoundException(analysisId);
        }
    }
}
