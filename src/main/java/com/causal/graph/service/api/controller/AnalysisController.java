package com.causal.graph.service.api.controller;

import com.causal.graph.service.api.dto.ApiResponse;
import com.causal.graph.service.api.dto.ArtifactTableResponse;
import com.causal.graph.service.error.AnalysisNotFoundException;
import com.causal.graph.service.pipeline.AnalysisPipeline;
import com.causal.graph.service.pipeline.StageResult;
import com.causal.graph.service.store.AnalysisIds;
import com.causal.graph.service.store.AnalysisStage;
import com.causal.graph.service.store.ArtifactStore;
import com.causal.graph.service.store.ArtifactStore.ArtifactMetadata;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for running pipeline stages and reading their artifacts.
 */
@Slf4j
@RestController
@RequestMapping("/analyses")
@Tag(name = "Analysis", description = "Endpoints for running analysis stages and reading stage outputs")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisPipeline pipeline;
    private final ArtifactStore artifactStore;

    @PostMapping("/{analysisId}/stages/{stage}")
    @Operation(summary = "Run one stage", description = "Runs a single stage; its inputs must already exist")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Stage completed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Analysis not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Prerequisite stage missing")
    })
    public ResponseEntity<ApiResponse<StageResult>> runStage(
            @Parameter(description = "Analysis ID") @PathVariable String analysisId,
            @Parameter(description = "Stage name, e.g. cycles or cycle-breaking") @PathVariable String stage) {
        var result = pipeline.runStage(analysisId, AnalysisStage.fromPath(stage));
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    @PostMapping("/{analysisId}/run")
    @Operation(summary = "Run all stages", description = "Runs every stage after ingestion in order")
    public ResponseEntity<ApiResponse<List<StageResult>>> runAll(
            @Parameter(description = "Analysis ID") @PathVariable String analysisId) {
        return ResponseEntity.ok(ApiResponse.success(pipeline.runAll(analysisId)));
    }

    @GetMapping("/{analysisId}/artifacts")
    @Operation(summary = "List artifacts", description = "Lists every stored artifact with its version")
    public ResponseEntity<ApiResponse<List<ArtifactMetadata>>> listArtifacts(
            @Parameter(description = "Analysis ID") @PathVariable String analysisId) {
        requireAnalysis(analysisId);
        return ResponseEntity.ok(ApiResponse.success(artifactStore.listArtifacts(analysisId)));
    }

    @GetMapping("/{analysisId}/artifacts/{stage}/{key}")
    @Operation(summary = "Get artifact table", description = "Returns one stored table with rows keyed by column")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Table found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Table not produced yet")
    })
    public ResponseEntity<ApiResponse<ArtifactTableResponse>> getTable(
            @Parameter(description = "Analysis ID") @PathVariable String analysisId,
            @Parameter(description = "Stage name") @PathVariable String stage,
            @Parameter(description = "Table key, e.g. node_cycle_participation") @PathVariable String key) {
        var analysisStage = AnalysisStage.fromPath(stage);
        requireAnalysis(analysisId);
        var table = artifactStore.getTable(analysisId, analysisStage, key);

        return ResponseEntity.ok(ApiResponse.success(ArtifactTableResponse.builder()
                .analysisId(analysisId)
                .stage(analysisStage.name())
                .key(key)
                .columns(table.columns())
                .rowCount(table.rowCount())
                .rows(table.asMaps())
                .build()));
    }

    private void requireAnalysis(String analysisId) {
        if (!artifactStore.exists(AnalysisIds.requireValid(analysisId))) {
            throw new AnalysisNotFoundException(analysisId);
        }
    }
}
