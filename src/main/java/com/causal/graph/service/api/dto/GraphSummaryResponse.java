package com.causal.graph.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Lightweight view of an analysis for listing endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GraphSummaryResponse {

    private String analysisId;

    private String exposure;

    private String outcome;

    /**
     * Node count of the ingested graph.
     */
    private int nodeCount;

    private int edgeCount;

    /**
     * Stages that have stored at least one artifact.
     */
    private List<String> completedStages;

    private Instant lastUpdatedAt;
}
