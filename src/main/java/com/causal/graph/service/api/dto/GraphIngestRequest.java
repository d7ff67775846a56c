package com.causal.graph.service.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for ingesting a causal graph as explicit node and edge lists.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphIngestRequest {

    /**
     * Optional id; derived from exposure, outcome and degree when blank.
     */
    private String analysisId;

    /**
     * Expansion degree the graph was generated with.
     */
    @Builder.Default
    @Min(value = 1, message = "degree must be between 1 and 3")
    @Max(value = 3, message = "degree must be between 1 and 3")
    private int degree = 2;

    /**
     * Nodes; at least one must be the exposure and one the outcome.
     */
    @NotNull(message = "nodes are required")
    private List<@Valid NodeDto> nodes;

    @NotNull(message = "edges are required")
    private List<@Valid EdgeDto> edges;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NodeDto {

        @NotBlank(message = "nodeId is required")
        private String nodeId;

        /**
         * EXPOSURE, OUTCOME or REGULAR (default).
         */
        private String role;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EdgeDto {

        @NotBlank(message = "source is required")
        private String source;

        @NotBlank(message = "target is required")
        private String target;
    }
}
