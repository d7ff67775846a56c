package com.causal.graph.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Complete graph of one analysis stage with nodes and edges.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GraphDetailResponse {

    private String analysisId;

    /**
     * Stage the graph snapshot belongs to.
     */
    private String stage;

    private String exposure;

    private String outcome;

    private List<NodeResponse> nodes;

    private List<EdgeResponse> edges;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NodeResponse {
        private String nodeId;
        private String role;
        private int inDegree;
        private int outDegree;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EdgeResponse {
        private String source;
        private String target;
    }
}
