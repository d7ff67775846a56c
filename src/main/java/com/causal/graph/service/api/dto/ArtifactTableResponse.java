package com.causal.graph.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One stored artifact table, rows keyed by column name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArtifactTableResponse {

    private String analysisId;

    private String stage;

    private String key;

    private List<String> columns;

    private int rowCount;

    private List<Map<String, String>> rows;
}
