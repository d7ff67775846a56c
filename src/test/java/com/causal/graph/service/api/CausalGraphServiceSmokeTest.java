package com.causal.graph.service.api;

import com.causal.graph.service.api.dto.GraphIngestRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Smoke tests for the Causal Graph Service.
 *
 * Tests basic functionality of all endpoints.
 */
@SpringBootTest
@AutoConfigureMockMvc
class CausalGraphServiceSmokeTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void contextLoads() {
        // Context loads successfully
    }

    @Test
    void healthEndpointWorks() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").exists())
                .andExpect(jsonPath("$.components.artifactStore.details.storeType").value("memory"));
    }

    @Test
    void swaggerUiAvailable() throws Exception {
        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().is3xxRedirection());
    }

    @Test
    void listGraphsReturnsArray() throws Exception {
        mockMvc.perform(get("/graphs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data").isArray());
    }

    @Test
    void ingestGraph_validRequest_returns201() throws Exception {
        GraphIngestRequest request = GraphIngestRequest.builder()
                .analysisId("smoke-graph-1")
                .nodes(List.of(
                        GraphIngestRequest.NodeDto.builder().nodeId("Smoking").role("exposure").build(),
                        GraphIngestRequest.NodeDto.builder().nodeId("Cancer").role("outcome").build()
                ))
                .edges(List.of(
                        GraphIngestRequest.EdgeDto.builder().source("Smoking").target("Tar").build(),
                        GraphIngestRequest.EdgeDto.builder().source("Tar").target("Cancer").build()
                ))
                .build();

        mockMvc.perform(post("/graphs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data").value("smoke-graph-1"));
    }

    @Test
    void ingestGraph_withoutAnalysisId_derivesIdFromExposureAndOutcome() throws Exception {
        GraphIngestRequest request = GraphIngestRequest.builder()
                .degree(3)
                .nodes(List.of(
                        GraphIngestRequest.NodeDto.builder().nodeId("Sleep apnea").role("exposure").build(),
                        GraphIngestRequest.NodeDto.builder().nodeId("Memory loss").role("outcome").build()
                ))
                .edges(List.of(
                        GraphIngestRequest.EdgeDto.builder().source("Sleep apnea").target("Memory loss").build()
                ))
                .build();

        mockMvc.perform(post("/graphs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data").value("Sleep_apnea_Memory_loss_degree3"));
    }

    @Test
    void ingestDagitty_pathLikeAnalysisId_returns400() throws Exception {
        mockMvc.perform(post("/graphs/dagitty")
                        .param("analysisId", "..")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("dag { X [exposure]\n Y [outcome]\n X -> Y }"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ANALYSIS_ID"));
    }

    @Test
    void ingestGraph_pathLikeAnalysisId_returns400() throws Exception {
        GraphIngestRequest request = GraphIngestRequest.builder()
                .analysisId("../escaped")
                .nodes(List.of(
                        GraphIngestRequest.NodeDto.builder().nodeId("X").role("exposure").build(),
                        GraphIngestRequest.NodeDto.builder().nodeId("Y").role("outcome").build()
                ))
                .edges(List.of())
                .build();

        mockMvc.perform(post("/graphs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ANALYSIS_ID"));
    }

    @Test
    void ingestGraph_missingNodes_returns400() throws Exception {
        GraphIngestRequest request = GraphIngestRequest.builder()
                .edges(List.of())
                .build();

        mockMvc.perform(post("/graphs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void ingestGraph_noOutcome_returns400() throws Exception {
        GraphIngestRequest request = GraphIngestRequest.builder()
                .nodes(List.of(GraphIngestRequest.NodeDto.builder().nodeId("X").role("exposure").build()))
                .edges(List.of())
                .build();

        mockMvc.perform(post("/graphs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("MALFORMED_GRAPH"));
    }

    @Test
    void ingestGraph_unknownRole_returns400() throws Exception {
        GraphIngestRequest request = GraphIngestRequest.builder()
                .nodes(List.of(GraphIngestRequest.NodeDto.builder().nodeId("X").role("mediator").build()))
                .edges(List.of())
                .build();

        mockMvc.perform(post("/graphs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void getGraph_notFound_returns404() throws Exception {
        mockMvc.perform(get("/graphs/non-existent"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("ANALYSIS_NOT_FOUND"));
    }

    @Test
    void runPipeline_notFound_returns404() throws Exception {
        mockMvc.perform(post("/analyses/non-existent/run"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("ANALYSIS_NOT_FOUND"));
    }

    @Test
    void deleteGraph_nonExistent_returns404() throws Exception {
        mockMvc.perform(delete("/graphs/non-existent"))
                .andExpect(status().isNotFound());
    }

    @Test
    void exportNeo4j_graphNotFound_returns404() throws Exception {
        mockMvc.perform(get("/export/neo4j/non-existent"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }
}
