package com.causal.graph.service.persistence;

import com.causal.graph.service.config.CausalConfig;
import com.causal.graph.service.config.MetricsConfig;
import com.causal.graph.service.store.AnalysisStage;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Session;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Default implementation of Neo4jWriter.
 * Connects only when the Neo4j export feature is enabled.
 */
@Slf4j
@Component
public class DefaultNeo4jWriter implements Neo4jWriter {

    private final CypherBuilder cypherBuilder;
    private final CausalConfig causalConfig;
    private final MetricsConfig metricsConfig;

    private Driver driver;
    private boolean connected = false;

    public DefaultNeo4jWriter(CypherBuilder cypherBuilder, CausalConfig causalConfig, MetricsConfig metricsConfig) {
        this.cypherBuilder = cypherBuilder;
        this.causalConfig = causalConfig;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    void init() {
        if (causalConfig.getFeatures().isNeo4jExportEnabled()) {
            initializeDriver();
        } else {
            log.info("Neo4j export is disabled");
        }
    }

    @PreDestroy
    void cleanup() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j driver closed");
        }
    }

    @Override
    public List<String> generateCypher(String analysisId, AnalysisStage stage) {
        return cypherBuilder.buildCypher(analysisId, stage);
    }

    @Override
    public ExportResult pushToNeo4j(String analysisId, AnalysisStage stage) {
        if (!connected || driver == null) {
            log.warn("Neo4j not connected, cannot push analysis: {}", analysisId);
            return ExportResult.failure(analysisId, "Neo4j not connected");
        }

        var statements = generateCypher(analysisId, stage);
        var sample = Timer.start(metricsConfig.getRegistry());
        try {
            var result = runStatements(analysisId, statements);
            metricsConfig.getExportsCompleted().increment();
            return result;
        } catch (Neo4jException e) {
            log.error("Failed to export analysis {} to Neo4j", analysisId, e);
            return ExportResult.failure(analysisId, e.getMessage());
        } finally {
            sample.stop(metricsConfig.getExportTimer());
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    // ==================== Private Methods ====================

    private void initializeDriver() {
        var neo4j = causalConfig.getNeo4j();
        try {
            driver = GraphDatabase.driver(neo4j.getUri(), AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword()));
            driver.verifyConnectivity();
            connected = true;
            log.info("Connected to Neo4j at {}", neo4j.getUri());
        } catch (Neo4jException | IllegalArgumentException e) {
            log.warn("Failed to connect to Neo4j at {}: {}", neo4j.getUri(), e.getMessage());
            connected = false;
        }
    }

    private ExportResult runStatements(String analysisId, List<String> statements) {
        long startTime = System.currentTimeMillis();
        int nodes = 0;
        int edges = 0;

        try (Session session = driver.session()) {
            for (String cypher : statements) {
                session.run(cypher).consume();
                if (cypher.contains(CypherBuilder.EDGE_TYPE)) {
                    edges++;
                } else if (cypher.contains(CypherBuilder.NODE_LABEL)) {
                    nodes++;
                }
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Exported analysis {} to Neo4j: {} nodes, {} edges in {}ms", analysisId, nodes, edges, duration);
        return ExportResult.success(analysisId, nodes, edges, duration);
    }
}
