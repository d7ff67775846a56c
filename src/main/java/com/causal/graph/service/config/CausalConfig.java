package com.causal.graph.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall application configuration for the causal graph service.
 *
 * Contains feature flags and Neo4j connection settings.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "causal")
public class CausalConfig {

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    /**
     * Neo4j connection used by the push export.
     */
    private Neo4j neo4j = new Neo4j();

    @Getter
    @Setter
    public static class Features {

        /**
         * Enable pushing analysis graphs to Neo4j.
         */
        private boolean neo4jExportEnabled = false;

        /**
         * Run the whole pipeline once at startup on the configured input file.
         */
        private boolean batchEnabled = false;
    }

    @Getter
    @Setter
    public static class Neo4j {

        private String uri = "bolt://localhost:7687";

        private String username = "neo4j";

        private String password = "password";
    }
}
