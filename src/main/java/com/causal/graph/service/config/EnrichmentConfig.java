package com.causal.graph.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Locations of the optional lookup files produced by the graph generation tool.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "causal.enrichment")
public class EnrichmentConfig {

    /**
     * JSON with {@code names} (name to vocabulary id) and {@code categories}
     * (vocabulary id to semantic category). Unset disables semantic types.
     */
    private String vocabularyFile;

    /**
     * Assertions JSON with literature references. Unset disables evidence lookup.
     */
    private String assertionsFile;
}
