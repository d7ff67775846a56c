package com.causal.graph.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the artifact store.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "causal.store")
public class StoreConfig {

    /**
     * {@code memory} or {@code filesystem}.
     */
    private String type = "memory";

    /**
     * Root directory of the file-system store.
     */
    private String baseDir = "output";
}
