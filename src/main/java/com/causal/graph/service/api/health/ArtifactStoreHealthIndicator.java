package com.causal.graph.service.api.health;

import com.causal.graph.service.config.StoreConfig;
import com.causal.graph.service.store.ArtifactStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the artifact store.
 *
 * Reports the store type and how many analyses it holds.
 */
@Component
@RequiredArgsConstructor
public class ArtifactStoreHealthIndicator implements HealthIndicator {

    private final ArtifactStore artifactStore;
    private final StoreConfig storeConfig;

    @Override
    public Health health() {
        var builder = Health.up()
                .withDetail("storeType", storeConfig.getType())
                .withDetail("analysisCount", artifactStore.count());
        if ("filesystem".equals(storeConfig.getType())) {
            builder.withDetail("baseDir", storeConfig.getBaseDir());
        }
        return builder.build();
    }
}
