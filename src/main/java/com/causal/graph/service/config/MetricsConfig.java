package com.causal.graph.service.config;

import com.causal.graph.service.store.AnalysisStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the causal graph service.
 *
 * Provides custom metrics for ingestion, stage execution and export operations.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter graphsIngested;
    private final Counter cyclesEnumerated;
    private final Counter edgesBroken;
    private final Counter nodesPruned;
    private final Counter exportsCompleted;

    // Timers
    private final Timer exportTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.graphsIngested = Counter.builder("causal.graphs.ingested")
                .description("Number of graphs ingested")
                .register(registry);

        this.cyclesEnumerated = Counter.builder("causal.cycles.enumerated")
                .description("Number of simple cycles counted across all analyses")
                .register(registry);

        this.edgesBroken = Counter.builder("causal.edges.broken")
                .description("Number of feedback edges removed by cycle breaking")
                .register(registry);

        this.nodesPruned = Counter.builder("causal.nodes.pruned")
                .description("Number of generic hub nodes pruned")
                .register(registry);

        this.exportsCompleted = Counter.builder("causal.export.count")
                .description("Number of export operations completed")
                .register(registry);

        this.exportTimer = Timer.builder("causal.export.duration")
                .description("Time taken for export operations")
                .register(registry);
    }

    /**
     * Timer for one pipeline stage; Micrometer returns the same meter on repeated calls.
     */
    public Timer stageTimer(AnalysisStage stage) {
        return Timer.builder("causal.stage.duration")
                .description("Time taken to run a pipeline stage")
                .tag("stage", stage.name())
                .register(registry);
    }

    public Counter stageCompleted(AnalysisStage stage) {
        return Counter.builder("causal.stage.completed")
                .description("Number of successful stage runs")
                .tag("stage", stage.name())
                .register(registry);
    }

    public Counter stageFailed(AnalysisStage stage) {
        return Counter.builder("causal.stage.failed")
                .description("Number of failed stage runs")
                .tag("stage", stage.name())
                .register(registry);
    }

    /**
     * Registers a gauge for store size monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerStoreGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
