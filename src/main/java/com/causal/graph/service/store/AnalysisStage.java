package com.causal.graph.service.store;

import java.util.Arrays;
import java.util.Locale;

/**
 * Pipeline stages in execution order. Each stage owns one directory of artifacts.
 */
public enum AnalysisStage {
    INGEST("01_ingest", "Graph ingestion"),
    CENTRALITY("02_centrality", "Centrality ranking"),
    PRUNING("03_pruning", "Hub pruning"),
    CYCLES("04_cycles", "Cycle enumeration"),
    CONFOUNDERS("05_confounders", "Confounder classification"),
    CYCLE_BREAKING("06_cycle_breaking", "Cycle breaking"),
    BUTTERFLY("07_butterfly", "Butterfly bias detection"),
    EVIDENCE("08_evidence", "Evidence extraction");

    private final String directoryName;
    private final String displayName;

    AnalysisStage(String directoryName, String displayName) {
        this.directoryName = directoryName;
        this.displayName = displayName;
    }

    public String getDirectoryName() {
        return directoryName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Name used in error messages, e.g. {@code CENTRALITY (Centrality ranking)}.
     */
    public String describe() {
        return "%s (%s)".formatted(name(), displayName);
    }

    /**
     * Parses a stage from a path segment such as {@code cycle-breaking} or {@code CYCLES}.
     */
    public static AnalysisStage fromPath(String value) {
        var normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(stage -> stage.name().equals(normalized) || stage.directoryName.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown stage: " + value));
    }

    public static AnalysisStage fromDirectory(String directoryName) {
        return Arrays.stream(values())
                .filter(stage -> stage.directoryName.equals(directoryName))
                .findFirst()
                .orElse(null);
    }
}
