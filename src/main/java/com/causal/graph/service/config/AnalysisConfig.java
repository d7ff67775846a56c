package com.causal.graph.service.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Policy parameters for the analysis stages.
 *
 * The generic-node list, top-N cut-off and feedback threshold were chosen empirically
 * and are meant to be tuned per study.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "causal.analysis")
public class AnalysisConfig {

    /**
     * Exposure node name used by the batch runner.
     */
    @NotBlank
    private String exposure = "Hypertension";

    /**
     * Outcome node name used by the batch runner.
     */
    @NotBlank
    private String outcome = "Alzheimers";

    /**
     * Literature graph degree produced by the generation tool (1-3).
     */
    @Min(1)
    @Max(3)
    private int degree = 2;

    /**
     * Directory holding the generated graph files.
     */
    private String inputDir = "input";

    /**
     * File name pattern, formatted with exposure, outcome and degree.
     */
    private String inputPattern = "%s_%s_degree_%d.R";

    @Valid
    private Pruning pruning = new Pruning();

    @Valid
    private Cycles cycles = new Cycles();

    @Valid
    private Centrality centrality = new Centrality();

    @Valid
    private Classification classification = new Classification();

    private Confounders confounders = new Confounders();

    /**
     * Id under which the configured exposure/outcome/degree triple is stored.
     */
    public String analysisId() {
        return analysisId(exposure, outcome, degree);
    }

    public static String analysisId(String exposure, String outcome, int degree) {
        return "%s_%s_degree%d".formatted(exposure, outcome, degree);
    }

    public String inputFileName() {
        return inputPattern.formatted(exposure, outcome, degree);
    }

    @Getter
    @Setter
    public static class Pruning {

        /**
         * Umbrella terms too broad to be causally meaningful. Only those that also rank
         * in a top-N centrality table are pruned.
         */
        private List<String> genericNodes = new ArrayList<>(List.of(
                "Disease",
                "Functional_disorder",
                "Complication",
                "Syndrome",
                "Symptoms",
                "Diagnosis",
                "Obstruction",
                "Physical_findings",
                "Adverse_effects"
        ));

        /**
         * Size of the top-by-degree and top-by-betweenness tables.
         */
        @Min(1)
        private int topN = 150;

        /**
         * Iteratively drop degree-1 nodes after hub pruning.
         */
        private boolean removeLeaves = false;
    }

    @Getter
    @Setter
    public static class Cycles {

        /**
         * Concrete cycle paths kept per SCC. Counts are always exhaustive.
         */
        @Min(0)
        private int maxCyclesToSave = 50;

        /**
         * Log a progress line every this many cycles found.
         */
        @Min(1)
        private long progressInterval = 100_000;
    }

    @Getter
    @Setter
    public static class Centrality {

        /**
         * Log a progress line every this many betweenness source nodes.
         */
        @Min(1)
        private int progressInterval = 1000;
    }

    @Getter
    @Setter
    public static class Classification {

        /**
         * Round-trip cycle length up to which a confounder is "Tight Feedback".
         */
        @Min(2)
        private int tightFeedbackMaxLength = 3;
    }

    @Getter
    @Setter
    public static class Confounders {

        /**
         * Confounders vetted as causally sound whose feedback edges from the exposure
         * and outcome are removed.
         */
        private List<String> strongConfounders = new ArrayList<>();
    }
}
