package com.causal.graph.service.testutil;

import com.causal.graph.service.graph.CausalGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Graph fixtures shared by the engine and pipeline tests.
 */
public final class TestGraphs {

    public static final String EXPOSURE = "Hypertension";
    public static final String OUTCOME = "Alzheimers";

    private TestGraphs() {
    }

    /**
     * Directed ring over {@code nodes} plus an isolated exposure X and outcome Y.
     */
    public static CausalGraph ring(String... nodes) {
        var builder = CausalGraph.builder().exposure("X").outcome("Y");
        for (int i = 0; i < nodes.length; i++) {
            builder.edge(nodes[i], nodes[(i + 1) % nodes.length]);
        }
        return builder.build();
    }

    /**
     * Complete digraph on K1..Kn with all n(n-1) edges plus an isolated exposure X and outcome Y.
     */
    public static CausalGraph complete(int n) {
        var builder = CausalGraph.builder().exposure("X").outcome("Y");
        var names = new ArrayList<String>();
        for (int i = 1; i <= n; i++) {
            names.add("K" + i);
        }
        for (String from : names) {
            for (String to : names) {
                if (!from.equals(to)) {
                    builder.edge(from, to);
                }
            }
        }
        return builder.build();
    }

    /**
     * X, Y with common parents C1 and C2, and C3 a parent of both C1 and C2.
     */
    public static CausalGraph grandparentConfounder() {
        return CausalGraph.builder()
                .exposure("X")
                .outcome("Y")
                .edge("C1", "X").edge("C1", "Y")
                .edge("C2", "X").edge("C2", "Y")
                .edge("C3", "C1").edge("C3", "C2")
                .build();
    }

    /**
     * Small literature-style graph exercising every stage:
     * <ul>
     *   <li>Disease is a generic hub inside two 2-cycles and is pruned.</li>
     *   <li>Diabetes and Obesity are valid confounders; Diabetes has tight feedback
     *       through Alzheimers -> Inflammation -> Diabetes.</li>
     *   <li>Sleep_apnea is a common parent but also a child of the exposure.</li>
     * </ul>
     * After pruning the cyclic core holds four simple cycles.
     */
    public static CausalGraph literatureGraph() {
        return CausalGraph.builder()
                .exposure(EXPOSURE)
                .outcome(OUTCOME)
                .edge("Diabetes", EXPOSURE).edge("Diabetes", OUTCOME)
                .edge("Obesity", EXPOSURE).edge("Obesity", OUTCOME)
                .edge("Obesity", "Diabetes")
                .edge(EXPOSURE, "Stroke").edge("Stroke", OUTCOME)
                .edge(OUTCOME, "Inflammation").edge("Inflammation", "Diabetes")
                .edge("Sleep_apnea", EXPOSURE).edge("Sleep_apnea", OUTCOME).edge(EXPOSURE, "Sleep_apnea")
                .edge("Stroke", "Disease").edge("Disease", "Stroke")
                .edge("Inflammation", "Disease").edge("Disease", "Inflammation")
                .build();
    }

    /**
     * DAGitty rendering of {@link #literatureGraph()} wrapped in an R script.
     */
    public static String literatureGraphScript() {
        var lines = List.of(
                "library(dagitty)",
                "g <- dagitty('dag {",
                " Hypertension [exposure]",
                " Alzheimers [outcome]",
                " Diabetes -> Hypertension",
                " Diabetes -> Alzheimers",
                " Obesity -> Hypertension",
                " Obesity -> Alzheimers",
                " Obesity -> Diabetes",
                " Hypertension -> Stroke -> Alzheimers",
                " Alzheimers -> Inflammation -> Diabetes",
                " Sleep_apnea -> Hypertension",
                " Sleep_apnea -> Alzheimers",
                " Hypertension -> Sleep_apnea",
                " Stroke -> Disease -> Stroke",
                " Inflammation -> Disease -> Inflammation",
                "}')");
        return String.join("\n", lines) + "\n";
    }
}
