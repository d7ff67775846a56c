package com.causal.graph.service.engine;

import com.causal.graph.service.graph.CausalGraph;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;

/**
 * Finds nodes that are direct parents of both the exposure and the outcome and
 * classifies them by feedback loop length.
 *
 * <ul>
 *   <li>A candidate that is also a direct child of the exposure or outcome is invalid.</li>
 *   <li>Cycle length through the exposure is the shortest path exposure to candidate
 *       plus the candidate's edge back; likewise for the outcome.</li>
 *   <li>Minimum cycle length up to {@code tightFeedbackMaxLength} is Tight Feedback, any
 *       longer finite length is Long Feedback, no return path at all is Pure Confounder.</li>
 * </ul>
 */
@Slf4j
public class ConfounderClassifier {

    private final int tightFeedbackMaxLength;

    public ConfounderClassifier(int tightFeedbackMaxLength) {
        this.tightFeedbackMaxLength = tightFeedbackMaxLength;
    }

    public ConfounderAnalysis classify(CausalGraph graph) {
        var exposure = graph.exposure();
        var outcome = graph.outcome();
        var exposureParents = graph.parents(exposure);
        var outcomeParents = new HashSet<>(graph.parents(outcome));
        var exposureChildren = new HashSet<>(graph.children(exposure));
        var outcomeChildren = new HashSet<>(graph.children(outcome));

        var fromExposure = ShortestPaths.from(graph, exposure);
        var fromOutcome = ShortestPaths.from(graph, outcome);

        List<ConfounderRecord> records = exposureParents.stream()
                .filter(outcomeParents::contains)
                .map(node -> classify(node,
                        exposureChildren.contains(node),
                        outcomeChildren.contains(node),
                        fromExposure.distanceTo(node),
                        fromOutcome.distanceTo(node)))
                .toList();

        var analysis = new ConfounderAnalysis(exposure, outcome,
                exposureParents.size(), outcomeParents.size(), records);
        log.info("Confounders of {} -> {}: {} candidates, {} valid {}",
                exposure, outcome, records.size(), analysis.validConfounders().size(),
                analysis.countsByClassification());
        return analysis;
    }

    // ==================== Classification ====================

    private ConfounderRecord classify(String node, boolean childOfExposure, boolean childOfOutcome,
                                      Integer distanceFromExposure, Integer distanceFromOutcome) {
        Integer exposureCycle = cycleLength(distanceFromExposure);
        Integer outcomeCycle = cycleLength(distanceFromOutcome);
        Integer minCycle = min(exposureCycle, outcomeCycle);

        return new ConfounderRecord(
                node,
                childOfExposure,
                childOfOutcome,
                distanceFromExposure,
                distanceFromOutcome,
                exposureCycle,
                outcomeCycle,
                minCycle,
                classificationFor(minCycle),
                !childOfExposure && !childOfOutcome
        );
    }

    ConfounderClassification classificationFor(Integer minCycleLength) {
        if (minCycleLength == null) {
            return ConfounderClassification.PURE_CONFOUNDER;
        }
        return minCycleLength <= tightFeedbackMaxLength
                ? ConfounderClassification.TIGHT_FEEDBACK
                : ConfounderClassification.LONG_FEEDBACK;
    }

    private static Integer cycleLength(Integer distance) {
        return distance == null ? null : distance + 1;
    }

    private static Integer min(Integer a, Integer b) {
        if (a == null) return b;
        if (b == null) return a;
        return Math.min(a, b);
    }
}
