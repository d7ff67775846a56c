package com.causal.graph.service.engine;

/**
 * Common parent of exposure and outcome with its feedback figures.
 * Distances and cycle lengths are {@code null} when there is no return path.
 *
 * @param distanceFromExposure shortest path exposure to the node
 * @param exposureCycleLength  {@code distanceFromExposure + 1}, the round trip through the exposure
 * @param minCycleLength       smaller of the two cycle lengths
 * @param valid                false when the node is also a direct child of exposure or outcome
 */
public record ConfounderRecord(
        String node,
        boolean childOfExposure,
        boolean childOfOutcome,
        Integer distanceFromExposure,
        Integer distanceFromOutcome,
        Integer exposureCycleLength,
        Integer outcomeCycleLength,
        Integer minCycleLength,
        ConfounderClassification classification,
        boolean valid
) {

    public boolean hasFeedback() {
        return minCycleLength != null;
    }
}
