package com.promptstability.evaluation;

import java.util.Map;

/**
 * Cross-prompt view of the mean stability of every (prompt, agent) group.
 *
 * @param overallMean   mean of every group's mean stability, 0 when nothing was evaluated
 * @param overallMin    lowest group mean stability, 0 when nothing was evaluated
 * @param overallMax    highest group mean stability, 0 when nothing was evaluated
 * @param agentAverages per agent, the mean of its group means across the prompts it answered
 */
public record StabilitySummary(
        double overallMean,
        double overallMin,
        double overallMax,
        Map<String, Double> agentAverages) {

    public static StabilitySummary empty() {
        return new StabilitySummary(0.0, 0.0, 0.0, Map.of());
    }
}
