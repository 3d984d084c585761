package com.promptstability.evaluation;

import java.util.Map;

import com.promptstability.stability.StabilityMetrics;

public record PromptEvaluation(
        Map<String, StabilityMetrics> stabilityMetrics,
        Map<String, Integer> numResponsesPerAgent) {
}
