package com.promptstability.report;

import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.promptstability.evaluation.EvaluationResult;
import com.promptstability.evaluation.PromptEvaluation;
import com.promptstability.evaluation.StabilitySummary;
import com.promptstability.stability.StabilityMetrics;

public class StabilityReportRenderer {
    private static final String RULE = "=".repeat(80);
    private static final String THIN_RULE = "-".repeat(80);

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public String renderText(EvaluationResult result, int iterations, String metricName) {
        StringBuilder builder = new StringBuilder();
        builder.append(RULE).append('\n')
                .append("PROMPT STABILITY EVALUATION REPORT").append('\n')
                .append(RULE).append('\n')
                .append('\n')
                .append("Similarity Metric: ").append(metricName).append('\n')
                .append("Monte-Carlo Iterations: ").append(iterations).append('\n')
                .append("Total Prompts Evaluated: ").append(result.prompts().size()).append('\n')
                .append('\n');

        for (Map.Entry<String, PromptEvaluation> entry : result.prompts().entrySet()) {
            builder.append(THIN_RULE).append('\n')
                    .append("Base Prompt: ").append(entry.getKey()).append('\n')
                    .append(THIN_RULE).append('\n');

            PromptEvaluation evaluation = entry.getValue();
            for (Map.Entry<String, StabilityMetrics> agentEntry : evaluation.stabilityMetrics().entrySet()) {
                StabilityMetrics metrics = agentEntry.getValue();
                builder.append('\n')
                        .append("Agent: ").append(agentEntry.getKey()).append('\n')
                        .append("  Number of Responses: ")
                        .append(evaluation.numResponsesPerAgent().getOrDefault(agentEntry.getKey(), 0)).append('\n')
                        .append("  Mean Stability: ").append(format(metrics.meanStability())).append('\n')
                        .append("  Stability Std Dev: ").append(format(metrics.stdDev())).append('\n')
                        .append("  Stability Variance: ").append(format(metrics.variance())).append('\n')
                        .append("  Min Stability: ").append(format(metrics.minStability())).append('\n')
                        .append("  Max Stability: ").append(format(metrics.maxStability())).append('\n');
            }
            builder.append('\n');
        }

        builder.append(RULE);
        return builder.toString();
    }

    public String renderSummary(StabilitySummary summary) {
        StringBuilder builder = new StringBuilder();
        builder.append(RULE).append('\n')
                .append("SUMMARY STATISTICS").append('\n')
                .append(RULE).append('\n')
                .append("Overall Mean Stability: ").append(format(summary.overallMean())).append('\n')
                .append("Overall Min Stability: ").append(format(summary.overallMin())).append('\n')
                .append("Overall Max Stability: ").append(format(summary.overallMax())).append('\n')
                .append('\n')
                .append("Agent Averages:");
        summary.agentAverages().forEach((agent, average) -> builder.append('\n')
                .append("  ").append(agent).append(": ").append(format(average)));
        return builder.toString();
    }

    public String renderJson(EvaluationResult result, StabilitySummary summary) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(new JsonReport(result.prompts(), summary));
    }

    public String renderSummaryJson(StabilitySummary summary) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(summary);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    public record JsonReport(Map<String, PromptEvaluation> prompts, StabilitySummary summary) {
    }
}
