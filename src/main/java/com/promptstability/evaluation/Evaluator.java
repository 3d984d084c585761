package com.promptstability.evaluation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.promptstability.runtime.InvalidConfigurationException;
import com.promptstability.stability.SamplingPolicy;
import com.promptstability.stability.StabilityCalculator;
import com.promptstability.stability.StabilityMetrics;
import com.promptstability.storage.ResponseRecord;
import com.promptstability.storage.ResponseStore;

/**
 * Loads response records, groups them per prompt and agent and runs the Monte-Carlo
 * stability estimation for every group.
 */
public class Evaluator {
    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final ResponseStore responseStore;
    private final StabilityCalculator stabilityCalculator;
    private final int monteCarloIterations;
    private final SamplingPolicy samplingPolicy;
    private ResponseAggregator aggregator = new ResponseAggregator();

    /**
     * Creates an evaluator without a backing store; records must be supplied through
     * {@link #aggregate(List)}.
     */
    public Evaluator(StabilityCalculator stabilityCalculator, int monteCarloIterations) {
        this(null, stabilityCalculator, monteCarloIterations, SamplingPolicy.halved());
    }

    public Evaluator(StabilityCalculator stabilityCalculator, int monteCarloIterations, SamplingPolicy samplingPolicy) {
        this(null, stabilityCalculator, monteCarloIterations, samplingPolicy);
    }

    public Evaluator(ResponseStore responseStore, StabilityCalculator stabilityCalculator, int monteCarloIterations) {
        this(responseStore, stabilityCalculator, monteCarloIterations, SamplingPolicy.halved());
    }

    /**
     * @param responseStore source for {@link #loadAndAggregate()}; may be {@code null} when records
     *                      are only passed to {@link #aggregate(List)}
     */
    public Evaluator(
            ResponseStore responseStore,
            StabilityCalculator stabilityCalculator,
            int monteCarloIterations,
            SamplingPolicy samplingPolicy) {
        if (monteCarloIterations <= 0) {
            throw new InvalidConfigurationException("Number of Monte-Carlo iterations must be positive: " + monteCarloIterations);
        }
        this.responseStore = responseStore;
        this.stabilityCalculator = Objects.requireNonNull(stabilityCalculator, "stabilityCalculator");
        this.monteCarloIterations = monteCarloIterations;
        this.samplingPolicy = Objects.requireNonNull(samplingPolicy, "samplingPolicy");
    }

    /**
     * Replaces the aggregated data with the current content of the response store.
     *
     * @throws IllegalStateException if this evaluator was created without a store
     */
    public ResponseAggregator loadAndAggregate() throws IOException {
        if (responseStore == null) {
            throw new IllegalStateException("No response store configured");
        }
        return aggregate(responseStore.loadAll());
    }

    public ResponseAggregator aggregate(List<ResponseRecord> records) {
        ResponseAggregator fresh = new ResponseAggregator();
        fresh.addRecords(records);
        aggregator = fresh;
        log.info("Aggregated response records loaded={} accepted={} dropped={} prompts={}",
                records.size(),
                fresh.acceptedRecords(),
                fresh.droppedRecords(),
                fresh.allPrompts().size());
        return fresh;
    }

    public ResponseAggregator aggregator() {
        return aggregator;
    }

    public EvaluationResult evaluateAll() {
        return evaluatePrompts(aggregator.allPrompts());
    }

    /**
     * Evaluates a single base prompt; an unknown prompt yields an empty result.
     */
    public EvaluationResult evaluate(String basePrompt) {
        if (basePrompt == null) {
            return evaluateAll();
        }
        return evaluatePrompts(List.of(basePrompt));
    }

    public StabilitySummary summary() {
        return summarize(evaluateAll());
    }

    public static StabilitySummary summarize(EvaluationResult result) {
        List<Double> allStabilities = new ArrayList<>();
        Map<String, List<Double>> agentStabilities = new LinkedHashMap<>();

        for (PromptEvaluation evaluation : result.prompts().values()) {
            evaluation.stabilityMetrics().forEach((agent, metrics) -> {
                allStabilities.add(metrics.meanStability());
                agentStabilities.computeIfAbsent(agent, key -> new ArrayList<>()).add(metrics.meanStability());
            });
        }

        if (allStabilities.isEmpty()) {
            return StabilitySummary.empty();
        }

        Map<String, Double> agentAverages = new LinkedHashMap<>();
        agentStabilities.forEach((agent, values) -> agentAverages.put(agent, mean(values)));
        return new StabilitySummary(
                mean(allStabilities),
                allStabilities.stream().mapToDouble(Double::doubleValue).min().orElse(0.0),
                allStabilities.stream().mapToDouble(Double::doubleValue).max().orElse(0.0),
                agentAverages);
    }

    private EvaluationResult evaluatePrompts(List<String> prompts) {
        Map<String, PromptEvaluation> results = new LinkedHashMap<>();
        for (String prompt : prompts) {
            Map<String, List<String>> responseSets = aggregator.responseSets(prompt);
            if (responseSets.isEmpty()) {
                continue;
            }

            Map<String, StabilityMetrics> stabilityMetrics = stabilityCalculator.comprehensiveStability(
                    responseSets,
                    monteCarloIterations,
                    samplingPolicy);
            Map<String, Integer> responseCounts = new LinkedHashMap<>();
            responseSets.forEach((agent, responses) -> responseCounts.put(agent, responses.size()));

            results.put(prompt, new PromptEvaluation(stabilityMetrics, responseCounts));
        }
        log.debug("Evaluated {} prompt(s) with {} iterations using metric={}",
                results.size(),
                monteCarloIterations,
                stabilityCalculator.similarityMetric().name());
        return new EvaluationResult(results);
    }

    private static double mean(List<Double> values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }
}
