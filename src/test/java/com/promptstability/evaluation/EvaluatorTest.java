package com.promptstability.evaluation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.promptstability.metric.JaccardSimilarity;
import com.promptstability.runtime.InvalidConfigurationException;
import com.promptstability.stability.SamplingPolicy;
import com.promptstability.stability.StabilityCalculator;
import com.promptstability.stability.StabilityMetrics;
import com.promptstability.storage.JsonResponseStore;
import com.promptstability.storage.ResponseRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EvaluatorTest {

    private static final String PROMPT = "Tell me about X";

    @TempDir
    Path tempDir;

    @Test
    void shouldEvaluateMixedResponseGroup() {
        Evaluator evaluator = new Evaluator(StabilityCalculator.seeded(new JaccardSimilarity(), 1L), 1);
        evaluator.aggregate(mixedRecords());

        EvaluationResult result = evaluator.evaluateAll();

        PromptEvaluation evaluation = result.get(PROMPT);
        assertEquals(3, evaluation.numResponsesPerAgent().get("agentA"));
        StabilityMetrics metrics = evaluation.stabilityMetrics().get("agentA");
        assertTrue(metrics.meanStability() > 0.0 && metrics.meanStability() <= 1.0);
        assertEquals(metrics.minStability(), metrics.maxStability());
    }

    @Test
    void shouldScoreMixedGroupStrictlyBetweenZeroAndOneOverFullSet() {
        Evaluator evaluator = new Evaluator(
                StabilityCalculator.seeded(new JaccardSimilarity(), 1L),
                1,
                SamplingPolicy.fullSet());
        evaluator.aggregate(mixedRecords());

        StabilityMetrics metrics = evaluator.evaluateAll().get(PROMPT).stabilityMetrics().get("agentA");

        assertTrue(metrics.meanStability() > 0.0 && metrics.meanStability() < 1.0);
    }

    @Test
    void shouldReturnEmptyResultAndZeroSummaryForEmptyInput() {
        Evaluator evaluator = new Evaluator(new StabilityCalculator(), 100);
        evaluator.aggregate(List.of());

        assertTrue(evaluator.evaluateAll().isEmpty());
        StabilitySummary summary = evaluator.summary();
        assertEquals(0.0, summary.overallMean());
        assertEquals(0.0, summary.overallMin());
        assertEquals(0.0, summary.overallMax());
        assertTrue(summary.agentAverages().isEmpty());
    }

    @Test
    void shouldOmitPromptsWhoseRecordsWereAllDropped() {
        Evaluator evaluator = new Evaluator(new StabilityCalculator(), 10);
        ResponseAggregator aggregator = evaluator.aggregate(List.of(
                new ResponseRecord(PROMPT, "agentA", "kept"),
                new ResponseRecord(PROMPT, "agentA", null),
                new ResponseRecord("Only malformed", "agentB", "")));

        EvaluationResult result = evaluator.evaluateAll();

        assertEquals(2, aggregator.droppedRecords());
        assertEquals(List.of(PROMPT), List.copyOf(result.prompts().keySet()));
        assertEquals(1, result.get(PROMPT).numResponsesPerAgent().get("agentA"));
        assertEquals(StabilityMetrics.degenerate(), result.get(PROMPT).stabilityMetrics().get("agentA"));
    }

    @Test
    void shouldSummariseAcrossPromptsAndAgents() {
        Evaluator evaluator = new Evaluator(new StabilityCalculator(), 20);
        evaluator.aggregate(List.of(
                new ResponseRecord("P1", "agentA", "a b"),
                new ResponseRecord("P1", "agentA", "a b c"),
                new ResponseRecord("P1", "agentB", "x"),
                new ResponseRecord("P1", "agentB", "x"),
                new ResponseRecord("P2", "agentA", "x"),
                new ResponseRecord("P2", "agentA", "y")));

        StabilitySummary summary = evaluator.summary();

        assertEquals((2.0 / 3.0 + 1.0 + 0.0) / 3.0, summary.overallMean(), 1e-9);
        assertEquals(0.0, summary.overallMin(), 1e-12);
        assertEquals(1.0, summary.overallMax(), 1e-12);
        assertEquals((2.0 / 3.0) / 2.0, summary.agentAverages().get("agentA"), 1e-9);
        assertEquals(1.0, summary.agentAverages().get("agentB"), 1e-12);
    }

    @Test
    void shouldRestrictEvaluationToSinglePrompt() {
        Evaluator evaluator = new Evaluator(new StabilityCalculator(), 5);
        evaluator.aggregate(List.of(
                new ResponseRecord("P1", "agentA", "one"),
                new ResponseRecord("P2", "agentA", "two")));

        assertEquals(List.of("P2"), List.copyOf(evaluator.evaluate("P2").prompts().keySet()));
        assertTrue(evaluator.evaluate("unknown").isEmpty());
        assertEquals(2, evaluator.evaluate(null).prompts().size());
    }

    @Test
    void shouldProduceIdenticalResultsForSameSeedAndInput() throws Exception {
        JsonResponseStore store = new JsonResponseStore(tempDir);
        for (ResponseRecord record : mixedRecords()) {
            store.append(record);
        }
        store.append(new ResponseRecord(PROMPT, "agentB", "a completely different answer"));
        store.append(new ResponseRecord(PROMPT, "agentB", "another different answer"));
        store.append(new ResponseRecord(PROMPT, "agentB", "an answer"));
        store.append(new ResponseRecord(PROMPT, "agentB", "different"));

        Evaluator first = new Evaluator(store, StabilityCalculator.seeded(new JaccardSimilarity(), 1234L), 200);
        first.loadAndAggregate();
        Evaluator second = new Evaluator(store, StabilityCalculator.seeded(new JaccardSimilarity(), 1234L), 200);
        second.loadAndAggregate();

        assertEquals(first.evaluateAll(), second.evaluateAll());
    }

    @Test
    void shouldRebuildAggregationOnEveryLoad() throws Exception {
        JsonResponseStore store = new JsonResponseStore(tempDir);
        store.append(new ResponseRecord(PROMPT, "agentA", "one"));
        Evaluator evaluator = new Evaluator(store, new StabilityCalculator(), 10);

        evaluator.loadAndAggregate();
        evaluator.loadAndAggregate();

        assertEquals(1, evaluator.aggregator().responseSets(PROMPT).get("agentA").size());
    }

    @Test
    void shouldCountStoredRecordWithMistypedFieldAsDropped() throws Exception {
        JsonResponseStore store = new JsonResponseStore(tempDir);
        Files.writeString(store.dataFile(), """
                [
                  {"base_prompt": "Tell me about X", "agent_name": "agentA", "response": "cats are great"},
                  {"base_prompt": "Tell me about X", "agent_name": "agentA", "response": "oops", "sentiment": 0.5},
                  {"base_prompt": "Tell me about X", "agent_name": "agentA", "response": "dogs are nice"}
                ]
                """);
        Evaluator evaluator = new Evaluator(store, new StabilityCalculator(), 10);

        ResponseAggregator aggregator = evaluator.loadAndAggregate();

        assertEquals(2, aggregator.acceptedRecords());
        assertEquals(1, aggregator.droppedRecords());
        assertEquals(2, evaluator.evaluateAll().get(PROMPT).numResponsesPerAgent().get("agentA"));
    }

    @Test
    void shouldRequireStoreForLoading() {
        Evaluator evaluator = new Evaluator(new StabilityCalculator(), 10);

        assertThrows(IllegalStateException.class, evaluator::loadAndAggregate);
    }

    @Test
    void shouldRejectNonPositiveIterationCount() {
        assertThrows(InvalidConfigurationException.class, () -> new Evaluator(new StabilityCalculator(), 0));
        assertThrows(InvalidConfigurationException.class, () -> new Evaluator(new StabilityCalculator(), -3));
    }

    private static List<ResponseRecord> mixedRecords() {
        return List.of(
                new ResponseRecord(PROMPT, "agentA", "cats are great"),
                new ResponseRecord(PROMPT, "agentA", "cats are great"),
                new ResponseRecord(PROMPT, "agentA", "dogs are nice"));
    }
}
