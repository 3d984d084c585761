package com.promptstability.stability;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.promptstability.metric.JaccardSimilarity;
import com.promptstability.metric.SimilarityMetric;
import com.promptstability.runtime.InvalidConfigurationException;

/**
 * Estimates how consistent a group of responses is by repeatedly scoring random subsets of it.
 *
 * <p>The stability of a set of responses is the mean pairwise similarity under the configured
 * {@link SimilarityMetric}. Each Monte-Carlo trial draws a subset without replacement according
 * to a {@link SamplingPolicy} and scores it; the trial scores are summarised as
 * {@link StabilityMetrics}.
 *
 * <p>Instances are not thread-safe: the random generator is advanced by every call. With a
 * parallelism above one, the trials of a single call are spread over worker threads, each
 * using its own stream split from the shared generator on the calling thread.
 */
public class StabilityCalculator {
    private static final Logger log = LoggerFactory.getLogger(StabilityCalculator.class);

    private final SimilarityMetric similarityMetric;
    private final SplittableRandom random;
    private final int parallelism;

    public StabilityCalculator() {
        this(new JaccardSimilarity());
    }

    public StabilityCalculator(SimilarityMetric similarityMetric) {
        this(similarityMetric, new SplittableRandom(), 1);
    }

    public StabilityCalculator(SimilarityMetric similarityMetric, SplittableRandom random, int parallelism) {
        if (parallelism <= 0) {
            throw new InvalidConfigurationException("Parallelism must be positive: " + parallelism);
        }
        this.similarityMetric = Objects.requireNonNull(similarityMetric, "similarityMetric");
        this.random = Objects.requireNonNull(random, "random");
        this.parallelism = parallelism;
    }

    public static StabilityCalculator seeded(SimilarityMetric similarityMetric, long seed) {
        return new StabilityCalculator(similarityMetric, new SplittableRandom(seed), 1);
    }

    public SimilarityMetric similarityMetric() {
        return similarityMetric;
    }

    public List<Double> pairwiseSimilarities(List<String> responses) {
        List<Double> similarities = new ArrayList<>();
        int n = responses.size();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                similarities.add(similarityMetric.calculate(responses.get(i), responses.get(j)));
            }
        }
        return similarities;
    }

    /**
     * Mean pairwise similarity of the responses. A single response cannot disagree with
     * itself, so fewer than two responses score {@code 1.0}.
     */
    public double stabilityScore(List<String> responses) {
        if (responses.size() < 2) {
            return 1.0;
        }
        List<Double> similarities = pairwiseSimilarities(responses);
        if (similarities.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double similarity : similarities) {
            sum += similarity;
        }
        return sum / similarities.size();
    }

    /**
     * Draws {@code sampleSize} responses without replacement. Requests for at least as many
     * responses as are available return the whole list.
     */
    public List<String> resampleTrial(List<String> responses, int sampleSize) {
        requirePositiveSampleSize(sampleSize);
        return sample(responses, sampleSize, random);
    }

    /**
     * Runs {@code nIterations} trials under the given policy and returns one score per trial.
     */
    public double[] trialScores(List<String> responses, int nIterations, SamplingPolicy policy) {
        requirePositiveIterations(nIterations);
        Objects.requireNonNull(policy, "policy");
        List<String> population = List.copyOf(responses);
        int sampleSize = policy.sampleSize(population.size());

        double[] scores = new double[nIterations];
        if (sampleSize >= population.size()) {
            // every trial would see the whole group
            Arrays.fill(scores, stabilityScore(population));
            return scores;
        }

        int workers = Math.min(parallelism, nIterations);
        if (workers == 1) {
            runTrials(population, sampleSize, scores, 0, nIterations, random);
        } else {
            runTrialsInParallel(population, sampleSize, scores, workers);
        }
        return scores;
    }

    public Map<String, StabilityMetrics> comprehensiveStability(Map<String, List<String>> responseSets, int nIterations) {
        return comprehensiveStability(responseSets, nIterations, SamplingPolicy.halved());
    }

    public Map<String, StabilityMetrics> comprehensiveStability(
            Map<String, List<String>> responseSets,
            int nIterations,
            SamplingPolicy policy) {
        requirePositiveIterations(nIterations);
        Map<String, StabilityMetrics> results = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : responseSets.entrySet()) {
            List<String> responses = entry.getValue();
            if (responses.size() < 2) {
                results.put(entry.getKey(), StabilityMetrics.degenerate());
                continue;
            }
            StabilityMetrics metrics = StabilityMetrics.fromScores(trialScores(responses, nIterations, policy));
            log.debug("agent={} responses={} iterations={} mean={} stdDev={}",
                    entry.getKey(),
                    responses.size(),
                    nIterations,
                    metrics.meanStability(),
                    metrics.stdDev());
            results.put(entry.getKey(), metrics);
        }
        return results;
    }

    /**
     * Mean trial score per agent with a fixed sample size; {@code null} scores the full set each trial.
     */
    public Map<String, Double> monteCarloStability(
            Map<String, List<String>> responseSets,
            int nIterations,
            Integer sampleSize) {
        requirePositiveIterations(nIterations);
        SamplingPolicy policy = sampleSize == null ? SamplingPolicy.fullSet() : SamplingPolicy.fixed(sampleSize);
        Map<String, Double> results = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : responseSets.entrySet()) {
            if (entry.getValue().size() < 2) {
                results.put(entry.getKey(), 1.0);
                continue;
            }
            results.put(entry.getKey(), StabilityMetrics.fromScores(
                    trialScores(entry.getValue(), nIterations, policy)).meanStability());
        }
        return results;
    }

    public Map<String, Double> stabilityVariance(Map<String, List<String>> responseSets, int nIterations) {
        requirePositiveIterations(nIterations);
        Map<String, Double> results = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : responseSets.entrySet()) {
            if (entry.getValue().size() < 2) {
                results.put(entry.getKey(), 0.0);
                continue;
            }
            results.put(entry.getKey(), StabilityMetrics.fromScores(
                    trialScores(entry.getValue(), nIterations, SamplingPolicy.halved())).variance());
        }
        return results;
    }

    private void runTrialsInParallel(List<String> population, int sampleSize, double[] scores, int workers) {
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<?>> futures = new ArrayList<>(workers);
            for (int worker = 0; worker < workers; worker++) {
                int from = (int) ((long) worker * scores.length / workers);
                int to = (int) ((long) (worker + 1) * scores.length / workers);
                SplittableRandom workerRandom = random.split();
                futures.add(executor.submit(() -> runTrials(population, sampleSize, scores, from, to, workerRandom)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Monte-Carlo trials interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Monte-Carlo trial failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private void runTrials(
            List<String> population,
            int sampleSize,
            double[] scores,
            int fromInclusive,
            int toExclusive,
            SplittableRandom trialRandom) {
        for (int i = fromInclusive; i < toExclusive; i++) {
            scores[i] = stabilityScore(sample(population, sampleSize, trialRandom));
        }
    }

    private static List<String> sample(List<String> responses, int sampleSize, SplittableRandom trialRandom) {
        if (sampleSize >= responses.size()) {
            return List.copyOf(responses);
        }
        List<String> pool = new ArrayList<>(responses);
        for (int i = 0; i < sampleSize; i++) {
            Collections.swap(pool, i, i + trialRandom.nextInt(pool.size() - i));
        }
        return List.copyOf(pool.subList(0, sampleSize));
    }

    private static void requirePositiveIterations(int nIterations) {
        if (nIterations <= 0) {
            throw new InvalidConfigurationException("Number of Monte-Carlo iterations must be positive: " + nIterations);
        }
    }

    private static void requirePositiveSampleSize(int sampleSize) {
        if (sampleSize <= 0) {
            throw new InvalidConfigurationException("Sample size must be positive: " + sampleSize);
        }
    }
}
