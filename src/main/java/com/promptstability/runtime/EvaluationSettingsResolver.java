package com.promptstability.runtime;

import java.nio.file.Path;
import java.util.Locale;
import java.util.SplittableRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.promptstability.metric.SimilarityMetric;
import com.promptstability.metric.SimilarityMetrics;
import com.promptstability.stability.SamplingPolicy;
import com.promptstability.stability.StabilityCalculator;

/**
 * Merges the YAML configuration with command-line overrides and validates the result
 * before any evaluation starts.
 */
public class EvaluationSettingsResolver {
    private static final Logger log = LoggerFactory.getLogger(EvaluationSettingsResolver.class);

    public ResolvedSettings resolve(AppConfig config, Overrides overrides) {
        AppConfig.EvaluationConfig evaluation = config.getEvaluation();

        int iterations = overrides.iterations() != null ? overrides.iterations() : evaluation.getIterations();
        if (iterations <= 0) {
            throw new InvalidConfigurationException("Monte-Carlo iterations must be a positive integer: " + iterations);
        }

        String metricName = firstNonBlank(overrides.metric(), evaluation.getMetric(), "jaccard");
        SimilarityMetric metric = SimilarityMetrics.byName(metricName);

        String samplingMode = firstNonBlank(overrides.samplingMode(), evaluation.getSampling().getMode(), "halved");
        Integer sampleSize = overrides.sampleSize() != null ? overrides.sampleSize() : evaluation.getSampling().getSampleSize();
        if (sampleSize != null && sampleSize <= 0) {
            throw new InvalidConfigurationException("Sample size must be positive: " + sampleSize);
        }
        if ("halved".equals(samplingMode.toLowerCase(Locale.ROOT)) && sampleSize != null) {
            log.info("Explicit sample size {} given; switching from halved to fixed sampling", sampleSize);
            samplingMode = "fixed";
        }
        SamplingPolicy samplingPolicy = SamplingPolicy.of(samplingMode, sampleSize);

        int parallelism = overrides.parallelism() != null ? overrides.parallelism() : evaluation.getParallelism();
        if (parallelism <= 0) {
            throw new InvalidConfigurationException("Parallelism must be a positive integer: " + parallelism);
        }

        Long seed = overrides.seed() != null ? overrides.seed() : evaluation.getSeed();

        String format = firstNonBlank(overrides.format(), config.getReport().getFormat(), "text").toLowerCase(Locale.ROOT);
        if (!"text".equals(format) && !"json".equals(format)) {
            throw new InvalidConfigurationException("Unknown report format: " + format + " (supported: text, json)");
        }

        Path dataDir = overrides.dataDir() != null
                ? overrides.dataDir()
                : Path.of(firstNonBlank(config.getStorage().getDataDir(), null, "test_data"));

        return new ResolvedSettings(iterations, metric, samplingPolicy, seed, parallelism, format, dataDir);
    }

    private static String firstNonBlank(String preferred, String configured, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return fallback;
    }

    /**
     * Command-line values; {@code null} means "use the configured value".
     */
    public record Overrides(
            Integer iterations,
            String metric,
            String samplingMode,
            Integer sampleSize,
            Long seed,
            Integer parallelism,
            String format,
            Path dataDir) {

        public static Overrides none() {
            return new Overrides(null, null, null, null, null, null, null, null);
        }
    }

    public record ResolvedSettings(
            int iterations,
            SimilarityMetric metric,
            SamplingPolicy samplingPolicy,
            Long seed,
            int parallelism,
            String format,
            Path dataDir) {

        public StabilityCalculator newCalculator() {
            SplittableRandom random = seed == null ? new SplittableRandom() : new SplittableRandom(seed);
            return new StabilityCalculator(metric, random, parallelism);
        }
    }
}
