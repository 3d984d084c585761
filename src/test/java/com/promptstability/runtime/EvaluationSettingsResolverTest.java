package com.promptstability.runtime;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.promptstability.metric.EditDistanceSimilarity;
import com.promptstability.metric.JaccardSimilarity;
import com.promptstability.metric.LengthSimilarity;
import com.promptstability.stability.SamplingPolicy;
import com.promptstability.stability.StabilityCalculator;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EvaluationSettingsResolverTest {

    private final EvaluationSettingsResolver resolver = new EvaluationSettingsResolver();

    @Test
    void shouldResolveDefaults() {
        EvaluationSettingsResolver.ResolvedSettings settings = resolver.resolve(
                new AppConfig(),
                EvaluationSettingsResolver.Overrides.none());

        assertEquals(1000, settings.iterations());
        assertInstanceOf(JaccardSimilarity.class, settings.metric());
        assertEquals(SamplingPolicy.halved(), settings.samplingPolicy());
        assertNull(settings.seed());
        assertEquals(1, settings.parallelism());
        assertEquals("text", settings.format());
        assertEquals(Path.of("test_data"), settings.dataDir());
    }

    @Test
    void shouldReadYamlAndPreferCommandLineOverrides() throws Exception {
        AppConfig config = new ObjectMapper(new YAMLFactory()).readValue("""
                evaluation:
                  iterations: 250
                  metric: length
                  sampling:
                    mode: fixed
                    sampleSize: 4
                  seed: 17
                  parallelism: 2
                storage:
                  dataDir: results
                report:
                  format: json
                unknownSection: ignored
                """, AppConfig.class);

        EvaluationSettingsResolver.ResolvedSettings fromFile = resolver.resolve(
                config,
                EvaluationSettingsResolver.Overrides.none());
        assertEquals(250, fromFile.iterations());
        assertInstanceOf(LengthSimilarity.class, fromFile.metric());
        assertEquals(SamplingPolicy.fixed(4), fromFile.samplingPolicy());
        assertEquals(17L, fromFile.seed());
        assertEquals(2, fromFile.parallelism());
        assertEquals("json", fromFile.format());
        assertEquals(Path.of("results"), fromFile.dataDir());

        EvaluationSettingsResolver.ResolvedSettings overridden = resolver.resolve(
                config,
                new EvaluationSettingsResolver.Overrides(10, "edit-distance", "halved", null, 3L, 1, "text", Path.of("other")));
        assertEquals(10, overridden.iterations());
        assertInstanceOf(EditDistanceSimilarity.class, overridden.metric());
        assertEquals(SamplingPolicy.fixed(4), overridden.samplingPolicy());
        assertEquals(3L, overridden.seed());
        assertEquals(Path.of("other"), overridden.dataDir());
    }

    @Test
    void shouldSwitchToFixedSamplingWhenSampleSizeIsGiven() {
        EvaluationSettingsResolver.ResolvedSettings settings = resolver.resolve(
                new AppConfig(),
                new EvaluationSettingsResolver.Overrides(null, null, null, 5, null, null, null, null));

        assertEquals(SamplingPolicy.fixed(5), settings.samplingPolicy());
    }

    @Test
    void shouldBuildReproducibleCalculatorsFromSeed() {
        EvaluationSettingsResolver.ResolvedSettings settings = resolver.resolve(
                new AppConfig(),
                new EvaluationSettingsResolver.Overrides(null, null, null, null, 8L, null, null, null));
        List<String> responses = List.of("a b", "b c", "c d", "d e", "a e", "a c");

        StabilityCalculator first = settings.newCalculator();
        StabilityCalculator second = settings.newCalculator();

        assertArrayEquals(
                first.trialScores(responses, 50, settings.samplingPolicy()),
                second.trialScores(responses, 50, settings.samplingPolicy()));
    }

    @Test
    void shouldRejectInvalidConfigurationBeforeEvaluation() {
        assertThrows(InvalidConfigurationException.class, () -> resolve(0, null, null, null, null, null));
        assertThrows(InvalidConfigurationException.class, () -> resolve(-1, null, null, null, null, null));
        assertThrows(InvalidConfigurationException.class, () -> resolve(null, "unknown", null, null, null, null));
        assertThrows(InvalidConfigurationException.class, () -> resolve(null, null, "bootstrap", null, null, null));
        assertThrows(InvalidConfigurationException.class, () -> resolve(null, null, null, 0, null, null));
        assertThrows(InvalidConfigurationException.class, () -> resolve(null, null, null, null, 0, null));
        assertThrows(InvalidConfigurationException.class, () -> resolve(null, null, null, null, null, "xml"));
    }

    private EvaluationSettingsResolver.ResolvedSettings resolve(
            Integer iterations,
            String metric,
            String sampling,
            Integer sampleSize,
            Integer parallelism,
            String format) {
        return resolver.resolve(new AppConfig(), new EvaluationSettingsResolver.Overrides(
                iterations, metric, sampling, sampleSize, null, parallelism, format, null));
    }
}
