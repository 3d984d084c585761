package com.promptstability;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.promptstability.evaluation.EvaluationResult;
import com.promptstability.evaluation.Evaluator;
import com.promptstability.evaluation.ResponseAggregator;
import com.promptstability.evaluation.StabilitySummary;
import com.promptstability.report.StabilityReportRenderer;
import com.promptstability.runtime.AppConfig;
import com.promptstability.runtime.EvaluationSettingsResolver;
import com.promptstability.runtime.InvalidConfigurationException;
import com.promptstability.storage.JsonResponseStore;
import com.promptstability.storage.ResponseRecord;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "prompt-stability",
        mixinStandardHelpOptions = true,
        version = "prompt-stability 0.1.0",
        description = "Evaluates stored agent responses and estimates prompt stability with Monte-Carlo resampling.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_NO_DATA = 1;
    static final int EXIT_USAGE_ERROR = 2;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "report")
    Mode mode;

    @Option(names = "--data-dir", description = "Directory containing test data (overrides storage.dataDir)")
    Path dataDir;

    @Option(names = "--iterations", description = "Number of Monte-Carlo iterations (overrides evaluation.iterations)")
    Integer iterations;

    @Option(names = "--metric", description = "Similarity metric: jaccard, length, edit-distance, cosine")
    String metric;

    @Option(names = "--sampling", description = "Trial sampling mode: halved, fixed")
    String sampling;

    @Option(names = "--sample-size", description = "Responses drawn per trial; implies fixed sampling")
    Integer sampleSize;

    @Option(names = "--seed", description = "Seed for reproducible resampling")
    Long seed;

    @Option(names = "--parallelism", description = "Worker threads used for Monte-Carlo trials")
    Integer parallelism;

    @Option(names = "--format", description = "Report format: text, json")
    String format;

    @Option(names = "--output", description = "Write the report to this file instead of stdout")
    Path output;

    @Option(names = "--prompt", description = "Base prompt: evaluation scope in report/summary mode, record prompt in record mode")
    String prompt;

    @Option(names = "--agent", description = "Agent name for record mode")
    String agent;

    @Option(names = "--response", description = "Response text for record mode")
    String response;

    @Option(names = "--style", description = "Style combination for record mode")
    String style;

    private final EvaluationSettingsResolver settingsResolver = new EvaluationSettingsResolver();
    private final StabilityReportRenderer renderer = new StabilityReportRenderer();

    enum Mode {
        report,
        summary,
        record,
        clear
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        EvaluationSettingsResolver.ResolvedSettings settings;
        try {
            settings = settingsResolver.resolve(config, new EvaluationSettingsResolver.Overrides(
                    iterations,
                    metric,
                    sampling,
                    sampleSize,
                    seed,
                    parallelism,
                    format,
                    dataDir));
        } catch (InvalidConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE_ERROR;
        }

        log.debug("Using config file: {}", configPath);
        JsonResponseStore store = new JsonResponseStore(settings.dataDir());

        if (mode == Mode.record) {
            return recordResponse(store);
        }
        if (mode == Mode.clear) {
            store.clear();
            log.info("Cleared response store {}", store.dataFile());
            return EXIT_OK;
        }

        Evaluator evaluator = new Evaluator(store, settings.newCalculator(), settings.iterations(), settings.samplingPolicy());
        ResponseAggregator aggregator = evaluator.loadAndAggregate();
        if (aggregator.acceptedRecords() + aggregator.droppedRecords() == 0) {
            log.error("No test data found in {}. Record responses first.", store.dataFile());
            return EXIT_NO_DATA;
        }

        log.info("Loaded {} test results, using {} similarity metric, {} sampling, {} Monte-Carlo iterations",
                aggregator.acceptedRecords() + aggregator.droppedRecords(),
                settings.metric().name(),
                settings.samplingPolicy().mode(),
                settings.iterations());

        EvaluationResult result = evaluator.evaluate(prompt);
        StabilitySummary summary = Evaluator.summarize(result);
        boolean json = "json".equals(settings.format());

        String rendered;
        if (mode == Mode.summary) {
            rendered = json ? renderer.renderSummaryJson(summary) : renderer.renderSummary(summary);
        } else {
            rendered = json
                    ? renderer.renderJson(result, summary)
                    : renderer.renderText(result, settings.iterations(), settings.metric().name());
        }
        writeReport(rendered);
        return EXIT_OK;
    }

    private int recordResponse(JsonResponseStore store) throws IOException {
        if (isBlank(prompt) || isBlank(agent) || isBlank(response)) {
            log.error("--prompt, --agent, and --response are required in record mode");
            return EXIT_USAGE_ERROR;
        }
        String fullPrompt = isBlank(style) ? null : prompt + " Please answer in a " + style + " manner.";
        store.append(new ResponseRecord(prompt, agent, response, style, fullPrompt, null, null));
        log.info("Recorded response agent={} prompt={} store={}", agent, prompt, store.dataFile());
        return EXIT_OK;
    }

    private void writeReport(String rendered) throws IOException {
        if (output == null) {
            System.out.println(rendered);
            return;
        }
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        Files.writeString(output, rendered + System.lineSeparator());
        log.info("Report saved to {}", output);
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
