package com.promptstability.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private EvaluationConfig evaluation = new EvaluationConfig();
    private StorageConfig storage = new StorageConfig();
    private ReportConfig report = new ReportConfig();

    public EvaluationConfig getEvaluation() {
        return evaluation;
    }

    public void setEvaluation(EvaluationConfig evaluation) {
        this.evaluation = evaluation == null ? new EvaluationConfig() : evaluation;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public ReportConfig getReport() {
        return report;
    }

    public void setReport(ReportConfig report) {
        this.report = report == null ? new ReportConfig() : report;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EvaluationConfig {
        private int iterations = 1000;
        private String metric = "jaccard";
        private SamplingConfig sampling = new SamplingConfig();
        private Long seed;
        private int parallelism = 1;

        public int getIterations() {
            return iterations;
        }

        public void setIterations(int iterations) {
            this.iterations = iterations;
        }

        public String getMetric() {
            return metric;
        }

        public void setMetric(String metric) {
            this.metric = metric;
        }

        public SamplingConfig getSampling() {
            return sampling;
        }

        public void setSampling(SamplingConfig sampling) {
            this.sampling = sampling == null ? new SamplingConfig() : sampling;
        }

        public Long getSeed() {
            return seed;
        }

        public void setSeed(Long seed) {
            this.seed = seed;
        }

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SamplingConfig {
        private String mode = "halved";
        private Integer sampleSize;

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public Integer getSampleSize() {
            return sampleSize;
        }

        public void setSampleSize(Integer sampleSize) {
            this.sampleSize = sampleSize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String dataDir = "test_data";

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReportConfig {
        private String format = "text";

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }
    }
}
