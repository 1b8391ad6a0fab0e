package com.ml.sentinel.monitor.model.mlflow;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request bodies of the MLflow tracking REST API (2.0).
 */
public final class MlflowRequests {

    private MlflowRequests() {
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateExperiment {
        private String name;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateRun {
        private String experimentId;
        private String runName;
        private long startTime;
        private List<KeyValue> tags;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LogBatch {
        private String runId;
        private List<KeyValue> params;
        private List<Metric> metrics;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UpdateRun {
        private String runId;
        private String status;
        private long endTime;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class KeyValue {
        private String key;
        private String value;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metric {
        private String key;
        private double value;
        private long timestamp;
        private long step;
    }
}
