package com.ml.sentinel.monitor.model.mlflow;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response bodies of the MLflow tracking REST API (2.0); only the fields read here.
 */
public final class MlflowResponses {

    private MlflowResponses() {
    }

    @Data
    @NoArgsConstructor
    public static class GetExperiment {
        private Experiment experiment;
    }

    @Data
    @NoArgsConstructor
    public static class Experiment {
        private String experimentId;
        private String name;
        private String lifecycleStage;
    }

    @Data
    @NoArgsConstructor
    public static class CreateExperiment {
        private String experimentId;
    }

    @Data
    @NoArgsConstructor
    public static class CreateRun {
        private Run run;
    }

    @Data
    @NoArgsConstructor
    public static class Run {
        private RunInfo info;
    }

    @Data
    @NoArgsConstructor
    public static class RunInfo {
        private String runId;
        private String experimentId;
        private String status;
    }
}
