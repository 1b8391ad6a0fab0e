package com.ml.sentinel.monitor.dto;

import com.ml.sentinel.monitor.enums.RetrainReason;
import com.ml.sentinel.monitor.enums.RunOutcome;
import lombok.Builder;

import java.time.Duration;
import java.time.Instant;

/**
 * One retraining attempt. Created once by the coordinator, never mutated.
 */
@Builder(toBuilder = true)
public record RunRecord(
        String runId,
        RetrainReason triggerReason,
        Double preAccuracy,
        Double postAccuracy,
        int trainingSamples,
        Duration duration,
        Instant timestamp,
        RunOutcome outcome,
        String modelVersion,
        String datasetRef,
        String error
) {
    public boolean isSuccess() {
        return outcome == RunOutcome.SUCCESS;
    }
}
