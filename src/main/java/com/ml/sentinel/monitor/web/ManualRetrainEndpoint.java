package com.ml.sentinel.monitor.web;

import com.ml.sentinel.monitor.dto.RunRecord;
import com.ml.sentinel.monitor.enums.RunOutcome;
import com.ml.sentinel.monitor.service.alert.AlertDispatcher;
import com.ml.sentinel.monitor.service.alert.AlertEvents;
import com.ml.sentinel.monitor.service.retrain.RetrainCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator trigger: {@code POST /actuator/retrain} starts a retrain outside
 * the cooldown. A retrain already in flight wins and the request is skipped.
 */
@Slf4j
@Component
@Endpoint(id = "retrain")
public class ManualRetrainEndpoint {

    private final RetrainCoordinator coordinator;
    private final AlertDispatcher dispatcher;

    public ManualRetrainEndpoint(RetrainCoordinator coordinator, AlertDispatcher dispatcher) {
        this.coordinator = coordinator;
        this.dispatcher = dispatcher;
    }

    @ReadOperation
    public Map<String, Object> status() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("in_progress", coordinator.isRetrainInProgress());
        m.put("last_decision", coordinator.lastDecision().toString());
        coordinator.lastRecord().ifPresent(r -> m.put("last_run", toMap(r)));
        return m;
    }

    @WriteOperation
    public Map<String, Object> trigger() {
        log.info("Manual retrain requested");
        RunRecord record = coordinator.requestManual();
        boolean alerted = false;
        if (record.outcome() != RunOutcome.SKIPPED) {
            alerted = dispatcher.dispatch(AlertEvents.fromRunRecord(record));
        }
        Map<String, Object> m = toMap(record);
        m.put("alert_sent", alerted);
        return m;
    }

    private static Map<String, Object> toMap(RunRecord r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("run_id", r.runId());
        m.put("trigger_reason", r.triggerReason().name());
        m.put("outcome", r.outcome().name());
        m.put("pre_accuracy", r.preAccuracy());
        m.put("post_accuracy", r.postAccuracy());
        m.put("training_samples", r.trainingSamples());
        m.put("duration_ms", r.duration() == null ? null : r.duration().toMillis());
        m.put("model_version", r.modelVersion());
        m.put("timestamp", String.valueOf(r.timestamp()));
        m.put("error", r.error());
        return m;
    }
}
