package com.ml.sentinel.monitor.service.monitor;

import com.ml.sentinel.monitor.core.CooldownState;
import com.ml.sentinel.monitor.dto.RunRecord;
import com.ml.sentinel.monitor.dto.TickReport;
import com.ml.sentinel.monitor.service.retrain.RetrainCoordinator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class SentinelHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "Monitoring ticks keep failing");

    private final MonitoringCycle cycle;
    private final RetrainCoordinator coordinator;
    private final CooldownState cooldown;

    public SentinelHealthIndicator(MonitoringCycle cycle, RetrainCoordinator coordinator, CooldownState cooldown) {
        this.cycle = cycle;
        this.coordinator = coordinator;
        this.cooldown = cooldown;
    }

    @Override
    public Health health() {
        try {
            Health.Builder b = cycle.consecutiveFailures() >= cycle.failureAlertAfter()
                    ? Health.status(DEGRADED)
                    : Health.up();
            b.withDetail("ticks", cycle.tickCount())
                    .withDetail("consecutive_failures", cycle.consecutiveFailures())
                    .withDetail("retrain_in_progress", coordinator.isRetrainInProgress())
                    .withDetail("last_decision", coordinator.lastDecision().toString());

            TickReport last = cycle.lastReport();
            if (last != null) {
                b.withDetail("last_verdict", last.verdict().name())
                        .withDetail("last_tick_at", String.valueOf(last.signal().timestamp()))
                        .withDetail("last_tick_ms", last.elapsed().toMillis());
            }
            coordinator.lastRecord().ifPresent(r -> b.withDetail("last_run", describe(r)));

            Map<String, String> cooldowns = new LinkedHashMap<>();
            cooldown.snapshot().forEach((k, v) -> cooldowns.put(k, v.toString()));
            b.withDetail("cooldowns", cooldowns);
            return b.build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("status", "Sentinel state not readable")
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }

    private static Map<String, Object> describe(RunRecord r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("run_id", r.runId());
        m.put("reason", r.triggerReason().name());
        m.put("outcome", r.outcome().name());
        m.put("post_accuracy", r.postAccuracy());
        m.put("at", String.valueOf(r.timestamp()));
        return m;
    }
}
