package com.ml.sentinel.monitor.service.monitor;

import com.ml.sentinel.monitor.common.constants.SentinelConsts;
import com.ml.sentinel.monitor.config.SentinelProperties;
import com.ml.sentinel.monitor.dto.AlertEvent;
import com.ml.sentinel.monitor.dto.RunRecord;
import com.ml.sentinel.monitor.dto.Signal;
import com.ml.sentinel.monitor.dto.TickReport;
import com.ml.sentinel.monitor.enums.Verdict;
import com.ml.sentinel.monitor.service.alert.AlertDispatcher;
import com.ml.sentinel.monitor.service.alert.AlertEvents;
import com.ml.sentinel.monitor.service.evaluator.DriftEvaluator;
import com.ml.sentinel.monitor.service.probe.MetricProbe;
import com.ml.sentinel.monitor.service.retrain.RetrainCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One monitoring tick: probe, evaluate, maybe retrain, alert. No exception
 * escapes a tick; every step degrades to a safe default (unknown verdict,
 * no run record, undelivered alert) and the failure feeds the streak that
 * eventually raises a low-severity health alert.
 */
@Slf4j
@Service
public class MonitoringCycle {

    private final MetricProbe probe;
    private final DriftEvaluator evaluator;
    private final RetrainCoordinator coordinator;
    private final AlertDispatcher dispatcher;
    private final SentinelProperties props;
    private final Clock clock;

    private final AtomicLong ticks = new AtomicLong();
    private final FailureStreakTracker failures;
    private int healthyStreak;
    private volatile TickReport lastReport;

    public MonitoringCycle(MetricProbe probe,
                           DriftEvaluator evaluator,
                           RetrainCoordinator coordinator,
                           AlertDispatcher dispatcher,
                           SentinelProperties props,
                           Clock clock) {
        this.probe = probe;
        this.evaluator = evaluator;
        this.coordinator = coordinator;
        this.dispatcher = dispatcher;
        this.props = props;
        this.clock = clock;
        this.failures = new FailureStreakTracker(props.getSchedule().getFailureAlertAfter());
    }

    public TickReport runTick() {
        long tick = ticks.incrementAndGet();
        MDC.put(SentinelConsts.MDC_TICK, String.valueOf(tick));
        Instant started = clock.instant();
        List<String> problems = new ArrayList<>();
        try {
            Signal signal = sample(problems);
            Verdict verdict = evaluate(signal, problems);
            RunRecord record = handle(verdict, signal, problems);

            boolean alertSent = false;
            if (record != null) {
                alertSent = dispatch(AlertEvents.fromRunRecord(record), problems);
            } else if (verdict.isActionable()) {
                alertSent = dispatch(AlertEvents.suppressedNotice(verdict, signal,
                        coordinator.lastDecision(), evaluator.thresholds()), problems);
            }

            if (!signal.apiHealthy()) {
                problems.add("serving API unreachable or unhealthy");
            }
            if (record != null && !record.isSuccess()) {
                problems.add("retrain failed: " + record.error());
            }
            trackStreaks(tick, signal, verdict, problems);

            Duration elapsed = Duration.between(started, clock.instant());
            TickReport report = new TickReport(tick, signal, verdict, record, alertSent, !problems.isEmpty(), elapsed);
            lastReport = report;
            log.info("Tick {} done in {} ms: verdict={} accuracy={} drift={} samples={} retrain={} alert={}",
                    tick, elapsed.toMillis(), verdict,
                    signal.apiHealthy() ? ratio(signal.rollingAccuracy()) : "-",
                    signal.apiHealthy() ? ratio(signal.driftScore()) : "-",
                    signal.sampleCount(),
                    record == null ? "none" : record.outcome(),
                    alertSent);
            if (elapsed.compareTo(props.getSchedule().getTickInterval()) > 0) {
                log.warn("Tick {} took {} which exceeds the {} interval; next tick is delayed",
                        tick, elapsed, props.getSchedule().getTickInterval());
            }
            return report;
        } finally {
            MDC.remove(SentinelConsts.MDC_TICK);
        }
    }

    private Signal sample(List<String> problems) {
        try {
            return probe.sample();
        } catch (RuntimeException e) {
            log.warn("Probe step failed: {}", e.toString(), e);
            problems.add("probe: " + e.getMessage());
            return Signal.unreachable(clock.instant());
        }
    }

    private Verdict evaluate(Signal signal, List<String> problems) {
        try {
            return evaluator.evaluate(signal);
        } catch (RuntimeException e) {
            log.warn("Evaluator step failed: {}", e.toString(), e);
            problems.add("evaluator: " + e.getMessage());
            return Verdict.UNKNOWN;
        }
    }

    private RunRecord handle(Verdict verdict, Signal signal, List<String> problems) {
        try {
            return coordinator.handle(verdict, signal).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Coordinator step failed: {}", e.toString(), e);
            problems.add("coordinator: " + e.getMessage());
            return null;
        }
    }

    private boolean dispatch(AlertEvent event, List<String> problems) {
        try {
            return dispatcher.dispatch(event);
        } catch (RuntimeException e) {
            log.warn("Dispatcher step failed: {}", e.toString(), e);
            problems.add("dispatcher: " + e.getMessage());
            return false;
        }
    }

    private void trackStreaks(long tick, Signal signal, Verdict verdict, List<String> problems) {
        if (problems.isEmpty()) {
            failures.recordSuccess();
        } else if (failures.recordFailure(String.join("; ", problems))) {
            log.warn("{} consecutive failed ticks, last: {}", failures.consecutive(), failures.lastFailure());
            dispatch(AlertEvents.failureStreak(failures.consecutive(), failures.lastFailure()), new ArrayList<>());
        }

        if (verdict == Verdict.HEALTHY) {
            healthyStreak++;
            int every = props.getSchedule().getStatusReportEvery();
            if (every > 0 && healthyStreak % every == 0) {
                dispatch(AlertEvents.statusReport(tick, signal, healthyStreak,
                        props.getSchedule().getTickInterval()), new ArrayList<>());
            }
        } else {
            healthyStreak = 0;
        }
    }

    public TickReport lastReport() {
        return lastReport;
    }

    public long tickCount() {
        return ticks.get();
    }

    public int consecutiveFailures() {
        return failures.consecutive();
    }

    public int failureAlertAfter() {
        return failures.alertAfter();
    }

    private static String ratio(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }
}
