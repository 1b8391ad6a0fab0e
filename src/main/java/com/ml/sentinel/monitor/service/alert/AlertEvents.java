package com.ml.sentinel.monitor.service.alert;

import com.ml.sentinel.monitor.dto.AlertEvent;
import com.ml.sentinel.monitor.dto.RetrainDecision;
import com.ml.sentinel.monitor.dto.RunRecord;
import com.ml.sentinel.monitor.dto.Signal;
import com.ml.sentinel.monitor.dto.Thresholds;
import com.ml.sentinel.monitor.enums.AlertCategory;
import com.ml.sentinel.monitor.enums.AlertSeverity;
import com.ml.sentinel.monitor.enums.RunOutcome;
import com.ml.sentinel.monitor.enums.Verdict;

import java.time.Duration;
import java.util.Locale;

/**
 * Builds the structured events components hand to the {@link AlertDispatcher}.
 */
public final class AlertEvents {

    private AlertEvents() {
    }

    public static AlertEvent fromRunRecord(RunRecord r) {
        AlertCategory category = r.triggerReason().alertCategory();
        if (r.outcome() == RunOutcome.SUCCESS) {
            String msg = "**Automated retraining succeeded**\n\n"
                    + "- Trigger: " + r.triggerReason().key() + "\n"
                    + "- New model: " + orNa(r.modelVersion()) + "\n"
                    + "- Accuracy: " + pct(r.preAccuracy()) + " -> " + pct(r.postAccuracy()) + "\n"
                    + "- Training samples: " + r.trainingSamples() + "\n"
                    + "- Duration: " + seconds(r.duration()) + "\n"
                    + "- Run: " + r.runId();
            return new AlertEvent(category, AlertSeverity.WARNING, "Model retrained (" + r.triggerReason().key() + ")", msg);
        }
        String msg = "**Automated retraining failed**\n\n"
                + "- Trigger: " + r.triggerReason().key() + "\n"
                + "- Error: " + truncate(orNa(r.error()), 300) + "\n"
                + "- Accuracy before: " + pct(r.preAccuracy()) + "\n"
                + "- Duration: " + seconds(r.duration()) + "\n"
                + "- Run: " + r.runId() + "\n"
                + "- Next attempt after cooldown";
        return new AlertEvent(category, AlertSeverity.CRITICAL, "Retraining failed (" + r.triggerReason().key() + ")", msg);
    }

    /**
     * Degraded or drifted, but no attempt was made this tick.
     */
    public static AlertEvent suppressedNotice(Verdict verdict, Signal s, RetrainDecision decision, Thresholds t) {
        AlertCategory category = verdict == Verdict.DRIFTED ? AlertCategory.DRIFT : AlertCategory.DEGRADATION;
        String why = decision.reason() != null && !decision.shouldRetrain()
                ? "retraining suppressed (cooldown active or retrain already running)"
                : "no retraining started";
        String msg = "**Model " + verdict.name().toLowerCase(Locale.ROOT) + "**\n\n"
                + "- Drift score: " + fmt(s.driftScore()) + " (threshold " + fmt(t.drift()) + ")\n"
                + "- Rolling accuracy: " + pct(s.rollingAccuracy()) + " (threshold " + pct(t.accuracy()) + ")\n"
                + "- Samples: " + s.sampleCount() + "\n"
                + "- Action: " + why;
        return new AlertEvent(category, AlertSeverity.INFO, "Model " + verdict.name().toLowerCase(Locale.ROOT), msg);
    }

    public static AlertEvent failureStreak(int consecutive, String lastFailure) {
        String msg = "**Monitoring degraded**\n\n"
                + "- Consecutive failed ticks: " + consecutive + "\n"
                + "- Last failure: " + truncate(orNa(lastFailure), 300) + "\n"
                + "- Monitoring continues on schedule";
        return new AlertEvent(AlertCategory.HEALTH, AlertSeverity.INFO, "Persistent backend failure", msg);
    }

    public static AlertEvent startup(Duration tickInterval, Thresholds t, Duration retrainCooldown) {
        String msg = "**Model monitoring started**\n\n"
                + "- Check interval: " + seconds(tickInterval) + "\n"
                + "- Drift threshold: " + fmt(t.drift()) + "\n"
                + "- Accuracy threshold: " + pct(t.accuracy()) + "\n"
                + "- Minimum samples: " + t.minSamples() + "\n"
                + "- Retrain cooldown: " + seconds(retrainCooldown);
        return new AlertEvent(AlertCategory.INFO, AlertSeverity.INFO, "Monitoring started", msg);
    }

    public static AlertEvent statusReport(long tick, Signal s, int healthyStreak, Duration tickInterval) {
        String msg = "**Status update**\n\n"
                + "- Model: healthy for " + healthyStreak + " consecutive checks\n"
                + "- Rolling accuracy: " + pct(s.rollingAccuracy()) + "\n"
                + "- Drift score: " + fmt(s.driftScore()) + "\n"
                + "- Samples: " + s.sampleCount() + "\n"
                + "- Ticks completed: " + tick + "\n"
                + "- Next check: " + seconds(tickInterval);
        return new AlertEvent(AlertCategory.INFO, AlertSeverity.INFO, "Periodic status report", msg);
    }

    static String pct(Double v) {
        return v == null ? "n/a" : String.format(Locale.ROOT, "%.1f%%", v * 100.0);
    }

    static String fmt(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }

    private static String seconds(Duration d) {
        return d == null ? "n/a" : String.format(Locale.ROOT, "%.1fs", d.toMillis() / 1000.0);
    }

    private static String orNa(String s) {
        return s == null || s.isBlank() ? "n/a" : s;
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
