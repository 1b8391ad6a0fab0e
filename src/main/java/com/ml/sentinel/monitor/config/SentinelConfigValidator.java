package com.ml.sentinel.monitor.config;

import com.ml.sentinel.monitor.common.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Cross-field checks the bean-validation annotations cannot express. Runs
 * before any tick is scheduled; a violation aborts startup.
 */
@Slf4j
@Component
public class SentinelConfigValidator {

    private final SentinelProperties props;

    public SentinelConfigValidator(SentinelProperties props) {
        this.props = props;
    }

    @PostConstruct
    public void validate() {
        List<String> problems = check(props);
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid sentinel configuration: " + String.join("; ", problems));
        }
        SentinelProperties.Timeouts t = props.getTimeouts();
        Duration worstTick = t.getProbe().plus(t.getRetrain());
        if (worstTick.compareTo(props.getSchedule().getTickInterval()) > 0) {
            log.warn("Probe + retrain timeouts ({}) exceed the tick interval ({}); slow ticks will delay the next one",
                    worstTick, props.getSchedule().getTickInterval());
        }
        log.info("Sentinel policy: tick={} drift>{} accuracy<{} minSamples={} retrainCooldown={} alertDedup={}",
                props.getSchedule().getTickInterval(),
                props.getThresholds().getDrift(),
                props.getThresholds().getAccuracy(),
                props.getThresholds().getMinSamples(),
                props.getCooldown().getRetrain(),
                props.getCooldown().getAlertDedup());
    }

    public static List<String> check(SentinelProperties p) {
        List<String> problems = new ArrayList<>();
        SentinelProperties.ThresholdPolicy th = p.getThresholds();
        if (!inUnitRange(th.getDrift())) problems.add("thresholds.drift must be within [0,1]");
        if (!inUnitRange(th.getAccuracy())) problems.add("thresholds.accuracy must be within [0,1]");
        if (th.getMinSamples() < 1) problems.add("thresholds.min-samples must be >= 1");

        requirePositive(problems, "schedule.tick-interval", p.getSchedule().getTickInterval());
        requirePositive(problems, "cooldown.retrain", p.getCooldown().getRetrain());
        requirePositive(problems, "cooldown.alert-dedup", p.getCooldown().getAlertDedup());
        requirePositive(problems, "timeouts.probe", p.getTimeouts().getProbe());
        requirePositive(problems, "timeouts.retrain", p.getTimeouts().getRetrain());
        requirePositive(problems, "timeouts.alert", p.getTimeouts().getAlert());
        requirePositive(problems, "timeouts.generator", p.getTimeouts().getGenerator());
        requirePositive(problems, "timeouts.tracker", p.getTimeouts().getTracker());
        requirePositive(problems, "probe.window-age", p.getProbe().getWindowAge());

        if (p.getSchedule().getFailureAlertAfter() < 1) {
            problems.add("schedule.failure-alert-after must be >= 1");
        }
        if (p.getProbe().getReferenceWeights() == null || p.getProbe().getReferenceWeights().size() != 2) {
            problems.add("probe.reference-weights must hold exactly two weights");
        }
        if (p.getProbe().getBaselineSize() > p.getProbe().getWindowSize()) {
            problems.add("probe.baseline-size must not exceed probe.window-size");
        }

        Duration lease = p.getRetrain().getLockStaleAfter();
        if (lease != null && problems.isEmpty()
                && lease.compareTo(p.getTimeouts().getProbe().plus(p.getTimeouts().getRetrain())) <= 0) {
            problems.add("retrain.lock-stale-after must exceed probe + retrain timeouts");
        }

        SentinelProperties.Endpoints e = p.getEndpoints();
        requireHttpUrl(problems, "endpoints.serving-url", e.getServingUrl());
        requireHttpUrl(problems, "endpoints.generator-url", e.getGeneratorUrl());
        requireHttpUrl(problems, "endpoints.tracker-url", e.getTrackerUrl());
        // no webhook means alerts are logged only
        if (e.getWebhookUrl() != null && !e.getWebhookUrl().isBlank()) {
            requireHttpUrl(problems, "endpoints.webhook-url", e.getWebhookUrl());
        }
        return problems;
    }

    private static boolean inUnitRange(double v) {
        return !Double.isNaN(v) && v >= 0.0 && v <= 1.0;
    }

    private static void requireHttpUrl(List<String> problems, String name, String url) {
        if (url == null || url.isBlank()) {
            problems.add(name + " must be set");
            return;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (!("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)) || uri.getHost() == null) {
                problems.add(name + " must be an http(s) URL with a host, got '" + url + "'");
            }
        } catch (URISyntaxException ex) {
            problems.add(name + " is not a valid URL: " + ex.getMessage());
        }
    }

    private static void requirePositive(List<String> problems, String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            problems.add(name + " must be a positive duration");
        }
    }
}
