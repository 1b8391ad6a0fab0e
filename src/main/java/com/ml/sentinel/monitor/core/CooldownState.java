package com.ml.sentinel.monitor.core;

import com.ml.sentinel.monitor.common.constants.SentinelConsts;
import com.ml.sentinel.monitor.enums.AlertCategory;
import com.ml.sentinel.monitor.enums.RetrainReason;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last-trigger timestamps per category, shared by the retrain coordinator
 * ({@code retrain:<reason>}) and the alert dispatcher ({@code alert:<category>}).
 * Created empty at startup; entries are only ever overwritten.
 */
public class CooldownState {

    private final Map<String, Instant> lastTriggered = new ConcurrentHashMap<>();

    public static String retrainKey(RetrainReason reason) {
        return SentinelConsts.RETRAIN_COOLDOWN_PREFIX + reason.key();
    }

    public static String alertKey(AlertCategory category) {
        return SentinelConsts.ALERT_COOLDOWN_PREFIX + category.key();
    }

    public Optional<Instant> lastTriggered(String key) {
        return Optional.ofNullable(lastTriggered.get(key));
    }

    /**
     * True while less than {@code period} has elapsed since the key last fired.
     */
    public boolean isCoolingDown(String key, Duration period, Instant now) {
        Instant last = lastTriggered.get(key);
        return last != null && Duration.between(last, now).compareTo(period) < 0;
    }

    public Duration remaining(String key, Duration period, Instant now) {
        Instant last = lastTriggered.get(key);
        if (last == null) return Duration.ZERO;
        Duration left = period.minus(Duration.between(last, now));
        return left.isNegative() ? Duration.ZERO : left;
    }

    public void markTriggered(String key, Instant at) {
        lastTriggered.put(key, at);
    }

    public Map<String, Instant> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(lastTriggered));
    }
}
