package com.ml.sentinel.monitor.config;

import com.ml.sentinel.monitor.dto.Thresholds;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Monitoring policy. Every value can be overridden through the environment,
 * e.g. {@code SENTINEL_THRESHOLDS_DRIFT=0.6}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties("sentinel")
public class SentinelProperties {

    @Valid
    private Schedule schedule = new Schedule();
    @Valid
    private ThresholdPolicy thresholds = new ThresholdPolicy();
    @Valid
    private Cooldown cooldown = new Cooldown();
    @Valid
    private Timeouts timeouts = new Timeouts();
    @Valid
    private Probe probe = new Probe();
    @Valid
    private Retrain retrain = new Retrain();
    @Valid
    private Endpoints endpoints = new Endpoints();

    public Thresholds toThresholds() {
        return new Thresholds(thresholds.getDrift(), thresholds.getAccuracy(), thresholds.getMinSamples());
    }

    /**
     * Lease TTL for the retrain lock; falls back to twice the retrain timeout.
     */
    public Duration effectiveLockStaleAfter() {
        Duration configured = retrain.getLockStaleAfter();
        return configured != null ? configured : timeouts.getRetrain().multipliedBy(2);
    }

    @Getter
    @Setter
    public static class Schedule {
        private boolean enabled = true;
        @NotNull
        private Duration tickInterval = Duration.ofSeconds(30);
        private Duration initialDelay = Duration.ofSeconds(5);
        @Min(1)
        private int failureAlertAfter = 3;
        // 0 disables the periodic report
        @Min(0)
        private int statusReportEvery = 10;
        private boolean startupNotification = true;
    }

    @Getter
    @Setter
    public static class ThresholdPolicy {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double drift = 0.7;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double accuracy = 0.85;
        @Min(1)
        private int minSamples = 20;
    }

    @Getter
    @Setter
    public static class Cooldown {
        @NotNull
        private Duration retrain = Duration.ofMinutes(10);
        @NotNull
        private Duration alertDedup = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class Timeouts {
        @NotNull
        private Duration probe = Duration.ofSeconds(5);
        @NotNull
        private Duration retrain = Duration.ofSeconds(60);
        @NotNull
        private Duration alert = Duration.ofSeconds(10);
        @NotNull
        private Duration generator = Duration.ofSeconds(30);
        @NotNull
        private Duration tracker = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Probe {
        @Min(0)
        private int canaryBatch = 5;
        @Min(1)
        private int windowSize = 200;
        @NotNull
        private Duration windowAge = Duration.ofMinutes(15);
        @Min(1)
        private int baselineSize = 50;
        @Size(min = 2, max = 2)
        private List<Double> referenceWeights = new ArrayList<>(List.of(0.5, 0.3));
        private long seed = 42L;
    }

    @Getter
    @Setter
    public static class Retrain {
        @Min(1)
        private int samples = 1000;
        private Duration lockStaleAfter;
    }

    @Getter
    @Setter
    public static class Endpoints {
        @NotBlank
        private String servingUrl = "http://localhost:8000";
        @NotBlank
        private String generatorUrl = "http://localhost:8000";
        @NotBlank
        private String trackerUrl = "http://localhost:5000";
        private String webhookUrl;
        @NotBlank
        private String experimentName = "model-sentinel";
    }
}
