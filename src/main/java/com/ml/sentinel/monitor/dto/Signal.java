package com.ml.sentinel.monitor.dto;

import java.time.Instant;

/**
 * Point-in-time reading produced by the probe once per tick. When
 * {@code apiHealthy} is false the remaining fields are not reliable.
 */
public record Signal(
        Instant timestamp,
        boolean apiHealthy,
        double rollingAccuracy,
        double driftScore,
        int sampleCount
) {
    public Signal {
        if (sampleCount < 0) {
            throw new IllegalArgumentException("sampleCount must be >= 0, was " + sampleCount);
        }
        rollingAccuracy = clamp01(rollingAccuracy);
        driftScore = clamp01(driftScore);
    }

    public static Signal unreachable(Instant at) {
        return new Signal(at, false, 0.0, 0.0, 0);
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
