package com.ml.sentinel.monitor.dto;

import java.time.Instant;

/**
 * A canary prediction checked against its reference label.
 */
public record PredictionOutcome(int predicted, int expected, double confidence, Instant at) {

    public boolean isHit() {
        return predicted == expected;
    }
}
