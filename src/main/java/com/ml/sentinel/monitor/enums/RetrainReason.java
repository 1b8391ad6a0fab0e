package com.ml.sentinel.monitor.enums;

import java.util.Optional;

public enum RetrainReason {
    NONE("none"),
    DRIFT("drift"),
    DEGRADATION("degradation"),
    MANUAL("manual");

    private final String key;

    RetrainReason(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<RetrainReason> fromVerdict(Verdict verdict) {
        if (verdict == Verdict.DRIFTED) return Optional.of(DRIFT);
        if (verdict == Verdict.DEGRADED) return Optional.of(DEGRADATION);
        return Optional.empty();
    }

    /**
     * Alert category for events about a retrain with this reason.
     */
    public AlertCategory alertCategory() {
        switch (this) {
            case DRIFT:
                return AlertCategory.DRIFT;
            case DEGRADATION:
                return AlertCategory.DEGRADATION;
            default:
                return AlertCategory.INFO;
        }
    }
}
