package com.ml.sentinel.monitor.enums;

public enum Verdict {
    HEALTHY,
    DEGRADED,
    DRIFTED,
    /** The probe could not produce a reliable signal. */
    UNKNOWN;

    public boolean isActionable() {
        return this == DEGRADED || this == DRIFTED;
    }
}
