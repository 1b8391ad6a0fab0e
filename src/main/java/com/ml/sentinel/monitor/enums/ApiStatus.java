package com.ml.sentinel.monitor.enums;

import java.util.Locale;

/**
 * Status reported by the serving API health endpoint.
 */
public enum ApiStatus {
    OK,
    DEGRADED,
    DOWN;

    /** Anything unrecognised is treated as DOWN. */
    public static ApiStatus parse(String raw) {
        if (raw == null) return DOWN;
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "ok":
            case "healthy":
            case "up":
                return OK;
            case "degraded":
                return DEGRADED;
            default:
                return DOWN;
        }
    }

    public boolean isReachable() {
        return this != DOWN;
    }
}
