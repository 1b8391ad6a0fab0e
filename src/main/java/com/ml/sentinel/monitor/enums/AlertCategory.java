package com.ml.sentinel.monitor.enums;

/**
 * Fixed set of categories; cooldown state never grows beyond these keys.
 */
public enum AlertCategory {
    DRIFT("drift"),
    DEGRADATION("degradation"),
    HEALTH("health"),
    INFO("info");

    private final String key;

    AlertCategory(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
