package com.ml.sentinel.monitor.enums;

public enum AlertSeverity {
    INFO, WARNING, CRITICAL
}
