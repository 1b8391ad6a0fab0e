package com.ml.sentinel.monitor.enums;

public enum RunOutcome {
    SUCCESS,
    FAILED,
    SKIPPED
}
