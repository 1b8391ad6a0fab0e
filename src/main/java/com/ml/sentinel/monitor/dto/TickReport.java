package com.ml.sentinel.monitor.dto;

import com.ml.sentinel.monitor.enums.Verdict;

import java.time.Duration;

/**
 * What one monitoring tick observed and did.
 */
public record TickReport(
        long tick,
        Signal signal,
        Verdict verdict,
        RunRecord record,
        boolean alertSent,
        boolean failed,
        Duration elapsed
) {
}
