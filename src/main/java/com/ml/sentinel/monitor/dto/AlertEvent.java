package com.ml.sentinel.monitor.dto;

import com.ml.sentinel.monitor.enums.AlertCategory;
import com.ml.sentinel.monitor.enums.AlertSeverity;

import java.util.Objects;

/**
 * Structured notification. Components emit these; only the dispatcher talks
 * to the sink.
 */
public record AlertEvent(
        AlertCategory category,
        AlertSeverity severity,
        String title,
        String message
) {
    public AlertEvent {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        if (title == null || title.isBlank()) {
            title = category.key() + " alert";
        }
    }
}
