package com.ml.sentinel.monitor.dto;

/**
 * Published after a retrain succeeded and a new model version is serving.
 */
public record ModelRetrainedEvent(RunRecord record) {
}
