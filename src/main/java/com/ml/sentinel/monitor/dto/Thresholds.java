package com.ml.sentinel.monitor.dto;

public record Thresholds(double drift, double accuracy, int minSamples) {

    public static final Thresholds DEFAULTS = new Thresholds(0.7, 0.85, 20);
}
