package com.ml.sentinel.monitor.service.monitor;

/**
 * Counts consecutive failed ticks. Touched only from the tick thread.
 */
public class FailureStreakTracker {

    private final int alertAfter;
    private int consecutive;
    private String lastFailure;

    public FailureStreakTracker(int alertAfter) {
        if (alertAfter < 1) throw new IllegalArgumentException("alertAfter must be >= 1");
        this.alertAfter = alertAfter;
    }

    /**
     * @return true when the streak has reached the alerting threshold
     */
    public boolean recordFailure(String reason) {
        consecutive++;
        lastFailure = reason;
        return consecutive >= alertAfter;
    }

    public void recordSuccess() {
        consecutive = 0;
        lastFailure = null;
    }

    public int consecutive() {
        return consecutive;
    }

    public String lastFailure() {
        return lastFailure;
    }

    public int alertAfter() {
        return alertAfter;
    }
}
