package com.ml.sentinel.monitor.service.probe;

import com.ml.sentinel.monitor.service.probe.PredictionWindow.WindowStats;

import java.util.HashSet;
import java.util.Set;

/**
 * Drift score in [0,1]: the larger of the total-variation distance between
 * predicted-label distributions and the relative drop in mean confidence,
 * recent window against the frozen baseline.
 */
public final class DriftScorer {

    private DriftScorer() {
    }

    public static double score(WindowStats recent, WindowStats baseline) {
        if (baseline == null || baseline.count() == 0 || recent == null || recent.count() == 0) {
            return 0.0;
        }
        return clamp(Math.max(labelShift(recent, baseline), confidenceDrop(recent, baseline)));
    }

    static double labelShift(WindowStats recent, WindowStats baseline) {
        Set<Integer> labels = new HashSet<>(recent.labelShares().keySet());
        labels.addAll(baseline.labelShares().keySet());
        double sum = 0.0;
        for (Integer label : labels) {
            sum += Math.abs(recent.labelShares().getOrDefault(label, 0.0)
                    - baseline.labelShares().getOrDefault(label, 0.0));
        }
        return sum / 2.0;
    }

    static double confidenceDrop(WindowStats recent, WindowStats baseline) {
        double base = baseline.meanConfidence();
        if (base <= 0.0) return 0.0;
        return Math.max(0.0, (base - recent.meanConfidence()) / base);
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
