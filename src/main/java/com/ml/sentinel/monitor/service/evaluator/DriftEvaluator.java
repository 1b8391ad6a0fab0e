package com.ml.sentinel.monitor.service.evaluator;

import com.ml.sentinel.monitor.config.SentinelProperties;
import com.ml.sentinel.monitor.dto.Signal;
import com.ml.sentinel.monitor.dto.Thresholds;
import com.ml.sentinel.monitor.enums.Verdict;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Maps a signal to a verdict. No memory of previous ticks and no I/O.
 * Order matters: unreliable signal, then drift, then accuracy.
 */
@Component
public class DriftEvaluator {

    private final Thresholds thresholds;

    @Autowired
    public DriftEvaluator(SentinelProperties props) {
        this(props.toThresholds());
    }

    public DriftEvaluator(Thresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    public Verdict evaluate(Signal signal) {
        return evaluate(signal, thresholds);
    }

    public static Verdict evaluate(Signal signal, Thresholds config) {
        if (signal == null || !signal.apiHealthy() || signal.sampleCount() < config.minSamples()) {
            return Verdict.UNKNOWN;
        }
        // drift wins over degradation when both hold
        if (signal.driftScore() > config.drift()) {
            return Verdict.DRIFTED;
        }
        if (signal.rollingAccuracy() < config.accuracy()) {
            return Verdict.DEGRADED;
        }
        return Verdict.HEALTHY;
    }

    public Thresholds thresholds() {
        return thresholds;
    }
}
