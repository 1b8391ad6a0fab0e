package com.ml.sentinel.monitor.service.probe;

import com.ml.sentinel.monitor.common.Result;
import com.ml.sentinel.monitor.common.constants.SentinelConsts;
import com.ml.sentinel.monitor.config.SentinelProperties;
import com.ml.sentinel.monitor.dto.ModelRetrainedEvent;
import com.ml.sentinel.monitor.dto.PredictionOutcome;
import com.ml.sentinel.monitor.dto.Signal;
import com.ml.sentinel.monitor.enums.ApiStatus;
import com.ml.sentinel.monitor.model.serving.PredictResponse;
import com.ml.sentinel.monitor.service.client.ServingApiClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Collects one {@link Signal} per tick: API health, then a batch of canary
 * predictions folded into the rolling window. Read-only towards the serving
 * API and never throws; an unreachable API is a normal outcome.
 */
@Slf4j
@Service
public class MetricProbe {

    private final ServingApiClient serving;
    private final CanarySampler sampler;
    private final PredictionWindow window;
    private final SentinelProperties props;
    private final Clock clock;

    private volatile Signal lastSignal;

    @Autowired
    public MetricProbe(ServingApiClient serving, SentinelProperties props, Clock clock) {
        this(serving,
                new CanarySampler(props.getProbe().getReferenceWeights(), props.getProbe().getSeed()),
                new PredictionWindow(props.getProbe().getWindowSize(), props.getProbe().getWindowAge(),
                        props.getProbe().getBaselineSize(), clock),
                props, clock);
    }

    public MetricProbe(ServingApiClient serving, CanarySampler sampler, PredictionWindow window,
                SentinelProperties props, Clock clock) {
        this.serving = serving;
        this.sampler = sampler;
        this.window = window;
        this.props = props;
        this.clock = clock;
    }

    public Signal sample() {
        Signal signal;
        try {
            signal = collect();
        } catch (RuntimeException e) {
            log.warn("Probe failed unexpectedly, reporting API as unreachable: {}", e.toString(), e);
            signal = Signal.unreachable(clock.instant());
        }
        lastSignal = signal;
        return signal;
    }

    private Signal collect() {
        Instant now = clock.instant();
        Result<ApiStatus> health = serving.health();
        if (health.isFailure() || !health.get().isReachable()) {
            log.warn("Serving API not healthy: {}", health.isFailure() ? health.getErrorCode() : health.get());
            return Signal.unreachable(now);
        }

        int batch = props.getProbe().getCanaryBatch();
        int answered = probeCanaries(batch);
        if (batch > 0 && answered == 0) {
            log.warn("Serving API passed health but answered none of {} canary predictions", batch);
            return Signal.unreachable(now);
        }

        PredictionWindow.WindowStats stats = window.snapshot();
        PredictionWindow.WindowStats baseline = window.baseline().orElse(null);
        double drift = DriftScorer.score(window.recent(props.getProbe().getBaselineSize()), baseline);

        Signal signal = new Signal(now, true, stats.accuracy(), drift, stats.count());
        log.debug("Probe signal: accuracy={} drift={} samples={} baseline={}",
                signal.rollingAccuracy(), signal.driftScore(), signal.sampleCount(), baseline != null);
        return signal;
    }

    private int probeCanaries(int batch) {
        int answered = 0;
        for (CanarySampler.Canary canary : sampler.next(batch)) {
            Result<PredictResponse> r = serving.predict(canary.features());
            if (r.isFailure()) {
                if (SentinelConsts.ERR_TIMEOUT.equals(r.getErrorCode())
                        || SentinelConsts.ERR_UNREACHABLE.equals(r.getErrorCode())) {
                    // do not stack timeouts inside one tick
                    break;
                }
                continue;
            }
            PredictResponse p = r.get();
            double confidence = p.getConfidence() == null ? 0.0 : p.getConfidence();
            window.record(new PredictionOutcome(p.getPrediction(), canary.expectedLabel(), confidence, clock.instant()));
            answered++;
        }
        return answered;
    }

    /**
     * Outcomes of the previous model version no longer describe what is serving.
     */
    @EventListener
    public void onModelRetrained(ModelRetrainedEvent event) {
        log.info("New model version {} serving, discarding canary history", event.record().modelVersion());
        resetWindow();
    }

    public void resetWindow() {
        window.reset();
        log.info("Prediction window and drift baseline reset");
    }

    public Signal lastSignal() {
        return lastSignal;
    }
}
