package com.ml.sentinel.monitor.service.probe;

import com.ml.sentinel.monitor.dto.PredictionOutcome;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recent canary outcomes, capped both by count and by age. The first
 * {@code baselineSize} outcomes after a reset are frozen as the baseline the
 * drift score compares against.
 */
public class PredictionWindow {

    private final int maxSize;
    private final Duration maxAge;
    private final int baselineSize;
    private final Clock clock;

    private final Deque<PredictionOutcome> outcomes = new ArrayDeque<>();
    private final List<PredictionOutcome> baselineBuffer = new ArrayList<>();
    private WindowStats baseline;

    public PredictionWindow(int maxSize, Duration maxAge, int baselineSize, Clock clock) {
        if (maxSize < 1) throw new IllegalArgumentException("maxSize must be >= 1");
        if (baselineSize < 1) throw new IllegalArgumentException("baselineSize must be >= 1");
        this.maxSize = maxSize;
        this.maxAge = maxAge;
        this.baselineSize = baselineSize;
        this.clock = clock;
    }

    public synchronized void record(PredictionOutcome outcome) {
        outcomes.addLast(outcome);
        while (outcomes.size() > maxSize) {
            outcomes.pollFirst();
        }
        if (baseline == null) {
            baselineBuffer.add(outcome);
            if (baselineBuffer.size() >= baselineSize) {
                baseline = WindowStats.of(baselineBuffer);
                baselineBuffer.clear();
            }
        }
        prune();
    }

    /**
     * Stats over everything still inside the window.
     */
    public synchronized WindowStats snapshot() {
        prune();
        return WindowStats.of(outcomes);
    }

    /**
     * Stats over the newest {@code n} outcomes.
     */
    public synchronized WindowStats recent(int n) {
        prune();
        List<PredictionOutcome> all = new ArrayList<>(outcomes);
        int from = Math.max(0, all.size() - n);
        return WindowStats.of(all.subList(from, all.size()));
    }

    public synchronized Optional<WindowStats> baseline() {
        return Optional.ofNullable(baseline);
    }

    /**
     * Forget everything, including the baseline. Called once a new model
     * version is serving.
     */
    public synchronized void reset() {
        outcomes.clear();
        baselineBuffer.clear();
        baseline = null;
    }

    private void prune() {
        if (maxAge == null) return;
        Instant cutoff = clock.instant().minus(maxAge);
        while (!outcomes.isEmpty() && outcomes.peekFirst().at().isBefore(cutoff)) {
            outcomes.pollFirst();
        }
    }

    /**
     * Aggregates over a set of outcomes.
     */
    public record WindowStats(int count, int hits, double meanConfidence, Map<Integer, Double> labelShares) {

        public static final WindowStats EMPTY = new WindowStats(0, 0, 0.0, Collections.emptyMap());

        public double accuracy() {
            return count == 0 ? 0.0 : (double) hits / count;
        }

        static WindowStats of(Iterable<PredictionOutcome> items) {
            int count = 0;
            int hits = 0;
            double confidence = 0.0;
            Map<Integer, Integer> labels = new HashMap<>();
            for (PredictionOutcome o : items) {
                count++;
                if (o.isHit()) hits++;
                confidence += o.confidence();
                labels.merge(o.predicted(), 1, Integer::sum);
            }
            if (count == 0) return EMPTY;
            Map<Integer, Double> shares = new HashMap<>();
            for (Map.Entry<Integer, Integer> e : labels.entrySet()) {
                shares.put(e.getKey(), e.getValue() / (double) count);
            }
            return new WindowStats(count, hits, confidence / count, Collections.unmodifiableMap(shares));
        }
    }
}
