package com.ml.sentinel.monitor.service.probe;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Produces canary feature vectors with a known label. The label follows the
 * same linear concept the data generator uses: {@code w1*f1 + w2*f2 > 0}.
 * The sequence is seeded, so a run is reproducible.
 */
public class CanarySampler {

    private final double w1;
    private final double w2;
    private final Random random;

    public CanarySampler(List<Double> referenceWeights, long seed) {
        if (referenceWeights == null || referenceWeights.size() != 2) {
            throw new IllegalArgumentException("exactly two reference weights required");
        }
        this.w1 = referenceWeights.get(0);
        this.w2 = referenceWeights.get(1);
        this.random = new Random(seed);
    }

    public synchronized List<Canary> next(int n) {
        List<Canary> batch = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double f1 = random.nextGaussian();
            double f2 = random.nextGaussian();
            batch.add(new Canary(List.of(f1, f2), expectedLabel(f1, f2)));
        }
        return batch;
    }

    public int expectedLabel(double f1, double f2) {
        return (w1 * f1 + w2 * f2) > 0 ? 1 : 0;
    }

    public record Canary(List<Double> features, int expectedLabel) {
    }
}
