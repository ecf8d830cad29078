package com.retail.herd.model;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rolling "normal" rate for one key, maintained by the baseline estimator from sealed buckets only.
 * Mean and M2 are Welford accumulators over the samples currently held in {@code history}.
 */
@Data
@NoArgsConstructor
public class BaselineStats {

    private double mean;

    // Welford sum of squared deviations from the mean over the retained samples
    private double m2;

    private int sampleCount;

    // Index of the last sealed bucket folded in; replays at or below it are ignored
    private long lastUpdatedBucket = Long.MIN_VALUE;

    // Secondary ring of retained samples; oldest at historyStart
    private double[] history;
    private int historyStart;

    // Folds since the accumulators were last recomputed exactly from the ring
    private int updatesSinceRecompute;

    public BaselineStats(int historyCap) {
        this.history = new double[historyCap];
    }

    /**
     * Sample variance (n - 1). Zero until two samples exist; never negative.
     */
    public double getVariance() {
        if (sampleCount < 2) return 0.0;
        return Math.max(0.0, m2 / (sampleCount - 1));
    }

    public double getStdDev() {
        return Math.sqrt(getVariance());
    }

    public boolean isDefined(int minSamples) {
        return sampleCount >= minSamples;
    }
}
