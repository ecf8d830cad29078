package com.retail.herd.engine;

import com.retail.herd.config.TrendDetectionConfig;
import com.retail.herd.model.BaselineStats;
import org.springframework.stereotype.Component;

/**
 * Rolling mean/variance of sealed bucket counts per key.
 *
 * Uses Welford's online update over a hard-capped ring of the last {@code historyCap} samples:
 * while the ring fills, a plain Welford add; once full, each fold replaces the oldest sample with a
 * sliding-window Welford step. Every {@code historyCap} folds the accumulators are recomputed exactly
 * from the ring so rounding error cannot build up on long-running keys.
 *
 * Once the baseline is defined, a breaching count is clipped to
 * {@code mean + upThreshold * std} (or {@code mean - downThreshold * std}) before it is folded in.
 * A sustained shift therefore still moves the baseline, but a single anomaly cannot inflate the
 * variance enough to hide the buckets that follow it.
 */
@Component
public class BaselineEstimator {

    private final TrendDetectionConfig config;

    public BaselineEstimator(TrendDetectionConfig config) {
        this.config = config;
    }

    /**
     * Fold a sealed bucket into the key's baseline.
     *
     * @return false when {@code bucketIndex} was already folded (replayed rollover); the stats are unchanged
     */
    public boolean update(BaselineStats stats, long bucketIndex, long count) {
        if (bucketIndex <= stats.getLastUpdatedBucket()) {
            return false;
        }

        fold(stats, dampen(stats, count));
        stats.setLastUpdatedBucket(bucketIndex);
        return true;
    }

    /**
     * The value actually folded for {@code count}: the raw count while the baseline is undefined or
     * flat, otherwise the count clipped to the breach band around the current mean.
     */
    double dampen(BaselineStats stats, long count) {
        if (!stats.isDefined(config.getMinSamples())) return count;
        double std = stats.getStdDev();
        if (std <= 0.0) return count;

        double upper = stats.getMean() + config.getUpThreshold() * std;
        double lower = Math.max(0.0, stats.getMean() - config.getDownThreshold() * std);
        return Math.min(upper, Math.max(lower, count));
    }

    private void fold(BaselineStats stats, double x) {
        double[] history = stats.getHistory();
        int cap = history.length;
        int n = stats.getSampleCount();
        double mean = stats.getMean();

        if (n < cap) {
            history[(stats.getHistoryStart() + n) % cap] = x;
            n++;
            double delta = x - mean;
            double newMean = mean + delta / n;
            stats.setM2(stats.getM2() + delta * (x - newMean));
            stats.setMean(newMean);
            stats.setSampleCount(n);
        } else {
            int start = stats.getHistoryStart();
            double evicted = history[start];
            history[start] = x;
            stats.setHistoryStart((start + 1) % cap);

            double newMean = mean + (x - evicted) / n;
            stats.setM2(stats.getM2() + (x - evicted) * (x - newMean + evicted - mean));
            stats.setMean(newMean);
        }

        if (stats.getM2() < 0.0) {
            stats.setM2(0.0);
        }

        stats.setUpdatesSinceRecompute(stats.getUpdatesSinceRecompute() + 1);
        if (stats.getUpdatesSinceRecompute() >= cap) {
            recompute(stats);
        }
    }

    /**
     * Exact two-pass mean and M2 over the samples currently in the ring.
     */
    void recompute(BaselineStats stats) {
        double[] history = stats.getHistory();
        int cap = history.length;
        int n = stats.getSampleCount();
        int start = stats.getHistoryStart();

        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += history[(start + i) % cap];
        }
        double mean = n > 0 ? sum / n : 0.0;

        double m2 = 0.0;
        for (int i = 0; i < n; i++) {
            double d = history[(start + i) % cap] - mean;
            m2 += d * d;
        }

        stats.setMean(mean);
        stats.setM2(m2);
        stats.setUpdatesSinceRecompute(0);
    }
}
