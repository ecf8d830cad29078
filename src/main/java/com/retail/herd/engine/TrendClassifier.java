package com.retail.herd.engine;

import com.retail.herd.config.TrendDetectionConfig;
import com.retail.herd.model.AlertState;
import com.retail.herd.model.BaselineStats;
import com.retail.herd.model.TrendDirection;
import com.retail.herd.model.TrendStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Scores sealed buckets against the baseline and drives the per-key hysteresis state machine.
 *
 * <pre>
 * NORMAL --breach--> RISING --debounce breaches--> TRENDING_UP --recovered--> FALLING --debounce recoveries--> NORMAL
 * NORMAL --breach--> FALLING --debounce breaches--> TRENDING_DOWN --recovered--> RISING --debounce recoveries--> NORMAL
 * </pre>
 *
 * RISING and FALLING are shared by onset and recovery; {@link AlertState#getAnchor()} tells them
 * apart (NONE while a trend is pending, the held direction while one is recovering). A pending
 * onset falls back to NORMAL on the first non-breaching bucket, and a pending recovery falls back to
 * the held trend on the first non-recovered bucket.
 */
@Component
public class TrendClassifier {

    // Below this a standard deviation is treated as zero.
    private static final double STD_EPSILON = 1e-9;

    private final TrendDetectionConfig config;

    public TrendClassifier(TrendDetectionConfig config) {
        this.config = config;
    }

    /**
     * Classify one sealed bucket. The caller guarantees the baseline is defined.
     *
     * @param at event time the bucket closed; recorded as the transition time
     */
    public Evaluation evaluate(AlertState state, long count, BaselineStats baseline, Instant at) {
        double mean = baseline.getMean();
        double std = baseline.getStdDev();

        double z;
        boolean up;
        boolean down;
        if (std > STD_EPSILON) {
            z = (count - mean) / std;
            up = z >= config.getUpThreshold();
            down = z <= -config.getDownThreshold();
        } else {
            // Flat baseline: any movement on an active key is a breach; a silent key never breaches.
            z = count - mean;
            boolean active = mean >= config.getMinActivityThreshold();
            up = active && count > mean;
            down = active && count < mean;
        }

        boolean recoveredFromUp = !up && z <= config.getRecoveryThreshold();
        boolean recoveredFromDown = !down && z >= -config.getRecoveryThreshold();

        TrendStatus from = state.getStatus();
        Step step = switch (from) {
            case NORMAL -> fromNormal(state, up, down);
            case RISING -> state.getAnchor() == TrendDirection.DOWN
                    ? recovering(state, TrendDirection.DOWN, recoveredFromDown)
                    : pendingOnset(state, TrendDirection.UP, up, down);
            case FALLING -> state.getAnchor() == TrendDirection.UP
                    ? recovering(state, TrendDirection.UP, recoveredFromUp)
                    : pendingOnset(state, TrendDirection.DOWN, down, up);
            case TRENDING_UP -> trending(state, TrendDirection.UP, recoveredFromUp);
            case TRENDING_DOWN -> trending(state, TrendDirection.DOWN, recoveredFromDown);
        };

        if (state.getStatus() != from) {
            state.setLastTransitionTime(at);
        }
        return new Evaluation(z, up, down, from, state.getStatus(), step.entered, step.cleared);
    }

    private Step fromNormal(AlertState state, boolean up, boolean down) {
        if (up) return beginOnset(state, TrendDirection.UP);
        if (down) return beginOnset(state, TrendDirection.DOWN);
        return Step.QUIET;
    }

    private Step beginOnset(AlertState state, TrendDirection direction) {
        state.setConsecutiveBreachCount(1);
        state.setConsecutiveRecoverCount(0);
        if (config.getDebounceCount() <= 1) {
            return enterTrend(state, direction);
        }
        state.setStatus(direction == TrendDirection.UP ? TrendStatus.RISING : TrendStatus.FALLING);
        return Step.QUIET;
    }

    private Step pendingOnset(AlertState state, TrendDirection direction, boolean breach, boolean opposite) {
        if (breach) {
            int breaches = state.getConsecutiveBreachCount() + 1;
            state.setConsecutiveBreachCount(breaches);
            if (breaches >= config.getDebounceCount()) {
                return enterTrend(state, direction);
            }
            return Step.QUIET;
        }
        if (opposite) {
            return beginOnset(state, opposite(direction));
        }
        state.setConsecutiveBreachCount(0);
        state.setStatus(TrendStatus.NORMAL);
        return Step.QUIET;
    }

    private Step trending(AlertState state, TrendDirection held, boolean recovered) {
        if (!recovered) {
            state.setConsecutiveRecoverCount(0);
            return Step.QUIET;
        }
        state.setConsecutiveRecoverCount(1);
        if (config.getDebounceCount() <= 1) {
            return clearTrend(state, held);
        }
        state.setStatus(held == TrendDirection.UP ? TrendStatus.FALLING : TrendStatus.RISING);
        return Step.QUIET;
    }

    private Step recovering(AlertState state, TrendDirection held, boolean recovered) {
        if (recovered) {
            int recoveries = state.getConsecutiveRecoverCount() + 1;
            state.setConsecutiveRecoverCount(recoveries);
            if (recoveries >= config.getDebounceCount()) {
                return clearTrend(state, held);
            }
            return Step.QUIET;
        }
        // Recovery interrupted: the trend was never externally left, so this is silent.
        state.setConsecutiveRecoverCount(0);
        state.setStatus(held == TrendDirection.UP ? TrendStatus.TRENDING_UP : TrendStatus.TRENDING_DOWN);
        return Step.QUIET;
    }

    private Step enterTrend(AlertState state, TrendDirection direction) {
        state.setStatus(direction == TrendDirection.UP ? TrendStatus.TRENDING_UP : TrendStatus.TRENDING_DOWN);
        state.setAnchor(direction);
        state.setConsecutiveBreachCount(0);
        state.setConsecutiveRecoverCount(0);
        return new Step(direction, TrendDirection.NONE);
    }

    private Step clearTrend(AlertState state, TrendDirection held) {
        state.setStatus(TrendStatus.NORMAL);
        state.setAnchor(TrendDirection.NONE);
        state.setConsecutiveBreachCount(0);
        state.setConsecutiveRecoverCount(0);
        return new Step(TrendDirection.NONE, held);
    }

    private static TrendDirection opposite(TrendDirection direction) {
        return direction == TrendDirection.UP ? TrendDirection.DOWN : TrendDirection.UP;
    }

    private record Step(TrendDirection entered, TrendDirection cleared) {
        static final Step QUIET = new Step(TrendDirection.NONE, TrendDirection.NONE);
    }
}
