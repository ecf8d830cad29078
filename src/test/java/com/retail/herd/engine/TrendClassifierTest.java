package com.retail.herd.engine;

import com.retail.herd.config.TrendDetectionConfig;
import com.retail.herd.model.AlertState;
import com.retail.herd.model.BaselineStats;
import com.retail.herd.model.TrendDirection;
import com.retail.herd.model.TrendStatus;
import com.retail.herd.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TrendClassifierTest {

    private static final Instant AT = TestDataFactory.T0;

    private TrendDetectionConfig config;
    private TrendClassifier classifier;
    private AlertState state;
    private BaselineStats baseline;

    @BeforeEach
    void setUp() {
        config = TestDataFactory.detectionConfig();
        classifier = new TrendClassifier(config);
        state = new AlertState();
        baseline = TestDataFactory.baseline(5.0, 1.0, 10);
    }

    @Test
    void firstBreach_movesToRisingWithoutAlert() {
        Evaluation eval = classifier.evaluate(state, 20, baseline, AT);

        assertThat(eval.zScore()).isCloseTo(15.0, within(1e-9));
        assertThat(eval.upBreach()).isTrue();
        assertThat(eval.to()).isEqualTo(TrendStatus.RISING);
        assertThat(eval.isVisible()).isFalse();
        assertThat(state.getConsecutiveBreachCount()).isEqualTo(1);
        assertThat(state.getAnchor()).isEqualTo(TrendDirection.NONE);
    }

    @Test
    void secondConsecutiveBreach_entersTrendingUp() {
        classifier.evaluate(state, 20, baseline, AT);
        Evaluation eval = classifier.evaluate(state, 20, baseline, AT.plusSeconds(10));

        assertThat(eval.from()).isEqualTo(TrendStatus.RISING);
        assertThat(eval.to()).isEqualTo(TrendStatus.TRENDING_UP);
        assertThat(eval.entered()).isEqualTo(TrendDirection.UP);
        assertThat(eval.isVisible()).isTrue();
        assertThat(eval.zScore()).isCloseTo(15.0, within(1e-9));
        assertThat(state.getAnchor()).isEqualTo(TrendDirection.UP);
        assertThat(state.getConsecutiveBreachCount()).isZero();
        assertThat(state.getLastTransitionTime()).isEqualTo(AT.plusSeconds(10));
    }

    @Test
    void threeConsecutiveBreaches_enterTrendingUpExactlyOnce() {
        Evaluation first = classifier.evaluate(state, 20, baseline, AT);
        Evaluation second = classifier.evaluate(state, 20, baseline, AT.plusSeconds(10));
        Evaluation third = classifier.evaluate(state, 20, baseline, AT.plusSeconds(20));

        assertThat(first.isVisible()).isFalse();
        assertThat(second.isVisible()).isTrue();
        assertThat(third.isVisible()).isFalse();
        assertThat(third.from()).isEqualTo(TrendStatus.TRENDING_UP);
        assertThat(third.to()).isEqualTo(TrendStatus.TRENDING_UP);
        assertThat(state.getLastTransitionTime()).isEqualTo(AT.plusSeconds(10));
    }

    @Test
    void singleBreachFollowedByNormalBucket_returnsToNormalSilently() {
        classifier.evaluate(state, 20, baseline, AT);
        Evaluation eval = classifier.evaluate(state, 5, baseline, AT.plusSeconds(10));

        assertThat(eval.to()).isEqualTo(TrendStatus.NORMAL);
        assertThat(eval.isVisible()).isFalse();
        assertThat(state.getConsecutiveBreachCount()).isZero();
    }

    @Test
    void sustainedDrop_entersTrendingDown() {
        Evaluation first = classifier.evaluate(state, 0, baseline, AT);
        Evaluation second = classifier.evaluate(state, 0, baseline, AT.plusSeconds(10));

        assertThat(first.to()).isEqualTo(TrendStatus.FALLING);
        assertThat(first.downBreach()).isTrue();
        assertThat(second.to()).isEqualTo(TrendStatus.TRENDING_DOWN);
        assertThat(second.entered()).isEqualTo(TrendDirection.DOWN);
        assertThat(second.zScore()).isCloseTo(-5.0, within(1e-9));
    }

    @Test
    void recoveryFromTrendingUp_takesDebounceBucketsAndEmitsClear() {
        enterTrendingUp();

        Evaluation first = classifier.evaluate(state, 5, baseline, AT.plusSeconds(20));
        assertThat(first.to()).isEqualTo(TrendStatus.FALLING);
        assertThat(first.isVisible()).isFalse();
        assertThat(state.getAnchor()).isEqualTo(TrendDirection.UP);

        Evaluation second = classifier.evaluate(state, 5, baseline, AT.plusSeconds(30));
        assertThat(second.to()).isEqualTo(TrendStatus.NORMAL);
        assertThat(second.cleared()).isEqualTo(TrendDirection.UP);
        assertThat(second.entered()).isEqualTo(TrendDirection.NONE);
        assertThat(second.isVisible()).isTrue();
        assertThat(state.getAnchor()).isEqualTo(TrendDirection.NONE);
    }

    @Test
    void interruptedRecovery_returnsToTrendWithoutNewAlert() {
        enterTrendingUp();
        classifier.evaluate(state, 5, baseline, AT.plusSeconds(20));

        Evaluation eval = classifier.evaluate(state, 20, baseline, AT.plusSeconds(30));

        assertThat(eval.from()).isEqualTo(TrendStatus.FALLING);
        assertThat(eval.to()).isEqualTo(TrendStatus.TRENDING_UP);
        assertThat(eval.isVisible()).isFalse();
        assertThat(state.getConsecutiveRecoverCount()).isZero();
    }

    @Test
    void countBetweenRecoveryAndBreachBand_holdsTrend() {
        enterTrendingUp();

        Evaluation eval = classifier.evaluate(state, 7, baseline, AT.plusSeconds(20));

        assertThat(eval.zScore()).isCloseTo(2.0, within(1e-9));
        assertThat(eval.to()).isEqualTo(TrendStatus.TRENDING_UP);
        assertThat(eval.isTransition()).isFalse();
    }

    @Test
    void oppositeBreachDuringOnset_restartsOnsetInOtherDirection() {
        classifier.evaluate(state, 20, baseline, AT);

        Evaluation eval = classifier.evaluate(state, 0, baseline, AT.plusSeconds(10));

        assertThat(eval.to()).isEqualTo(TrendStatus.FALLING);
        assertThat(state.getAnchor()).isEqualTo(TrendDirection.NONE);
        assertThat(state.getConsecutiveBreachCount()).isEqualTo(1);
    }

    @Test
    void debounceOfOne_entersOnFirstBreach() {
        config.setDebounceCount(1);

        Evaluation eval = classifier.evaluate(state, 20, baseline, AT);

        assertThat(eval.to()).isEqualTo(TrendStatus.TRENDING_UP);
        assertThat(eval.entered()).isEqualTo(TrendDirection.UP);
    }

    @Test
    void flatBaseline_anyIncreaseOnActiveKeyIsABreach() {
        BaselineStats flat = TestDataFactory.baseline(5.0, 0.0, 10);

        Evaluation up = classifier.evaluate(state, 6, flat, AT);
        assertThat(up.upBreach()).isTrue();
        assertThat(up.zScore()).isCloseTo(1.0, within(1e-9));

        Evaluation same = classifier.evaluate(new AlertState(), 5, flat, AT);
        assertThat(same.upBreach()).isFalse();
        assertThat(same.downBreach()).isFalse();
        assertThat(same.to()).isEqualTo(TrendStatus.NORMAL);
    }

    @Test
    void flatSilentBaseline_neverBreaches() {
        BaselineStats silent = TestDataFactory.baseline(0.0, 0.0, 10);

        Evaluation eval = classifier.evaluate(state, 3, silent, AT);

        assertThat(eval.upBreach()).isFalse();
        assertThat(eval.to()).isEqualTo(TrendStatus.NORMAL);
    }

    @Test
    void recoveryFromTrendingDown_usesRisingAsRecoveryState() {
        classifier.evaluate(state, 0, baseline, AT);
        classifier.evaluate(state, 0, baseline, AT.plusSeconds(10));

        Evaluation first = classifier.evaluate(state, 5, baseline, AT.plusSeconds(20));
        Evaluation second = classifier.evaluate(state, 5, baseline, AT.plusSeconds(30));

        assertThat(first.to()).isEqualTo(TrendStatus.RISING);
        assertThat(second.to()).isEqualTo(TrendStatus.NORMAL);
        assertThat(second.cleared()).isEqualTo(TrendDirection.DOWN);
    }

    private void enterTrendingUp() {
        classifier.evaluate(state, 20, baseline, AT);
        classifier.evaluate(state, 20, baseline, AT.plusSeconds(10));
        assertThat(state.getStatus()).isEqualTo(TrendStatus.TRENDING_UP);
    }
}
