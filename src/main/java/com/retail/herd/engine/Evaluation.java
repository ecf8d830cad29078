package com.retail.herd.engine;

import com.retail.herd.model.TrendDirection;
import com.retail.herd.model.TrendStatus;

/**
 * Outcome of classifying one sealed bucket.
 *
 * @param zScore  standardized deviation of the bucket (raw deviation when the baseline is flat)
 * @param from    status before the bucket
 * @param to      status after the bucket
 * @param entered trend entered on this bucket, NONE otherwise
 * @param cleared trend that cleared back to NORMAL on this bucket, NONE otherwise
 */
public record Evaluation(double zScore,
                         boolean upBreach,
                         boolean downBreach,
                         TrendStatus from,
                         TrendStatus to,
                         TrendDirection entered,
                         TrendDirection cleared) {

    public boolean isTransition() {
        return from != to;
    }

    /**
     * Entering a trend and clearing one are the only transitions consumers see.
     */
    public boolean isVisible() {
        return entered != TrendDirection.NONE || cleared != TrendDirection.NONE;
    }
}
