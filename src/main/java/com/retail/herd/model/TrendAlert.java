package com.retail.herd.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * A trend transition for one product. Produced only when a key enters a trend or a held trend clears.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Trend alert emitted when a product enters or leaves a trending state")
public record TrendAlert(
        @Schema(description = "Product identifier", example = "sneaker-limited-001")
        String productId,
        @Schema(description = "Event count of the sealed bucket that caused the transition", example = "20")
        long currentCount,
        @Schema(description = "Baseline mean events per bucket", example = "5.0")
        double baselineMean,
        @Schema(description = "Baseline standard deviation", example = "1.0")
        double baselineStd,
        @Schema(description = "Standardized deviation of the bucket from the baseline", example = "15.0")
        double zScore,
        @Schema(description = "Direction of the trend entered; none when a trend clears", example = "up")
        TrendDirection trendDirection,
        @Schema(description = "Direction of the trend that cleared; none when a trend is entered", example = "none")
        TrendDirection clearedDirection,
        @Schema(description = "Status after the transition", example = "TRENDING_UP")
        TrendStatus status,
        @Schema(description = "Start of the sealed bucket that caused the transition")
        Instant bucketStart,
        @Schema(description = "Event time at which the alert was generated (end of that bucket)")
        Instant generatedAt) {

    @JsonIgnore
    public boolean isClear() {
        return status == TrendStatus.NORMAL;
    }

    /**
     * Direction a notification is about: the trend entered, or the trend that cleared.
     */
    public TrendDirection subjectDirection() {
        return isClear() ? clearedDirection : trendDirection;
    }
}
