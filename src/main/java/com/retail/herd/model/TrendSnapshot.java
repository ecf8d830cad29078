package com.retail.herd.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * Point-in-time view of one key, refreshed every time one of its buckets is evaluated.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Latest detection state of one product")
public record TrendSnapshot(
        @Schema(description = "Product identifier", example = "sneaker-limited-001")
        String productId,
        @Schema(description = "Event count of the latest sealed bucket", example = "132")
        long currentCount,
        @Schema(description = "z-score of the latest sealed bucket", example = "4.5")
        double zScore,
        @Schema(description = "Trend currently held", example = "up")
        TrendDirection trendDirection,
        @Schema(description = "Hysteresis status", example = "TRENDING_UP")
        TrendStatus status,
        @Schema(description = "Baseline mean events per bucket", example = "40.0")
        double baselineMean,
        @Schema(description = "Baseline standard deviation", example = "6.2")
        double baselineStd,
        @Schema(description = "End of the latest evaluated bucket")
        Instant updatedAt) {

    @JsonIgnore
    public boolean isTrending() {
        return trendDirection != TrendDirection.NONE;
    }
}
