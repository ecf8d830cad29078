package com.retail.herd.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Full per-key view read from the owning shard: window contents, baseline and hysteresis state.
 * The active bucket may be stale until the next event or sweep rolls it over.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Detection window, baseline and alert state of one product")
public record TrendDetail(
        String productId,
        Instant activeBucketStart,
        long activeCount,
        List<SealedBucket> recentBuckets,
        boolean baselineDefined,
        double baselineMean,
        double baselineStd,
        int baselineSamples,
        TrendStatus status,
        TrendDirection trendDirection,
        int consecutiveBreachCount,
        int consecutiveRecoverCount,
        Instant lastTransitionTime,
        Instant cooldownUntil) {}
