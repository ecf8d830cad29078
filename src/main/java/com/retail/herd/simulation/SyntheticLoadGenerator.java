package com.retail.herd.simulation;

import com.retail.herd.config.TrendDetectionConfig;
import com.retail.herd.model.InteractionEvent;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Produces deterministic event sequences for end-to-end checks of the classifier. Counts per bucket
 * follow the pattern exactly; within a bucket events are spread evenly in event time. Event types,
 * users and metadata are drawn from a seeded {@link Random}.
 */
@Component
public class SyntheticLoadGenerator {

    private static final String[] EVENT_TYPES = {"view_product", "add_to_cart", "purchase", "share_product"};
    private static final int[] EVENT_WEIGHTS = {65, 20, 10, 5};
    private static final String[] REGIONS = {"US", "EU", "ASIA", "LATAM"};
    private static final String[] DEVICES = {"mobile", "desktop", "tablet"};

    private final long bucketWidthMillis;

    public SyntheticLoadGenerator(TrendDetectionConfig config) {
        this.bucketWidthMillis = config.getBucketWidth().toMillis();
    }

    public List<InteractionEvent> generate(SimulationRequest request) {
        Random random = new Random(request.getSeed());
        int[] counts = bucketCounts(request, random);
        long startMillis = resolveStart(request).toEpochMilli();
        // Align to a bucket boundary so every bucket gets its full count
        long firstBucket = Math.floorDiv(startMillis, bucketWidthMillis) * bucketWidthMillis;

        List<InteractionEvent> events = new ArrayList<>();
        for (int b = 0; b < counts.length; b++) {
            long bucketStart = firstBucket + b * bucketWidthMillis;
            for (int i = 0; i < counts[b]; i++) {
                long offset = (i * bucketWidthMillis) / counts[b];
                events.add(event(request.getProductId(), Instant.ofEpochMilli(bucketStart + offset), random));
            }
        }
        return events;
    }

    /**
     * Events per bucket: {@code warmupBuckets} at the base rate, then the pattern.
     */
    int[] bucketCounts(SimulationRequest request, Random random) {
        int warmup = Math.max(0, request.getWarmupBuckets());
        int active = Math.max(0, request.getActiveBuckets());
        int base = Math.max(0, request.getBaseRate());
        double multiplier = request.getMultiplier() > 0 ? request.getMultiplier() : 1.0;

        int[] counts = new int[warmup + active];
        for (int b = 0; b < warmup; b++) {
            counts[b] = jittered(base, request.getJitter(), random);
        }

        for (int i = 0; i < active; i++) {
            counts[warmup + i] = switch (request.getPattern()) {
                case BACKGROUND -> jittered(base, request.getJitter(), random);
                case SPIKE -> (int) Math.round(base * multiplier);
                case COLLAPSE -> (int) Math.round(base / multiplier);
                case GRADUAL -> gradual(i, active, base, multiplier);
            };
        }
        return counts;
    }

    // 30% slow start at the base rate, 40% linear ramp to base * multiplier, 30% plateau at 75% of the peak
    private static int gradual(int i, int active, int base, double multiplier) {
        double peak = base * multiplier;
        int slowEnd = (int) Math.round(active * 0.3);
        int rampEnd = (int) Math.round(active * 0.7);
        if (i < slowEnd) {
            return base;
        }
        if (i < rampEnd) {
            double progress = (double) (i - slowEnd + 1) / (rampEnd - slowEnd);
            return (int) Math.round(base + (peak - base) * progress);
        }
        return (int) Math.round(peak * 0.75);
    }

    private static int jittered(int base, int jitter, Random random) {
        if (jitter <= 0) return base;
        return Math.max(0, base + random.nextInt(2 * jitter + 1) - jitter);
    }

    private Instant resolveStart(SimulationRequest request) {
        if (request.getStart() != null) return request.getStart();
        return Instant.now().minusMillis((long) request.getTotalBuckets() * bucketWidthMillis);
    }

    private static InteractionEvent event(String productId, Instant timestamp, Random random) {
        return InteractionEvent.builder()
                .eventType(eventType(random))
                .productId(productId)
                .timestamp(timestamp)
                .userId("user-" + random.nextInt(10_000))
                .sessionId("session-" + timestamp.toEpochMilli() + "-" + Integer.toString(random.nextInt(1 << 30), 36))
                .metadata(Map.of(
                        "region", REGIONS[random.nextInt(REGIONS.length)],
                        "device", DEVICES[random.nextInt(DEVICES.length)],
                        "synthetic", true))
                .build();
    }

    private static String eventType(Random random) {
        int roll = random.nextInt(100);
        int cumulative = 0;
        for (int i = 0; i < EVENT_TYPES.length; i++) {
            cumulative += EVENT_WEIGHTS[i];
            if (roll < cumulative) return EVENT_TYPES[i];
        }
        return EVENT_TYPES[0];
    }
}
