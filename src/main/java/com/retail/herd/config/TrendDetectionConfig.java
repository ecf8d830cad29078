package com.retail.herd.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "herd")
public class TrendDetectionConfig {

    // Width of one counting bucket.
    private Duration bucketWidth = Duration.ofSeconds(10);

    // Span covered by a key's ring of buckets. Must be a whole number of bucket widths.
    private Duration windowHorizon = Duration.ofMinutes(10);

    // Sealed buckets retained by the baseline estimator (hard cap of its secondary ring).
    private int historyCap = 60;

    // Sealed buckets needed before a baseline is considered defined.
    private int minSamples = 6;

    // z-score at or above which a bucket counts as an upward breach.
    private double upThreshold = 3.0;

    // Magnitude of the negative z-score at or beyond which a bucket counts as a downward breach.
    private double downThreshold = 3.0;

    // |z| at or below which a trending key counts a bucket as recovered. Lower than both thresholds.
    private double recoveryThreshold = 1.0;

    // Consecutive sealed buckets required to enter or leave a trend.
    private int debounceCount = 2;

    // Minimum interval between two notifications of the same direction for one key.
    private Duration cooldownDuration = Duration.ofMinutes(5);

    // Baseline mean required before a zero-variance key may breach.
    private double minActivityThreshold = 1.0;

    // How far past the wall clock an event time may lie before the event is rejected.
    private Duration maxFutureSkew = Duration.ofMinutes(1);

    // Buckets a shard watermark may move forward per event; bounds how far one event can sweep idle keys.
    private int maxWatermarkStep = 1;

    private int shardCount = 4;
    private int shardQueueCapacity = 10_000;
    private Duration enqueueTimeout = Duration.ofMillis(200);
    private Duration queryTimeout = Duration.ofSeconds(2);
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    // When false, a trend clearing back to NORMAL updates the store but is not pushed to subscribers.
    private boolean notifyOnClear = true;

    private Subscriber subscriber = new Subscriber();

    @Data
    public static class Subscriber {
        private int queueCapacity = 256;
        private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_OLDEST;
    }

    public enum OverflowPolicy {
        DROP_OLDEST,
        CLOSE
    }

    /**
     * Number of buckets in a key's ring (window horizon / bucket width).
     */
    public int getBucketsPerWindow() {
        return (int) (windowHorizon.toMillis() / bucketWidth.toMillis());
    }

    /**
     * Upper bound on empty buckets sealed when a key jumps forward after a long idle period.
     * Beyond this many zero buckets the baseline ring holds nothing but zeros anyway.
     */
    public int getMaxGapBuckets() {
        return Math.max(getBucketsPerWindow(), historyCap);
    }

    /**
     * Rejects configurations the engine cannot run with. Called once at startup; a failure
     * prevents the application context from starting.
     */
    @PostConstruct
    public void validate() {
        require(bucketWidth != null && bucketWidth.toMillis() > 0, "herd.bucket-width must be positive");
        require(windowHorizon != null && windowHorizon.toMillis() >= bucketWidth.toMillis(),
                "herd.window-horizon must be at least one bucket width");
        require(windowHorizon.toMillis() % bucketWidth.toMillis() == 0,
                "herd.window-horizon must be a whole number of bucket widths");
        require(minSamples >= 2, "herd.min-samples must be >= 2");
        require(historyCap >= minSamples, "herd.history-cap must be >= herd.min-samples");
        require(upThreshold > 0, "herd.up-threshold must be positive");
        require(downThreshold > 0, "herd.down-threshold must be positive");
        require(recoveryThreshold >= 0 && recoveryThreshold < upThreshold && recoveryThreshold < downThreshold,
                "herd.recovery-threshold must be >= 0 and below both up and down thresholds");
        require(debounceCount >= 1, "herd.debounce-count must be >= 1");
        require(cooldownDuration != null && !cooldownDuration.isNegative(), "herd.cooldown-duration must not be negative");
        require(minActivityThreshold >= 0, "herd.min-activity-threshold must not be negative");
        require(maxFutureSkew != null && !maxFutureSkew.isNegative(), "herd.max-future-skew must not be negative");
        require(maxWatermarkStep >= 1, "herd.max-watermark-step must be >= 1");
        require(shardCount >= 1, "herd.shard-count must be >= 1");
        require(shardQueueCapacity >= 1, "herd.shard-queue-capacity must be >= 1");
        require(subscriber.getQueueCapacity() >= 1, "herd.subscriber.queue-capacity must be >= 1");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException("Invalid trend detection configuration: " + message);
        }
    }
}
