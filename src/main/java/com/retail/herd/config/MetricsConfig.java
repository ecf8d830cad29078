package com.retail.herd.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger trackedKeyCount;
    private final AtomicInteger trendingKeyCount;
    private final AtomicInteger activeSubscriptionCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.trackedKeyCount = registry.gauge("herd.keys.tracked", new AtomicInteger(0));
        this.trendingKeyCount = registry.gauge("herd.keys.trending", new AtomicInteger(0));
        this.activeSubscriptionCount = registry.gauge("herd.subscriptions.active", new AtomicInteger(0));
    }

    public void recordIngested() {
        Counter.builder("herd.events.ingested")
                .register(registry)
                .increment();
    }

    /**
     * @param reason one of validation, late, overload, shutdown
     */
    public void recordRejected(String reason) {
        Counter.builder("herd.events.rejected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordBucketsSealed(int count) {
        Counter.builder("herd.buckets.sealed")
                .register(registry)
                .increment(count);
    }

    public void recordTransition(String toStatus) {
        Counter.builder("herd.trend.transitions")
                .tag("to", toStatus)
                .register(registry)
                .increment();
    }

    public void recordAlertPublished(String direction) {
        Counter.builder("herd.alerts.published")
                .tag("direction", direction)
                .register(registry)
                .increment();
    }

    public void recordAlertSuppressed(String reason) {
        Counter.builder("herd.alerts.suppressed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordSubscriberDrop(String policy) {
        Counter.builder("herd.subscriber.dropped")
                .tag("policy", policy)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("herd.notification.sent")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordTransportFailure(String operation) {
        Counter.builder("herd.transport.failures")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void adjustTrackedKeys(int delta) {
        trackedKeyCount.addAndGet(delta);
    }

    public void updateTrendingKeyCount(int count) {
        trendingKeyCount.set(count);
    }

    public void updateActiveSubscriptionCount(int count) {
        activeSubscriptionCount.set(count);
    }
}
