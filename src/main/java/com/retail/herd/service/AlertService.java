package com.retail.herd.service;

import com.retail.herd.config.MetricsConfig;
import com.retail.herd.config.TrendDetectionConfig;
import com.retail.herd.config.TrendDetectionConfig.OverflowPolicy;
import com.retail.herd.engine.Evaluation;
import com.retail.herd.model.AlertState;
import com.retail.herd.model.BaselineStats;
import com.retail.herd.model.SealedBucket;
import com.retail.herd.model.TrendAlert;
import com.retail.herd.model.TrendDirection;
import com.retail.herd.model.TrendSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Receives every evaluation from the shards, keeps the latest snapshot and alert per product,
 * applies cooldown to trend entries and fans published alerts out to subscribers.
 *
 * Snapshot and alert maps are written from shard threads and read by the HTTP layer; each entry is
 * an immutable record, so readers always see a consistent per-key view.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private static final Comparator<TrendSnapshot> BY_MAGNITUDE =
            Comparator.comparingDouble((TrendSnapshot s) -> Math.abs(s.zScore())).reversed()
                    .thenComparing(TrendSnapshot::productId);

    private final TrendDetectionConfig config;
    private final MetricsConfig metricsConfig;

    private final Map<String, TrendSnapshot> snapshots = new ConcurrentHashMap<>();
    private final Map<String, TrendAlert> latestAlerts = new ConcurrentHashMap<>();
    private final Set<AlertSubscription> subscriptions = new CopyOnWriteArraySet<>();
    private final AtomicInteger trendingCount = new AtomicInteger();
    private final Object publishLock = new Object();

    public AlertService(TrendDetectionConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Record the evaluation of one sealed bucket. Called on the shard thread that owns the product,
     * after the classifier has updated {@code state} and before the baseline absorbs the bucket.
     */
    public void onEvaluated(String productId, SealedBucket bucket, Instant closedAt,
                            BaselineStats baseline, AlertState state, Evaluation evaluation) {
        TrendSnapshot snapshot = new TrendSnapshot(
                productId,
                bucket.count(),
                evaluation.zScore(),
                state.getAnchor(),
                state.getStatus(),
                baseline.getMean(),
                baseline.getStdDev(),
                closedAt);
        TrendSnapshot previous = snapshots.put(productId, snapshot);
        trackTrending(previous, snapshot);

        if (!evaluation.isVisible()) {
            return;
        }

        TrendAlert alert = new TrendAlert(
                productId,
                bucket.count(),
                baseline.getMean(),
                baseline.getStdDev(),
                evaluation.zScore(),
                evaluation.entered(),
                evaluation.cleared(),
                state.getStatus(),
                bucket.start(),
                closedAt);
        latestAlerts.put(productId, alert);

        if (alert.isClear()) {
            if (!config.isNotifyOnClear()) {
                metricsConfig.recordAlertSuppressed("clear");
                log.debug("Trend cleared for product={} (notification disabled)", productId);
                return;
            }
            log.info("Trend cleared: product={}, was={}, count={}, z={}",
                    productId, alert.clearedDirection(), alert.currentCount(), String.format("%.2f", alert.zScore()));
            publish(alert);
            return;
        }

        TrendDirection direction = alert.trendDirection();
        if (state.isInCooldown(direction, closedAt)) {
            metricsConfig.recordAlertSuppressed("cooldown");
            log.info("Trend alert suppressed by cooldown: product={}, direction={}, cooldownUntil={}",
                    productId, direction, state.getCooldownUntil());
            return;
        }

        state.setCooldownUntil(closedAt.plus(config.getCooldownDuration()));
        state.setCooldownDirection(direction);
        log.info("Trend detected: product={}, direction={}, count={}, mean={}, std={}, z={}",
                productId, direction, alert.currentCount(),
                String.format("%.2f", alert.baselineMean()),
                String.format("%.2f", alert.baselineStd()),
                String.format("%.2f", alert.zScore()));
        publish(alert);
    }

    /**
     * Products currently holding a trend, strongest |z| first. When nothing is trending the most
     * deviating products are returned instead.
     */
    public List<TrendSnapshot> snapshot(int topK) {
        List<TrendSnapshot> all = new ArrayList<>(snapshots.values());
        List<TrendSnapshot> trending = all.stream().filter(TrendSnapshot::isTrending).toList();
        List<TrendSnapshot> source = trending.isEmpty() ? all : new ArrayList<>(trending);

        return source.stream()
                .sorted(BY_MAGNITUDE)
                .limit(Math.max(0, topK))
                .toList();
    }

    public Optional<TrendSnapshot> getSnapshot(String productId) {
        return Optional.ofNullable(snapshots.get(productId));
    }

    public Optional<TrendAlert> getLatestAlert(String productId) {
        return Optional.ofNullable(latestAlerts.get(productId));
    }

    public int getTrackedProductCount() {
        return snapshots.size();
    }

    public int getTrendingCount() {
        return trendingCount.get();
    }

    public AlertSubscription subscribe() {
        return subscribe(config.getSubscriber().getQueueCapacity(), config.getSubscriber().getOverflowPolicy());
    }

    public AlertSubscription subscribe(int capacity, OverflowPolicy overflowPolicy) {
        AlertSubscription subscription = new AlertSubscription(
                UUID.randomUUID().toString(),
                capacity,
                overflowPolicy,
                this::unsubscribe,
                policy -> metricsConfig.recordSubscriberDrop(policy.name()));
        subscriptions.add(subscription);
        metricsConfig.updateActiveSubscriptionCount(subscriptions.size());
        log.info("Alert subscription opened: id={}, capacity={}, overflow={}",
                subscription.getId(), capacity, overflowPolicy);
        return subscription;
    }

    public int getSubscriptionCount() {
        return subscriptions.size();
    }

    public void closeAllSubscriptions() {
        for (AlertSubscription subscription : subscriptions) {
            subscription.close();
        }
    }

    private void unsubscribe(AlertSubscription subscription) {
        if (subscriptions.remove(subscription)) {
            metricsConfig.updateActiveSubscriptionCount(subscriptions.size());
            log.info("Alert subscription closed: id={}, dropped={}",
                    subscription.getId(), subscription.getDroppedCount());
        }
    }

    private void publish(TrendAlert alert) {
        synchronized (publishLock) {
            for (AlertSubscription subscription : subscriptions) {
                subscription.deliver(alert);
            }
        }
        metricsConfig.recordAlertPublished(alert.subjectDirection().getLabel());
    }

    private void trackTrending(TrendSnapshot previous, TrendSnapshot current) {
        boolean was = previous != null && previous.isTrending();
        if (was == current.isTrending()) return;
        metricsConfig.updateTrendingKeyCount(current.isTrending()
                ? trendingCount.incrementAndGet()
                : trendingCount.decrementAndGet());
    }
}
