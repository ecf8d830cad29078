package com.retail.herd.engine;

import com.retail.herd.config.MetricsConfig;
import com.retail.herd.config.TrendDetectionConfig;
import com.retail.herd.model.AlertState;
import com.retail.herd.model.BaselineStats;
import com.retail.herd.model.IngestOutcome;
import com.retail.herd.model.InteractionEvent;
import com.retail.herd.model.SealedBucket;
import com.retail.herd.model.TrendDetail;
import com.retail.herd.service.AlertService;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sharded detection pipeline. Each product is owned by one shard, chosen by a stable hash of the
 * product id; the shard's worker thread is the only code that touches that product's ring,
 * baseline and alert state.
 *
 * Flow per event: aggregator ingest → (on rollover) classifier evaluates the sealed bucket against
 * the pre-update baseline → alert service records the result → estimator folds the bucket in.
 *
 * Depends on the dispatcher so that it is destroyed first: alerts flushed during shutdown still
 * reach the listeners.
 */
@Component
@DependsOn("alertDispatcher")
public class TrendDetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(TrendDetectionEngine.class);

    private final TrendDetectionConfig config;
    private final WindowedAggregator aggregator;
    private final BaselineEstimator estimator;
    private final TrendClassifier classifier;
    private final AlertService alertService;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final Clock clock;

    private final List<ShardWorker> shards = new ArrayList<>();
    private volatile boolean accepting = false;

    public TrendDetectionEngine(TrendDetectionConfig config,
                                WindowedAggregator aggregator,
                                BaselineEstimator estimator,
                                TrendClassifier classifier,
                                AlertService alertService,
                                MetricsConfig metricsConfig,
                                Tracer tracer,
                                Clock clock) {
        this.config = config;
        this.aggregator = aggregator;
        this.estimator = estimator;
        this.classifier = classifier;
        this.alertService = alertService;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        for (int i = 0; i < config.getShardCount(); i++) {
            ShardWorker shard = new ShardWorker(i, config.getShardQueueCapacity());
            shards.add(shard);
            shard.start();
        }
        accepting = true;
        log.info("Trend detection engine started: shards={}, bucketWidth={}, bucketsPerWindow={}, minSamples={}",
                shards.size(), config.getBucketWidth(), config.getBucketsPerWindow(), config.getMinSamples());
    }

    public int shardFor(String productId) {
        return Math.floorMod(productId.hashCode(), shards.size());
    }

    /**
     * Queue an event on the shard that owns its product. Waits at most the enqueue timeout for
     * queue space; the returned future completes once the shard has applied the event.
     */
    public CompletableFuture<IngestOutcome> submit(InteractionEvent event) {
        if (!accepting) {
            metricsConfig.recordRejected("shutdown");
            return CompletableFuture.completedFuture(IngestOutcome.SHUTTING_DOWN);
        }

        ShardWorker shard = shards.get(shardFor(event.getProductId()));
        CompletableFuture<IngestOutcome> outcome = new CompletableFuture<>();
        boolean queued;
        try {
            queued = shard.offer(() -> {
                try {
                    outcome.complete(apply(shard, event));
                } catch (RuntimeException e) {
                    outcome.completeExceptionally(e);
                    throw e;
                }
            }, config.getEnqueueTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            queued = false;
        }

        if (!queued) {
            String reason = accepting ? "overload" : "shutdown";
            metricsConfig.recordRejected(reason);
            log.warn("Shard {} rejected event for product={} ({}), pending={}",
                    shard.getShardId(), event.getProductId(), reason, shard.pendingTasks());
            return CompletableFuture.completedFuture(accepting ? IngestOutcome.OVERLOADED : IngestOutcome.SHUTTING_DOWN);
        }
        return outcome;
    }

    /**
     * Read a product's window, baseline and state through its owning shard, waiting at most the
     * query timeout.
     */
    public Optional<TrendDetail> describe(String productId) throws TimeoutException {
        ShardWorker shard = shards.get(shardFor(productId));
        CompletableFuture<Optional<TrendDetail>> detail = new CompletableFuture<>();
        Duration timeout = config.getQueryTimeout();
        try {
            boolean queued = shard.offer(() -> detail.complete(Optional.ofNullable(shard.keys().get(productId))
                    .map(this::toDetail)), timeout);
            if (!queued) {
                throw new TimeoutException("Shard " + shard.getShardId() + " did not accept the query");
            }
            return detail.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TimeoutException("Interrupted while reading product " + productId);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to read product " + productId, e.getCause());
        }
    }

    /**
     * Wait until every shard has processed everything queued before this call.
     *
     * @return false if some shard did not catch up within {@code timeout}
     */
    public boolean awaitQuiescence(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        List<CompletableFuture<Void>> barriers = new ArrayList<>();
        try {
            for (ShardWorker shard : shards) {
                CompletableFuture<Void> barrier = new CompletableFuture<>();
                if (!shard.offer(() -> barrier.complete(null), remaining(deadline))) {
                    return false;
                }
                barriers.add(barrier);
            }
            CompletableFuture.allOf(barriers.toArray(new CompletableFuture[0]))
                    .get(remaining(deadline).toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException e) {
            return false;
        }
    }

    public boolean isAccepting() {
        return accepting;
    }

    public int getShardCount() {
        return shards.size();
    }

    /**
     * Scoped drain: stop accepting, let every shard finish its queue and seal the buckets that are
     * complete relative to its watermark, then release per-key state and close subscriptions.
     */
    @PreDestroy
    public void shutdown() {
        if (!accepting) return;
        accepting = false;
        log.info("Trend detection engine draining {} shards", shards.size());

        for (ShardWorker shard : shards) {
            try {
                if (!shard.offer(() -> sealCompleted(shard), config.getShutdownTimeout())) {
                    log.warn("Shard {} queue full at shutdown; completed buckets not flushed", shard.getShardId());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            shard.stop();
        }

        long deadline = System.nanoTime() + config.getShutdownTimeout().toNanos();
        int released = 0;
        for (ShardWorker shard : shards) {
            boolean terminated = false;
            try {
                terminated = shard.awaitTermination(remaining(deadline));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (!terminated) {
                // The worker may still be touching its keys; leave them to it
                log.warn("Shard {} did not drain within {}, keys not released",
                        shard.getShardId(), config.getShutdownTimeout());
                continue;
            }
            released += shard.keys().size();
            shard.keys().clear();
        }
        metricsConfig.adjustTrackedKeys(-released);
        alertService.closeAllSubscriptions();
        log.info("Trend detection engine stopped, released {} keys", released);
    }

    // ---- shard-thread code below: only ever runs inside a ShardWorker task ----

    private IngestOutcome apply(ShardWorker shard, InteractionEvent event) {
        long index = aggregator.bucketIndex(event.getTimestamp());
        Instant horizon = clock.instant().plus(config.getMaxFutureSkew());
        if (event.getTimestamp().isAfter(horizon)) {
            metricsConfig.recordRejected("future");
            log.warn("Future event rejected: product={}, eventTime={}, horizon={}",
                    event.getProductId(), event.getTimestamp(), horizon);
            return IngestOutcome.FUTURE;
        }

        KeyState key = shard.keys().get(event.getProductId());
        if (key == null) {
            key = new KeyState(event.getProductId(), config.getBucketsPerWindow(), config.getHistoryCap());
            shard.keys().put(event.getProductId(), key);
            metricsConfig.adjustTrackedKeys(1);
        }

        IngestOutcome outcome = aggregator.ingest(key, event.getTimestamp(), this::onSealed);
        if (outcome == IngestOutcome.LATE) {
            metricsConfig.recordRejected("late");
            log.debug("Late event rejected: product={}, eventTime={}, activeBucket={}",
                    event.getProductId(), event.getTimestamp(), aggregator.bucketStart(key.getActiveIndex()));
            return outcome;
        }

        metricsConfig.recordIngested();
        if (shard.advanceWatermark(index, config.getMaxWatermarkStep())) {
            sweepIdleKeys(shard);
        }
        return outcome;
    }

    /**
     * Roll every key lagging more than one bucket behind the shard watermark, so products that go
     * quiet still produce (empty) sealed buckets. The bucket just before the watermark stays open
     * for slightly out-of-order arrivals. The watermark moves at most {@code max-watermark-step}
     * buckets per event, so one event stamped far ahead cannot seal other keys' buckets.
     */
    private void sweepIdleKeys(ShardWorker shard) {
        long target = shard.getWatermarkIndex() - 1;
        for (KeyState key : shard.keys().values()) {
            if (key.hasActiveBucket() && key.getActiveIndex() < target) {
                aggregator.advance(key, target, this::onSealed);
            }
        }
    }

    private void sealCompleted(ShardWorker shard) {
        long watermark = shard.getWatermarkIndex();
        int flushed = 0;
        for (KeyState key : shard.keys().values()) {
            if (key.hasActiveBucket() && key.getActiveIndex() < watermark) {
                flushed += aggregator.advance(key, watermark, this::onSealed);
            }
        }
        log.info("Shard {} flushed {} completed buckets on shutdown", shard.getShardId(), flushed);
    }

    void onSealed(KeyState key, SealedBucket bucket) {
        BaselineStats baseline = key.getBaseline();
        if (bucket.index() <= baseline.getLastUpdatedBucket()) {
            return;
        }
        metricsConfig.recordBucketsSealed(1);

        try {
            if (baseline.isDefined(config.getMinSamples())) {
                evaluate(key, bucket);
            }
        } catch (RuntimeException e) {
            log.error("Evaluation failed for product={} bucket={}: {}",
                    key.getProductId(), bucket.start(), e.getMessage(), e);
        }

        estimator.update(baseline, bucket.index(), bucket.count());
    }

    private void evaluate(KeyState key, SealedBucket bucket) {
        Instant closedAt = aggregator.bucketEnd(bucket.index());
        AlertState state = key.getAlertState();

        Span span = tracer.nextSpan()
                .name("bucket.evaluate")
                .tag("product.id", key.getProductId())
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            Evaluation evaluation = classifier.evaluate(state, bucket.count(), key.getBaseline(), closedAt);
            span.tag("trend.from", evaluation.from().name());
            span.tag("trend.to", evaluation.to().name());

            if (evaluation.isTransition()) {
                metricsConfig.recordTransition(evaluation.to().name());
            }
            log.debug("Bucket evaluated: product={} start={} count={} mean={} std={} z={} {} -> {}",
                    key.getProductId(), bucket.start(), bucket.count(),
                    String.format("%.2f", key.getBaseline().getMean()),
                    String.format("%.2f", key.getBaseline().getStdDev()),
                    String.format("%.2f", evaluation.zScore()),
                    evaluation.from(), evaluation.to());

            alertService.onEvaluated(key.getProductId(), bucket, closedAt, key.getBaseline(), state, evaluation);
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private TrendDetail toDetail(KeyState key) {
        BaselineStats baseline = key.getBaseline();
        AlertState state = key.getAlertState();
        return new TrendDetail(
                key.getProductId(),
                key.hasActiveBucket() ? aggregator.bucketStart(key.getActiveIndex()) : null,
                key.getActiveCount(),
                aggregator.recentBuckets(key),
                baseline.isDefined(config.getMinSamples()),
                baseline.getMean(),
                baseline.getStdDev(),
                baseline.getSampleCount(),
                state.getStatus(),
                state.getAnchor(),
                state.getConsecutiveBreachCount(),
                state.getConsecutiveRecoverCount(),
                state.getLastTransitionTime(),
                state.getCooldownUntil());
    }

    private static Duration remaining(long deadlineNanos) {
        return Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime()));
    }
}
