package com.retail.herd.service;

import com.retail.herd.config.TrendDetectionConfig.OverflowPolicy;
import com.retail.herd.model.TrendAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * A bounded per-subscriber alert queue. Producers never block on it: when the queue is full the
 * overflow policy either discards the oldest pending alert or closes the subscription.
 */
public class AlertSubscription implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AlertSubscription.class);

    private final String id;
    private final BlockingQueue<TrendAlert> queue;
    private final OverflowPolicy overflowPolicy;
    private final Consumer<AlertSubscription> onClose;
    private final Consumer<OverflowPolicy> onDrop;
    private final AtomicLong droppedCount = new AtomicLong();
    private volatile boolean closed = false;

    AlertSubscription(String id, int capacity, OverflowPolicy overflowPolicy,
                      Consumer<AlertSubscription> onClose, Consumer<OverflowPolicy> onDrop) {
        this.id = id;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.overflowPolicy = overflowPolicy;
        this.onClose = onClose;
        this.onDrop = onDrop;
    }

    public String getId() {
        return id;
    }

    public boolean isClosed() {
        return closed;
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    public int pending() {
        return queue.size();
    }

    /**
     * Called by the publisher with the publish lock held, so offers from different shards reach
     * every subscriber in the same order.
     */
    void deliver(TrendAlert alert) {
        if (closed) return;
        if (queue.offer(alert)) return;

        if (overflowPolicy == OverflowPolicy.CLOSE) {
            droppedCount.incrementAndGet();
            onDrop.accept(overflowPolicy);
            log.warn("Subscription {} overflowed ({} pending), closing", id, queue.size());
            close();
            return;
        }

        while (!queue.offer(alert)) {
            if (queue.poll() != null) {
                droppedCount.incrementAndGet();
                onDrop.accept(overflowPolicy);
            }
        }
    }

    /**
     * Wait up to {@code timeout} for the next alert.
     *
     * @return the alert, or null on timeout or once the subscription is closed and drained
     */
    public TrendAlert poll(Duration timeout) throws InterruptedException {
        TrendAlert alert = queue.poll();
        if (alert != null || closed) return alert;
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public List<TrendAlert> drain() {
        List<TrendAlert> alerts = new ArrayList<>();
        queue.drainTo(alerts);
        return alerts;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        onClose.accept(this);
        log.debug("Subscription {} closed, dropped={}", id, droppedCount.get());
    }
}
