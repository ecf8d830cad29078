package com.retail.herd.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A single thread that owns a partition of the keys. Tasks run strictly in the order they were
 * queued, so per-key state needs no locking as long as it is only touched from inside a task.
 */
class ShardWorker {

    private static final Logger log = LoggerFactory.getLogger(ShardWorker.class);
    private static final long POLL_MILLIS = 100;

    private final int shardId;
    private final BlockingQueue<Runnable> tasks;
    private final Map<String, KeyState> keys = new HashMap<>();
    private final Thread thread;
    private volatile boolean running = true;

    // Event-time progress of the shard; trails the newest bucket seen by at most the step cap per event
    private long watermarkIndex = KeyState.NO_BUCKET;

    ShardWorker(int shardId, int queueCapacity) {
        this.shardId = shardId;
        this.tasks = new LinkedBlockingQueue<>(queueCapacity);
        this.thread = new Thread(this::runLoop, "herd-shard-" + shardId);
        this.thread.setDaemon(true);
    }

    void start() {
        thread.start();
    }

    int getShardId() {
        return shardId;
    }

    Map<String, KeyState> keys() {
        return keys;
    }

    long getWatermarkIndex() {
        return watermarkIndex;
    }

    /**
     * Move the watermark towards {@code index}, by at most {@code maxStep} buckets. The first event
     * seen by the shard sets it outright.
     *
     * @return true if the watermark moved to a newer bucket
     */
    boolean advanceWatermark(long index, int maxStep) {
        if (index <= watermarkIndex) {
            return false;
        }
        watermarkIndex = watermarkIndex == KeyState.NO_BUCKET
                ? index
                : Math.min(index, watermarkIndex + maxStep);
        return true;
    }

    boolean offer(Runnable task, Duration timeout) throws InterruptedException {
        if (!running) return false;
        return tasks.offer(task, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    int pendingTasks() {
        return tasks.size();
    }

    /**
     * Stop taking new tasks. Already queued tasks still run before the thread exits.
     */
    void stop() {
        running = false;
    }

    boolean awaitTermination(Duration timeout) throws InterruptedException {
        thread.join(Math.max(1, timeout.toMillis()));
        return !thread.isAlive();
    }

    private void runLoop() {
        log.info("Shard {} worker started", shardId);
        while (running || !tasks.isEmpty()) {
            Runnable task;
            try {
                task = tasks.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (task == null) continue;

            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Shard {} task failed: {}", shardId, e.getMessage(), e);
            }
        }
        log.info("Shard {} worker stopped ({} keys)", shardId, keys.size());
    }
}
