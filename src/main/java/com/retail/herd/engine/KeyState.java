package com.retail.herd.engine;

import com.retail.herd.model.AlertState;
import com.retail.herd.model.BaselineStats;

/**
 * Everything the engine keeps for one product: the bucket ring, the baseline and the alert state.
 * Instances live inside a single shard and are only touched from that shard's worker thread.
 */
public class KeyState {

    static final long NO_BUCKET = Long.MIN_VALUE;

    private final String productId;
    private final long[] ring;
    private long activeIndex = NO_BUCKET;
    private long firstIndex = NO_BUCKET;
    private final BaselineStats baseline;
    private final AlertState alertState;

    public KeyState(String productId, int bucketsPerWindow, int historyCap) {
        this.productId = productId;
        this.ring = new long[bucketsPerWindow];
        this.baseline = new BaselineStats(historyCap);
        this.alertState = new AlertState();
    }

    public String getProductId() {
        return productId;
    }

    public BaselineStats getBaseline() {
        return baseline;
    }

    public AlertState getAlertState() {
        return alertState;
    }

    public boolean hasActiveBucket() {
        return activeIndex != NO_BUCKET;
    }

    public long getActiveIndex() {
        return activeIndex;
    }

    public long getFirstIndex() {
        return firstIndex;
    }

    public long getActiveCount() {
        return hasActiveBucket() ? ring[slot(activeIndex)] : 0L;
    }

    int getRingSize() {
        return ring.length;
    }

    long countAt(long index) {
        return ring[slot(index)];
    }

    void setCountAt(long index, long count) {
        ring[slot(index)] = count;
    }

    void activate(long index) {
        if (firstIndex == NO_BUCKET) {
            firstIndex = index;
        }
        activeIndex = index;
        ring[slot(index)] = 0L;
    }

    void incrementActive() {
        ring[slot(activeIndex)]++;
    }

    private int slot(long index) {
        return (int) Math.floorMod(index, (long) ring.length);
    }
}
