package com.retail.herd.engine;

import com.retail.herd.config.TrendDetectionConfig;
import com.retail.herd.model.IngestOutcome;
import com.retail.herd.model.SealedBucket;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Counts events into fixed-width buckets per key and rolls the ring forward in event time.
 *
 * Exactly one bucket per key is active. An event for a newer bucket seals the active bucket and
 * every empty bucket up to the new one, oldest first; an event for a bucket older than the active
 * one is rejected as late and changes nothing.
 */
@Component
public class WindowedAggregator {

    private final long bucketWidthMillis;
    private final int maxGapBuckets;

    public WindowedAggregator(TrendDetectionConfig config) {
        this.bucketWidthMillis = config.getBucketWidth().toMillis();
        this.maxGapBuckets = config.getMaxGapBuckets();
    }

    public long bucketIndex(Instant eventTime) {
        return Math.floorDiv(eventTime.toEpochMilli(), bucketWidthMillis);
    }

    public Instant bucketStart(long index) {
        return Instant.ofEpochMilli(index * bucketWidthMillis);
    }

    public Instant bucketEnd(long index) {
        return Instant.ofEpochMilli((index + 1) * bucketWidthMillis);
    }

    /**
     * Count one event for {@code key} at {@code eventTime}, sealing any buckets the event rolls past.
     */
    public IngestOutcome ingest(KeyState key, Instant eventTime, BucketSealListener listener) {
        long index = bucketIndex(eventTime);

        if (!key.hasActiveBucket()) {
            key.activate(index);
            key.incrementActive();
            return IngestOutcome.ACCEPTED;
        }

        if (index < key.getActiveIndex()) {
            return IngestOutcome.LATE;
        }

        advance(key, index, listener);
        key.incrementActive();
        return IngestOutcome.ACCEPTED;
    }

    /**
     * Make {@code newIndex} the active bucket of {@code key}. The previously active bucket is
     * sealed with its count, followed by the empty buckets in between. For a key idle longer than
     * the gap cap only the most recent {@code maxGapBuckets} empty buckets are sealed.
     *
     * @return number of buckets sealed
     */
    public int advance(KeyState key, long newIndex, BucketSealListener listener) {
        if (!key.hasActiveBucket() || newIndex <= key.getActiveIndex()) {
            return 0;
        }

        long oldIndex = key.getActiveIndex();
        int sealed = 0;

        listener.onSealed(key, new SealedBucket(oldIndex, bucketStart(oldIndex), key.countAt(oldIndex)));
        sealed++;

        long firstEmpty = Math.max(oldIndex + 1, newIndex - maxGapBuckets);
        for (long i = firstEmpty; i < newIndex; i++) {
            key.setCountAt(i, 0L);
            listener.onSealed(key, new SealedBucket(i, bucketStart(i), 0L));
            sealed++;
        }

        key.activate(newIndex);
        return sealed;
    }

    /**
     * Sealed buckets still held in the key's ring, oldest first. The active bucket is not included.
     */
    public List<SealedBucket> recentBuckets(KeyState key) {
        List<SealedBucket> buckets = new ArrayList<>();
        if (!key.hasActiveBucket()) return buckets;

        long active = key.getActiveIndex();
        long from = Math.max(key.getFirstIndex(), active - key.getRingSize() + 1);
        for (long i = from; i < active; i++) {
            buckets.add(new SealedBucket(i, bucketStart(i), key.countAt(i)));
        }
        return buckets;
    }
}
