package com.retail.herd.engine;

import com.retail.herd.model.SealedBucket;

/**
 * Receives buckets as the aggregator rolls past them, oldest first.
 */
@FunctionalInterface
public interface BucketSealListener {

    void onSealed(KeyState key, SealedBucket bucket);
}
