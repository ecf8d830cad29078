package com.retail.herd.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.retail.herd.config.AerospikeConfig;
import com.retail.herd.model.TrendAlert;
import com.retail.herd.model.TrendDirection;
import com.retail.herd.model.TrendStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
@ConditionalOnProperty(prefix = "aerospike", name = "enabled", havingValue = "true")
public class AlertHistoryRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public AlertHistoryRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("alertWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void save(TrendAlert alert) {
        // One record per transition: product id plus the bucket that caused it.
        Key key = new Key(namespace, AerospikeConfig.SET_TREND_ALERTS,
                alert.productId() + ":" + alert.bucketStart().toEpochMilli() + ":" + alert.status().name());

        client.put(writePolicy, key,
                new Bin("productId", alert.productId()),
                new Bin("count", alert.currentCount()),
                new Bin("mean", alert.baselineMean()),
                new Bin("std", alert.baselineStd()),
                new Bin("zScore", alert.zScore()),
                new Bin("direction", alert.trendDirection().name()),
                new Bin("cleared", alert.clearedDirection().name()),
                new Bin("status", alert.status().name()),
                new Bin("bucketStart", alert.bucketStart().toEpochMilli()),
                new Bin("generatedAt", alert.generatedAt().toEpochMilli()));
    }

    /**
     * Most recent alerts first, optionally restricted to one product.
     */
    public List<TrendAlert> findRecent(String productId, int limit) {
        List<TrendAlert> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TREND_ALERTS,
                (key, record) -> {
                    if (productId == null || productId.equals(record.getString("productId"))) {
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    }
                });

        results.sort(Comparator.comparing(TrendAlert::generatedAt).reversed());
        if (results.size() > limit) {
            return results.subList(0, limit);
        }
        return results;
    }

    private TrendAlert mapRecord(Record record) {
        return new TrendAlert(
                record.getString("productId"),
                record.getLong("count"),
                record.getDouble("mean"),
                record.getDouble("std"),
                record.getDouble("zScore"),
                TrendDirection.valueOf(record.getString("direction")),
                TrendDirection.valueOf(record.getString("cleared")),
                TrendStatus.valueOf(record.getString("status")),
                Instant.ofEpochMilli(record.getLong("bucketStart")),
                Instant.ofEpochMilli(record.getLong("generatedAt")));
    }
}
