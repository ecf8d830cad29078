package com.retail.herd.controller;

import com.retail.herd.config.TransportConfig;
import com.retail.herd.config.TrendDetectionConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View the effective detection configuration")
public class ConfigController {

    private final TrendDetectionConfig config;
    private final TransportConfig transportConfig;

    public ConfigController(TrendDetectionConfig config, TransportConfig transportConfig) {
        this.config = config;
        this.transportConfig = transportConfig;
    }

    @Operation(summary = "Get detection configuration",
            description = "Read-only. Configuration is validated at startup and cannot change while running.")
    @GetMapping
    public ResponseEntity<Map<String, Object>> getConfig() {
        Map<String, Object> detection = new LinkedHashMap<>();
        detection.put("bucketWidth", config.getBucketWidth().toString());
        detection.put("windowHorizon", config.getWindowHorizon().toString());
        detection.put("bucketsPerWindow", config.getBucketsPerWindow());
        detection.put("historyCap", config.getHistoryCap());
        detection.put("minSamples", config.getMinSamples());
        detection.put("upThreshold", config.getUpThreshold());
        detection.put("downThreshold", config.getDownThreshold());
        detection.put("recoveryThreshold", config.getRecoveryThreshold());
        detection.put("debounceCount", config.getDebounceCount());
        detection.put("cooldownDuration", config.getCooldownDuration().toString());
        detection.put("minActivityThreshold", config.getMinActivityThreshold());
        detection.put("notifyOnClear", config.isNotifyOnClear());
        detection.put("maxFutureSkew", config.getMaxFutureSkew().toString());
        detection.put("maxWatermarkStep", config.getMaxWatermarkStep());

        Map<String, Object> concurrency = new LinkedHashMap<>();
        concurrency.put("shardCount", config.getShardCount());
        concurrency.put("shardQueueCapacity", config.getShardQueueCapacity());
        concurrency.put("enqueueTimeout", config.getEnqueueTimeout().toString());
        concurrency.put("queryTimeout", config.getQueryTimeout().toString());
        concurrency.put("subscriberQueueCapacity", config.getSubscriber().getQueueCapacity());
        concurrency.put("subscriberOverflowPolicy", config.getSubscriber().getOverflowPolicy().name());

        Map<String, Object> transport = new LinkedHashMap<>();
        transport.put("enabled", transportConfig.isEnabled());
        transport.put("eventsTopic", transportConfig.getEventsTopic());
        transport.put("alertsTopic", transportConfig.getAlertsTopic());
        transport.put("maxAttempts", transportConfig.getMaxAttempts());
        transport.put("initialBackoff", transportConfig.getInitialBackoff().toString());
        transport.put("maxBackoff", transportConfig.getMaxBackoff().toString());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("detection", detection);
        body.put("concurrency", concurrency);
        body.put("transport", transport);
        return ResponseEntity.ok(body);
    }
}
