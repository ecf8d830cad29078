package com.retail.herd.controller;

import com.retail.herd.engine.TrendDetectionEngine;
import com.retail.herd.model.TrendDetail;
import com.retail.herd.model.TrendSnapshot;
import com.retail.herd.service.AlertService;
import com.retail.herd.service.AlertStreamService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

@RestController
@RequestMapping("/api/v1/trends")
@Tag(name = "Trends", description = "Currently trending products, per-product detection state and the live alert stream")
public class TrendController {

    private static final int MAX_TOP_K = 1000;

    private final AlertService alertService;
    private final TrendDetectionEngine engine;
    private final AlertStreamService streamService;

    public TrendController(AlertService alertService,
                           TrendDetectionEngine engine,
                           AlertStreamService streamService) {
        this.alertService = alertService;
        this.engine = engine;
        this.streamService = streamService;
    }

    @Operation(summary = "List trending products",
            description = "Products currently holding a trend, ordered by |z-score| descending. " +
                    "When nothing is trending, the most deviating products are returned instead.")
    @GetMapping
    public ResponseEntity<?> getTrends(
            @Parameter(description = "Maximum number of products to return", example = "10")
            @RequestParam(defaultValue = "10") int topK) {
        if (topK < 1 || topK > MAX_TOP_K) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "topK must be between 1 and " + MAX_TOP_K, "field", "topK"));
        }

        List<TrendSnapshot> products = alertService.snapshot(topK);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("trending", alertService.getTrendingCount());
        body.put("tracked", alertService.getTrackedProductCount());
        body.put("products", products);
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Get detection state of one product",
            description = "Reads the product's window, baseline and hysteresis state through its owning shard.")
    @GetMapping("/{productId}")
    public ResponseEntity<?> getProduct(
            @Parameter(description = "Product ID", example = "sneaker-limited-001")
            @PathVariable String productId) {
        Optional<TrendDetail> detail;
        try {
            detail = engine.describe(productId);
        } catch (TimeoutException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Timed out reading product " + productId));
        }
        return detail.<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "Stream trend alerts",
            description = "Server-sent events: a 'hello' event on connect, then one 'trend-alert' event per published alert.")
    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(
            @Parameter(description = "Connection timeout in milliseconds", example = "1800000")
            @RequestParam(defaultValue = "1800000") long timeoutMs) {
        return streamService.registerClient(timeoutMs);
    }
}
