package com.retail.herd.controller;

import com.retail.herd.model.TrendAlert;
import com.retail.herd.service.AlertHistoryService;
import com.retail.herd.service.AlertService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Latest and historical trend alerts")
public class AlertController {

    private final AlertService alertService;
    private final Optional<AlertHistoryService> historyService;

    public AlertController(AlertService alertService, Optional<AlertHistoryService> historyService) {
        this.alertService = alertService;
        this.historyService = historyService;
    }

    @Operation(summary = "Get the latest alert for a product")
    @GetMapping("/latest/{productId}")
    public ResponseEntity<TrendAlert> getLatest(
            @Parameter(description = "Product ID", example = "sneaker-limited-001")
            @PathVariable String productId) {
        return alertService.getLatestAlert(productId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "List persisted alerts",
            description = "Most recent first. Requires Aerospike persistence; otherwise returns an empty list.")
    @GetMapping("/history")
    public ResponseEntity<Map<String, Object>> getHistory(
            @Parameter(description = "Restrict to one product")
            @RequestParam(required = false) String productId,
            @Parameter(description = "Max number of alerts to return", example = "50")
            @RequestParam(defaultValue = "50") int limit) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (historyService.isEmpty()) {
            body.put("persistence", "disabled");
            body.put("alerts", List.of());
            return ResponseEntity.ok(body);
        }
        List<TrendAlert> alerts = historyService.get().findRecent(productId, limit);
        body.put("persistence", "aerospike");
        body.put("alerts", alerts);
        return ResponseEntity.ok(body);
    }
}
