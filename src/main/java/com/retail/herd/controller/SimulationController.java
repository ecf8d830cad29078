package com.retail.herd.controller;

import com.retail.herd.model.BatchResult;
import com.retail.herd.model.InteractionEvent;
import com.retail.herd.service.IngestionService;
import com.retail.herd.simulation.SimulationRequest;
import com.retail.herd.simulation.SyntheticLoadGenerator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/simulate")
@Tag(name = "Simulation", description = "Push scripted traffic patterns through the ingestion path")
public class SimulationController {

    private static final Logger log = LoggerFactory.getLogger(SimulationController.class);
    private static final int MAX_BUCKETS = 10_000;
    private static final int MAX_EVENTS = 1_000_000;

    private final SyntheticLoadGenerator generator;
    private final IngestionService ingestionService;

    public SimulationController(SyntheticLoadGenerator generator, IngestionService ingestionService) {
        this.generator = generator;
        this.ingestionService = ingestionService;
    }

    @Operation(summary = "Run a synthetic traffic pattern",
            description = "Generates BACKGROUND, SPIKE, GRADUAL or COLLAPSE traffic for one product in event time " +
                    "and ingests it. The same seed always produces the same events.")
    @PostMapping
    public ResponseEntity<?> simulate(@RequestBody SimulationRequest request) {
        if (request.getProductId() == null || request.getProductId().isBlank()) {
            return badRequest("productId is required", "productId");
        }
        if (request.getPattern() == null) {
            return badRequest("pattern is required", "pattern");
        }
        if (request.getWarmupBuckets() < 0 || request.getActiveBuckets() < 0
                || request.getTotalBuckets() > MAX_BUCKETS) {
            return badRequest("warmupBuckets + activeBuckets must be between 0 and " + MAX_BUCKETS, "activeBuckets");
        }
        if (request.getBaseRate() < 0 || request.getMultiplier() <= 0) {
            return badRequest("baseRate must be >= 0 and multiplier > 0", "multiplier");
        }

        List<InteractionEvent> events = generator.generate(request);
        if (events.size() > MAX_EVENTS) {
            return badRequest("Pattern would generate " + events.size() + " events (max " + MAX_EVENTS + ")", "baseRate");
        }

        BatchResult result = ingestionService.submitAll(events);
        log.info("Simulation {} for product={}: generated={}, accepted={}, late={}, rejected={}",
                request.getPattern(), request.getProductId(), events.size(),
                result.getAccepted(), result.getLate(), result.getRejected());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pattern", request.getPattern());
        body.put("productId", request.getProductId());
        body.put("generated", events.size());
        body.put("accepted", result.getAccepted());
        body.put("late", result.getLate());
        body.put("rejected", result.getRejected());
        return ResponseEntity.ok(body);
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
