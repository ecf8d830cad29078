package com.retail.herd.controller;

import com.retail.herd.config.TrendDetectionConfig;
import com.retail.herd.model.BatchResult;
import com.retail.herd.model.IngestOutcome;
import com.retail.herd.model.TrackRequest;
import com.retail.herd.service.IngestionService;
import com.retail.herd.service.InvalidEventException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@RestController
@RequestMapping("/api/v1/events")
@Tag(name = "Events", description = "Ingest product interaction events from the collector")
public class EventController {

    private final IngestionService ingestionService;
    private final TrendDetectionConfig config;

    public EventController(IngestionService ingestionService, TrendDetectionConfig config) {
        this.ingestionService = ingestionService;
        this.config = config;
    }

    @Operation(summary = "Track one interaction event",
            description = "Validates the event and queues it on the shard that owns its product. " +
                    "Returns 202 once queued; status is 'late' when the event is older than the product's active bucket. " +
                    "Events stamped beyond the allowed clock skew are rejected with 400.")
    @PostMapping("/track")
    public ResponseEntity<?> track(@RequestBody TrackRequest request) {
        CompletableFuture<IngestOutcome> pending;
        try {
            pending = ingestionService.ingest(request);
        } catch (InvalidEventException e) {
            return badRequest(e.getMessage(), e.getField());
        }

        IngestOutcome outcome;
        try {
            outcome = pending.get(config.getQueryTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return ResponseEntity.accepted().body(Map.of("status", "queued", "productId", request.getProductId()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return unavailable("Interrupted while queuing event");
        } catch (ExecutionException e) {
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getCause().getMessage())));
        }

        return switch (outcome) {
            case ACCEPTED -> ResponseEntity.accepted().body(Map.of("status", "accepted", "productId", request.getProductId()));
            case LATE -> ResponseEntity.accepted().body(Map.of("status", "late", "productId", request.getProductId()));
            case FUTURE -> badRequest("timestamp is further ahead of the detector clock than "
                    + config.getMaxFutureSkew(), "timestamp");
            case OVERLOADED -> unavailable("Ingestion queue is full, retry later");
            case SHUTTING_DOWN -> unavailable("Detector is shutting down");
        };
    }

    @Operation(summary = "Track a batch of interaction events",
            description = "Validates each event independently. Invalid events are reported by index and do not fail the batch.")
    @PostMapping("/batch")
    public ResponseEntity<BatchResult> trackBatch(@RequestBody List<TrackRequest> requests) {
        return ResponseEntity.accepted().body(ingestionService.ingestBatch(requests));
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private ResponseEntity<Map<String, String>> unavailable(String error) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", error));
    }
}
