package com.retail.herd.service;

import com.retail.herd.config.MetricsConfig;
import com.retail.herd.config.TrendDetectionConfig;
import com.retail.herd.engine.TrendDetectionEngine;
import com.retail.herd.model.BatchResult;
import com.retail.herd.model.IngestOutcome;
import com.retail.herd.model.InteractionEvent;
import com.retail.herd.model.TrackRequest;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Front door for inbound events, shared by the HTTP endpoints, the Kafka listener and the
 * synthetic load generator. Validation happens here, synchronously, so malformed records never
 * reach a shard.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            Instant::parse,
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));

    // Event times the bucket arithmetic can represent with room to spare
    static final Instant EARLIEST_TIMESTAMP = Instant.EPOCH;
    static final Instant LATEST_TIMESTAMP = Instant.parse("9999-12-31T23:59:59Z");

    private final TrendDetectionEngine engine;
    private final TrendDetectionConfig config;
    private final MetricsConfig metricsConfig;

    public IngestionService(TrendDetectionEngine engine,
                            TrendDetectionConfig config,
                            MetricsConfig metricsConfig) {
        this.engine = engine;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Validate and submit one record.
     *
     * @throws InvalidEventException if the product id or timestamp is missing or malformed
     */
    @Observed(name = "events.ingest", contextualName = "ingest-event")
    public CompletableFuture<IngestOutcome> ingest(TrackRequest request) {
        return engine.submit(validate(request));
    }

    public CompletableFuture<IngestOutcome> submit(InteractionEvent event) {
        return engine.submit(event);
    }

    /**
     * Validate and submit every record, then wait (bounded by the query timeout) for the shards to
     * apply them. Invalid records are counted as rejected and do not stop the batch.
     */
    public BatchResult ingestBatch(List<TrackRequest> requests) {
        BatchResult result = new BatchResult();
        List<InteractionEvent> events = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            try {
                events.add(validate(requests.get(i)));
            } catch (InvalidEventException e) {
                result.setRejected(result.getRejected() + 1);
                result.getErrors().add("[" + i + "] " + e.getField() + ": " + e.getMessage());
            }
        }
        tally(result, events);
        return result;
    }

    /**
     * Submit already-validated events and tally their outcomes.
     */
    public BatchResult submitAll(List<InteractionEvent> events) {
        BatchResult result = new BatchResult();
        tally(result, events);
        return result;
    }

    private void tally(BatchResult result, List<InteractionEvent> events) {
        List<CompletableFuture<IngestOutcome>> pending = new ArrayList<>(events.size());
        for (InteractionEvent event : events) {
            pending.add(engine.submit(event));
        }

        long deadline = System.nanoTime() + config.getQueryTimeout().toNanos();
        for (CompletableFuture<IngestOutcome> future : pending) {
            IngestOutcome outcome = await(future, deadline);
            switch (outcome) {
                case ACCEPTED -> result.setAccepted(result.getAccepted() + 1);
                case LATE -> result.setLate(result.getLate() + 1);
                default -> result.setRejected(result.getRejected() + 1);
            }
        }
        log.debug("Batch submitted: accepted={}, late={}, rejected={}",
                result.getAccepted(), result.getLate(), result.getRejected());
    }

    private IngestOutcome await(CompletableFuture<IngestOutcome> future, long deadlineNanos) {
        try {
            long waitNanos = Math.max(0, deadlineNanos - System.nanoTime());
            return future.get(waitNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            // Queued but not yet applied; it will still be counted by the shard.
            return IngestOutcome.ACCEPTED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return IngestOutcome.SHUTTING_DOWN;
        } catch (ExecutionException e) {
            log.error("Event submission failed: {}", e.getCause().getMessage(), e.getCause());
            return IngestOutcome.OVERLOADED;
        }
    }

    public InteractionEvent validate(TrackRequest request) {
        if (request == null) {
            return reject("body", "Event body is required");
        }
        if (request.getProductId() == null || request.getProductId().isBlank()) {
            return reject("product_id", "product_id is required");
        }
        if (request.getTimestamp() == null || request.getTimestamp().isBlank()) {
            return reject("timestamp", "timestamp is required");
        }

        Instant timestamp = parseTimestamp(request.getTimestamp());
        if (timestamp == null) {
            return reject("timestamp", "timestamp is not a valid ISO-8601 date-time: " + request.getTimestamp());
        }
        if (timestamp.isBefore(EARLIEST_TIMESTAMP) || timestamp.isAfter(LATEST_TIMESTAMP)) {
            return reject("timestamp", "timestamp is outside the supported range "
                    + EARLIEST_TIMESTAMP + " .. " + LATEST_TIMESTAMP + ": " + request.getTimestamp());
        }

        return InteractionEvent.builder()
                .eventType(request.getEventType())
                .productId(request.getProductId().trim())
                .timestamp(timestamp)
                .userId(request.getUserId())
                .sessionId(request.getSessionId())
                .metadata(request.getMetadata() != null ? request.getMetadata() : Map.of())
                .build();
    }

    /**
     * Accepts an instant ({@code ...Z}), an offset date-time, or a local date-time taken as UTC.
     */
    static Instant parseTimestamp(String value) {
        String text = value.trim();
        DateTimeParseException last = null;
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        log.debug("Unparsable timestamp '{}': {}", value, last.getMessage());
        return null;
    }

    private InteractionEvent reject(String field, String message) {
        metricsConfig.recordRejected("validation");
        throw new InvalidEventException(field, message);
    }
}
