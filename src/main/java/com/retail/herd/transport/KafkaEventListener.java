package com.retail.herd.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retail.herd.config.MetricsConfig;
import com.retail.herd.config.TrendDetectionConfig;
import com.retail.herd.model.IngestOutcome;
import com.retail.herd.model.TrackRequest;
import com.retail.herd.service.IngestionService;
import com.retail.herd.service.InvalidEventException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Consumes collector events from the events topic. Malformed records are logged and skipped;
 * the consumer waits for each event to be applied so a saturated shard slows the topic down
 * instead of dropping events.
 */
@Component
@ConditionalOnProperty(prefix = "herd.transport", name = "enabled", havingValue = "true")
public class KafkaEventListener {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventListener.class);

    private final IngestionService ingestionService;
    private final ObjectMapper objectMapper;
    private final TrendDetectionConfig config;
    private final MetricsConfig metricsConfig;

    public KafkaEventListener(IngestionService ingestionService,
                              ObjectMapper objectMapper,
                              TrendDetectionConfig config,
                              MetricsConfig metricsConfig) {
        this.ingestionService = ingestionService;
        this.objectMapper = objectMapper;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @KafkaListener(
            topics = "${herd.transport.events-topic:user_events}",
            groupId = "${herd.transport.group-id:herd-trend-detector}")
    public void onMessage(ConsumerRecord<String, String> record) {
        if (record.value() == null) {
            metricsConfig.recordRejected("validation");
            log.warn("Skipping empty event at partition={} offset={}", record.partition(), record.offset());
            return;
        }

        TrackRequest request;
        try {
            request = objectMapper.readValue(record.value(), TrackRequest.class);
        } catch (JsonProcessingException e) {
            metricsConfig.recordRejected("validation");
            log.warn("Skipping unparsable event at partition={} offset={}: {}",
                    record.partition(), record.offset(), e.getOriginalMessage());
            return;
        }

        try {
            IngestOutcome outcome = ingestionService.ingest(request)
                    .get(config.getQueryTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (outcome != IngestOutcome.ACCEPTED) {
                log.debug("Event for product={} not counted: {}", request.getProductId(), outcome);
            }
        } catch (InvalidEventException e) {
            // already counted by the ingestion service
            log.warn("Skipping invalid event at partition={} offset={}: {} ({})",
                    record.partition(), record.offset(), e.getMessage(), e.getField());
        } catch (TimeoutException e) {
            log.warn("Event for product={} still queued after {}", request.getProductId(), config.getQueryTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.error("Event for product={} failed: {}", request.getProductId(), e.getCause().getMessage(), e.getCause());
        }
    }
}
