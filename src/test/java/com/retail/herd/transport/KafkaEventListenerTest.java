package com.retail.herd.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.retail.herd.config.MetricsConfig;
import com.retail.herd.model.IngestOutcome;
import com.retail.herd.service.IngestionService;
import com.retail.herd.service.InvalidEventException;
import com.retail.herd.testutil.TestDataFactory;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KafkaEventListenerTest {

    @Mock private IngestionService ingestionService;
    @Mock private MetricsConfig metricsConfig;

    private KafkaEventListener listener;

    @BeforeEach
    void setUp() {
        listener = new KafkaEventListener(ingestionService, new ObjectMapper(),
                TestDataFactory.detectionConfig(), metricsConfig);
    }

    @Test
    void tombstone_isSkippedAndCounted() {
        listener.onMessage(new ConsumerRecord<>("user_events", 0, 7L, "sku-1", null));

        verify(metricsConfig).recordRejected("validation");
        verifyNoInteractions(ingestionService);
    }

    @Test
    void unparsableJson_isSkippedAndCounted() {
        listener.onMessage(new ConsumerRecord<>("user_events", 0, 8L, "sku-1", "{not json"));

        verify(metricsConfig).recordRejected("validation");
        verifyNoInteractions(ingestionService);
    }

    @Test
    void validRecord_goesThroughIngestion() {
        when(ingestionService.ingest(any())).thenReturn(CompletableFuture.completedFuture(IngestOutcome.ACCEPTED));

        listener.onMessage(new ConsumerRecord<>("user_events", 0, 9L, "sneaker-limited-001",
                "{\"event_type\":\"view_product\",\"product_id\":\"sneaker-limited-001\","
                        + "\"timestamp\":\"2025-01-27T10:30:00Z\"}"));

        verify(ingestionService).ingest(argThat(r -> "sneaker-limited-001".equals(r.getProductId())));
        verifyNoInteractions(metricsConfig);
    }

    @Test
    void invalidRecord_isSkippedWithoutEscapingTheListener() {
        when(ingestionService.ingest(any())).thenThrow(new InvalidEventException("timestamp", "timestamp is required"));

        listener.onMessage(new ConsumerRecord<>("user_events", 0, 10L, "sku-1", "{\"product_id\":\"sku-1\"}"));

        verify(ingestionService).ingest(any());
        verify(metricsConfig, never()).recordRejected(any());
    }
}
