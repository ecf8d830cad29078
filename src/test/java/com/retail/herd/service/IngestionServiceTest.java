package com.retail.herd.service;

import com.retail.herd.config.MetricsConfig;
import com.retail.herd.engine.TrendDetectionEngine;
import com.retail.herd.model.*;
import com.retail.herd.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    @Mock private TrendDetectionEngine engine;
    @Mock private MetricsConfig metricsConfig;

    private IngestionService ingestionService;

    @BeforeEach
    void setUp() {
        ingestionService = new IngestionService(engine, TestDataFactory.detectionConfig(), metricsConfig);
    }

    @Test
    void ingest_validRecord_isSubmittedWithParsedTimestamp() {
        when(engine.submit(any())).thenReturn(CompletableFuture.completedFuture(IngestOutcome.ACCEPTED));

        ingestionService.ingest(TestDataFactory.trackRequest("sneaker-limited-001", "2025-01-27T10:30:00Z"));

        ArgumentCaptor<InteractionEvent> captor = ArgumentCaptor.forClass(InteractionEvent.class);
        verify(engine).submit(captor.capture());
        assertThat(captor.getValue().getProductId()).isEqualTo("sneaker-limited-001");
        assertThat(captor.getValue().getTimestamp()).isEqualTo(Instant.parse("2025-01-27T10:30:00Z"));
        assertThat(captor.getValue().getMetadata()).containsEntry("region", "US");
    }

    @Test
    void ingest_missingProductId_isRejectedBeforeTheEngine() {
        TrackRequest request = TestDataFactory.trackRequest(null, "2025-01-27T10:30:00Z");

        assertThatThrownBy(() -> ingestionService.ingest(request))
                .isInstanceOf(InvalidEventException.class)
                .extracting("field").isEqualTo("product_id");
        verify(engine, never()).submit(any());
        verify(metricsConfig).recordRejected("validation");
    }

    @Test
    void ingest_unparsableTimestamp_isRejected() {
        TrackRequest request = TestDataFactory.trackRequest("sku-1", "yesterday at noon");

        assertThatThrownBy(() -> ingestionService.ingest(request))
                .isInstanceOf(InvalidEventException.class)
                .hasMessageContaining("ISO-8601")
                .extracting("field").isEqualTo("timestamp");
        verify(engine, never()).submit(any());
    }

    @Test
    void ingest_timestampOutsideSupportedRange_isRejected() {
        TrackRequest request = TestDataFactory.trackRequest("sku-1", "+300000000-01-01T00:00:00Z");

        assertThatThrownBy(() -> ingestionService.ingest(request))
                .isInstanceOf(InvalidEventException.class)
                .hasMessageContaining("supported range")
                .extracting("field").isEqualTo("timestamp");
        verify(engine, never()).submit(any());
        verify(metricsConfig).recordRejected("validation");
    }

    @Test
    void ingestBatch_failedAndFutureSubmissions_areCountedAsRejected() {
        when(engine.submit(any())).thenReturn(
                CompletableFuture.failedFuture(new ArithmeticException("long overflow")),
                CompletableFuture.completedFuture(IngestOutcome.FUTURE),
                CompletableFuture.completedFuture(IngestOutcome.ACCEPTED));

        BatchResult result = ingestionService.ingestBatch(List.of(
                TestDataFactory.trackRequest("sku-1", "2025-01-27T10:30:00Z"),
                TestDataFactory.trackRequest("sku-2", "2025-01-27T10:30:00Z"),
                TestDataFactory.trackRequest("sku-3", "2025-01-27T10:30:00Z")));

        assertThat(result.getAccepted()).isEqualTo(1);
        assertThat(result.getRejected()).isEqualTo(2);
        assertThat(result.getLate()).isZero();
    }

    @Test
    void ingest_missingTimestamp_isRejected() {
        TrackRequest request = TestDataFactory.trackRequest("sku-1", " ");

        assertThatThrownBy(() -> ingestionService.ingest(request))
                .isInstanceOf(InvalidEventException.class)
                .extracting("field").isEqualTo("timestamp");
    }

    @Test
    void parseTimestamp_acceptsOffsetAndLocalForms() {
        Instant expected = Instant.parse("2025-01-27T10:30:00Z");

        assertThat(IngestionService.parseTimestamp("2025-01-27T10:30:00Z")).isEqualTo(expected);
        assertThat(IngestionService.parseTimestamp("2025-01-27T10:30:00.000Z")).isEqualTo(expected);
        assertThat(IngestionService.parseTimestamp("2025-01-27T12:30:00+02:00")).isEqualTo(expected);
        assertThat(IngestionService.parseTimestamp("2025-01-27T10:30:00")).isEqualTo(expected);
        assertThat(IngestionService.parseTimestamp("27/01/2025")).isNull();
    }

    @Test
    void ingestBatch_countsEachOutcomeAndListsErrorsByIndex() {
        when(engine.submit(any()))
                .thenReturn(CompletableFuture.completedFuture(IngestOutcome.ACCEPTED))
                .thenReturn(CompletableFuture.completedFuture(IngestOutcome.LATE))
                .thenReturn(CompletableFuture.completedFuture(IngestOutcome.OVERLOADED));

        BatchResult result = ingestionService.ingestBatch(List.of(
                TestDataFactory.trackRequest("sku-1", "2025-01-27T10:30:00Z"),
                TestDataFactory.trackRequest("sku-1", "2025-01-27T10:29:00Z"),
                TestDataFactory.trackRequest(null, "2025-01-27T10:30:00Z"),
                TestDataFactory.trackRequest("sku-2", "2025-01-27T10:30:00Z")));

        assertThat(result.getAccepted()).isEqualTo(1);
        assertThat(result.getLate()).isEqualTo(1);
        assertThat(result.getRejected()).isEqualTo(2);
        assertThat(result.getErrors()).hasSize(1);
        assertThat(result.getErrors().get(0)).startsWith("[2] product_id");
        verify(engine, times(3)).submit(any());
    }
}
