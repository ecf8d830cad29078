package com.retail.herd.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retail.herd.config.MetricsConfig;
import com.retail.herd.config.TransportConfig;
import com.retail.herd.model.TrendAlert;
import com.retail.herd.service.AlertListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Publishes alerts to the alerts topic keyed by product id, so per-product order holds on the
 * broker as well.
 */
@Component
@ConditionalOnProperty(prefix = "herd.transport", name = "enabled", havingValue = "true")
public class KafkaAlertPublisher implements AlertListener {

    private static final Logger log = LoggerFactory.getLogger(KafkaAlertPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final TransportConfig config;
    private final BackoffRetrier retrier;
    private final TransportHealth health;
    private final MetricsConfig metricsConfig;

    public KafkaAlertPublisher(KafkaTemplate<String, String> kafkaTemplate,
                               ObjectMapper objectMapper,
                               TransportConfig config,
                               BackoffRetrier retrier,
                               TransportHealth health,
                               MetricsConfig metricsConfig) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.config = config;
        this.retrier = retrier;
        this.health = health;
        this.metricsConfig = metricsConfig;
    }

    @Override
    public String name() {
        return "kafka";
    }

    @Override
    public void onAlert(TrendAlert alert) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(alert);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize alert for product={}: {}", alert.productId(), e.getMessage(), e);
            return;
        }

        try {
            retrier.execute("publish alert", () -> kafkaTemplate
                    .send(config.getAlertsTopic(), alert.productId(), payload)
                    .get(config.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS));
            health.recordSuccess();
            log.debug("Alert published to {} for product={}", config.getAlertsTopic(), alert.productId());
        } catch (TransportUnavailableException e) {
            health.recordFailure(e.getMessage());
            metricsConfig.recordTransportFailure("publish");
            log.error("Dropping alert for product={} after {} attempts: {}",
                    alert.productId(), e.getAttempts(), e.getCause().getMessage());
        }
    }
}
