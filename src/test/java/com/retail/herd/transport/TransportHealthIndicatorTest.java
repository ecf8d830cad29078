package com.retail.herd.transport;

import com.retail.herd.config.TransportConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

class TransportHealthIndicatorTest {

    private TransportConfig config;
    private TransportHealth health;
    private TransportHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        config = new TransportConfig();
        health = new TransportHealth();
        indicator = new TransportHealthIndicator(config, health);
    }

    @Test
    void disabledTransport_isUp() {
        Health result = indicator.health();

        assertThat(result.getStatus()).isEqualTo(Status.UP);
        assertThat(result.getDetails()).containsEntry("transport", "disabled");
    }

    @Test
    void failedPublish_reportsDegradedNotDown() {
        config.setEnabled(true);
        health.recordFailure("publish alert failed after 10 attempts");

        Health result = indicator.health();

        assertThat(result.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(result.getDetails()).containsEntry("consecutiveFailures", 1);
        assertThat(result.getDetails()).containsKey("lastError");
    }

    @Test
    void successAfterFailure_restoresUp() {
        config.setEnabled(true);
        health.recordFailure("timeout");
        health.recordSuccess();

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
    }
}
