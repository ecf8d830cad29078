package com.retail.herd.transport;

import com.retail.herd.config.TransportConfig;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

@Component("transport")
public class TransportHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "Broker unreachable; detection continues from memory");

    private final TransportConfig config;
    private final TransportHealth health;

    public TransportHealthIndicator(TransportConfig config, TransportHealth health) {
        this.config = config;
        this.health = health;
    }

    @Override
    public Health health() {
        if (!config.isEnabled()) {
            return Health.up().withDetail("transport", "disabled").build();
        }

        Health.Builder builder = health.isDegraded() ? Health.status(DEGRADED) : Health.up();
        builder.withDetail("eventsTopic", config.getEventsTopic())
                .withDetail("alertsTopic", config.getAlertsTopic())
                .withDetail("consecutiveFailures", health.getConsecutiveFailures());
        if (health.getLastError() != null) {
            builder.withDetail("lastError", health.getLastError())
                    .withDetail("lastFailureAt", String.valueOf(health.getLastFailureAt()));
        }
        if (health.getLastSuccessAt() != null) {
            builder.withDetail("lastSuccessAt", health.getLastSuccessAt().toString());
        }
        return builder.build();
    }
}
