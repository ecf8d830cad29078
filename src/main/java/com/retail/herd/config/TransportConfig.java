package com.retail.herd.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "herd.transport")
public class TransportConfig {

    // Kafka ingestion and alert publishing are off unless a broker is configured.
    private boolean enabled = false;

    private String eventsTopic = "user_events";
    private String alertsTopic = "alerts";
    private String groupId = "herd-trend-detector";

    // Reconnect/retry curve: initialBackoff * multiplier^n, capped at maxBackoff, for at most maxAttempts tries.
    private int maxAttempts = 10;
    private Duration initialBackoff = Duration.ofSeconds(1);
    private double multiplier = 2.0;
    private Duration maxBackoff = Duration.ofSeconds(30);

    // Per-attempt wait for a broker acknowledgement.
    private Duration sendTimeout = Duration.ofSeconds(5);
}
