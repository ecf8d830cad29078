package com.retail.herd.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI herdTrendDetectorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Herd Trend Detector API")
                        .version("1.0.0")
                        .description(
                                "Real-time detection of herd behavior: sustained surges or collapses in the rate of " +
                                "interaction events for a single product.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Receive events via `POST /events/track` (or the `user_events` Kafka topic)\n" +
                                "2. Count events per product into fixed-width time buckets (sharded by product)\n" +
                                "3. On bucket rollover, score the sealed bucket against the product's rolling baseline (z-score)\n" +
                                "4. Debounce the score through a hysteresis state machine " +
                                "(NORMAL → RISING → TRENDING_UP → FALLING → NORMAL, and the symmetric downward path)\n" +
                                "5. Publish a trend alert on entering or leaving a trend, subject to a per-product cooldown\n\n" +
                                "**Read paths:** `GET /trends` (pull snapshot, ordered by |z|) and " +
                                "`GET /trends/stream` (push feed of alerts as Server-Sent Events).")
                        .contact(new Contact().name("Herd Detection Team")));
    }
}
