package com.retail.herd.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Inbound interaction record as posted by the collector. Field names follow the collector's
 * snake_case wire format; nothing here is trusted until validated into an {@link InteractionEvent}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A product interaction event submitted for trend detection")
public class TrackRequest {

    @JsonProperty("event_type")
    @Schema(description = "Interaction type", example = "view_product")
    private String eventType;

    @JsonProperty("product_id")
    @Schema(description = "Product identifier (the detection key). Required.", example = "sneaker-limited-001")
    private String productId;

    @JsonProperty("timestamp")
    @Schema(description = "Event time, ISO-8601. Required.", example = "2025-01-27T10:30:00Z")
    private String timestamp;

    @JsonProperty("user_id")
    @Schema(description = "User identifier", example = "user-4821")
    private String userId;

    @JsonProperty("session_id")
    @Schema(description = "Session identifier", example = "session-1738000000000-k3j9x2a1b")
    private String sessionId;

    @JsonProperty("metadata")
    @Schema(description = "Opaque metadata (region, device, ...)")
    private Map<String, Object> metadata;
}
