package com.retail.herd.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A validated interaction event. Immutable; consumed once by the owning shard.
 */
@Value
@Builder
public class InteractionEvent {
    String eventType;
    String productId;
    Instant timestamp;
    String userId;
    String sessionId;
    Map<String, Object> metadata;
}
