package com.retail.herd.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Hysteresis state of one key. Mutated only by the shard that owns the key.
 */
@Data
@NoArgsConstructor
public class AlertState {

    private TrendStatus status = TrendStatus.NORMAL;

    // Trend currently held. UP/DOWN from the moment a trend is entered until recovery completes,
    // so FALLING with anchor UP is a recovery while FALLING with anchor NONE is a pending downtrend.
    private TrendDirection anchor = TrendDirection.NONE;

    private int consecutiveBreachCount;
    private int consecutiveRecoverCount;
    private Instant lastTransitionTime;

    // Notifications for cooldownDirection are suppressed until cooldownUntil
    private Instant cooldownUntil;
    private TrendDirection cooldownDirection = TrendDirection.NONE;

    public boolean isInCooldown(TrendDirection direction, Instant at) {
        return cooldownUntil != null
                && cooldownDirection == direction
                && at.isBefore(cooldownUntil);
    }
}
