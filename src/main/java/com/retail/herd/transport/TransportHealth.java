package com.retail.herd.transport;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Last known state of the broker connection as seen by the alert publisher. Broker trouble never
 * takes the detector down; it only marks the transport as degraded.
 */
@Component
public class TransportHealth {

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicReference<String> lastError = new AtomicReference<>();
    private final AtomicReference<Instant> lastFailureAt = new AtomicReference<>();
    private final AtomicReference<Instant> lastSuccessAt = new AtomicReference<>();

    public void recordSuccess() {
        consecutiveFailures.set(0);
        lastSuccessAt.set(Instant.now());
    }

    public void recordFailure(String error) {
        consecutiveFailures.incrementAndGet();
        lastError.set(error);
        lastFailureAt.set(Instant.now());
    }

    public boolean isDegraded() {
        return consecutiveFailures.get() > 0;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public String getLastError() {
        return lastError.get();
    }

    public Instant getLastFailureAt() {
        return lastFailureAt.get();
    }

    public Instant getLastSuccessAt() {
        return lastSuccessAt.get();
    }
}
