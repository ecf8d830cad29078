package com.retail.herd.transport;

import com.retail.herd.config.TransportConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.util.concurrent.Callable;

/**
 * Bounded retry for broker operations: {@code initialBackoff * multiplier^n} between attempts,
 * capped at {@code maxBackoff}, giving up after {@code maxAttempts} tries.
 */
@Component
public class BackoffRetrier {

    private static final Logger log = LoggerFactory.getLogger(BackoffRetrier.class);

    private final TransportConfig config;
    private final Sleeper sleeper;

    @Autowired
    public BackoffRetrier(TransportConfig config) {
        this(config, Thread::sleep);
    }

    BackoffRetrier(TransportConfig config, Sleeper sleeper) {
        this.config = config;
        this.sleeper = sleeper;
    }

    public <T> T execute(String operation, Callable<T> action) throws TransportUnavailableException {
        BackOffExecution backOff = newBackOff().start();
        int maxAttempts = Math.max(1, config.getMaxAttempts());

        for (int attempt = 1; ; attempt++) {
            try {
                return action.call();
            } catch (Exception e) {
                if (attempt >= maxAttempts) {
                    throw new TransportUnavailableException(operation, attempt, e);
                }
                long delay = backOff.nextBackOff();
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, maxAttempts, delay, e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new TransportUnavailableException(operation, attempt, ie);
                }
            }
        }
    }

    ExponentialBackOff newBackOff() {
        ExponentialBackOff backOff = new ExponentialBackOff(
                config.getInitialBackoff().toMillis(), config.getMultiplier());
        backOff.setMaxInterval(config.getMaxBackoff().toMillis());
        return backOff;
    }
}
