package com.retail.herd.service;

import com.retail.herd.model.TrendAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;

/**
 * Server-sent event stream of published alerts. Each client is backed by its own bounded
 * subscription, so a stalled browser only loses its own alerts.
 */
@Service
public class AlertStreamService {

    private static final Logger log = LoggerFactory.getLogger(AlertStreamService.class);
    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    private final AlertService alertService;
    private final TaskExecutor executor;

    public AlertStreamService(AlertService alertService,
                              @Qualifier("alertStreamExecutor") TaskExecutor executor) {
        this.alertService = alertService;
        this.executor = executor;
    }

    public SseEmitter registerClient(long timeoutMs) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        AlertSubscription subscription = alertService.subscribe();
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());

        try {
            emitter.send(SseEmitter.event().name("hello").data("connected"));
            executor.execute(() -> pump(emitter, subscription));
        } catch (IOException | TaskRejectedException e) {
            log.warn("Could not open alert stream {}: {}", subscription.getId(), e.getMessage());
            subscription.close();
            emitter.completeWithError(e);
        }
        return emitter;
    }

    private void pump(SseEmitter emitter, AlertSubscription subscription) {
        try {
            while (true) {
                TrendAlert alert = subscription.poll(POLL_INTERVAL);
                if (alert == null) {
                    if (subscription.isClosed()) break;
                    continue;
                }
                emitter.send(SseEmitter.event()
                        .name("trend-alert")
                        .id(alert.productId() + "-" + alert.generatedAt().toEpochMilli())
                        .data(alert));
            }
            emitter.complete();
        } catch (IOException e) {
            log.debug("Alert stream {} disconnected: {}", subscription.getId(), e.getMessage());
            subscription.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscription.close();
            emitter.complete();
        }
    }
}
