package com.retail.herd.service;

import com.retail.herd.model.TrendAlert;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connects every enabled {@link AlertListener} to the alert stream through its own subscription
 * and drain thread.
 */
@Service
public class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);
    private static final Duration POLL_INTERVAL = Duration.ofMillis(500);
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);

    private final AlertService alertService;
    private final ObjectProvider<AlertListener> listeners;
    private final List<AlertSubscription> subscriptions = new ArrayList<>();
    private final List<Thread> workers = new ArrayList<>();

    public AlertDispatcher(AlertService alertService, ObjectProvider<AlertListener> listeners) {
        this.alertService = alertService;
        this.listeners = listeners;
    }

    @PostConstruct
    public void start() {
        listeners.orderedStream()
                .filter(AlertListener::isEnabled)
                .forEach(this::attach);
        log.info("Alert dispatcher started with {} listeners", workers.size());
    }

    private void attach(AlertListener listener) {
        AlertSubscription subscription = alertService.subscribe();
        Thread worker = new Thread(() -> drain(listener, subscription), "herd-dispatch-" + listener.name());
        worker.setDaemon(true);
        subscriptions.add(subscription);
        workers.add(worker);
        worker.start();
        log.info("Alert listener '{}' attached to subscription {}", listener.name(), subscription.getId());
    }

    private void drain(AlertListener listener, AlertSubscription subscription) {
        while (true) {
            TrendAlert alert;
            try {
                alert = subscription.poll(POLL_INTERVAL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (alert == null) {
                if (subscription.isClosed()) return;
                continue;
            }
            try {
                listener.onAlert(alert);
            } catch (RuntimeException e) {
                log.error("Alert listener '{}' failed for product={}: {}",
                        listener.name(), alert.productId(), e.getMessage(), e);
            }
        }
    }

    public int getListenerCount() {
        return workers.size();
    }

    /**
     * Closing the subscriptions lets each worker deliver what is already queued and then exit.
     */
    @PreDestroy
    public void stop() {
        subscriptions.forEach(AlertSubscription::close);
        for (Thread worker : workers) {
            try {
                worker.join(STOP_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (worker.isAlive()) {
                log.warn("Dispatcher thread {} still busy after {}", worker.getName(), STOP_TIMEOUT);
            }
        }
    }
}
