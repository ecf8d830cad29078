package com.retail.herd.service;

import com.retail.herd.model.TrendAlert;
import com.retail.herd.repository.AlertHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Persists every published alert so the history outlives the in-memory store.
 */
@Service
@ConditionalOnProperty(prefix = "aerospike", name = "enabled", havingValue = "true")
public class AlertHistoryService implements AlertListener {

    private static final Logger log = LoggerFactory.getLogger(AlertHistoryService.class);
    private static final int MAX_LIMIT = 500;

    private final AlertHistoryRepository repository;

    public AlertHistoryService(AlertHistoryRepository repository) {
        this.repository = repository;
    }

    @Override
    public String name() {
        return "history";
    }

    @Override
    public void onAlert(TrendAlert alert) {
        try {
            repository.save(alert);
        } catch (Exception e) {
            log.error("Failed to persist alert for product={}: {}", alert.productId(), e.getMessage(), e);
        }
    }

    public List<TrendAlert> findRecent(String productId, int limit) {
        return repository.findRecent(productId, Math.min(Math.max(1, limit), MAX_LIMIT));
    }
}
