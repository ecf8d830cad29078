package com.retail.herd.service;

import com.retail.herd.model.TrendAlert;

/**
 * Downstream sink for published alerts. Each enabled listener gets its own subscription and
 * dispatch thread, so a slow sink only ever loses its own alerts.
 */
public interface AlertListener {

    String name();

    void onAlert(TrendAlert alert);

    default boolean isEnabled() {
        return true;
    }
}
