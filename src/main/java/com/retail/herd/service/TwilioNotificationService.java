package com.retail.herd.service;

import com.retail.herd.config.MetricsConfig;
import com.retail.herd.config.TwilioNotificationConfig;
import com.retail.herd.model.TrendAlert;
import com.retail.herd.model.TrendDirection;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TwilioNotificationService implements AlertListener {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio notification service is DISABLED.");
        }
    }

    @Override
    public String name() {
        return "twilio";
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    /**
     * Texts the on-call number when a product starts trending. Clears are not sent.
     */
    @Override
    @Observed(name = "notification.send", contextualName = "send-trend-notification")
    public void onAlert(TrendAlert alert) {
        if (!config.isEnabled() || alert.isClear()) {
            return;
        }
        if (alert.trendDirection() == TrendDirection.DOWN && !config.isNotifyOnCollapse()) {
            log.debug("Skipping collapse notification for product={}", alert.productId());
            return;
        }

        try {
            String body = buildMessageBody(alert);
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getToNumber());

            Message message = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    body
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Twilio notification sent for product={}, sid={}", alert.productId(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send Twilio notification for product={}: {}", alert.productId(), e.getMessage(), e);
        }
    }

    String buildMessageBody(TrendAlert alert) {
        String headline = alert.trendDirection().getLabel().equals("up")
                ? "[TREND ALERT] Product is trending UP"
                : "[TREND ALERT] Product is trending DOWN";

        return String.format(
                "%s\n" +
                "Product: %s\n" +
                "Events in bucket: %d\n" +
                "Baseline: %.1f +/- %.1f\n" +
                "Z-Score: %.2f\n" +
                "Bucket start: %s",
                headline,
                alert.productId(),
                alert.currentCount(),
                alert.baselineMean(),
                alert.baselineStd(),
                alert.zScore(),
                alert.bucketStart()
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
