package com.retail.herd.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * SMS / WhatsApp delivery of trend alerts to the merchandising on-call number.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String toNumber;
    private boolean enabled = false;
    private String channel = "sms";  // "sms" or "whatsapp"

    // When false only surges (TrendingUp) are texted; collapses still reach the other sinks.
    private boolean notifyOnCollapse = true;
}
