package com.bank.governance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Reviewer paging over Twilio. Off unless {@code twilio.enabled=true}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String toNumber;            // on-call reviewer line
    private boolean enabled = false;
    private String channel = "sms";     // "sms" or "whatsapp"
    private String reviewConsoleUrl;    // appended to the message when set
}
