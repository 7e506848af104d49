package com.bank.governance.service;

import com.bank.governance.config.MetricsConfig;
import com.bank.governance.config.TwilioNotificationConfig;
import com.bank.governance.model.ReviewRequest;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Pages the on-call reviewer when a review request is queued.
 */
@Service
public class ReviewerNotificationService {

    private static final Logger log = LoggerFactory.getLogger(ReviewerNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public ReviewerNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Reviewer notifications initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Reviewer notifications are DISABLED.");
        }
    }

    @Async
    @Observed(name = "notification.send", contextualName = "notify-reviewer")
    public void notifyReviewRequested(ReviewRequest request) {
        if (!config.isEnabled()) {
            return;
        }

        try {
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getToNumber());

            Message message = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    buildMessageBody(request)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Reviewer notified for review={}, sid={}", request.getReviewId(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to notify reviewer for review={}: {}", request.getReviewId(), e.getMessage(), e);
        }
    }

    String buildMessageBody(ReviewRequest request) {
        StringBuilder body = new StringBuilder(String.format(
                "[HITL REVIEW] Agent action awaiting approval\n" +
                "Tier: %s\n" +
                "Review ID: %s\n" +
                "Reason: %s",
                request.getTier().getValue(),
                request.getReviewId(),
                request.getReason()));
        if (config.getReviewConsoleUrl() != null && !config.getReviewConsoleUrl().isBlank()) {
            body.append("\nReview: ").append(config.getReviewConsoleUrl())
                    .append("/").append(request.getReviewId());
        }
        return body.toString();
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
