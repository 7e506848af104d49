package com.bank.governance.config;

import com.bank.governance.exception.GovernanceConfigurationException;
import com.bank.governance.model.OversightTier;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "governance.review")
public class ReviewConfig {

    // Sweep PENDING reviews older than expiryTimeoutMs to EXPIRED.
    private boolean expiryEnabled = true;

    private long expiryTimeoutMs = 86_400_000L;  // 24 hours

    private int expiryCheckIntervalSeconds = 60;

    // Tiers whose review requests page the on-call reviewer.
    private List<OversightTier> notifyTiers = new ArrayList<>(List.of(OversightTier.TIER_1_HIGH));

    @PostConstruct
    public void validate() {
        if (expiryTimeoutMs <= 0) {
            throw new GovernanceConfigurationException("governance.review.expiry-timeout-ms must be > 0");
        }
        if (expiryCheckIntervalSeconds <= 0) {
            throw new GovernanceConfigurationException(
                    "governance.review.expiry-check-interval-seconds must be > 0");
        }
    }
}
