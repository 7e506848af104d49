package com.bank.governance.config;

import com.bank.governance.exception.GovernanceConfigurationException;
import com.bank.governance.model.OversightTier;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tier assignment thresholds and action sets, bound from {@code governance.oversight.*}.
 *
 * <p>All values live in one immutable {@link OversightSettings} behind an atomic reference.
 * Readers take {@link #current()} once per classification; the config API replaces the whole
 * set with {@link #apply}.
 */
@Configuration
@ConfigurationProperties(prefix = "governance.oversight")
public class OversightConfig {

    private final AtomicReference<OversightSettings> settings = new AtomicReference<>(new OversightSettings(
            // Tier for actions that trip no rule and are not listed as Tier-3 actions.
            OversightTier.TIER_3_LOW,
            // Agent confidence below this escalates to Tier 2.
            0.85,
            // Amounts strictly above this escalate to Tier 2.
            10000.0,
            // Share of Tier-2 decisions routed to a human (0-1), sampled by decision id.
            0.10,
            // Regulatory actions that always require human approval.
            List.of("sar_filing", "payment_block", "account_close", "fraud_escalation"),
            // Read-only actions that are logged but never interrupt.
            List.of("info_lookup", "status_lookup", "knowledge_search", "faq_response"),
            List.of("fraud", "identity_theft", "money_laundering", "account_takeover")));

    @PostConstruct
    public void validate() {
        String problem = current().describeProblem();
        if (problem != null) {
            throw new GovernanceConfigurationException("governance.oversight: " + problem);
        }
    }

    public OversightSettings current() {
        return settings.get();
    }

    /**
     * Replace every setting at once.
     *
     * @throws IllegalArgumentException if the combination is invalid; the active settings are kept
     */
    public void apply(OversightSettings next) {
        String problem = next.describeProblem();
        if (problem != null) {
            throw new IllegalArgumentException(problem);
        }
        settings.set(next);
    }

    /**
     * Returns a description of the first invalid setting, or null when the combination is valid.
     */
    public static String describeProblem(OversightTier defaultTier, double confidenceThreshold,
                                         double amountThreshold, double sampleRateTier2,
                                         List<String> tier1Actions, List<String> tier3Actions) {
        if (defaultTier == null) {
            return "defaultTier is required";
        }
        if (defaultTier == OversightTier.TIER_1_HIGH) {
            return "defaultTier must be TIER_2_MEDIUM or TIER_3_LOW";
        }
        if (!(confidenceThreshold >= 0 && confidenceThreshold <= 1)) {
            return "confidenceThreshold must be in [0, 1]";
        }
        if (!(amountThreshold >= 0) || Double.isInfinite(amountThreshold)) {
            return "amountThreshold must be a finite value >= 0";
        }
        if (!(sampleRateTier2 >= 0 && sampleRateTier2 <= 1)) {
            return "sampleRateTier2 must be in [0, 1]";
        }
        if (tier1Actions == null || tier1Actions.isEmpty()) {
            return "tier1Actions must not be empty";
        }
        if (tier3Actions != null) {
            for (String action : tier3Actions) {
                if (tier1Actions.contains(action)) {
                    return "action '" + action + "' cannot be both Tier 1 and Tier 3";
                }
            }
        }
        return null;
    }

    // Property binding. Each setter swaps in a copy with one value changed.

    public OversightTier getDefaultTier() {
        return current().defaultTier();
    }

    public void setDefaultTier(OversightTier defaultTier) {
        settings.updateAndGet(s -> s.withDefaultTier(defaultTier));
    }

    public double getConfidenceThreshold() {
        return current().confidenceThreshold();
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        settings.updateAndGet(s -> s.withConfidenceThreshold(confidenceThreshold));
    }

    public double getAmountThreshold() {
        return current().amountThreshold();
    }

    public void setAmountThreshold(double amountThreshold) {
        settings.updateAndGet(s -> s.withAmountThreshold(amountThreshold));
    }

    public double getSampleRateTier2() {
        return current().sampleRateTier2();
    }

    public void setSampleRateTier2(double sampleRateTier2) {
        settings.updateAndGet(s -> s.withSampleRateTier2(sampleRateTier2));
    }

    public List<String> getTier1Actions() {
        return current().tier1Actions();
    }

    public void setTier1Actions(List<String> tier1Actions) {
        settings.updateAndGet(s -> s.withTier1Actions(tier1Actions));
    }

    public List<String> getTier3Actions() {
        return current().tier3Actions();
    }

    public void setTier3Actions(List<String> tier3Actions) {
        settings.updateAndGet(s -> s.withTier3Actions(tier3Actions));
    }

    public List<String> getHighRiskDisputeTypes() {
        return current().highRiskDisputeTypes();
    }

    public void setHighRiskDisputeTypes(List<String> highRiskDisputeTypes) {
        settings.updateAndGet(s -> s.withHighRiskDisputeTypes(highRiskDisputeTypes));
    }
}
