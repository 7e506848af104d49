package com.bank.governance.engine;

import com.bank.governance.config.OversightConfig;
import com.bank.governance.config.OversightSettings;
import com.bank.governance.model.OversightTier;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Pure tier assignment. Rules are evaluated in strict precedence and the first match wins:
 * <ol>
 *   <li>Tier-1 action: TIER_1_HIGH, always interrupts.</li>
 *   <li>Low confidence, amount over threshold or high-risk dispute: TIER_2_MEDIUM, interrupts
 *       only when the decision id is sampled.</li>
 *   <li>Otherwise TIER_3_LOW for listed Tier-3 actions, else the configured default tier.</li>
 * </ol>
 * Inputs are assumed valid; range checks happen in {@code OversightService}.
 */
@Component
public class OversightClassifier {

    static final String SAMPLED = "tier_2_sampled";
    static final String AUTO_PROCEED = "tier_2_auto_proceed";

    private final OversightConfig config;

    public OversightClassifier(OversightConfig config) {
        this.config = config;
    }

    public Classification classify(UUID decisionId, double confidence, Double amount,
                                   String disputeType, String actionType) {
        OversightSettings settings = config.current();
        if (actionType != null && settings.tier1Actions().contains(actionType)) {
            return new Classification(OversightTier.TIER_1_HIGH, true, "tier_1_action:" + actionType, null);
        }

        List<String> triggers = new ArrayList<>(3);
        double confidenceThreshold = settings.confidenceThreshold();
        double amountThreshold = settings.amountThreshold();
        if (confidence < confidenceThreshold) {
            triggers.add("low_confidence:" + format(confidence) + "<" + format(confidenceThreshold));
        }
        if (amount != null && amount > amountThreshold) {
            triggers.add("high_amount:" + format(amount) + ">" + format(amountThreshold));
        }
        if (disputeType != null && settings.highRiskDisputeTypes().contains(disputeType)) {
            triggers.add("high_risk_dispute:" + disputeType);
        }
        if (!triggers.isEmpty()) {
            return sampledTier2(decisionId, settings, String.join(";", triggers));
        }

        if (actionType != null && settings.tier3Actions().contains(actionType)) {
            return new Classification(OversightTier.TIER_3_LOW, false, "tier_3_action:" + actionType, null);
        }
        if (settings.defaultTier() == OversightTier.TIER_2_MEDIUM) {
            return sampledTier2(decisionId, settings, "default_tier:" + OversightTier.TIER_2_MEDIUM.getValue());
        }
        return new Classification(OversightTier.TIER_3_LOW, false, "within_thresholds", null);
    }

    /**
     * Tier implied by the type-based rules alone. Agrees with {@link #classify} for any
     * confidence above and amount below the thresholds.
     */
    public OversightTier tierFor(String disputeType, String actionType) {
        OversightSettings settings = config.current();
        if (actionType != null && settings.tier1Actions().contains(actionType)) {
            return OversightTier.TIER_1_HIGH;
        }
        if (disputeType != null && settings.highRiskDisputeTypes().contains(disputeType)) {
            return OversightTier.TIER_2_MEDIUM;
        }
        if (actionType != null && settings.tier3Actions().contains(actionType)) {
            return OversightTier.TIER_3_LOW;
        }
        return settings.defaultTier();
    }

    private Classification sampledTier2(UUID decisionId, OversightSettings settings, String reason) {
        boolean sampled = TierSampler.isSampled(decisionId, settings.sampleRateTier2());
        return new Classification(OversightTier.TIER_2_MEDIUM, sampled,
                reason + ";" + (sampled ? SAMPLED : AUTO_PROCEED), sampled);
    }

    static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Value
    public static class Classification {
        OversightTier tier;
        boolean shouldInterrupt;
        String reason;
        Boolean sampled;    // null outside Tier 2
    }
}
