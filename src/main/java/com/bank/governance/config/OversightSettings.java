package com.bank.governance.config;

import com.bank.governance.model.OversightTier;
import lombok.With;

import java.util.List;

/**
 * One consistent set of oversight thresholds and action lists. A classification reads exactly one
 * instance, so a runtime update is seen either entirely or not at all.
 */
@With
public record OversightSettings(OversightTier defaultTier,
                                double confidenceThreshold,
                                double amountThreshold,
                                double sampleRateTier2,
                                List<String> tier1Actions,
                                List<String> tier3Actions,
                                List<String> highRiskDisputeTypes) {

    public OversightSettings {
        tier1Actions = tier1Actions != null ? List.copyOf(tier1Actions) : List.of();
        tier3Actions = tier3Actions != null ? List.copyOf(tier3Actions) : List.of();
        highRiskDisputeTypes = highRiskDisputeTypes != null ? List.copyOf(highRiskDisputeTypes) : List.of();
    }

    /**
     * Description of the first invalid setting, or null when the combination is valid.
     */
    public String describeProblem() {
        return OversightConfig.describeProblem(defaultTier, confidenceThreshold, amountThreshold,
                sampleRateTier2, tier1Actions, tier3Actions);
    }
}
