package com.bank.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Human oversight tiers, ordered by severity: TIER_1_HIGH > TIER_2_MEDIUM > TIER_3_LOW.
 */
public enum OversightTier {

    TIER_1_HIGH("tier_1", 3),
    TIER_2_MEDIUM("tier_2", 2),
    TIER_3_LOW("tier_3", 1);

    private final String value;
    private final int severity;

    OversightTier(String value, int severity) {
        this.value = value;
        this.severity = severity;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getSeverity() {
        return severity;
    }

    public boolean isMoreSevereThan(OversightTier other) {
        return severity > other.severity;
    }

    @JsonCreator
    public static OversightTier fromValue(String name) {
        if (name != null) {
            String trimmed = name.trim();
            for (OversightTier tier : values()) {
                if (tier.value.equalsIgnoreCase(trimmed) || tier.name().equalsIgnoreCase(trimmed)) {
                    return tier;
                }
            }
        }
        throw new IllegalArgumentException("Unknown oversight tier: " + name);
    }
}
