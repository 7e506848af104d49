package com.bank.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Prompt-injection threat taxonomy. Serialized by its lowercase wire value.
 */
public enum ThreatType {

    INSTRUCTION_OVERRIDE("instruction_override"),
    ROLE_HIJACK("role_hijack"),
    PROMPT_LEAK("prompt_leak"),
    DELIMITER_INJECTION("delimiter_injection"),
    JAILBREAK("jailbreak"),
    // operator-defined patterns and fail-closed classifier outages
    CUSTOM("custom");

    private final String value;

    ThreatType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolve a threat type from its wire value or enum name, ignoring case.
     *
     * @throws IllegalArgumentException if the name is not part of the taxonomy
     */
    @JsonCreator
    public static ThreatType fromValue(String name) {
        if (name != null) {
            String trimmed = name.trim();
            for (ThreatType type : values()) {
                if (type.value.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown threat type: " + name);
    }
}
