package com.bank.governance.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScanType {
    USER_INPUT("user_input"),
    AGENT_OUTPUT("agent_output");

    private final String value;

    ScanType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
