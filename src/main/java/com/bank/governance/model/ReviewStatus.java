package com.bank.governance.model;

public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
