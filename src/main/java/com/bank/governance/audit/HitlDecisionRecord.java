package com.bank.governance.audit;

import lombok.Builder;
import lombok.Value;

/**
 * Audit projection of one oversight decision. Exactly one is written per evaluation.
 */
@Value
@Builder
public class HitlDecisionRecord implements AuditEvent {
    String decisionId;
    long timestamp;
    boolean shouldInterrupt;
    String reason;
    String tier;
    double confidence;
    Double amount;
    String disputeType;
    String actionType;
    String sessionId;
    String agentId;

    @Override
    public String getEventId() {
        return decisionId;
    }
}
