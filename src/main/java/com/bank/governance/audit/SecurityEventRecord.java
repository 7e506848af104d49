package com.bank.governance.audit;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Audit projection of a scan. Carries the SHA-256 of the input, never the input itself.
 */
@Value
@Builder
public class SecurityEventRecord implements AuditEvent {
    String eventId;
    long timestamp;
    String inputHash;
    int inputLength;
    boolean safe;
    String threatType;
    double confidence;
    List<String> matchedPatterns;
    double scanDurationMs;
    String sessionId;
    String userId;
    String agentId;
    String scannerVersion;
    String scanType;
}
