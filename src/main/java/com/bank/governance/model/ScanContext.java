package com.bank.governance.model;

import lombok.Builder;
import lombok.Value;

/**
 * Correlation identifiers attached to a scan's audit record.
 */
@Value
@Builder
public class ScanContext {

    String sessionId;
    String userId;
    String agentId;

    @Builder.Default
    ScanType scanType = ScanType.USER_INPUT;

    public static ScanContext empty() {
        return ScanContext.builder().build();
    }
}
