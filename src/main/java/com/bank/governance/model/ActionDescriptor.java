package com.bank.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A proposed agent action submitted for oversight classification.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Proposed agent action to classify")
public class ActionDescriptor {

    public static final String DEFAULT_DISPUTE_TYPE = "general";

    @Schema(description = "Agent confidence in the action (0-1)", example = "0.72", requiredMode = Schema.RequiredMode.REQUIRED)
    private Double confidence;

    @Schema(description = "Disputed amount; omit for non-financial actions", example = "15000")
    private Double amount;

    @Schema(description = "Dispute category, defaults to 'general'", example = "fraud")
    private String disputeType;

    @Schema(description = "Action the agent intends to take", example = "sar_filing")
    private String actionType;

    @Schema(description = "Conversation session id for audit correlation", example = "sess-42")
    private String sessionId;

    @Schema(description = "Proposing agent id for audit correlation", example = "dispute-agent")
    private String agentId;
}
