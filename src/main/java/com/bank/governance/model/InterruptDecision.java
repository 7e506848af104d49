package com.bank.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@Jacksonized
@Schema(description = "Oversight classification of a proposed agent action")
public class InterruptDecision {

    @Schema(description = "Whether execution must pause for human review", example = "true")
    boolean shouldInterrupt;

    @Schema(description = "The rule(s) that set the tier", example = "low_confidence:0.72<0.85;high_amount:15000>10000;tier_2_sampled")
    String reason;

    @Schema(description = "Assigned oversight tier", example = "tier_2")
    OversightTier tier;

    @Schema(description = "Agent confidence in the action (0-1)", example = "0.72")
    double confidence;

    @Schema(description = "Disputed amount, if the action is financial", example = "15000")
    Double amount;

    @Schema(description = "Dispute category", example = "fraud")
    String disputeType;

    @Schema(description = "Proposed action", example = "refund_issue")
    String actionType;

    @Schema(description = "Tier-2 sampling verdict, null outside Tier 2", example = "true")
    Boolean sampled;

    @Schema(description = "When the decision was made")
    Instant timestamp;

    @Schema(description = "Unique id used to correlate audit rows and reviews")
    UUID decisionId;
}
