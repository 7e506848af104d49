package com.bank.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Human review request for an interrupted agent action")
public class ReviewRequest {

    @Schema(description = "Review identifier")
    private UUID reviewId;

    @Schema(description = "Decision that triggered the review")
    private UUID decisionId;

    @Schema(description = "Creation time (epoch millis)", example = "1718000000000")
    private long createdAt;

    @Schema(description = "Reviewer context, forwarded verbatim from the caller")
    private Map<String, Object> context;

    private Long reviewedAt;            // null while pending
    private Boolean approved;           // null while pending or expired
    private String reviewerId;          // reviewer ID or "SYSTEM" for expiry
    private String notes;

    @Schema(description = "Lifecycle status", example = "PENDING")
    private ReviewStatus status;

    @Schema(description = "Oversight tier of the triggering decision", example = "tier_1")
    private OversightTier tier;

    @Schema(description = "Reason of the triggering decision", example = "tier_1_action:sar_filing")
    private String reason;
}
