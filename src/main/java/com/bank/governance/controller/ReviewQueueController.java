package com.bank.governance.controller;

import com.bank.governance.model.Outcome;
import com.bank.governance.model.PagedResponse;
import com.bank.governance.model.ReviewRequest;
import com.bank.governance.model.ReviewSubmission;
import com.bank.governance.service.ReviewQueueService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/review")
@Tag(name = "Review Queue", description = "Human review of interrupted agent actions")
public class ReviewQueueController {

    private final ReviewQueueService reviewQueueService;

    public ReviewQueueController(ReviewQueueService reviewQueueService) {
        this.reviewQueueService = reviewQueueService;
    }

    @PostMapping("/requests")
    @Operation(summary = "Request human review",
               description = "Queues an interrupting decision as a PENDING review. Tier-1 requests page the reviewer.")
    public ResponseEntity<?> requestReview(@RequestBody ReviewSubmission submission) {
        Outcome<UUID> outcome = reviewQueueService.requestHumanReview(submission.getDecision(), submission.getContext());
        if (!outcome.isOk()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", outcome.getError().message(),
                    "field", outcome.getError().field()));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("reviewId", outcome.get()));
    }

    @GetMapping("/requests")
    @Operation(summary = "List pending reviews",
               description = "Newest first. Pass nextCursor from the previous page as 'before' to continue.")
    public ResponseEntity<PagedResponse<ReviewRequest>> getPendingReviews(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) Long before) {
        return ResponseEntity.ok(reviewQueueService.getPendingReviews(Math.max(1, Math.min(limit, 500)), before));
    }

    @GetMapping("/requests/{reviewId}")
    @Operation(summary = "Get a review request")
    public ResponseEntity<ReviewRequest> getReview(@PathVariable UUID reviewId) {
        return ResponseEntity.ok(reviewQueueService.getReview(reviewId));
    }

    @PostMapping("/requests/{reviewId}/decision")
    @Operation(summary = "Record the reviewer's decision",
               description = "Moves a PENDING review to APPROVED or REJECTED. Returns 409 if it was already resolved.")
    public ResponseEntity<?> recordDecision(@PathVariable UUID reviewId,
                                            @RequestBody Map<String, Object> body) {
        Object approved = body.get("approved");
        if (!(approved instanceof Boolean approvedFlag)) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "approved must be true or false", "field", "approved"));
        }
        String reviewerId = body.get("reviewerId") != null ? body.get("reviewerId").toString() : null;
        String notes = body.get("notes") != null ? body.get("notes").toString() : null;

        return ResponseEntity.ok(reviewQueueService.recordHumanDecision(reviewId, approvedFlag, reviewerId, notes));
    }

    @GetMapping("/stats")
    @Operation(summary = "Get review queue statistics",
               description = "Returns counts by review status")
    public ResponseEntity<Map<String, Integer>> getStats() {
        return ResponseEntity.ok(reviewQueueService.getReviewStats());
    }
}
