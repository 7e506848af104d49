package com.bank.governance.service;

import com.bank.governance.config.MetricsConfig;
import com.bank.governance.config.ReviewConfig;
import com.bank.governance.exception.GovernanceValidationException;
import com.bank.governance.exception.ReviewNotFoundException;
import com.bank.governance.model.InterruptDecision;
import com.bank.governance.model.Outcome;
import com.bank.governance.model.PagedResponse;
import com.bank.governance.model.ReviewRequest;
import com.bank.governance.model.ReviewStatus;
import com.bank.governance.model.ValidationError;
import com.bank.governance.repository.ReviewRequestRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Service
public class ReviewQueueService {

    private static final Logger log = LoggerFactory.getLogger(ReviewQueueService.class);

    private final ReviewRequestRepository reviewRepo;
    private final ReviewerNotificationService notificationService;
    private final ReviewConfig reviewConfig;
    private final MetricsConfig metricsConfig;

    public ReviewQueueService(ReviewRequestRepository reviewRepo,
                              ReviewerNotificationService notificationService,
                              ReviewConfig reviewConfig,
                              MetricsConfig metricsConfig) {
        this.reviewRepo = reviewRepo;
        this.notificationService = notificationService;
        this.reviewConfig = reviewConfig;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Queue an interrupted decision for a human reviewer.
     *
     * @return the new review id, or a rejection if the decision did not interrupt
     */
    @Observed(name = "review.request", contextualName = "request-human-review")
    public Outcome<UUID> requestHumanReview(InterruptDecision decision, Map<String, Object> context) {
        if (decision == null) {
            return Outcome.rejected("decision", "decision is required");
        }
        if (!decision.isShouldInterrupt()) {
            return Outcome.rejected("decision", "only interrupting decisions can be queued for review");
        }
        if (decision.getDecisionId() == null || decision.getTier() == null) {
            return Outcome.rejected("decision", "decisionId and tier are required");
        }

        ReviewRequest request = ReviewRequest.builder()
                .reviewId(UUID.randomUUID())
                .decisionId(decision.getDecisionId())
                .createdAt(System.currentTimeMillis())
                .context(context != null ? context : new HashMap<>())
                .status(ReviewStatus.PENDING)
                .tier(decision.getTier())
                .reason(decision.getReason())
                .build();

        try {
            reviewRepo.create(request);
        } catch (IllegalArgumentException e) {
            return Outcome.rejected("context", e.getMessage());
        }

        metricsConfig.recordReviewRequested(request.getTier().getValue());
        log.info("Review requested: review={}, decision={}, tier={}",
                request.getReviewId(), request.getDecisionId(), request.getTier().getValue());

        if (reviewConfig.getNotifyTiers().contains(request.getTier())) {
            notificationService.notifyReviewRequested(request);
        }
        return Outcome.ok(request.getReviewId());
    }

    /**
     * Record a reviewer's verdict on a pending review.
     *
     * @throws GovernanceValidationException if the reviewer id is blank
     * @throws ReviewNotFoundException       if no review has this id
     * @throws com.bank.governance.exception.ReviewAlreadyResolvedException if it is no longer pending
     */
    public ReviewRequest recordHumanDecision(UUID reviewId, boolean approved, String reviewerId, String notes) {
        if (reviewerId == null || reviewerId.isBlank()) {
            throw new GovernanceValidationException(new ValidationError("reviewerId", "reviewerId is required"));
        }
        ReviewStatus status = approved ? ReviewStatus.APPROVED : ReviewStatus.REJECTED;
        ReviewRequest resolved = reviewRepo.resolve(reviewId, status, approved, reviewerId, notes);

        metricsConfig.recordReviewResolved(status.name());
        log.info("Review resolved: review={}, status={}, by={}", reviewId, status, reviewerId);
        return resolved;
    }

    public ReviewRequest getReview(UUID reviewId) {
        ReviewRequest request = reviewRepo.findById(reviewId);
        if (request == null) {
            throw new ReviewNotFoundException(reviewId);
        }
        return request;
    }

    public PagedResponse<ReviewRequest> getPendingReviews(int limit, Long before) {
        return reviewRepo.findByStatus(ReviewStatus.PENDING, limit, before);
    }

    public Map<String, Integer> getReviewStats() {
        Map<ReviewStatus, Integer> counts = reviewRepo.countByStatus();
        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("pending", counts.getOrDefault(ReviewStatus.PENDING, 0));
        stats.put("approved", counts.getOrDefault(ReviewStatus.APPROVED, 0));
        stats.put("rejected", counts.getOrDefault(ReviewStatus.REJECTED, 0));
        stats.put("expired", counts.getOrDefault(ReviewStatus.EXPIRED, 0));
        return stats;
    }
}
