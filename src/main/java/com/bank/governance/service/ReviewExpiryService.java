package com.bank.governance.service;

import com.bank.governance.config.MetricsConfig;
import com.bank.governance.config.ReviewConfig;
import com.bank.governance.exception.ReviewAlreadyResolvedException;
import com.bank.governance.exception.ReviewNotFoundException;
import com.bank.governance.model.ReviewRequest;
import com.bank.governance.model.ReviewStatus;
import com.bank.governance.repository.ReviewRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.TimeUnit;

@Service
public class ReviewExpiryService {

    private static final Logger log = LoggerFactory.getLogger(ReviewExpiryService.class);

    static final String SYSTEM_REVIEWER = "SYSTEM";

    private final ReviewRequestRepository reviewRepo;
    private final ReviewConfig reviewConfig;
    private final MetricsConfig metricsConfig;

    public ReviewExpiryService(ReviewRequestRepository reviewRepo,
                               ReviewConfig reviewConfig,
                               MetricsConfig metricsConfig) {
        this.reviewRepo = reviewRepo;
        this.reviewConfig = reviewConfig;
        this.metricsConfig = metricsConfig;
    }

    @Scheduled(fixedRateString = "${governance.review.expiry-check-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "30")
    public void expireStaleReviewsOnSchedule() {
        if (reviewConfig.isExpiryEnabled()) {
            expireStaleReviews();
        }
    }

    /**
     * Move every PENDING review older than the configured timeout to EXPIRED.
     *
     * @return number of reviews this sweep expired
     */
    public int expireStaleReviews() {
        List<ReviewRequest> pending = reviewRepo.findPending();
        long cutoff = System.currentTimeMillis() - reviewConfig.getExpiryTimeoutMs();
        int expired = 0;

        for (ReviewRequest review : pending) {
            if (review.getCreatedAt() >= cutoff) {
                continue;
            }
            try {
                reviewRepo.resolve(review.getReviewId(), ReviewStatus.EXPIRED, null, SYSTEM_REVIEWER,
                        "expired after " + reviewConfig.getExpiryTimeoutMs() + "ms without a decision");
                expired++;
            } catch (ReviewAlreadyResolvedException | ReviewNotFoundException e) {
                log.debug("Skipped expiry of review {}: {}", review.getReviewId(), e.getMessage());
            }
        }

        if (expired > 0) {
            log.info("Expired {} stale review requests", expired);
            metricsConfig.recordReviewsExpired(expired);
        }
        return expired;
    }
}
