package com.bank.governance.exception;

import com.bank.governance.model.ReviewStatus;

import java.util.UUID;

/**
 * A review left PENDING before this transition could be applied, either earlier or by a concurrent writer.
 */
public class ReviewAlreadyResolvedException extends RuntimeException {

    private final UUID reviewId;
    private final ReviewStatus currentStatus;

    public ReviewAlreadyResolvedException(UUID reviewId, ReviewStatus currentStatus) {
        super("Review request " + reviewId + " is already " + currentStatus);
        this.reviewId = reviewId;
        this.currentStatus = currentStatus;
    }

    public UUID getReviewId() {
        return reviewId;
    }

    public ReviewStatus getCurrentStatus() {
        return currentStatus;
    }
}
