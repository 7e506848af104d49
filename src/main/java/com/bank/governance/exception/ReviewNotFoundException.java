package com.bank.governance.exception;

import java.util.UUID;

public class ReviewNotFoundException extends RuntimeException {

    private final UUID reviewId;

    public ReviewNotFoundException(UUID reviewId) {
        super("Review request not found: " + reviewId);
        this.reviewId = reviewId;
    }

    public UUID getReviewId() {
        return reviewId;
    }
}
