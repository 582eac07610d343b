package com.qrl.review.common;

public class ReviewNotFoundException extends RuntimeException {
    private final long reviewId;

    public ReviewNotFoundException(long reviewId) {
        super("review not found: " + reviewId);
        this.reviewId = reviewId;
    }

    public long getReviewId() {
        return reviewId;
    }
}
