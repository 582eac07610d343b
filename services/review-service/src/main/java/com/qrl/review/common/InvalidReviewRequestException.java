package com.qrl.review.common;

public class InvalidReviewRequestException extends RuntimeException {
    public InvalidReviewRequestException(String message) {
        super(message);
    }
}
