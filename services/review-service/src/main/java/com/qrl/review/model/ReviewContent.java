package com.qrl.review.model;

/**
 * Content-bearing fields of a review. Each record kind has its own shape;
 * {@link com.qrl.review.text.ReviewTextExtractor} is the only place that
 * turns a variant into searchable text.
 */
public sealed interface ReviewContent permits TicketContent, ConversationContent {
    String notes();

    String feedback();

    String shortDescription();

    ReviewKind kind();
}
