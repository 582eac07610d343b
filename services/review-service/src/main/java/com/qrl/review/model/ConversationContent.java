package com.qrl.review.model;

public record ConversationContent(
    String notes,
    String feedback,
    String shortDescription,
    String conversationExcerpt
) implements ReviewContent {
    @Override
    public ReviewKind kind() {
        return ReviewKind.CONVERSATION;
    }
}
