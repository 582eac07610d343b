package com.qrl.review.model;

public record TicketContent(String notes, String feedback, String shortDescription) implements ReviewContent {
    @Override
    public ReviewKind kind() {
        return ReviewKind.TICKET;
    }
}
