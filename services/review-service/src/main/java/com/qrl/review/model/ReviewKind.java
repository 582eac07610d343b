package com.qrl.review.model;

public enum ReviewKind {
    TICKET,
    CONVERSATION
}
