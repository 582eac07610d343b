package com.qrl.review.model;

public enum ReviewStatus {
    SELECTED,
    GRADED
}
