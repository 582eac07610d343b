package com.qrl.review.issues;

public enum ResolutionPath {
    CATEGORY,
    EMBEDDING,
    UNRESOLVED
}
