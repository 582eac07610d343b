package com.qrl.review.model;

/** One scored hit of a single retrieval call; never persisted. */
public record CandidateResult(long documentId, int score, MatchType matchType) {
}
