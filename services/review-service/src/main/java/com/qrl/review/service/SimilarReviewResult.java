package com.qrl.review.service;

import com.qrl.review.model.CandidateResult;
import java.util.List;

/**
 * @param candidates fused candidates, best first
 * @param hits the same candidates with display metadata, in the same order
 * @param vectorStatus {@code ok}, {@code skipped}, {@code timeout}, {@code error} or {@code circuit_open}
 * @param message neutral notice when nothing matched, otherwise {@code null}
 */
public record SimilarReviewResult(
    List<CandidateResult> candidates,
    List<SimilarReviewHit> hits,
    String vectorStatus,
    String message,
    long tookMs
) {
}
