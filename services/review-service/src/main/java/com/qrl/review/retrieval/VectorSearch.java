package com.qrl.review.retrieval;

import com.qrl.review.model.CandidateResult;
import java.util.List;

/**
 * Outcome of one vector lookup.
 *
 * @param failureReason provider reason when the query could not be embedded, else {@code null}
 */
public record VectorSearch(List<CandidateResult> candidates, String failureReason) {
    public VectorSearch {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static VectorSearch of(List<CandidateResult> candidates) {
        return new VectorSearch(candidates, null);
    }

    public static VectorSearch failed(String reason) {
        return new VectorSearch(List.of(), reason);
    }

    public boolean hasFailed() {
        return failureReason != null;
    }
}
