package com.qrl.review.retrieval;

import java.util.List;
import java.util.Set;

/**
 * Input of one finder call.
 *
 * @param text normalized query text
 * @param excludeIds ids that must not be returned
 * @param categories optional label filter; when non-empty a record must share one label
 */
public record CandidateQuery(String text, Set<Long> excludeIds, List<String> categories) {
    public CandidateQuery {
        text = text == null ? "" : text;
        excludeIds = excludeIds == null ? Set.of() : Set.copyOf(excludeIds);
        categories = categories == null ? List.of() : List.copyOf(categories);
    }
}
