package com.qrl.review.merge;

import com.qrl.review.model.CandidateResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Max-score merge of keyword and vector candidates. */
public final class ScoreFusion {
    private ScoreFusion() {
    }

    public static List<CandidateResult> fuse(
        List<CandidateResult> keywordResults,
        List<CandidateResult> vectorResults,
        int limit
    ) {
        Map<Long, CandidateResult> best = new LinkedHashMap<>();
        mergeInto(best, keywordResults);
        mergeInto(best, vectorResults);

        List<CandidateResult> fused = new ArrayList<>(best.values());
        fused.sort(
            Comparator.comparingInt(CandidateResult::score).reversed()
                .thenComparingLong(CandidateResult::documentId)
        );
        int size = Math.max(0, limit);
        return fused.size() > size ? List.copyOf(fused.subList(0, size)) : List.copyOf(fused);
    }

    private static void mergeInto(Map<Long, CandidateResult> best, List<CandidateResult> results) {
        if (results == null) {
            return;
        }
        for (CandidateResult result : results) {
            // ties keep the earlier entry, so keyword wins an equal score
            best.merge(result.documentId(), result, (current, incoming) ->
                incoming.score() > current.score() ? incoming : current);
        }
    }
}
