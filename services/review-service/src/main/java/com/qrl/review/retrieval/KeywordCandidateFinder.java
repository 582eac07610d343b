package com.qrl.review.retrieval;

import com.qrl.review.model.CandidateResult;
import com.qrl.review.model.MatchType;
import com.qrl.review.model.ReviewRecord;
import com.qrl.review.store.ReviewStore;
import com.qrl.review.text.KeywordExtractor;
import com.qrl.review.text.ReviewTextExtractor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class KeywordCandidateFinder implements CandidateFinder {
    private final ReviewStore reviewStore;
    private final KeywordExtractor keywordExtractor;
    private final ReviewTextExtractor textExtractor;
    private final SimilarityProperties properties;

    public KeywordCandidateFinder(
        ReviewStore reviewStore,
        KeywordExtractor keywordExtractor,
        ReviewTextExtractor textExtractor,
        SimilarityProperties properties
    ) {
        this.reviewStore = reviewStore;
        this.keywordExtractor = keywordExtractor;
        this.textExtractor = textExtractor;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "keyword";
    }

    @Override
    public List<CandidateResult> find(CandidateQuery query) {
        List<String> tokens = keywordExtractor.extract(query.text());
        if (tokens.isEmpty()) {
            return List.of();
        }
        List<ReviewRecord> rows = reviewStore.findKeywordCandidates(
            tokens,
            query.excludeIds(),
            query.categories(),
            properties.getKeywordRawLimit()
        );

        List<CandidateResult> scored = new ArrayList<>();
        for (ReviewRecord row : rows) {
            if (row.id() == null || query.excludeIds().contains(row.id())) {
                continue;
            }
            String haystack = textExtractor.extract(row.content()).keywordText();
            int matched = 0;
            for (String token : tokens) {
                if (haystack.contains(token)) {
                    matched++;
                }
            }
            int score = (int) Math.round(100.0 * matched / tokens.size());
            if (score >= properties.getKeywordFloor()) {
                scored.add(new CandidateResult(row.id(), score, MatchType.KEYWORD));
            }
        }
        scored.sort(
            Comparator.comparingInt(CandidateResult::score).reversed()
                .thenComparingLong(CandidateResult::documentId)
        );
        return scored.size() > properties.getKeywordTopN()
            ? List.copyOf(scored.subList(0, properties.getKeywordTopN()))
            : List.copyOf(scored);
    }
}
