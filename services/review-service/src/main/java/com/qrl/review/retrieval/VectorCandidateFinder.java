package com.qrl.review.retrieval;

import com.qrl.review.common.ProviderUnavailableException;
import com.qrl.review.embed.EmbeddingProvider;
import com.qrl.review.model.CandidateResult;
import com.qrl.review.model.MatchType;
import com.qrl.review.model.ReviewRecord;
import com.qrl.review.store.ReviewStore;
import com.qrl.review.text.ReviewTextExtractor;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores stored embeddings against the query embedding. Never throws on
 * provider trouble: a failed or empty query embedding means no candidates,
 * and {@link #search} reports the failure reason to the caller.
 */
@Component
public class VectorCandidateFinder implements CandidateFinder {
    private static final Logger logger = LoggerFactory.getLogger(VectorCandidateFinder.class);

    private final ReviewStore reviewStore;
    private final EmbeddingProvider embeddingProvider;
    private final ReviewTextExtractor textExtractor;
    private final SimilarityProperties properties;
    private final MeterRegistry meterRegistry;

    public VectorCandidateFinder(
        ReviewStore reviewStore,
        EmbeddingProvider embeddingProvider,
        ReviewTextExtractor textExtractor,
        SimilarityProperties properties,
        MeterRegistry meterRegistry
    ) {
        this.reviewStore = reviewStore;
        this.embeddingProvider = embeddingProvider;
        this.textExtractor = textExtractor;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public String name() {
        return "vector";
    }

    @Override
    public List<CandidateResult> find(CandidateQuery query) {
        return search(query).candidates();
    }

    public VectorSearch search(CandidateQuery query) {
        if (query.text().length() < textExtractor.getMinEmbeddableLength()) {
            return VectorSearch.of(List.of());
        }
        List<Double> queryVector;
        try {
            queryVector = embeddingProvider.embed(query.text());
        } catch (ProviderUnavailableException ex) {
            meterRegistry.counter("review.similar.vector.skipped", "reason", ex.getReason()).increment();
            logger.warn("similar_vector_embed_failed reason={}", ex.getReason());
            return VectorSearch.failed(ex.getReason());
        }
        if (queryVector == null || queryVector.isEmpty()) {
            return VectorSearch.of(List.of());
        }

        List<ReviewRecord> pool = reviewStore.findEmbeddedCandidates(
            query.excludeIds(),
            query.categories(),
            properties.getVectorPoolLimit()
        );
        List<CandidateResult> scored = new ArrayList<>();
        int dimensionMismatches = 0;
        for (ReviewRecord record : pool) {
            if (record.id() == null || query.excludeIds().contains(record.id()) || !record.hasFreshEmbedding()) {
                continue;
            }
            if (record.embedding().size() != queryVector.size()) {
                dimensionMismatches++;
                continue;
            }
            int score = VectorMath.similarityScore(queryVector, record.embedding());
            if (score >= properties.getVectorFloor()) {
                scored.add(new CandidateResult(record.id(), score, MatchType.EMBEDDING));
            }
        }
        if (dimensionMismatches > 0) {
            meterRegistry.counter("review.similar.vector.dimension_mismatch").increment(dimensionMismatches);
            logger.warn(
                "similar_vector_dimension_mismatch records={} query_dims={} hint=run_force_backfill",
                dimensionMismatches,
                queryVector.size()
            );
        }
        scored.sort(
            Comparator.comparingInt(CandidateResult::score).reversed()
                .thenComparingLong(CandidateResult::documentId)
        );
        return VectorSearch.of(scored.size() > properties.getVectorTopN()
            ? scored.subList(0, properties.getVectorTopN())
            : scored);
    }
}
