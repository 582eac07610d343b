package com.qrl.review.issues;

import com.qrl.review.common.ProviderUnavailableException;
import com.qrl.review.model.ReviewRecord;
import com.qrl.review.retrieval.VectorMath;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Decides whether a low-scoring review was followed by a good review that fixes it.
 *
 * <p>A later good review sharing any category label resolves the bad one without
 * any check of what the reviews actually say. That can mark distinct problems in
 * the same category as resolved.
 */
@Component
@EnableConfigurationProperties(IssueAnalysisProperties.class)
public class IssueResolutionEngine {
    private static final Logger logger = LoggerFactory.getLogger(IssueResolutionEngine.class);

    private final IssueAnalysisProperties properties;

    public IssueResolutionEngine(IssueAnalysisProperties properties) {
        this.properties = properties;
    }

    public boolean isBad(ReviewRecord record) {
        return record.qualityScore() != null && record.qualityScore() < properties.getBadScoreThreshold();
    }

    public Resolution resolve(ReviewRecord bad, List<ReviewRecord> goods, RunEmbeddingCache embeddings) {
        List<ReviewRecord> later = laterGoods(bad, goods);
        if (later.isEmpty()) {
            return Resolution.unresolved();
        }

        for (ReviewRecord good : later) {
            if (bad.sharesCategoryWith(good)) {
                return Resolution.byCategory(good.id());
            }
        }

        Optional<List<Double>> badVector;
        try {
            badVector = embeddings.vectorFor(bad);
        } catch (ProviderUnavailableException ex) {
            logger.warn("issue_resolution_embed_failed review_id={} reason={}", bad.id(), ex.getReason());
            return Resolution.unresolved();
        }
        if (badVector.isEmpty()) {
            return Resolution.unresolved();
        }

        for (ReviewRecord good : later) {
            Optional<List<Double>> goodVector;
            try {
                goodVector = embeddings.vectorFor(good);
            } catch (ProviderUnavailableException ex) {
                logger.warn("issue_resolution_embed_failed review_id={} reason={}", good.id(), ex.getReason());
                continue;
            }
            if (goodVector.isEmpty()) {
                continue;
            }
            double similarity = VectorMath.cosine(badVector.get(), goodVector.get());
            if (similarity >= properties.getSimilarityThreshold()) {
                return Resolution.byEmbedding(good.id(), similarity);
            }
        }
        return Resolution.unresolved();
    }

    private List<ReviewRecord> laterGoods(ReviewRecord bad, List<ReviewRecord> goods) {
        Instant badAt = bad.gradedAt();
        List<ReviewRecord> later = new ArrayList<>();
        if (badAt == null) {
            return later;
        }
        for (ReviewRecord good : goods) {
            if (good.gradedAt() != null && good.gradedAt().isAfter(badAt)) {
                later.add(good);
            }
        }
        later.sort(Comparator.comparing(ReviewRecord::gradedAt).thenComparing(ReviewRecord::id));
        return later;
    }
}
