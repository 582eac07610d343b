package com.qrl.review.service;

import com.qrl.review.common.InvalidReviewRequestException;
import com.qrl.review.common.ReviewNotFoundException;
import com.qrl.review.embed.EmbeddingProvider;
import com.qrl.review.model.ReviewRecord;
import com.qrl.review.model.ReviewStatus;
import com.qrl.review.store.ReviewStore;
import com.qrl.review.text.ExtractedText;
import com.qrl.review.text.ReviewTextExtractor;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes review records and keeps {@code embeddingStale} in step with content edits.
 */
@Service
public class ReviewRecordService {
    private static final Logger logger = LoggerFactory.getLogger(ReviewRecordService.class);

    private final ReviewStore reviewStore;
    private final ReviewTextExtractor textExtractor;
    private final EmbeddingProvider embeddingProvider;

    public ReviewRecordService(
        ReviewStore reviewStore,
        ReviewTextExtractor textExtractor,
        EmbeddingProvider embeddingProvider
    ) {
        this.reviewStore = reviewStore;
        this.textExtractor = textExtractor;
        this.embeddingProvider = embeddingProvider;
    }

    public ReviewRecord create(ReviewRecord draft) {
        validate(draft);
        ReviewRecord toStore = new ReviewRecord(
            null,
            draft.ticketNo(),
            draft.agentId(),
            draft.content(),
            draft.qualityScore(),
            draft.categories(),
            draft.status(),
            resolveGradedAt(draft, null),
            null,
            true
        );
        long id = reviewStore.insert(toStore);
        logger.info("review_created review_id={} agent_id={} status={}", id, draft.agentId(), draft.status());
        return toStore.withId(id);
    }

    public ReviewRecord update(long id, ReviewRecord changes) {
        validate(changes);
        ReviewRecord existing = get(id);
        boolean contentChanged = !Objects.equals(existing.content(), changes.content());
        ReviewRecord updated = new ReviewRecord(
            id,
            changes.ticketNo(),
            changes.agentId(),
            changes.content(),
            changes.qualityScore(),
            changes.categories(),
            changes.status(),
            resolveGradedAt(changes, existing),
            null,
            existing.embeddingStale() || contentChanged
        );
        reviewStore.update(updated);
        if (contentChanged) {
            logger.info("review_content_changed review_id={} embedding_stale=true", id);
        }
        return updated;
    }

    public ReviewRecord get(long id) {
        return reviewStore.findById(id, false).orElseThrow(() -> new ReviewNotFoundException(id));
    }

    /**
     * Computes and stores the embedding of one record from its current content.
     *
     * @throws com.qrl.review.common.ProviderUnavailableException when the provider fails; the record is left untouched
     */
    public EmbeddingOutcome refreshEmbedding(long id) {
        ReviewRecord record = get(id);
        ExtractedText text = textExtractor.extract(record.content());
        if (!text.isEmbeddable()) {
            return EmbeddingOutcome.SKIPPED;
        }
        List<Double> vector = embeddingProvider.embed(text.embeddingText());
        if (vector == null || vector.isEmpty()) {
            return EmbeddingOutcome.SKIPPED;
        }
        if (!reviewStore.storeEmbedding(id, vector, embeddingProvider.modelId(), record.content())) {
            logger.info("review_embedding_superseded review_id={}", id);
            return EmbeddingOutcome.SUPERSEDED;
        }
        return EmbeddingOutcome.PROCESSED;
    }

    private void validate(ReviewRecord record) {
        if (record == null || record.content() == null) {
            throw new InvalidReviewRequestException("content is required");
        }
        if (record.agentId() == null || record.agentId().isBlank()) {
            throw new InvalidReviewRequestException("agent_id is required");
        }
        if (record.status() == null) {
            throw new InvalidReviewRequestException("status is required");
        }
        Integer score = record.qualityScore();
        if (score != null && (score < 0 || score > 100)) {
            throw new InvalidReviewRequestException("quality_score must be between 0 and 100");
        }
        if (record.status() == ReviewStatus.GRADED && score == null) {
            throw new InvalidReviewRequestException("graded reviews need a quality_score");
        }
    }

    private Instant resolveGradedAt(ReviewRecord incoming, ReviewRecord existing) {
        if (incoming.status() != ReviewStatus.GRADED) {
            return incoming.gradedAt();
        }
        if (incoming.gradedAt() != null) {
            return incoming.gradedAt();
        }
        if (existing != null && existing.gradedAt() != null) {
            return existing.gradedAt();
        }
        return Instant.now();
    }
}
