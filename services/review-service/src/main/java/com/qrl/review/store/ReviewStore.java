package com.qrl.review.store;

import com.qrl.review.model.BackfillMode;
import com.qrl.review.model.ReviewContent;
import com.qrl.review.model.ReviewRecord;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Document store for review records. Embedding vectors are only loaded by the
 * methods that say so; everything else returns records with a {@code null} vector.
 */
public interface ReviewStore {
    long insert(ReviewRecord record);

    /** Writes content, grading fields and the stale flag. Leaves the stored vector alone. */
    void update(ReviewRecord record);

    Optional<ReviewRecord> findById(long id, boolean includeEmbedding);

    List<ReviewRecord> findByIds(Collection<Long> ids);

    /**
     * Graded records with notes and feedback whose keyword text contains any of
     * {@code tokens}, case-insensitively.
     *
     * @param categories when non-empty, only records sharing at least one label
     */
    List<ReviewRecord> findKeywordCandidates(
        List<String> tokens,
        Collection<Long> excludeIds,
        Collection<String> categories,
        int limit
    );

    /**
     * Graded records holding a fresh embedding, vector included.
     *
     * @param categories when non-empty, only records sharing at least one label
     */
    List<ReviewRecord> findEmbeddedCandidates(Collection<Long> excludeIds, Collection<String> categories, int limit);

    /**
     * Ids eligible for an embedding backfill, oldest first.
     *
     * @param gradedFrom inclusive lower bound on the graded date, or {@code null} for no bound
     * @param limit maximum ids to return, {@code 0} for no limit
     */
    List<Long> findIdsForBackfill(BackfillMode mode, Instant gradedFrom, int limit);

    /**
     * Stores a freshly computed vector and clears the stale flag, provided the
     * record still holds {@code embeddedFrom}.
     *
     * @return {@code false} when the content changed since it was read; nothing is written
     */
    boolean storeEmbedding(long id, List<Double> vector, String modelId, ReviewContent embeddedFrom);

    /** Graded, scored records of one agent since {@code gradedFrom}, oldest first, vectors included. */
    List<ReviewRecord> findGradedForAgent(String agentId, Instant gradedFrom);
}
