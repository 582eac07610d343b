package com.qrl.review.issues;

import com.qrl.review.embed.EmbeddingProvider;
import com.qrl.review.model.ReviewRecord;
import com.qrl.review.store.ReviewStore;
import com.qrl.review.text.ExtractedText;
import com.qrl.review.text.ReviewTextExtractor;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Vectors used during one analysis run. Fresh stored vectors are reused; missing
 * or stale ones are computed once and optionally written back to the store.
 * Not thread-safe; one instance per agent run.
 */
public class RunEmbeddingCache {
    private final EmbeddingProvider embeddingProvider;
    private final ReviewTextExtractor textExtractor;
    private final ReviewStore reviewStore;
    private final boolean persistComputed;
    private final Map<Long, Optional<List<Double>>> vectors = new HashMap<>();
    private int computed;

    public RunEmbeddingCache(
        EmbeddingProvider embeddingProvider,
        ReviewTextExtractor textExtractor,
        ReviewStore reviewStore,
        boolean persistComputed
    ) {
        this.embeddingProvider = embeddingProvider;
        this.textExtractor = textExtractor;
        this.reviewStore = reviewStore;
        this.persistComputed = persistComputed;
    }

    /**
     * @return the record's vector, or empty when its text is too short to embed
     * @throws com.qrl.review.common.ProviderUnavailableException when computing the vector fails
     */
    public Optional<List<Double>> vectorFor(ReviewRecord record) {
        Optional<List<Double>> cached = record.id() == null ? null : vectors.get(record.id());
        if (cached != null) {
            return cached;
        }
        Optional<List<Double>> vector = resolve(record);
        if (record.id() != null) {
            vectors.put(record.id(), vector);
        }
        return vector;
    }

    public int getComputedCount() {
        return computed;
    }

    private Optional<List<Double>> resolve(ReviewRecord record) {
        if (record.hasFreshEmbedding()) {
            return Optional.of(record.embedding());
        }
        ExtractedText text = textExtractor.extract(record.content());
        if (!text.isEmbeddable()) {
            return Optional.empty();
        }
        List<Double> vector = embeddingProvider.embed(text.embeddingText());
        if (vector == null || vector.isEmpty()) {
            return Optional.empty();
        }
        computed++;
        if (persistComputed && record.id() != null) {
            reviewStore.storeEmbedding(record.id(), vector, embeddingProvider.modelId(), record.content());
        }
        return Optional.of(vector);
    }
}
