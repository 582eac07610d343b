package com.qrl.review.embed;

import com.qrl.review.cache.TextDigest;
import com.qrl.review.cache.TtlCache;
import com.qrl.review.resilience.CircuitBreaker;
import com.qrl.review.resilience.ReviewResilienceRegistry;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Embeds review and query text with the configured provider. Recent vectors are
 * kept in a short-lived cache keyed by model and text digest, so repeated
 * similar-review queries skip the provider.
 */
@Component
public class EmbeddingService implements EmbeddingProvider {
    private final EmbeddingProperties properties;
    private final EmbeddingGateway embeddingGateway;
    private final ToyEmbedder toyEmbedder;
    private final TtlCache<List<Double>> recentVectors;
    private final ReviewResilienceRegistry resilienceRegistry;

    public EmbeddingService(
        EmbeddingProperties properties,
        EmbeddingGateway embeddingGateway,
        ToyEmbedder toyEmbedder,
        ReviewResilienceRegistry resilienceRegistry
    ) {
        this.properties = properties;
        this.embeddingGateway = embeddingGateway;
        this.toyEmbedder = toyEmbedder;
        this.recentVectors = new TtlCache<>(properties.getCache().getMaxEntries());
        this.resilienceRegistry = resilienceRegistry;
    }

    @Override
    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String input = truncate(text);
        String key = cacheKey(input);
        if (key != null) {
            Optional<List<Double>> cached = recentVectors.get(key);
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        List<Double> vector = fetch(input);
        if (key != null && vector != null && !vector.isEmpty()) {
            recentVectors.put(key, List.copyOf(vector), properties.getCache().getTtlMs());
        }
        return vector;
    }

    @Override
    public String modelId() {
        if (properties.getMode() == EmbeddingMode.TOY) {
            return "toy-" + toyEmbedder.getDimensions();
        }
        return properties.getModel();
    }

    private List<Double> fetch(String text) {
        if (properties.getMode() == EmbeddingMode.TOY) {
            return toyEmbedder.embed(text);
        }
        CircuitBreaker breaker = resilienceRegistry.getEmbedBreaker();
        if (!breaker.allowRequest()) {
            throw new EmbeddingUnavailableException("embed_circuit_open");
        }
        try {
            List<Double> vector = embeddingGateway.embed(text);
            int expected = properties.getDimensions();
            if (expected > 0 && vector.size() != expected) {
                throw new EmbeddingUnavailableException("embed_dimension_mismatch");
            }
            breaker.recordSuccess();
            return vector;
        } catch (EmbeddingUnavailableException ex) {
            breaker.recordFailure();
            throw ex;
        }
    }

    private String cacheKey(String input) {
        EmbeddingProperties.Cache cache = properties.getCache();
        if (cache == null || !cache.isEnabled()) {
            return null;
        }
        return modelId() + ":" + TextDigest.hex(input);
    }

    private String truncate(String text) {
        int max = properties.getMaxInputChars();
        if (max > 0 && text.length() > max) {
            return text.substring(0, max);
        }
        return text;
    }
}
