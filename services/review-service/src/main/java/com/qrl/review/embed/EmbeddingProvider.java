package com.qrl.review.embed;

import java.util.List;

public interface EmbeddingProvider {
    /**
     * Embeds already-normalized text.
     *
     * @return the vector, or {@code null} when {@code text} is empty
     * @throws EmbeddingUnavailableException when the provider fails
     */
    List<Double> embed(String text);

    String modelId();
}
