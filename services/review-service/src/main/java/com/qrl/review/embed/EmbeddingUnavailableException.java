package com.qrl.review.embed;

import com.qrl.review.common.ProviderUnavailableException;

public class EmbeddingUnavailableException extends ProviderUnavailableException {
    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
