package com.qrl.review.common;

/**
 * Failure of an external model provider (embedding or summarization).
 * The message is a short machine-readable reason such as {@code embed_timeout}.
 */
public class ProviderUnavailableException extends RuntimeException {
    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getReason() {
        return getMessage();
    }
}
