package com.qrl.review.summary;

import com.qrl.review.common.ProviderUnavailableException;

public class SummaryUnavailableException extends ProviderUnavailableException {
    public SummaryUnavailableException(String message) {
        super(message);
    }

    public SummaryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
