package com.qrl.review.summary;

public enum SummaryMode {
    /** OpenAI-compatible chat completions. */
    HTTP,
    /** First sentence of the feedback, trimmed to the word limit. No network. */
    EXTRACTIVE
}
