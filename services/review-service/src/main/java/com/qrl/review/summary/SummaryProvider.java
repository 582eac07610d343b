package com.qrl.review.summary;

import com.qrl.review.model.ReviewRecord;

public interface SummaryProvider {
    String FALLBACK_SUMMARY = "Issue details unavailable";

    /**
     * One short sentence describing what went wrong in the review.
     *
     * @throws SummaryUnavailableException when the provider fails
     */
    String summarize(ReviewRecord record);
}
