package com.qrl.review.retrieval;

import com.qrl.review.model.CandidateResult;
import java.util.List;

public interface CandidateFinder {
    String name();

    /** Returns scored candidates, best first. */
    List<CandidateResult> find(CandidateQuery query);
}
