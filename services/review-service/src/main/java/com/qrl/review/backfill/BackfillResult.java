package com.qrl.review.backfill;

import com.qrl.review.model.BackfillMode;

public record BackfillResult(
    BackfillMode mode,
    int total,
    int processed,
    int skipped,
    int errors,
    boolean interrupted
) {
}
