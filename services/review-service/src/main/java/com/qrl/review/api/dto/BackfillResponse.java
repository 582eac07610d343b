package com.qrl.review.api.dto;

import com.qrl.review.backfill.BackfillResult;

public record BackfillResponse(String mode, int total, int processed, int skipped, int errors, boolean interrupted) {
    public static BackfillResponse from(BackfillResult result) {
        return new BackfillResponse(
            result.mode().getValue(),
            result.total(),
            result.processed(),
            result.skipped(),
            result.errors(),
            result.interrupted()
        );
    }
}
