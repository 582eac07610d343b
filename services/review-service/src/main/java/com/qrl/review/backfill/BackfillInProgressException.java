package com.qrl.review.backfill;

public class BackfillInProgressException extends RuntimeException {
    public BackfillInProgressException() {
        super("an embedding backfill is already running");
    }
}
