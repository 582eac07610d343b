package com.qrl.review.backfill;

import com.qrl.review.model.BackfillMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Nightly fresh-missing pass so edited records regain a usable vector. */
@Component
public class EmbeddingBackfillScheduler {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingBackfillScheduler.class);

    private final EmbeddingBackfillService backfillService;
    private final BackfillProperties properties;

    public EmbeddingBackfillScheduler(EmbeddingBackfillService backfillService, BackfillProperties properties) {
        this.backfillService = backfillService;
        this.properties = properties;
    }

    @Scheduled(cron = "${review.backfill.schedule-cron:0 30 2 * * *}")
    public void backfillMissingEmbeddings() {
        if (!properties.isScheduleEnabled()) {
            return;
        }
        try {
            backfillService.backfill(BackfillMode.FRESH_MISSING);
        } catch (BackfillInProgressException ex) {
            logger.info("embedding_backfill_schedule_skipped reason=already_running");
        }
    }
}
