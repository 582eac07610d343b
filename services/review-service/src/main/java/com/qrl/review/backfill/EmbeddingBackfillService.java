package com.qrl.review.backfill;

import com.qrl.review.common.ProviderUnavailableException;
import com.qrl.review.common.ReviewNotFoundException;
import com.qrl.review.execution.BoundedBatchExecutor;
import com.qrl.review.execution.FixedIntervalGate;
import com.qrl.review.execution.Sleeper;
import com.qrl.review.model.BackfillMode;
import com.qrl.review.service.EmbeddingOutcome;
import com.qrl.review.service.ReviewRecordService;
import com.qrl.review.store.ReviewStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Computes embeddings for eligible records in bounded batches. Eligible ids are
 * selected once up front, so records edited mid-run are picked up by the next run.
 */
@Service
@EnableConfigurationProperties(BackfillProperties.class)
public class EmbeddingBackfillService {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingBackfillService.class);

    private final ReviewStore reviewStore;
    private final ReviewRecordService reviewRecordService;
    private final BoundedBatchExecutor batchExecutor;
    private final BackfillProperties properties;
    private final Sleeper sleeper;
    private final MeterRegistry meterRegistry;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public EmbeddingBackfillService(
        ReviewStore reviewStore,
        ReviewRecordService reviewRecordService,
        BoundedBatchExecutor batchExecutor,
        BackfillProperties properties,
        Sleeper sleeper,
        MeterRegistry meterRegistry
    ) {
        this.reviewStore = reviewStore;
        this.reviewRecordService = reviewRecordService;
        this.batchExecutor = batchExecutor;
        this.properties = properties;
        this.sleeper = sleeper;
        this.meterRegistry = meterRegistry;
    }

    public BackfillResult backfill(BackfillMode mode) {
        if (!running.compareAndSet(false, true)) {
            throw new BackfillInProgressException();
        }
        try {
            return run(mode == null ? BackfillMode.FRESH_MISSING : mode);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private BackfillResult run(BackfillMode mode) {
        long started = System.currentTimeMillis();
        Instant gradedFrom = properties.getGradedWindowDays() > 0
            ? Instant.now().minus(Duration.ofDays(properties.getGradedWindowDays()))
            : null;
        List<Long> ids = reviewStore.findIdsForBackfill(mode, gradedFrom, Math.max(0, properties.getMaxRecordsPerRun()));
        logger.info(
            "embedding_backfill_start mode={} eligible={} batch_size={} batch_delay_ms={}",
            mode.getValue(),
            ids.size(),
            properties.getBatchSize(),
            properties.getBatchDelayMs()
        );

        AtomicInteger processed = new AtomicInteger();
        AtomicInteger skipped = new AtomicInteger();
        AtomicInteger errors = new AtomicInteger();
        FixedIntervalGate gate = new FixedIntervalGate(properties.getBatchDelayMs(), sleeper);
        boolean interrupted = false;
        try {
            batchExecutor.runBatches(ids, properties.getBatchSize(), gate, id -> {
                switch (processOne(id)) {
                    case PROCESSED -> processed.incrementAndGet();
                    case SKIPPED -> skipped.incrementAndGet();
                    default -> errors.incrementAndGet();
                }
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interrupted = true;
            logger.warn("embedding_backfill_interrupted mode={} processed={}", mode.getValue(), processed.get());
        }

        BackfillResult result = new BackfillResult(
            mode,
            ids.size(),
            processed.get(),
            skipped.get(),
            errors.get(),
            interrupted
        );
        meterRegistry.counter("review.backfill.records.total", "outcome", "processed").increment(result.processed());
        meterRegistry.counter("review.backfill.records.total", "outcome", "skipped").increment(result.skipped());
        meterRegistry.counter("review.backfill.records.total", "outcome", "error").increment(result.errors());
        logger.info(
            "embedding_backfill_done mode={} total={} processed={} skipped={} errors={} took_ms={}",
            mode.getValue(),
            result.total(),
            result.processed(),
            result.skipped(),
            result.errors(),
            System.currentTimeMillis() - started
        );
        return result;
    }

    private RecordOutcome processOne(long id) {
        try {
            EmbeddingOutcome outcome = reviewRecordService.refreshEmbedding(id);
            return outcome == EmbeddingOutcome.PROCESSED ? RecordOutcome.PROCESSED : RecordOutcome.SKIPPED;
        } catch (ReviewNotFoundException ex) {
            return RecordOutcome.SKIPPED;
        } catch (ProviderUnavailableException ex) {
            logger.warn("embedding_backfill_record_failed review_id={} reason={}", id, ex.getReason());
            return RecordOutcome.ERROR;
        } catch (RuntimeException ex) {
            logger.warn("embedding_backfill_record_error review_id={} message={}", id, ex.getMessage());
            return RecordOutcome.ERROR;
        }
    }

    private enum RecordOutcome {
        PROCESSED,
        SKIPPED,
        ERROR
    }
}
