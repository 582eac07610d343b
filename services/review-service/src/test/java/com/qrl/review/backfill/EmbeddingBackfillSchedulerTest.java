package com.qrl.review.backfill;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.qrl.review.model.BackfillMode;
import org.junit.jupiter.api.Test;

class EmbeddingBackfillSchedulerTest {

    @Test
    void skipsWhenDisabled() {
        EmbeddingBackfillService service = mock(EmbeddingBackfillService.class);

        new EmbeddingBackfillScheduler(service, new BackfillProperties()).backfillMissingEmbeddings();

        verify(service, never()).backfill(any());
    }

    @Test
    void runningBackfillIsNotAnError() {
        EmbeddingBackfillService service = mock(EmbeddingBackfillService.class);
        when(service.backfill(BackfillMode.FRESH_MISSING)).thenThrow(new BackfillInProgressException());
        BackfillProperties properties = new BackfillProperties();
        properties.setScheduleEnabled(true);

        new EmbeddingBackfillScheduler(service, properties).backfillMissingEmbeddings();

        verify(service).backfill(BackfillMode.FRESH_MISSING);
    }
}
