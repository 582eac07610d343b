package com.qrl.review.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.qrl.review.support.RecordingSleeper;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BoundedBatchExecutorTest {
    private final ExecutorService executor = Executors.newFixedThreadPool(3);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void runsEveryItemAndWaitsBetweenBatches() throws InterruptedException {
        RecordingSleeper sleeper = new RecordingSleeper();
        FixedIntervalGate gate = new FixedIntervalGate(1_000L, () -> 0L, sleeper);
        List<Integer> seen = new CopyOnWriteArrayList<>();

        int batches = new BoundedBatchExecutor(executor)
            .runBatches(List.of(1, 2, 3, 4, 5, 6, 7), 3, gate, seen::add);

        assertThat(batches).isEqualTo(3);
        assertThat(seen).containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6, 7);
        assertThat(sleeper.sleeps()).containsExactly(1_000L, 1_000L);
    }

    @Test
    void nextBatchStartsOnlyAfterPreviousCompletes() throws InterruptedException {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        FixedIntervalGate gate = new FixedIntervalGate(0L, new RecordingSleeper());

        new BoundedBatchExecutor(executor).runBatches(List.of(1, 2, 3, 4, 5, 6), 2, gate, item -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
        });

        assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
    }

    @Test
    void escapingTaskFailureFailsTheRun() {
        FixedIntervalGate gate = new FixedIntervalGate(0L, new RecordingSleeper());

        assertThatThrownBy(() -> new BoundedBatchExecutor(executor).runBatches(List.of(1, 2), 2, gate, item -> {
            if (item == 2) {
                throw new IllegalArgumentException("boom");
            }
        })).isInstanceOf(IllegalStateException.class).hasCauseInstanceOf(IllegalArgumentException.class);
    }
}
