package com.qrl.review.execution;

import static org.assertj.core.api.Assertions.assertThat;

import com.qrl.review.support.RecordingSleeper;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class FixedIntervalGateTest {

    @Test
    void firstPassIsImmediateAndLaterPassesWaitOutTheInterval() throws InterruptedException {
        AtomicLong clock = new AtomicLong(1_000L);
        RecordingSleeper sleeper = new RecordingSleeper();
        FixedIntervalGate gate = new FixedIntervalGate(500L, clock::get, sleeper);

        gate.acquire();
        clock.addAndGet(120L);
        gate.acquire();
        clock.addAndGet(700L);
        gate.acquire();

        assertThat(sleeper.sleeps()).containsExactly(380L);
    }

    @Test
    void zeroIntervalNeverSleeps() throws InterruptedException {
        RecordingSleeper sleeper = new RecordingSleeper();
        FixedIntervalGate gate = new FixedIntervalGate(0L, () -> 5L, sleeper);

        gate.acquire();
        gate.acquire();

        assertThat(sleeper.sleeps()).isEmpty();
    }
}
