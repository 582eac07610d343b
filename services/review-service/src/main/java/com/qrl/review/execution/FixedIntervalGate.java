package com.qrl.review.execution;

import java.util.function.LongSupplier;

/**
 * Rate limiter that lets one caller through at most once per interval.
 * The first pass is immediate; later passes block until the interval since
 * the previous pass has elapsed.
 */
public class FixedIntervalGate {
    private final long intervalMs;
    private final LongSupplier clock;
    private final Sleeper sleeper;
    private long lastPassMs = -1L;

    public FixedIntervalGate(long intervalMs, Sleeper sleeper) {
        this(intervalMs, System::currentTimeMillis, sleeper);
    }

    public FixedIntervalGate(long intervalMs, LongSupplier clock, Sleeper sleeper) {
        this.intervalMs = Math.max(0L, intervalMs);
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public synchronized void acquire() throws InterruptedException {
        long now = clock.getAsLong();
        if (intervalMs > 0 && lastPassMs >= 0) {
            long waitMs = lastPassMs + intervalMs - now;
            if (waitMs > 0) {
                sleeper.sleep(waitMs);
                now = clock.getAsLong();
            }
        }
        lastPassMs = now;
    }

    public long getIntervalMs() {
        return intervalMs;
    }
}
