package com.amqpclient.container;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Waits for a fixed number of {@link #done()} calls, then runs a completion
 * callback.
 *
 * The callback is scheduled on the event loop with zero delay rather than
 * run from inside the last {@code done()} call, so it is ordered with the
 * other event loop work.
 */
public final class CountdownBarrier {

    private final Scheduler scheduler;
    private final Runnable onReady;
    private final AtomicInteger remaining;

    public CountdownBarrier(Scheduler scheduler, int count, Runnable onReady) {
        if (count < 1) {
            throw new IllegalArgumentException("Barrier count must be positive: " + count);
        }
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.onReady = Objects.requireNonNull(onReady, "onReady");
        this.remaining = new AtomicInteger(count);
    }

    /**
     * Count one party as done.
     *
     * @throws IllegalStateException if called more often than the barrier count
     */
    public void done() {
        int left = remaining.decrementAndGet();
        if (left == 0) {
            scheduler.schedule(Duration.ZERO, onReady);
        } else if (left < 0) {
            throw new IllegalStateException("Barrier already complete");
        }
    }

    public int getRemaining() {
        return Math.max(remaining.get(), 0);
    }

    public boolean isComplete() {
        return remaining.get() <= 0;
    }
}
