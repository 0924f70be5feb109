package com.amqpclient.container;

import java.time.Duration;

/**
 * One-shot deferred execution on the event loop.
 */
public interface Scheduler {

    /**
     * Run {@code work} on the event loop after {@code delay}.
     *
     * The task never runs inline, even with a zero delay.
     */
    ScheduledWork schedule(Duration delay, Runnable work);
}
