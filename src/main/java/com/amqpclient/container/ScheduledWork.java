package com.amqpclient.container;

/**
 * Handle for a task submitted to a {@link Scheduler}.
 */
public interface ScheduledWork {

    /**
     * Prevent the task from running.
     *
     * @return true if the task had not run yet and now never will
     */
    boolean cancel();

    boolean isCancelled();
}
