package com.amqpclient.container;

import com.amqpclient.config.ConnectionOptions;
import com.amqpclient.connection.Connection;

/**
 * Host event loop for connections.
 *
 * Everything a container does for its connections (transport callbacks,
 * retry timers, application callbacks) runs on a single event loop, so the
 * events of one connection never overlap.
 */
public interface Container extends Scheduler {

    /**
     * Identifier used as the AMQP container id unless a connection sets its own.
     */
    String getId();

    /**
     * Open a connection to {@code address}.
     */
    Connection connect(String address);

    /**
     * Open a connection to {@code address} with the given options.
     *
     * The first attempt always goes to {@code address}. Failover addresses and
     * a reconnect URL in {@code options} only apply to reconnect attempts.
     */
    Connection connect(String address, ConnectionOptions options);

    /**
     * Run the container, blocking until it stops. Stops by itself once no
     * connections and no scheduled tasks remain.
     */
    void run();

    /**
     * Stop the container: cancel all scheduled tasks and close every
     * connection without reconnecting. Safe to call from any thread.
     */
    void stop();

    boolean isStopped();

    /**
     * Run {@code task} on the event loop: inline when already on it,
     * otherwise as soon as possible.
     */
    void execute(Runnable task);

    /**
     * True when the calling thread is running the container's event loop.
     */
    boolean inEventLoop();
}
