package com.amqpclient.connection;

import com.amqpclient.address.ConnectionTarget;
import com.amqpclient.config.ConnectionOptions;
import com.amqpclient.container.Container;
import com.amqpclient.error.TransportError;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;

/**
 * Application handle for one logical connection.
 *
 * The handle stays the same across reconnects. {@link #close()} and
 * {@link #updateOptions(ConnectionOptions)} may be called from any thread;
 * off the event loop they are queued onto it, on the event loop (inside a
 * callback) they take effect immediately.
 */
public final class Connection {

    private final ReconnectEngine engine;

    Connection(ReconnectEngine engine) {
        this.engine = engine;
    }

    public String getId() {
        return engine.getId();
    }

    public Container container() {
        return engine.getContainer();
    }

    public EngineState getState() {
        return engine.getState();
    }

    public boolean isOpen() {
        return engine.getState() == EngineState.OPEN;
    }

    public boolean isClosed() {
        return engine.getState() == EngineState.CLOSED;
    }

    /**
     * True if this connection went through at least one reconnect cycle.
     * False on the first open, true on every later one.
     */
    public boolean reconnected() {
        return engine.isReconnected();
    }

    /**
     * Address of the attempt in flight or of the open connection.
     *
     * @throws IllegalStateException if called before the first attempt started
     */
    public ConnectionTarget url() {
        return engine.getCurrentTarget();
    }

    /**
     * The user name the next attempt authenticates as, empty if none.
     */
    public String user() {
        return engine.getOptions().user().orElse("");
    }

    /**
     * The virtual host the next attempt asks for, empty if none.
     */
    public String virtualHost() {
        return engine.getOptions().virtualHost().orElse("");
    }

    /**
     * The effective options: everything given to connect() with every update merged in.
     */
    public ConnectionOptions options() {
        return engine.getOptions();
    }

    /**
     * The most recent failure, null if none.
     */
    public TransportError lastError() {
        return engine.getLastError();
    }

    /**
     * Merge {@code delta} into this connection's options. Fields not set in
     * {@code delta} keep their value. Takes effect from the next connection attempt.
     */
    public void updateOptions(ConnectionOptions delta) {
        Container container = engine.getContainer();
        if (container.inEventLoop()) {
            engine.updateOptions(delta);
        } else {
            container.execute(() -> engine.updateOptions(delta));
        }
    }

    public void close() {
        close(null);
    }

    /**
     * Close the connection, sending {@code condition} to the peer if open.
     */
    public void close(ErrorCondition condition) {
        Container container = engine.getContainer();
        if (container.inEventLoop()) {
            engine.close(condition);
        } else {
            container.execute(() -> engine.close(condition));
        }
    }

    @Override
    public String toString() {
        return "Connection{id=" + engine.getId() + ", state=" + engine.getState() + "}";
    }
}
