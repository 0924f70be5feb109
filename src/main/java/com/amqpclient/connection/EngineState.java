package com.amqpclient.connection;

/**
 * States of a connection's reconnect engine.
 *
 * <pre>
 * CONNECTING -> OPEN, RETRY_WAIT, CLOSED
 * OPEN       -> RETRY_WAIT, CLOSED
 * RETRY_WAIT -> CONNECTING, CLOSED
 * CLOSED     -> (terminal)
 * </pre>
 */
public enum EngineState {
    /**
     * A transport attempt to the selected target is in flight.
     */
    CONNECTING,

    /**
     * The AMQP connection is open.
     */
    OPEN,

    /**
     * The last attempt failed and a retry timer is armed.
     */
    RETRY_WAIT,

    /**
     * Closed for good. No further attempts are made.
     */
    CLOSED;

    public boolean isTerminal() {
        return this == CLOSED;
    }
}
