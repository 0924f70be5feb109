package com.amqpclient.connection;

import com.amqpclient.container.Container;
import com.amqpclient.error.TransportError;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;

/**
 * Application callbacks for connection events.
 *
 * All callbacks run on the container's event loop, one at a time. Every
 * method does nothing by default.
 */
public interface ConnectionHandler {

    /**
     * The container started running.
     */
    default void onContainerStart(Container container) {
    }

    /**
     * The connection opened. {@link Connection#reconnected()} tells a first
     * open from a reopen after failures.
     */
    default void onConnectionOpen(Connection connection) {
    }

    /**
     * A close started by the application completed its handshake with the peer.
     */
    default void onConnectionClose(Connection connection) {
    }

    /**
     * The peer closed the connection with an error and no reconnect will follow.
     */
    default void onConnectionError(Connection connection, ErrorCondition condition) {
    }

    /**
     * A connection attempt or an open connection failed.
     *
     * {@link Connection#close()} called from here stops reconnecting, and
     * {@link Connection#updateOptions} called from here applies to the next
     * attempt.
     */
    default void onTransportError(Connection connection, TransportError error) {
    }

    /**
     * The connection is closed for good. Called exactly once per connection.
     */
    default void onTransportClose(Connection connection) {
    }
}
