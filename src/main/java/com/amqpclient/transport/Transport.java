package com.amqpclient.transport;

import org.apache.qpid.proton.amqp.transport.ErrorCondition;

/**
 * One attempt at an AMQP connection to one target.
 */
public interface Transport {

    /**
     * Start the AMQP closing handshake. Completion is reported through
     * {@link TransportListener#onClosed(boolean)}.
     *
     * @param condition error condition to send to the peer, or null
     */
    void close(ErrorCondition condition);

    /**
     * Drop the connection without a closing handshake. No listener callbacks
     * follow.
     */
    void abort();
}
