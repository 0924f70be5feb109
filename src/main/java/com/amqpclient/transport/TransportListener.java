package com.amqpclient.transport;

import com.amqpclient.error.TransportError;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;

/**
 * Lifecycle events of a {@link Transport}, delivered on the container's event loop.
 */
public interface TransportListener {

    /**
     * The socket is connected, SASL succeeded and the peer answered our Open.
     */
    void onEstablished();

    /**
     * The attempt failed, or an established connection was lost.
     */
    void onFailure(TransportError error);

    /**
     * The peer closed the connection on its own initiative.
     *
     * @param condition the error the peer sent, or null
     */
    void onRemoteClose(ErrorCondition condition);

    /**
     * The transport finished closing.
     *
     * @param clean true if both sides exchanged Close frames
     */
    void onClosed(boolean clean);
}
