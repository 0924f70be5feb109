package com.amqpclient.transport;

import com.amqpclient.address.ConnectionTarget;
import com.amqpclient.config.ConnectionOptions;

/**
 * Opens transports. Called on the container's event loop.
 */
public interface TransportFactory {

    /**
     * Begin connecting to {@code target}. Outcomes are reported to
     * {@code listener} later on the event loop, never from inside this call.
     */
    Transport open(ConnectionTarget target, ConnectionOptions options, TransportListener listener);
}
