package com.amqpclient.transport;

import com.amqpclient.address.ConnectionTarget;
import com.amqpclient.error.TransportError;
import com.amqpclient.error.TransportErrorKind;
import io.vertx.core.AsyncResult;
import io.vertx.proton.ProtonConnection;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One vertx-proton connection attempt.
 *
 * Connect result, remote Open, remote Close and socket loss are mapped onto
 * {@link TransportListener} calls. After {@link #abort()} or the final
 * callback no further events are delivered.
 */
final class ProtonTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(ProtonTransport.class);

    private final ConnectionTarget target;
    private final TransportListener listener;
    private final String containerId;
    private final String virtualHost;

    private ProtonConnection connection;
    private boolean finished;
    private boolean established;
    private boolean localClose;

    ProtonTransport(ConnectionTarget target, TransportListener listener, String containerId, String virtualHost) {
        this.target = target;
        this.listener = listener;
        this.containerId = containerId;
        this.virtualHost = virtualHost;
    }

    void onConnectResult(AsyncResult<ProtonConnection> result) {
        if (finished) {
            if (result.succeeded()) {
                result.result().disconnect();
            }
            return;
        }
        if (result.failed()) {
            finished = true;
            log.debug("Connect to {} failed: {}", target, result.cause().toString());
            listener.onFailure(TransportError.fromException(target, result.cause()));
            return;
        }

        connection = result.result();
        connection.setContainer(containerId);
        if (virtualHost != null && !virtualHost.isEmpty()) {
            connection.setHostname(virtualHost);
        }
        connection.openHandler(this::onOpen);
        connection.closeHandler(this::onRemoteClose);
        connection.disconnectHandler(this::onDisconnect);
        connection.open();
    }

    private void onOpen(AsyncResult<ProtonConnection> result) {
        if (finished) {
            return;
        }
        // The peer's Open arrived. A failed result only means its Close with an
        // error condition came in the same read; closeHandler reports that.
        established = true;
        if (result.failed()) {
            log.debug("AMQP connection to {} open, closing already: {}", target, connection.getRemoteCondition());
        } else {
            log.debug("AMQP connection to {} open, remote container {}", target, connection.getRemoteContainer());
        }
        listener.onEstablished();
    }

    private void onRemoteClose(AsyncResult<ProtonConnection> result) {
        if (finished) {
            return;
        }
        ErrorCondition condition = connection.getRemoteCondition();
        if (localClose) {
            finished = true;
            connection.disconnect();
            listener.onClosed(true);
            return;
        }
        log.debug("Peer {} closed connection: {}", target, condition);
        listener.onRemoteClose(condition);
    }

    private void onDisconnect(ProtonConnection disconnected) {
        if (finished) {
            return;
        }
        finished = true;
        if (localClose) {
            listener.onClosed(false);
        } else if (established) {
            listener.onFailure(new TransportError(TransportErrorKind.ADDRESS_UNREACHABLE, target, "connection lost"));
        } else {
            listener.onFailure(new TransportError(TransportErrorKind.PROTOCOL_NEGOTIATION_FAILED, target,
                "disconnected before the AMQP connection opened"));
        }
    }

    @Override
    public void close(ErrorCondition condition) {
        if (finished || connection == null) {
            return;
        }
        localClose = true;
        if (condition != null) {
            connection.setCondition(condition);
        }
        connection.close();
    }

    @Override
    public void abort() {
        if (finished) {
            return;
        }
        finished = true;
        if (connection != null) {
            if (!connection.isDisconnected()) {
                connection.close();
                connection.disconnect();
            }
        }
    }
}
