package com.amqpclient.transport;

import com.amqpclient.address.ConnectionTarget;
import com.amqpclient.config.ConnectionOptions;
import io.vertx.core.Vertx;
import io.vertx.proton.ProtonClient;
import io.vertx.proton.ProtonClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Opens AMQP 1.0 transports with vertx-proton.
 *
 * Must be called on a Vert.x context; the connection's callbacks then come
 * back on that same context.
 */
public class ProtonTransportFactory implements TransportFactory {

    private static final Logger log = LoggerFactory.getLogger(ProtonTransportFactory.class);

    private static final String ANONYMOUS = "ANONYMOUS";

    private final ProtonClient client;
    private final String defaultContainerId;

    public ProtonTransportFactory(Vertx vertx, String defaultContainerId) {
        this.client = ProtonClient.create(Objects.requireNonNull(vertx, "vertx"));
        this.defaultContainerId = Objects.requireNonNull(defaultContainerId, "defaultContainerId");
    }

    @Override
    public Transport open(ConnectionTarget target, ConnectionOptions options, TransportListener listener) {
        ProtonTransport transport = new ProtonTransport(
            target,
            listener,
            options.containerId().orElse(defaultContainerId),
            options.virtualHost().orElse(null));

        ProtonClientOptions clientOptions = createClientOptions(target, options);
        String user = options.user().orElse(null);
        String password = options.password().orElse(null);

        log.debug("Opening AMQP transport to {}:{} (user: {}, ssl: {})",
                  target.getHost(), target.getPort(), user, clientOptions.isSsl());
        client.connect(clientOptions, target.getHost(), target.getPort(), user, password,
                       transport::onConnectResult);
        return transport;
    }

    /**
     * Translate connection options into vertx-proton client options.
     */
    ProtonClientOptions createClientOptions(ConnectionTarget target, ConnectionOptions options) {
        ProtonClientOptions clientOptions = new ProtonClientOptions();

        if (!options.saslEnabled().orElse(true)) {
            clientOptions.addEnabledSaslMechanism(ANONYMOUS);
        } else if (options.saslAllowedMechs().isSet()) {
            for (String mechanism : options.saslAllowedMechs().get().trim().split("\\s+")) {
                if (!mechanism.isEmpty()) {
                    clientOptions.addEnabledSaslMechanism(mechanism);
                }
            }
        }

        if (options.idleTimeout().isSet()) {
            clientOptions.setHeartbeat((int) Math.min(options.idleTimeout().get().toMillis(), Integer.MAX_VALUE));
        }
        if (options.maxFrameSize().isSet()) {
            clientOptions.setMaxFrameSize(options.maxFrameSize().get());
        }
        if (options.connectTimeout().isSet()) {
            clientOptions.setConnectTimeout((int) Math.min(options.connectTimeout().get().toMillis(), Integer.MAX_VALUE));
        }
        if (target.isTls() || options.sslEnabled().orElse(false)) {
            clientOptions.setSsl(true);
        }
        return clientOptions;
    }
}
