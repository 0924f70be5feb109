package com.amqpclient.connection;

import com.amqpclient.address.CandidateList;
import com.amqpclient.address.ConnectionTarget;
import com.amqpclient.config.ConnectionOptions;
import com.amqpclient.container.Container;
import com.amqpclient.container.ScheduledWork;
import com.amqpclient.error.TransportError;
import com.amqpclient.error.TransportErrorKind;
import com.amqpclient.reconnect.ReconnectOptions;
import com.amqpclient.transport.Transport;
import com.amqpclient.transport.TransportFactory;
import com.amqpclient.transport.TransportListener;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Lifecycle state machine of one logical connection.
 *
 * Owns the candidate list, the reconnect policy and the connection options,
 * reacts to transport events, and decides whether, when and where to retry.
 * All methods must run on the container's event loop; the engine takes no
 * locks of its own. Public entry points reached through {@link Connection}
 * hop onto the event loop first.
 *
 * <pre>
 * CONNECTING --established--> OPEN
 * CONNECTING/OPEN --failure, policy gives a delay--> RETRY_WAIT --timer--> CONNECTING
 * CONNECTING/OPEN --failure, no policy or exhausted--> CLOSED
 * OPEN --close() + peer Close--> CLOSED (clean)
 * any --close() during failure/retry, or container stop--> CLOSED (abort)
 * </pre>
 */
public final class ReconnectEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconnectEngine.class);

    private final String id;
    private final Container container;
    private final TransportFactory transports;
    private final ConnectionHandler fallbackHandler;
    private final Consumer<Connection> terminationListener;
    private final Connection connection;
    private final CandidateList candidates;

    private volatile ConnectionOptions options;
    private volatile EngineState state = EngineState.CONNECTING;
    private volatile ConnectionTarget currentTarget;
    private volatile TransportError lastError;

    private Attempt attempt;
    private ScheduledWork retryTimer;
    private Object retryToken;

    // Policy attempt number for the next retry; back to 1 whenever the connection opens
    private int retryAttempt = 1;
    // Retry cycles over the whole life of the connection
    private volatile int retryCycles;
    private int openCount;

    private boolean started;
    private boolean handlingFailure;
    private boolean closeRequested;
    private boolean cleanCloseInProgress;

    public ReconnectEngine(String id, ConnectionTarget address, ConnectionOptions options,
                           Container container, TransportFactory transports,
                           ConnectionHandler fallbackHandler, Consumer<Connection> terminationListener) {
        this.id = Objects.requireNonNull(id, "id");
        this.options = Objects.requireNonNull(options, "options");
        this.container = Objects.requireNonNull(container, "container");
        this.transports = Objects.requireNonNull(transports, "transports");
        this.fallbackHandler = fallbackHandler != null ? fallbackHandler : new ConnectionHandler() { };
        this.terminationListener = terminationListener;
        this.candidates = new CandidateList(Objects.requireNonNull(address, "address"));
        refreshCandidates();
        this.connection = new Connection(this);
    }

    /**
     * Make the first connection attempt, always to the connect address.
     */
    public void start() {
        if (started) {
            throw new IllegalStateException("Connection " + id + " already started");
        }
        started = true;
        if (state == EngineState.CLOSED) {
            return;
        }
        log.info("Connection {} connecting to {}", id, candidates.getOriginal());
        openTransport(candidates.nextTarget(true));
    }

    public Connection getConnection() {
        return connection;
    }

    public String getId() {
        return id;
    }

    public EngineState getState() {
        return state;
    }

    public Container getContainer() {
        return container;
    }

    public ConnectionOptions getOptions() {
        return options;
    }

    public TransportError getLastError() {
        return lastError;
    }

    /**
     * True once at least one retry cycle has happened.
     */
    public boolean isReconnected() {
        return retryCycles > 0;
    }

    public int getRetryCycles() {
        return retryCycles;
    }

    public int getOpenCount() {
        return openCount;
    }

    /**
     * Target of the attempt in flight or of the open connection.
     *
     * @throws IllegalStateException if no target has been selected yet
     */
    public ConnectionTarget getCurrentTarget() {
        ConnectionTarget target = currentTarget;
        if (target == null) {
            throw new IllegalStateException("Connection " + id + " has not selected a target yet");
        }
        return target;
    }

    CandidateList getCandidates() {
        return candidates;
    }

    /**
     * Merge {@code delta} into the options. Applies from the next attempt.
     */
    public void updateOptions(ConnectionOptions delta) {
        Objects.requireNonNull(delta, "delta");
        options = options.update(delta);
        if (delta.touchesReconnect()) {
            refreshCandidates();
        }
        log.debug("Connection {} options updated: {}", id, options);
    }

    /**
     * Close the connection.
     *
     * When open, starts the closing handshake and reports a clean close once
     * the peer answers. In any other state, including from inside the
     * transport error callback, cancels reconnection and closes at once
     * without a clean close notification.
     */
    public void close(ErrorCondition condition) {
        if (state == EngineState.CLOSED) {
            return;
        }
        if (handlingFailure) {
            // Finished by handleFailure() once the callback returns
            closeRequested = true;
            return;
        }
        switch (state) {
            case OPEN:
                if (!closeRequested) {
                    closeRequested = true;
                    cleanCloseInProgress = true;
                    log.info("Connection {} closing", id);
                    Transport transport = attempt != null ? attempt.transport : null;
                    if (transport != null) {
                        transport.close(condition);
                    } else {
                        terminate(false);
                    }
                }
                break;
            case CONNECTING:
            case RETRY_WAIT:
                closeRequested = true;
                log.info("Connection {} closed while {}, reconnection cancelled", id, state);
                lastError = new TransportError(TransportErrorKind.LOCAL_ABORT, currentTarget, "closed by application");
                terminate(false);
                break;
            default:
                break;
        }
    }

    /**
     * Container-wide stop: no further attempts regardless of remaining policy.
     */
    public void stop() {
        if (state == EngineState.CLOSED) {
            return;
        }
        log.info("Connection {} stopped in state {}", id, state);
        closeRequested = true;
        lastError = new TransportError(TransportErrorKind.LOCAL_ABORT, currentTarget, "container stopped");
        terminate(false);
    }

    private void openTransport(ConnectionTarget target) {
        state = EngineState.CONNECTING;
        currentTarget = target;
        Attempt next = new Attempt(target);
        attempt = next;
        log.debug("Connection {} attempt to {} (retry cycle {})", id, target, retryCycles);
        try {
            next.transport = transports.open(target, options, next);
        } catch (RuntimeException e) {
            log.warn("Connection {} could not start transport to {}", id, target, e);
            if (attempt == next) {
                handleFailure(TransportError.fromException(target, e));
            }
        }
    }

    private void onEstablished(Attempt source) {
        if (state != EngineState.CONNECTING) {
            log.debug("Connection {} ignoring establish in state {}", id, state);
            return;
        }
        state = EngineState.OPEN;
        retryAttempt = 1;
        openCount++;
        log.info("Connection {} open to {} (reconnected: {})", id, source.target, isReconnected());
        notifyHandler("onConnectionOpen", h -> h.onConnectionOpen(connection));
    }

    private void onRemoteClose(Attempt source, ErrorCondition condition) {
        if (cleanCloseInProgress) {
            // The peer's answer to our Close, completion follows in onClosed
            return;
        }
        TransportError error = TransportError.fromCondition(source.target, condition);
        if (options.effectiveReconnect().isPresent()) {
            handleFailure(error);
            return;
        }
        log.warn("Connection {} closed by peer: {}", id, error.getMessage());
        lastError = error;
        dropTransport();
        if (condition != null && condition.getCondition() != null) {
            notifyHandler("onConnectionError", h -> h.onConnectionError(connection, condition));
        }
        terminate(false);
    }

    private void onClosed(Attempt source, boolean clean) {
        source.transport = null;
        if (cleanCloseInProgress) {
            terminate(clean);
            return;
        }
        handleFailure(new TransportError(TransportErrorKind.ADDRESS_UNREACHABLE, source.target, "connection lost"));
    }

    private void handleFailure(TransportError error) {
        if (state == EngineState.CLOSED) {
            return;
        }
        dropTransport();
        lastError = error;
        log.warn("Connection {} transport error: {}", id, error.getMessage());

        handlingFailure = true;
        try {
            notifyHandler("onTransportError", h -> h.onTransportError(connection, error));
        } finally {
            handlingFailure = false;
        }

        if (closeRequested) {
            log.info("Connection {} closed after transport error, not reconnecting", id);
            terminate(false);
            return;
        }

        Optional<ReconnectOptions> policy = options.effectiveReconnect();
        Optional<Duration> delay = policy.isPresent() ? policy.get().nextDelay(retryAttempt) : Optional.empty();
        if (!delay.isPresent()) {
            if (policy.isPresent()) {
                log.info("Connection {} giving up after {} reconnect attempts", id, retryAttempt - 1);
                lastError = new TransportError(TransportErrorKind.POLICY_EXHAUSTED, error.getTarget(),
                    "reconnect attempts exhausted, last error: " + error.getDescription(),
                    error.getCondition(), error.getCause());
            }
            terminate(false);
            return;
        }

        retryAttempt++;
        retryCycles++;
        state = EngineState.RETRY_WAIT;
        Object token = new Object();
        retryToken = token;
        log.debug("Connection {} retry in {}ms", id, delay.get().toMillis());
        retryTimer = container.schedule(delay.get(), () -> onRetryTimer(token));
    }

    private void onRetryTimer(Object token) {
        if (state != EngineState.RETRY_WAIT || retryToken != token) {
            log.debug("Connection {} ignoring stale retry timer in state {}", id, state);
            return;
        }
        retryTimer = null;
        retryToken = null;
        openTransport(candidates.nextTarget(false));
    }

    private void refreshCandidates() {
        candidates.setFailover(options.failoverTargets());
        candidates.setOverride(options.reconnectTarget().orElse(null));
    }

    private void cancelRetry() {
        retryToken = null;
        if (retryTimer != null) {
            retryTimer.cancel();
            retryTimer = null;
        }
    }

    private void dropTransport() {
        Attempt current = attempt;
        attempt = null;
        if (current != null && current.transport != null) {
            Transport transport = current.transport;
            current.transport = null;
            transport.abort();
        }
    }

    private void terminate(boolean clean) {
        if (state == EngineState.CLOSED) {
            return;
        }
        cancelRetry();
        dropTransport();
        state = EngineState.CLOSED;
        log.info("Connection {} closed{}", id, clean ? "" : (lastError != null ? ": " + lastError.getMessage() : ""));
        if (clean) {
            notifyHandler("onConnectionClose", h -> h.onConnectionClose(connection));
        }
        notifyHandler("onTransportClose", h -> h.onTransportClose(connection));
        if (terminationListener != null) {
            terminationListener.accept(connection);
        }
    }

    private void notifyHandler(String callback, Consumer<ConnectionHandler> call) {
        ConnectionHandler handler = options.handler().orElse(fallbackHandler);
        try {
            call.accept(handler);
        } catch (RuntimeException e) {
            log.warn("Connection {} handler {} threw", id, callback, e);
        }
    }

    /**
     * Listener bound to one transport attempt. Events from attempts that are
     * no longer current are dropped.
     */
    private final class Attempt implements TransportListener {
        private final ConnectionTarget target;
        private Transport transport;

        Attempt(ConnectionTarget target) {
            this.target = target;
        }

        private boolean isCurrent() {
            return attempt == this;
        }

        @Override
        public void onEstablished() {
            if (isCurrent()) {
                ReconnectEngine.this.onEstablished(this);
            }
        }

        @Override
        public void onFailure(TransportError error) {
            if (isCurrent()) {
                handleFailure(error);
            }
        }

        @Override
        public void onRemoteClose(ErrorCondition condition) {
            if (isCurrent()) {
                ReconnectEngine.this.onRemoteClose(this, condition);
            }
        }

        @Override
        public void onClosed(boolean clean) {
            if (isCurrent()) {
                ReconnectEngine.this.onClosed(this, clean);
            }
        }
    }
}
