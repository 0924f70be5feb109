package com.amqpclient.error;

/**
 * Categories of connection failures.
 *
 * Every kind except {@link #LOCAL_ABORT} and {@link #POLICY_EXHAUSTED} is
 * reported through the transport error callback and retried according to the
 * reconnect policy. Deciding that a failure is fatal is up to the application,
 * which can close the connection from inside that callback.
 */
public enum TransportErrorKind {
    /**
     * Name resolution failed, the connection was refused or timed out, or an
     * established socket was lost.
     */
    ADDRESS_UNREACHABLE("address-unreachable", true),

    /**
     * TLS handshake failed or the peer did not speak AMQP 1.0.
     */
    PROTOCOL_NEGOTIATION_FAILED("protocol-negotiation-failed", true),

    /**
     * SASL negotiation failed: bad credentials or no common mechanism.
     */
    AUTHENTICATION_FAILED("authentication-failed", true),

    /**
     * The peer closed the connection with an error condition.
     */
    PEER_REFUSED("peer-refused", true),

    /**
     * The application closed the connection.
     */
    LOCAL_ABORT("local-abort", false),

    /**
     * The reconnect policy allows no further attempts.
     */
    POLICY_EXHAUSTED("policy-exhausted", false);

    private final String label;
    private final boolean retryable;

    TransportErrorKind(String label, boolean retryable) {
        this.label = label;
        this.retryable = retryable;
    }

    public String getLabel() {
        return label;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
