package com.amqpclient.error;

import com.amqpclient.address.ConnectionTarget;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;

import java.util.Objects;

/**
 * Details of one failed connection attempt.
 *
 * The message always names the target, so every hop through the failover
 * list can be told apart in logs and callbacks.
 */
public final class TransportError {

    private final TransportErrorKind kind;
    private final ConnectionTarget target;
    private final String description;
    private final ErrorCondition condition;
    private final Throwable cause;

    public TransportError(TransportErrorKind kind, ConnectionTarget target, String description) {
        this(kind, target, description, null, null);
    }

    public TransportError(TransportErrorKind kind, ConnectionTarget target, String description,
                          ErrorCondition condition, Throwable cause) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.target = target;
        this.description = description != null ? description : kind.getLabel();
        this.condition = condition;
        this.cause = cause;
    }

    /**
     * Build an error from an exception raised while connecting.
     */
    public static TransportError fromException(ConnectionTarget target, Throwable cause) {
        String description = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new TransportError(ErrorClassifier.classify(cause), target, description, null, cause);
    }

    /**
     * Build an error from an AMQP error condition sent by the peer.
     */
    public static TransportError fromCondition(ConnectionTarget target, ErrorCondition condition) {
        String description;
        if (condition == null || condition.getCondition() == null) {
            description = "connection closed by peer";
        } else if (condition.getDescription() != null) {
            description = condition.getCondition() + ": " + condition.getDescription();
        } else {
            description = condition.getCondition().toString();
        }
        return new TransportError(ErrorClassifier.classify(condition), target, description, condition, null);
    }

    public TransportErrorKind getKind() {
        return kind;
    }

    /**
     * The address of the failed attempt, null if no attempt was made.
     */
    public ConnectionTarget getTarget() {
        return target;
    }

    public String getDescription() {
        return description;
    }

    /**
     * The AMQP error condition the peer sent, if any.
     */
    public ErrorCondition getCondition() {
        return condition;
    }

    public Throwable getCause() {
        return cause;
    }

    public String getMessage() {
        if (target == null) {
            return kind.getLabel() + ": " + description;
        }
        return kind.getLabel() + " [" + target + "]: " + description;
    }

    @Override
    public String toString() {
        return "TransportError{" + getMessage() + "}";
    }
}
