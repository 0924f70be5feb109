package com.amqpclient.error;

import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.codec.DecoderException;
import io.vertx.proton.sasl.MechanismMismatchException;
import io.vertx.proton.sasl.SaslSystemException;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;

import javax.net.ssl.SSLException;
import javax.security.sasl.AuthenticationException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.util.Locale;

/**
 * Maps connection failures onto {@link TransportErrorKind}.
 */
public final class ErrorClassifier {

    private static final Symbol UNAUTHORIZED_ACCESS = Symbol.valueOf("amqp:unauthorized-access");
    private static final Symbol DECODE_ERROR = Symbol.valueOf("amqp:decode-error");
    private static final Symbol NOT_IMPLEMENTED = Symbol.valueOf("amqp:not-implemented");
    private static final Symbol FRAMING_ERROR = Symbol.valueOf("amqp:connection:framing-error");
    private static final Symbol INVALID_FIELD = Symbol.valueOf("amqp:invalid-field");

    private static final int MAX_CAUSE_DEPTH = 10;

    private ErrorClassifier() {
        // Utility class
    }

    /**
     * Classify an exception raised by the transport.
     *
     * Unrecognised failures count as unreachable addresses.
     */
    public static TransportErrorKind classify(Throwable throwable) {
        Throwable current = throwable;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            TransportErrorKind kind = classifyDirect(current);
            if (kind != null) {
                return kind;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return TransportErrorKind.ADDRESS_UNREACHABLE;
    }

    /**
     * Classify an error condition sent by the peer when closing the connection.
     */
    public static TransportErrorKind classify(ErrorCondition condition) {
        if (condition == null || condition.getCondition() == null) {
            return TransportErrorKind.PEER_REFUSED;
        }
        Symbol symbol = condition.getCondition();
        if (UNAUTHORIZED_ACCESS.equals(symbol)) {
            return TransportErrorKind.AUTHENTICATION_FAILED;
        }
        if (DECODE_ERROR.equals(symbol) || NOT_IMPLEMENTED.equals(symbol)
                || FRAMING_ERROR.equals(symbol) || INVALID_FIELD.equals(symbol)) {
            return TransportErrorKind.PROTOCOL_NEGOTIATION_FAILED;
        }
        return TransportErrorKind.PEER_REFUSED;
    }

    private static TransportErrorKind classifyDirect(Throwable t) {
        // SASL failures
        if (t instanceof AuthenticationException) return TransportErrorKind.AUTHENTICATION_FAILED;
        if (t instanceof MechanismMismatchException) return TransportErrorKind.AUTHENTICATION_FAILED;
        if (t instanceof SaslSystemException) return TransportErrorKind.AUTHENTICATION_FAILED;

        // TLS and framing
        if (t instanceof SSLException) return TransportErrorKind.PROTOCOL_NEGOTIATION_FAILED;
        if (t instanceof DecoderException) return TransportErrorKind.PROTOCOL_NEGOTIATION_FAILED;

        // Network
        if (t instanceof UnknownHostException) return TransportErrorKind.ADDRESS_UNREACHABLE;
        if (t instanceof ConnectException) return TransportErrorKind.ADDRESS_UNREACHABLE;
        if (t instanceof NoRouteToHostException) return TransportErrorKind.ADDRESS_UNREACHABLE;
        if (t instanceof ConnectTimeoutException) return TransportErrorKind.ADDRESS_UNREACHABLE;
        if (t instanceof SocketTimeoutException) return TransportErrorKind.ADDRESS_UNREACHABLE;
        if (t instanceof ClosedChannelException) return TransportErrorKind.ADDRESS_UNREACHABLE;
        if (t instanceof SocketException) return TransportErrorKind.ADDRESS_UNREACHABLE;

        return classifyByMessage(t);
    }

    private static TransportErrorKind classifyByMessage(Throwable t) {
        String msg = t.getMessage();
        if (msg == null) {
            return null;
        }
        String lower = msg.toLowerCase(Locale.ROOT);
        if (lower.contains("sasl") || lower.contains("authenticat")) {
            return TransportErrorKind.AUTHENTICATION_FAILED;
        }
        if (lower.contains("protocol header") || lower.contains("handshake")) {
            return TransportErrorKind.PROTOCOL_NEGOTIATION_FAILED;
        }
        return null;
    }
}
