package io.atomledger.client;

import io.atomledger.core.LedgerException;

import java.util.Objects;

/**
 * Errors raised by {@link NodeConnection} and {@link RpcTransport} implementations.
 *
 * <p>Each failure surfaces on the operation that caused it: the {@code Mono} or {@code Flux}
 * returned to the caller terminates with one of these subclasses.
 */
public abstract class NodeConnectionException extends LedgerException {

    protected NodeConnectionException(String message) {
        super(message);
    }

    protected NodeConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The socket failed or could not be reached.
     */
    public static class TransportError extends NodeConnectionException {
        public TransportError(String message) {
            super(message);
        }

        public TransportError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The socket did not open within the configured connect timeout.
     */
    public static class ConnectTimeout extends NodeConnectionException {
        public ConnectTimeout(String message) {
            super(message);
        }
    }

    /**
     * The connection is closed, or closed while the operation was in progress.
     */
    public static class ConnectionClosed extends NodeConnectionException {
        public ConnectionClosed(String message) {
            super(message);
        }

        public ConnectionClosed(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class SubscriptionFailed extends NodeConnectionException {
        public SubscriptionFailed(String address, Throwable cause) {
            super("subscription to " + address + " failed", cause);
        }
    }

    public static class UnsubscriptionFailed extends NodeConnectionException {
        public UnsubscriptionFailed(String address, Throwable cause) {
            super("unsubscribing from " + address + " failed", cause);
        }
    }

    /**
     * No acknowledgement arrived within the submission timeout. The connection is closed.
     */
    public static class SubmissionTimeout extends NodeConnectionException {
        public SubmissionTimeout(String message) {
            super(message);
        }
    }

    /**
     * The submission call itself failed.
     */
    public static class SubmissionFailed extends NodeConnectionException {
        public SubmissionFailed(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The node refused the atom.
     */
    public static class SubmissionRejected extends NodeConnectionException {
        private final Reason reason;
        private final String detail;

        public SubmissionRejected(Reason reason, String detail) {
            super(detail == null ? String.valueOf(reason) : reason + ": " + detail);
            this.reason = Objects.requireNonNull(reason, "reason");
            this.detail = detail;
        }

        public Reason reason() {
            return reason;
        }

        /**
         * Message sent by the node, may be {@code null}.
         */
        public String detail() {
            return detail;
        }

        public enum Reason {
            COLLISION,
            ILLEGAL_STATE,
            UNSUITABLE_PEER,
            VALIDATION_ERROR
        }
    }

    /**
     * The node answered a query in a shape this client does not understand.
     */
    public static class UnsupportedQuery extends NodeConnectionException {
        public UnsupportedQuery(String message) {
            super(message);
        }
    }

    /**
     * The node answered a JSON-RPC call with an error object.
     */
    public static class RpcException extends NodeConnectionException {
        private final int code;

        public RpcException(int code, String message) {
            super(message + " (code " + code + ")");
            this.code = code;
        }

        public int code() {
            return code;
        }
    }
}
