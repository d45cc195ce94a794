package io.atomledger.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing settings of a {@link NodeConnection}.
 */
public final class NodeConnectionOptions {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SUBMISSION_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_PING_INTERVAL = Duration.ofSeconds(10);

    private final Duration connectTimeout;
    private final Duration submissionTimeout;
    private final Duration pingInterval;

    private NodeConnectionOptions(Builder builder) {
        this.connectTimeout = builder.connectTimeout;
        this.submissionTimeout = builder.submissionTimeout;
        this.pingInterval = builder.pingInterval;
    }

    public static NodeConnectionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration submissionTimeout() {
        return submissionTimeout;
    }

    public Duration pingInterval() {
        return pingInterval;
    }

    @Override
    public String toString() {
        return "NodeConnectionOptions{connectTimeout=" + connectTimeout
                + ", submissionTimeout=" + submissionTimeout
                + ", pingInterval=" + pingInterval + '}';
    }

    public static final class Builder {
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration submissionTimeout = DEFAULT_SUBMISSION_TIMEOUT;
        private Duration pingInterval = DEFAULT_PING_INTERVAL;

        private Builder() {}

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = positive(connectTimeout, "connectTimeout");
            return this;
        }

        /**
         * How long a submission may wait for the node's acknowledgement.
         */
        public Builder submissionTimeout(Duration submissionTimeout) {
            this.submissionTimeout = positive(submissionTimeout, "submissionTimeout");
            return this;
        }

        /**
         * Interval of the liveness probe sent while the connection is open.
         */
        public Builder pingInterval(Duration pingInterval) {
            this.pingInterval = positive(pingInterval, "pingInterval");
            return this;
        }

        public NodeConnectionOptions build() {
            return new NodeConnectionOptions(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
