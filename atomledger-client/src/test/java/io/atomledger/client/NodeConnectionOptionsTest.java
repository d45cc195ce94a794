package io.atomledger.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeConnectionOptionsTest {

    @Test
    void defaultsMatchNodeExpectations() {
        NodeConnectionOptions options = NodeConnectionOptions.defaults();
        assertThat(options.connectTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(options.submissionTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(options.pingInterval()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void rejectsNonPositiveDurations() {
        assertThatThrownBy(() -> NodeConnectionOptions.builder().pingInterval(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pingInterval");
        assertThatThrownBy(() -> NodeConnectionOptions.builder().submissionTimeout(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builderRequiresTransportOrEndpoint() {
        assertThatThrownBy(() -> NodeConnection.builder().build())
                .isInstanceOf(IllegalStateException.class);
    }
}
