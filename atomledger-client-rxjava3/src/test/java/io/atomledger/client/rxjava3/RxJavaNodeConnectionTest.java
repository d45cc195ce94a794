package io.atomledger.client.rxjava3;

import io.atomledger.client.AtomSubmissionState;
import io.atomledger.client.AtomUpdate;
import io.atomledger.client.NodeConnection;
import io.atomledger.client.NodeConnectionException;
import io.atomledger.client.RpcTransport;
import io.atomledger.core.Bytes;
import io.atomledger.core.atom.Atom;
import io.atomledger.core.atom.LedgerTypes;
import io.atomledger.core.atom.MessageParticle;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RxJavaNodeConnectionTest {

    private final AutoAckTransport transport = new AutoAckTransport();
    private final RxJavaNodeConnection connection =
            new RxJavaNodeConnection(NodeConnection.builder().transport(transport).build());

    @AfterEach
    void tearDown() {
        connection.close();
    }

    private static Atom atom() {
        return Atom.builder().particle(MessageParticle.of("alice", "bob", Bytes.fromHex("01"))).build();
    }

    @Test
    void openCompletes() {
        assertThat(connection.open().blockingAwait(3, TimeUnit.SECONDS)).isTrue();
        assertThat(connection.isReady()).isTrue();
    }

    @Test
    void subscriptionDeliversAtoms() throws Exception {
        connection.open().blockingAwait();
        Atom atom = atom();

        TestSubscriber<AtomUpdate> updates = connection.subscribe("alice").test();
        transport.push("Atoms.subscribeUpdate", Map.of(
                "subscriberId", "2",
                "atoms", List.of(LedgerTypes.serialization().toWire(atom)),
                "isHead", true));

        updates.awaitCount(1);
        updates.assertValue(update -> update.atom().equals(atom));
        assertThat(connection.isSynced("alice").blockingFirst()).isTrue();
        assertThat(connection.subscribedAddresses()).containsExactly("alice");

        connection.unsubscribe("alice").blockingAwait(3, TimeUnit.SECONDS);
        updates.await(3, TimeUnit.SECONDS);
        updates.assertComplete();
    }

    @Test
    void submissionStatesArriveAsFlowable() {
        connection.open().blockingAwait();

        List<AtomSubmissionState> states = connection.submitAtom(atom())
                .doOnNext(state -> {
                    if (state == AtomSubmissionState.SUBMITTED) {
                        transport.push("AtomSubmissionState.onNext", Map.of("subscriberId", "2", "value", "STORED"));
                    }
                })
                .toList()
                .blockingGet();

        assertThat(states).containsExactly(AtomSubmissionState.SUBMITTED, AtomSubmissionState.STORED);
    }

    @Test
    void unsupportedAtomQueryFailsSingle() {
        connection.open().blockingAwait();

        connection.getAtomById(LedgerTypes.serialization().hid(atom()))
                .test()
                .awaitDone(3, TimeUnit.SECONDS)
                .assertError(NodeConnectionException.UnsupportedQuery.class);
    }

    /**
     * Opens on connect and acknowledges every call with an empty result.
     */
    private static final class AutoAckTransport implements RpcTransport {
        private volatile Listener listener;

        @Override
        public URI endpoint() {
            return URI.create("ws://node.test/rpc");
        }

        @Override
        public void connect(Listener listener) {
            this.listener = listener;
            listener.onOpen();
        }

        @Override
        public CompletableFuture<Object> call(String method, Map<String, Object> params) {
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public boolean isReady() {
            return listener != null;
        }

        @Override
        public void close() {
            Listener l = listener;
            if (l != null) {
                l.onClose(1000, "closed");
            }
        }

        void push(String method, Map<String, Object> params) {
            listener.onNotification(method, params);
        }
    }
}
