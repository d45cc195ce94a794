package io.atomledger.client;

import io.atomledger.core.EUID;
import io.atomledger.core.LedgerException;
import io.atomledger.core.atom.Atom;
import io.atomledger.core.atom.LedgerTypes;
import io.atomledger.core.serialization.Dson;
import io.atomledger.core.serialization.Serialization;
import io.atomledger.core.serialization.ValueCodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.concurrent.Queues;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Session with one ledger node: address subscriptions, atom submission and queries over a
 * {@link RpcTransport}.
 *
 * <p>Every transport callback, RPC completion and timer is re-dispatched onto a single-threaded
 * scheduler owned by the connection, so all bookkeeping has exactly one writer. Operations start
 * eagerly when called; the returned {@code Mono} or {@code Flux} only observes the outcome.
 *
 * <p>A closed connection cannot be reopened. Create a new one instead.
 *
 * <pre>{@code
 * NodeConnection node = NodeConnection.builder()
 *     .endpoint(URI.create("wss://node.example.org/rpc"))
 *     .build();
 * node.open().block();
 * node.subscribe(address).subscribe(update -> ...);
 * }</pre>
 */
public final class NodeConnection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NodeConnection.class);

    static final String SUBSCRIBE = "Atoms.subscribe";
    static final String CANCEL = "Atoms.cancel";
    static final String SUBMIT = "Universe.submitAtomAndSubscribe";
    static final String GET_ATOM_INFO = "Atoms.getAtomInfo";
    static final String PING = "Network.getInfo";
    static final String SUBSCRIBE_UPDATE = "Atoms.subscribeUpdate";
    static final String SUBMISSION_UPDATE = "AtomSubmissionState.onNext";

    private final RpcTransport transport;
    private final Serialization serialization;
    private final NodeConnectionOptions options;
    private final Scheduler loop;
    private final Sinks.Many<ConnectionStatus> statusSink = Sinks.many().replay().latestOrDefault(ConnectionStatus.CLOSED);

    // confined to the loop
    private ConnectionStatus state = ConnectionStatus.CLOSED;
    private boolean terminated;
    private long lastSubscriberId = 1;
    private Disposable connectTimer;
    private Disposable pingTask;
    private final List<Sinks.One<Void>> openWaiters = new ArrayList<>();
    private final Map<String, Subscription> subscriptionsByAddress = new LinkedHashMap<>();
    private final Map<String, Subscription> subscriptionsById = new HashMap<>();
    private final Map<String, Submission> submissions = new HashMap<>();

    // published by the loop for readers on other threads
    private volatile ConnectionStatus status = ConnectionStatus.CLOSED;
    private volatile Set<String> addresses = Set.of();

    private NodeConnection(RpcTransport transport, Serialization serialization, NodeConnectionOptions options) {
        this.transport = transport;
        this.serialization = serialization;
        this.options = options;
        this.loop = Schedulers.newSingle("atomledger-node-" + transport.endpoint().getHost(), true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public URI endpoint() {
        return transport.endpoint();
    }

    public NodeConnectionOptions options() {
        return options;
    }

    /**
     * Connects to the node. Completes once the socket is open, immediately if it already is.
     *
     * <p>Fails with {@link NodeConnectionException.ConnectTimeout} when the socket does not open
     * within {@link NodeConnectionOptions#connectTimeout()}, or with
     * {@link NodeConnectionException.TransportError} when the transport reports an error first.
     */
    public Mono<Void> open() {
        Sinks.One<Void> result = Sinks.one();
        dispatch(() -> doOpen(result), result::tryEmitError);
        return result.asMono();
    }

    /**
     * Subscribes to atoms relevant to {@code address}. The returned stream delivers updates in the
     * order the node sends them and ends when the subscription is cancelled or the connection closes.
     */
    public Flux<AtomUpdate> subscribe(String address) {
        Objects.requireNonNull(address, "address");
        // stays open when a consumer cancels; only unsubscribe or close end it
        Sinks.Many<AtomUpdate> updates = Sinks.many().multicast()
                .onBackpressureBuffer(Queues.SMALL_BUFFER_SIZE, false);
        dispatch(() -> doSubscribe(address, updates), updates::tryEmitError);
        return updates.asFlux();
    }

    /**
     * Cancels the subscription for {@code address}. On success its update and sync streams complete.
     */
    public Mono<Void> unsubscribe(String address) {
        Objects.requireNonNull(address, "address");
        Sinks.One<Void> result = Sinks.one();
        dispatch(() -> doUnsubscribe(address, result), result::tryEmitError);
        return result.asMono();
    }

    /**
     * Cancels every subscription, waits for all of them, then fails with the first failure if any.
     */
    public Mono<Void> unsubscribeAll() {
        Sinks.One<List<String>> snapshot = Sinks.one();
        dispatch(() -> snapshot.tryEmitValue(List.copyOf(subscriptionsByAddress.keySet())), snapshot::tryEmitError);

        Sinks.One<Void> result = Sinks.one();
        snapshot.asMono()
                .flatMapMany(all -> Flux.fromIterable(all)
                        .flatMapSequential(address -> unsubscribe(address)
                                .then(Mono.<Throwable>empty())
                                .onErrorResume(Mono::just)))
                .collectList()
                .subscribe(errors -> {
                    if (errors.isEmpty()) {
                        result.tryEmitEmpty();
                    } else {
                        result.tryEmitError(errors.get(0));
                    }
                }, result::tryEmitError);
        return result.asMono();
    }

    /**
     * Whether the node has delivered everything it holds for {@code address}. Starts with
     * {@code false} and replays the latest value to new subscribers.
     */
    public Flux<Boolean> isSynced(String address) {
        Objects.requireNonNull(address, "address");
        Sinks.One<Sinks.Many<Boolean>> lookup = Sinks.one();
        dispatch(() -> {
            Subscription subscription = subscriptionsByAddress.get(address);
            if (subscription == null) {
                lookup.tryEmitError(new IllegalStateException("not subscribed to " + address));
            } else {
                lookup.tryEmitValue(subscription.synced);
            }
        }, lookup::tryEmitError);
        return lookup.asMono().flatMapMany(Sinks.Many::asFlux);
    }

    /**
     * Submits {@code atom} and reports its progress. The stream replays every state to late
     * subscribers, completes after {@link AtomSubmissionState#STORED}, and fails with
     * {@link NodeConnectionException.SubmissionRejected}, {@link NodeConnectionException.SubmissionFailed}
     * or {@link NodeConnectionException.SubmissionTimeout}.
     */
    public Flux<AtomSubmissionState> submitAtom(Atom atom) {
        Objects.requireNonNull(atom, "atom");
        Sinks.Many<AtomSubmissionState> states = Sinks.many().replay().all();
        dispatch(() -> doSubmit(atom, states), states::tryEmitError);
        return states.asFlux();
    }

    /**
     * Looks up a stored atom by its identifier.
     *
     * <p>Nodes answer this query in different shapes. Only a response whose {@code result} is an
     * atom object is understood; anything else fails with
     * {@link NodeConnectionException.UnsupportedQuery}.
     */
    public Mono<Atom> getAtomById(EUID id) {
        Objects.requireNonNull(id, "id");
        Sinks.One<Atom> result = Sinks.one();
        dispatch(() -> {
            if (!requireOpen(result::tryEmitError)) {
                return;
            }
            Map<String, Object> params = Map.of("id", ValueCodecs.IDENTIFIER.toWire(id, serialization));
            call(GET_ATOM_INFO, params).whenComplete((response, error) -> {
                if (error != null) {
                    result.tryEmitError(unwrap(error));
                    return;
                }
                try {
                    result.tryEmitValue(decodeAtomInfo(id, response));
                } catch (LedgerException e) {
                    result.tryEmitError(e);
                }
            });
        }, result::tryEmitError);
        return result.asMono();
    }

    /**
     * Connection status changes. Replays the current status and completes once the connection is
     * closed for good.
     */
    public Flux<ConnectionStatus> status() {
        return statusSink.asFlux();
    }

    public ConnectionStatus currentStatus() {
        return status;
    }

    /**
     * True while the connection is open and the transport can send.
     */
    public boolean isReady() {
        return status == ConnectionStatus.OPEN && transport.isReady();
    }

    public Set<String> subscribedAddresses() {
        return addresses;
    }

    /**
     * Closes the transport. Live subscriptions and submissions fail with
     * {@link NodeConnectionException.ConnectionClosed}. Calling it again has no effect.
     */
    @Override
    public void close() {
        dispatch(() -> {
            if (!terminated) {
                log.info("Closing connection to {}", transport.endpoint());
                transport.close();
                handleClosed(new NodeConnectionException.ConnectionClosed("connection closed by client"));
            }
        }, error -> log.debug("Connection to {} already closed", transport.endpoint()));
    }

    private void doOpen(Sinks.One<Void> result) {
        if (terminated) {
            result.tryEmitError(new NodeConnectionException.ConnectionClosed("connection is closed"));
            return;
        }
        if (state == ConnectionStatus.OPEN) {
            result.tryEmitEmpty();
            return;
        }
        openWaiters.add(result);
        if (state == ConnectionStatus.CONNECTING) {
            return;
        }
        setState(ConnectionStatus.CONNECTING);
        log.info("Connecting to {}", transport.endpoint());
        connectTimer = loop.schedule(this::onConnectTimeout, options.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        try {
            transport.connect(new TransportListener());
        } catch (RuntimeException e) {
            handleError(e);
        }
    }

    private void onConnectTimeout() {
        if (state != ConnectionStatus.CONNECTING) {
            return;
        }
        log.warn("Connecting to {} timed out after {}", transport.endpoint(), options.connectTimeout());
        transport.close();
        failOpenWaiters(new NodeConnectionException.ConnectTimeout(
                "no connection to " + transport.endpoint() + " within " + options.connectTimeout()));
        handleClosed(new NodeConnectionException.ConnectionClosed("connect timed out"));
    }

    private void handleOpen() {
        if (state != ConnectionStatus.CONNECTING) {
            return;
        }
        dispose(connectTimer);
        setState(ConnectionStatus.OPEN);
        log.info("Connected to {}", transport.endpoint());
        long interval = options.pingInterval().toMillis();
        pingTask = loop.schedulePeriodically(this::ping, interval, interval, TimeUnit.MILLISECONDS);
        List<Sinks.One<Void>> waiters = new ArrayList<>(openWaiters);
        openWaiters.clear();
        waiters.forEach(Sinks.One::tryEmitEmpty);
    }

    private void handleError(Throwable error) {
        if (terminated) {
            return;
        }
        log.error("Transport error on {}", transport.endpoint(), error);
        transport.close();
        failOpenWaiters(new NodeConnectionException.TransportError("transport error on " + transport.endpoint(), error));
        handleClosed(new NodeConnectionException.ConnectionClosed("transport error", error));
    }

    private void handleClosed(NodeConnectionException.ConnectionClosed reason) {
        if (terminated) {
            return;
        }
        terminated = true;
        dispose(connectTimer);
        dispose(pingTask);
        setState(ConnectionStatus.CLOSED);
        statusSink.tryEmitComplete();
        log.info("Connection to {} closed: {}", transport.endpoint(), reason.getMessage());

        failOpenWaiters(reason);
        for (Subscription subscription : subscriptionsByAddress.values()) {
            subscription.fail(reason);
        }
        subscriptionsByAddress.clear();
        subscriptionsById.clear();
        addresses = Set.of();
        for (Submission submission : new ArrayList<>(submissions.values())) {
            submission.fail(reason);
        }
        submissions.clear();

        loop.disposeGracefully().subscribe(null,
                error -> log.warn("Event loop of {} did not stop cleanly", transport.endpoint(), error));
    }

    private void failOpenWaiters(Throwable error) {
        List<Sinks.One<Void>> waiters = new ArrayList<>(openWaiters);
        openWaiters.clear();
        waiters.forEach(waiter -> waiter.tryEmitError(error));
    }

    private void ping() {
        call(PING, Map.of("id", 0)).whenComplete((info, error) -> {
            if (error != null) {
                log.warn("Ping to {} failed: {}", transport.endpoint(), unwrap(error).toString());
            } else {
                log.debug("Ping to {} answered", transport.endpoint());
            }
        });
    }

    private void doSubscribe(String address, Sinks.Many<AtomUpdate> updates) {
        if (!requireOpen(updates::tryEmitError)) {
            return;
        }
        if (subscriptionsByAddress.containsKey(address)) {
            updates.tryEmitError(new IllegalStateException("already subscribed to " + address));
            return;
        }
        Subscription subscription = new Subscription(address, nextSubscriberId(), updates);
        subscriptionsByAddress.put(address, subscription);
        subscriptionsById.put(subscription.id, subscription);
        addresses = Set.copyOf(subscriptionsByAddress.keySet());
        log.debug("Subscribing to {} as {}", address, subscription.id);

        Map<String, Object> params = Map.of(
                "subscriberId", subscription.id,
                "query", Map.of("address", address),
                "debug", true);
        call(SUBSCRIBE, params).whenComplete(onLoop((ignored, error) -> {
            if (subscriptionsById.get(subscription.id) != subscription) {
                return;
            }
            if (error != null) {
                log.error("Subscription to {} failed: {}", address, error.toString());
                remove(subscription);
                subscription.fail(new NodeConnectionException.SubscriptionFailed(address, error));
            } else {
                log.info("Subscribed to {} as {}", address, subscription.id);
            }
        }, updates::tryEmitError));
    }

    private void doUnsubscribe(String address, Sinks.One<Void> result) {
        if (!requireOpen(result::tryEmitError)) {
            return;
        }
        Subscription subscription = subscriptionsByAddress.get(address);
        if (subscription == null) {
            result.tryEmitError(new IllegalStateException("not subscribed to " + address));
            return;
        }
        call(CANCEL, Map.of("subscriberId", subscription.id)).whenComplete(onLoop((ignored, error) -> {
            if (error != null) {
                log.warn("Unsubscribing from {} failed: {}", address, error.toString());
                result.tryEmitError(new NodeConnectionException.UnsubscriptionFailed(address, error));
                return;
            }
            if (subscriptionsById.get(subscription.id) == subscription) {
                remove(subscription);
                subscription.complete();
            }
            log.debug("Unsubscribed from {}", address);
            result.tryEmitEmpty();
        }, result::tryEmitError));
    }

    private void doSubmit(Atom atom, Sinks.Many<AtomSubmissionState> states) {
        if (!requireOpen(states::tryEmitError)) {
            return;
        }
        Map<String, Object> wire;
        try {
            wire = serialization.toWire(atom);
        } catch (LedgerException e) {
            states.tryEmitError(e);
            return;
        }
        Submission submission = new Submission(nextSubscriberId(), states);
        submissions.put(submission.id, submission);
        submission.timer = loop.schedule(() -> onSubmissionTimeout(submission),
                options.submissionTimeout().toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Submitting atom {} as {}", wire.get("hid"), submission.id);

        call(SUBMIT, Map.of("subscriberId", submission.id, "atom", wire)).whenComplete(onLoop((ignored, error) -> {
            if (error != null) {
                submission.fail(new NodeConnectionException.SubmissionFailed(
                        "submission " + submission.id + " failed", error));
            } else {
                submission.advance(AtomSubmissionState.SUBMITTED);
            }
        }, states::tryEmitError));
    }

    private void onSubmissionTimeout(Submission submission) {
        if (submission.done || terminated) {
            return;
        }
        log.warn("Submission {} was not acknowledged within {}, closing connection",
                submission.id, options.submissionTimeout());
        transport.close();
        submission.fail(new NodeConnectionException.SubmissionTimeout(
                "submission " + submission.id + " not acknowledged within " + options.submissionTimeout()));
        handleClosed(new NodeConnectionException.ConnectionClosed("submission timed out"));
    }

    private void handleNotification(String method, Map<String, Object> params) {
        switch (method) {
            case SUBSCRIBE_UPDATE:
                handleSubscribeUpdate(params);
                break;
            case SUBMISSION_UPDATE:
                handleSubmissionUpdate(params);
                break;
            default:
                log.debug("Ignoring notification {}", method);
        }
    }

    private void handleSubscribeUpdate(Map<String, Object> params) {
        String id = String.valueOf(params.get("subscriberId"));
        Subscription subscription = subscriptionsById.get(id);
        if (subscription == null) {
            log.warn("Dropping update for unknown subscriber {}", id);
            return;
        }
        Object wire = params.get("atoms");
        List<Atom> atoms;
        try {
            atoms = wire == null ? List.of() : serialization.fromWireList(wire, Atom.class);
        } catch (LedgerException e) {
            log.error("Failed to decode atoms for {}", subscription.address, e);
            remove(subscription);
            subscription.fail(e);
            return;
        }
        for (int i = 0; i < atoms.size(); i++) {
            Atom atom = atoms.get(i);
            checkHid(((List<?>) wire).get(i), atom);
            subscription.updates.tryEmitNext(new AtomUpdate(AtomUpdate.Action.STORE, atom, Map.of()));
        }
        subscription.synced.tryEmitNext(Boolean.TRUE.equals(params.get("isHead")));
    }

    private void checkHid(Object wire, Atom atom) {
        if (!(wire instanceof Map)) {
            return;
        }
        Object sent = ((Map<?, ?>) wire).get("hid");
        if (sent == null) {
            return;
        }
        EUID computed = serialization.hid(atom);
        String expected = Dson.EUID_PREFIX + computed.toHex();
        if (expected.equals(sent)) {
            log.debug("Atom {} hid verified", computed);
        } else {
            log.error("Atom hid mismatch: node sent {}, computed {}", sent, expected);
        }
    }

    private void handleSubmissionUpdate(Map<String, Object> params) {
        String id = String.valueOf(params.get("subscriberId"));
        Submission submission = submissions.get(id);
        if (submission == null) {
            log.warn("Dropping submission state for unknown subscriber {}", id);
            return;
        }
        Object value = params.get("value");
        Object message = params.get("message");
        String detail = message == null ? null : message.toString();
        switch (String.valueOf(value)) {
            case "SUBMITTING":
                submission.advance(AtomSubmissionState.SUBMITTING);
                break;
            case "SUBMITTED":
                submission.advance(AtomSubmissionState.SUBMITTED);
                break;
            case "STORED":
                submission.advance(AtomSubmissionState.STORED);
                break;
            case "COLLISION":
                submission.reject(NodeConnectionException.SubmissionRejected.Reason.COLLISION, detail);
                break;
            case "ILLEGAL_STATE":
                submission.reject(NodeConnectionException.SubmissionRejected.Reason.ILLEGAL_STATE, detail);
                break;
            case "UNSUITABLE_PEER":
                submission.reject(NodeConnectionException.SubmissionRejected.Reason.UNSUITABLE_PEER, detail);
                break;
            case "VALIDATION_ERROR":
                submission.reject(NodeConnectionException.SubmissionRejected.Reason.VALIDATION_ERROR, detail);
                break;
            default:
                log.warn("Ignoring unknown submission state {} for {}", value, id);
        }
    }

    private Atom decodeAtomInfo(EUID id, Object response) {
        if (response instanceof Map) {
            Object result = ((Map<?, ?>) response).get("result");
            if (result instanceof Map) {
                return serialization.fromWire(result, Atom.class);
            }
        }
        throw new NodeConnectionException.UnsupportedQuery("unexpected response to " + GET_ATOM_INFO + " for " + id);
    }

    private boolean requireOpen(Consumer<Throwable> onClosed) {
        if (state == ConnectionStatus.OPEN) {
            return true;
        }
        onClosed.accept(new NodeConnectionException.ConnectionClosed("connection is " + state.name().toLowerCase()));
        return false;
    }

    private String nextSubscriberId() {
        lastSubscriberId++;
        return Long.toString(lastSubscriberId);
    }

    private void remove(Subscription subscription) {
        subscriptionsByAddress.remove(subscription.address, subscription);
        subscriptionsById.remove(subscription.id, subscription);
        addresses = Set.copyOf(subscriptionsByAddress.keySet());
    }

    private void setState(ConnectionStatus next) {
        state = next;
        status = next;
        statusSink.tryEmitNext(next);
    }

    private CompletableFuture<Object> call(String method, Map<String, Object> params) {
        try {
            return transport.call(method, params);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Moves an RPC completion back onto the loop, with the failure unwrapped.
     */
    private <T> BiConsumer<T, Throwable> onLoop(BiConsumer<T, Throwable> handler, Consumer<Throwable> onRejected) {
        return (value, error) -> dispatch(() -> handler.accept(value, error == null ? null : unwrap(error)), onRejected);
    }

    private void dispatch(Runnable task, Consumer<Throwable> onRejected) {
        try {
            loop.schedule(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Unexpected failure on the event loop of {}", transport.endpoint(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            onRejected.accept(new NodeConnectionException.ConnectionClosed("connection is closed", e));
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static void dispose(Disposable disposable) {
        if (disposable != null) {
            disposable.dispose();
        }
    }

    private static final class Subscription {
        final String address;
        final String id;
        final Sinks.Many<AtomUpdate> updates;
        final Sinks.Many<Boolean> synced = Sinks.many().replay().latestOrDefault(false);

        Subscription(String address, String id, Sinks.Many<AtomUpdate> updates) {
            this.address = address;
            this.id = id;
            this.updates = updates;
        }

        void complete() {
            updates.tryEmitComplete();
            synced.tryEmitComplete();
        }

        void fail(Throwable error) {
            updates.tryEmitError(error);
            synced.tryEmitError(error);
        }
    }

    private final class Submission {
        final String id;
        final Sinks.Many<AtomSubmissionState> states;
        AtomSubmissionState current = AtomSubmissionState.CREATED;
        Disposable timer;
        boolean done;

        Submission(String id, Sinks.Many<AtomSubmissionState> states) {
            this.id = id;
            this.states = states;
        }

        void advance(AtomSubmissionState next) {
            if (done || next.compareTo(current) <= 0) {
                return;
            }
            if (next == AtomSubmissionState.STORED && current != AtomSubmissionState.SUBMITTED) {
                emit(AtomSubmissionState.SUBMITTED);
            }
            emit(next);
            if (next == AtomSubmissionState.STORED) {
                finish();
                states.tryEmitComplete();
                log.debug("Submission {} stored", id);
            }
        }

        void reject(NodeConnectionException.SubmissionRejected.Reason reason, String detail) {
            if (done) {
                return;
            }
            if (current != AtomSubmissionState.SUBMITTED) {
                emit(AtomSubmissionState.SUBMITTED);
            }
            log.info("Submission {} rejected: {} {}", id, reason, detail);
            fail(new NodeConnectionException.SubmissionRejected(reason, detail));
        }

        void fail(Throwable error) {
            if (done) {
                return;
            }
            finish();
            states.tryEmitError(error);
        }

        private void emit(AtomSubmissionState next) {
            current = next;
            if (next == AtomSubmissionState.SUBMITTED) {
                dispose(timer);
            }
            states.tryEmitNext(next);
        }

        private void finish() {
            done = true;
            dispose(timer);
            submissions.remove(id, this);
        }
    }

    private final class TransportListener implements RpcTransport.Listener {
        @Override
        public void onOpen() {
            dispatch(NodeConnection.this::handleOpen, NodeConnection::ignoreLate);
        }

        @Override
        public void onClose(int code, String reason) {
            dispatch(() -> handleClosed(new NodeConnectionException.ConnectionClosed(
                    "connection closed by node: " + code + " " + reason)), NodeConnection::ignoreLate);
        }

        @Override
        public void onError(Throwable error) {
            dispatch(() -> handleError(error), NodeConnection::ignoreLate);
        }

        @Override
        public void onNotification(String method, Map<String, Object> params) {
            dispatch(() -> handleNotification(method, params), NodeConnection::ignoreLate);
        }
    }

    private static void ignoreLate(Throwable error) {
        log.debug("Dropping transport event after close");
    }

    /**
     * Builder for {@link NodeConnection}.
     */
    public static final class Builder {
        private RpcTransport transport;
        private URI endpoint;
        private Serialization serialization;
        private NodeConnectionOptions options = NodeConnectionOptions.defaults();

        private Builder() {}

        /**
         * Connects to {@code endpoint} with a {@link WebSocketRpcTransport}.
         */
        public Builder endpoint(URI endpoint) {
            this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
            return this;
        }

        /**
         * Sets a custom transport implementation. Takes precedence over {@link #endpoint(URI)}.
         */
        public Builder transport(RpcTransport transport) {
            this.transport = Objects.requireNonNull(transport, "transport");
            return this;
        }

        /**
         * Sets the serializer for atoms. Defaults to {@link LedgerTypes#serialization()}.
         */
        public Builder serialization(Serialization serialization) {
            this.serialization = Objects.requireNonNull(serialization, "serialization");
            return this;
        }

        public Builder options(NodeConnectionOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        public NodeConnection build() {
            RpcTransport resolved = transport;
            if (resolved == null) {
                if (endpoint == null) {
                    throw new IllegalStateException("either transport or endpoint must be set");
                }
                resolved = WebSocketRpcTransport.builder(endpoint)
                        .connectTimeout(options.connectTimeout())
                        .build();
            }
            return new NodeConnection(resolved,
                    serialization != null ? serialization : LedgerTypes.serialization(), options);
        }
    }
}
