package io.atomledger.client;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory transport that records calls and lets a test answer them or push notifications.
 */
final class ScriptedTransport implements RpcTransport {

    record Call(String method, Map<String, Object> params, CompletableFuture<Object> result) {}

    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final Map<String, Integer> taken = new ConcurrentHashMap<>();
    private final Map<String, Function<Map<String, Object>, Object>> responders = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    final AtomicInteger closeCount = new AtomicInteger();

    volatile Consumer<Listener> onConnect = Listener::onOpen;
    private volatile Listener listener;

    @Override
    public URI endpoint() {
        return URI.create("ws://node.test/rpc");
    }

    @Override
    public void connect(Listener listener) {
        this.listener = listener;
        onConnect.accept(listener);
    }

    @Override
    public CompletableFuture<Object> call(String method, Map<String, Object> params) {
        Call call = new Call(method, params, new CompletableFuture<>());
        calls.add(call);
        Function<Map<String, Object>, Object> responder = responders.get(method);
        if (responder != null) {
            try {
                call.result().complete(responder.apply(params));
            } catch (RuntimeException e) {
                call.result().completeExceptionally(e);
            }
        }
        return call.result();
    }

    @Override
    public boolean isReady() {
        return listener != null && !closed.get();
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
        if (closed.compareAndSet(false, true) && listener != null) {
            listener.onClose(1000, "closed");
        }
    }

    void respond(String method, Function<Map<String, Object>, Object> responder) {
        responders.put(method, responder);
    }

    void push(String method, Map<String, Object> params) {
        listener.onNotification(method, params);
    }

    void drop(int code, String reason) {
        if (closed.compareAndSet(false, true)) {
            listener.onClose(code, reason);
        }
    }

    boolean isClosed() {
        return closed.get();
    }

    /**
     * Waits for the next not yet awaited call to {@code method}.
     */
    Call awaitCall(String method) throws InterruptedException {
        long deadline = System.nanoTime() + 2_000_000_000L;
        int index = taken.getOrDefault(method, 0);
        while (System.nanoTime() < deadline) {
            List<Call> matching = calls.stream()
                    .filter(call -> call.method().equals(method))
                    .collect(Collectors.toList());
            if (matching.size() > index) {
                taken.put(method, index + 1);
                return matching.get(index);
            }
            Thread.sleep(10);
        }
        throw new AssertionError("no call to " + method + " within 2s, saw " + calls);
    }

    Call awaitCallUnchecked(String method) {
        try {
            return awaitCall(method);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError(e);
        }
    }

    List<Call> calls(String method) {
        return calls.stream().filter(call -> call.method().equals(method)).collect(Collectors.toList());
    }
}
