package io.atomledger.client;

import io.atomledger.json.jackson.JacksonJsonCodec;
import io.atomledger.json.spi.JsonCodec;
import io.atomledger.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link RpcTransport} over {@link java.net.http.WebSocket} speaking JSON-RPC 2.0.
 *
 * <p>Requests carry an increasing numeric id and are matched to responses by it. Frames without an
 * id that name a {@code method} (or {@code notification}) are delivered as server pushes.
 */
public final class WebSocketRpcTransport implements RpcTransport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketRpcTransport.class);

    private static final String JSONRPC_VERSION = "2.0";

    private final URI endpoint;
    private final HttpClient http;
    private final JsonCodec json;
    private final Duration connectTimeout;

    private final AtomicLong ids = new AtomicLong();
    private final Map<Long, CompletableFuture<Object>> pending = new ConcurrentHashMap<>();
    private final AtomicBoolean closeNotified = new AtomicBoolean();
    private final Object sendLock = new Object();

    private volatile Listener listener;
    private volatile WebSocket socket;
    private volatile boolean closing;
    private CompletableFuture<?> lastSend = CompletableFuture.completedFuture(null);

    private WebSocketRpcTransport(Builder builder) {
        this.endpoint = builder.endpoint;
        this.http = builder.httpClient != null ? builder.httpClient : HttpClient.newHttpClient();
        this.json = builder.jsonCodec != null ? builder.jsonCodec : new JacksonJsonCodec();
        this.connectTimeout = builder.connectTimeout;
    }

    public static Builder builder(URI endpoint) {
        return new Builder(endpoint);
    }

    @Override
    public URI endpoint() {
        return endpoint;
    }

    @Override
    public void connect(Listener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
        log.debug("Connecting to {}", endpoint);
        http.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(endpoint, new SocketListener())
                .whenComplete((ws, error) -> {
                    if (error != null) {
                        Throwable cause = unwrap(error);
                        log.warn("Connecting to {} failed: {}", endpoint, cause.toString());
                        notifyError(cause);
                    } else if (closing) {
                        ws.abort();
                    } else {
                        socket = ws;
                    }
                });
    }

    @Override
    public CompletableFuture<Object> call(String method, Map<String, Object> params) {
        WebSocket ws = socket;
        if (ws == null || closing) {
            return CompletableFuture.failedFuture(
                    new NodeConnectionException.TransportError("not connected to " + endpoint));
        }
        long id = ids.incrementAndGet();
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("jsonrpc", JSONRPC_VERSION);
        frame.put("method", method);
        frame.put("params", params);
        frame.put("id", id);

        String text;
        try {
            text = json.writeString(frame);
        } catch (JsonException e) {
            return CompletableFuture.failedFuture(
                    new NodeConnectionException.TransportError("failed to encode " + method, e));
        }

        CompletableFuture<Object> result = new CompletableFuture<>();
        pending.put(id, result);
        log.trace("-> {}", text);
        send(ws, text).whenComplete((ignored, error) -> {
            if (error != null) {
                CompletableFuture<Object> call = pending.remove(id);
                if (call != null) {
                    call.completeExceptionally(
                            new NodeConnectionException.TransportError("failed to send " + method, unwrap(error)));
                }
            }
        });
        return result;
    }

    @Override
    public boolean isReady() {
        WebSocket ws = socket;
        return ws != null && !closing && !closeNotified.get() && !ws.isOutputClosed();
    }

    @Override
    public void close() {
        if (closing) {
            return;
        }
        closing = true;
        WebSocket ws = socket;
        if (ws != null && !ws.isOutputClosed()) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "").whenComplete((ignored, error) -> {
                if (error != null) {
                    log.debug("Close handshake with {} failed: {}", endpoint, error.toString());
                    ws.abort();
                }
            });
        }
        failPending(new NodeConnectionException.TransportError("transport closed"));
        notifyClosed(WebSocket.NORMAL_CLOSURE, "closed by client");
    }

    // WebSocket.sendText must not be called again before the previous send completes
    private CompletableFuture<WebSocket> send(WebSocket ws, String text) {
        synchronized (sendLock) {
            CompletableFuture<WebSocket> next = lastSend
                    .handle((ignored, error) -> null)
                    .thenCompose(ignored -> ws.sendText(text, true));
            lastSend = next;
            return next;
        }
    }

    private void handleFrame(String text) {
        log.trace("<- {}", text);
        Map<?, ?> frame;
        try {
            frame = json.readValue(text, Map.class);
        } catch (JsonException e) {
            log.warn("Dropping malformed frame from {}", endpoint, e);
            return;
        }

        Object id = frame.get("id");
        if (id == null) {
            Object method = frame.containsKey("method") ? frame.get("method") : frame.get("notification");
            if (method instanceof String) {
                listener.onNotification((String) method, params(frame.get("params")));
            } else {
                log.warn("Dropping frame without id or method: {}", text);
            }
            return;
        }
        if (!(id instanceof Number)) {
            log.warn("Dropping response with non-numeric id: {}", text);
            return;
        }
        CompletableFuture<Object> call = pending.remove(((Number) id).longValue());
        if (call == null) {
            log.debug("No pending call for response id {}", id);
            return;
        }
        Object error = frame.get("error");
        if (error != null) {
            call.completeExceptionally(rpcError(error));
        } else {
            call.complete(frame.get("result"));
        }
    }

    private static NodeConnectionException.RpcException rpcError(Object error) {
        if (error instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) error;
            int code = map.get("code") instanceof Number ? ((Number) map.get("code")).intValue() : 0;
            Object message = map.get("message");
            return new NodeConnectionException.RpcException(code, message == null ? "rpc error" : message.toString());
        }
        return new NodeConnectionException.RpcException(0, String.valueOf(error));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> params(Object params) {
        if (params instanceof Map) {
            return (Map<String, Object>) params;
        }
        return Map.of();
    }

    private void failPending(Throwable error) {
        for (Long id : pending.keySet()) {
            CompletableFuture<Object> call = pending.remove(id);
            if (call != null) {
                call.completeExceptionally(error);
            }
        }
    }

    private void notifyClosed(int code, String reason) {
        if (closeNotified.compareAndSet(false, true)) {
            Listener l = listener;
            if (l != null) {
                l.onClose(code, reason);
            }
        }
    }

    private void notifyError(Throwable error) {
        if (closeNotified.compareAndSet(false, true)) {
            Listener l = listener;
            if (l != null) {
                l.onError(error);
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private final class SocketListener implements WebSocket.Listener {
        private final StringBuilder partial = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            socket = webSocket;
            log.debug("Connected to {}", endpoint);
            webSocket.request(1);
            listener.onOpen();
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String text = partial.toString();
                partial.setLength(0);
                handleFrame(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.debug("Connection to {} closed: {} {}", endpoint, statusCode, reason);
            failPending(new NodeConnectionException.TransportError("socket closed: " + statusCode + " " + reason));
            notifyClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.warn("Connection to {} failed", endpoint, error);
            failPending(new NodeConnectionException.TransportError("socket error", error));
            notifyError(error);
        }
    }

    /**
     * Builder for {@link WebSocketRpcTransport}.
     */
    public static final class Builder {
        private final URI endpoint;
        private HttpClient httpClient;
        private JsonCodec jsonCodec;
        private Duration connectTimeout = NodeConnectionOptions.DEFAULT_CONNECT_TIMEOUT;

        private Builder(URI endpoint) {
            this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        }

        /**
         * Uses a provided JDK HttpClient instead of a new default one.
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
            return this;
        }

        /**
         * Sets the JSON codec for frames. Defaults to {@link JacksonJsonCodec}.
         */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
            return this;
        }

        public WebSocketRpcTransport build() {
            return new WebSocketRpcTransport(this);
        }
    }
}
