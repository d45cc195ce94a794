package io.atomledger.client;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Duplex JSON-RPC channel to one node.
 *
 * <p>Listener callbacks may arrive on any thread. {@link NodeConnection} re-dispatches them onto
 * its own event loop.
 */
public interface RpcTransport {

    URI endpoint();

    /**
     * Starts connecting. Completion is reported through {@link Listener#onOpen()} or
     * {@link Listener#onError(Throwable)}.
     */
    void connect(Listener listener);

    /**
     * Sends a request and completes with the response's {@code result} value, or exceptionally
     * with a {@link NodeConnectionException}.
     */
    CompletableFuture<Object> call(String method, Map<String, Object> params);

    boolean isReady();

    void close();

    interface Listener {
        void onOpen();

        void onClose(int code, String reason);

        void onError(Throwable error);

        /**
         * A server push with no request id.
         */
        void onNotification(String method, Map<String, Object> params);
    }
}
