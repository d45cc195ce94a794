/**
 * Client for ledger nodes.
 *
 * <p>{@link io.atomledger.client.NodeConnection} drives the node protocol over an
 * {@link io.atomledger.client.RpcTransport}. {@link io.atomledger.client.WebSocketRpcTransport}
 * is the default transport and speaks JSON-RPC 2.0 over the JDK WebSocket client.
 */
package io.atomledger.client;
