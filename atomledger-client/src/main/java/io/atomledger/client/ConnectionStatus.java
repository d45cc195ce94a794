package io.atomledger.client;

public enum ConnectionStatus {
    CLOSED,
    CONNECTING,
    OPEN
}
