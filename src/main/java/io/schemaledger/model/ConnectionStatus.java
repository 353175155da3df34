package io.schemaledger.model;

public enum ConnectionStatus {
    CONNECTED,
    CONNECTING,
    ERROR,
    DISCONNECTED
}
