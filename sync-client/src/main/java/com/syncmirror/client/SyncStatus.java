package com.syncmirror.client;

/**
 * Connection status as seen by the reconnection supervisor.
 *
 * DISCONNECTED → CONNECTING → CONNECTED → (failure) RECONNECTING → CONNECTING → ...
 * OFFLINE is terminal until {@code forceSync()} or {@code connect()}.
 */
public enum SyncStatus {
    DISCONNECTED("Disconnected"),
    CONNECTING("Connecting"),
    CONNECTED("Connected"),
    RECONNECTING("Reconnecting"),
    OFFLINE("Offline");

    private final String label;

    SyncStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
