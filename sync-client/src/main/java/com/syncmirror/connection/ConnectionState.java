package com.syncmirror.connection;

/**
 * Lifecycle of one pooled connection.
 *
 * CONNECTING → OPEN → (CLOSED | ERROR). ERROR and CLOSED are terminal; a
 * reconnect always builds fresh connections.
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    ERROR,
    CLOSED;

    public boolean isTerminal() {
        return this == ERROR || this == CLOSED;
    }
}
