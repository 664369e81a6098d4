package com.syncmirror.connection;

import com.syncmirror.protocol.Message;

/**
 * Lifecycle and inbound traffic of a {@link ConnectionPool}.
 *
 * Invoked while the pool's mutex is held.
 */
public interface PoolListener {

    /**
     * The pool went from no active connection to one.
     */
    void onConnected(PooledConnection active);

    /**
     * The active connection was lost and a standby took over.
     */
    void onConnectionSwitch(PooledConnection from, PooledConnection to);

    /**
     * The active connection was lost and no standby was left.
     */
    void onDisconnected(Throwable cause);

    /**
     * An inbound application message. Handshake and heartbeat frames are consumed by the pool.
     */
    void onMessage(PooledConnection connection, Message message);
}
