package com.syncmirror.error;

/**
 * Connection-level failure. Triggers failover inside the pool, or reconnection
 * when no standby remains.
 */
public class TransportException extends SyncException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
