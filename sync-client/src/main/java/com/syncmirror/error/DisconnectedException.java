package com.syncmirror.error;

/**
 * Outstanding request cancelled because the client was disconnected.
 */
public class DisconnectedException extends SyncException {

    public DisconnectedException(String message) {
        super(message);
    }
}
