package com.syncmirror.error;

/**
 * Root of the sync client's exception hierarchy.
 *
 * All sync exceptions are unchecked. Connection-level failures never reach
 * application code as thrown exceptions; they surface as status transitions and
 * listener events. Only futures handed back to callers (connect, sendAndAwait)
 * complete exceptionally with one of these types.
 */
public class SyncException extends RuntimeException {

    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
