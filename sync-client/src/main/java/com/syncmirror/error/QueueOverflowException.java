package com.syncmirror.error;

/**
 * The outbound queue was full and held no low-priority message to evict,
 * so the incoming message was dropped.
 */
public class QueueOverflowException extends SyncException {

    public QueueOverflowException(String message) {
        super(message);
    }
}
