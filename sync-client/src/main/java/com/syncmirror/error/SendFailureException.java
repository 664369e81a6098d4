package com.syncmirror.error;

/**
 * A single message could not be written to the active connection.
 * The queue retries the message until its retry budget is spent.
 */
public class SendFailureException extends SyncException {

    public SendFailureException(String message) {
        super(message);
    }

    public SendFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
