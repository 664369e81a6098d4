package com.syncmirror.error;

/**
 * No correlated response arrived within the caller's timeout.
 *
 * This is a local failure only: the request may still have been delivered and
 * processed by the remote authority.
 */
public class ResponseTimeoutException extends SyncException {

    private final String messageId;
    private final long timeoutMs;

    public ResponseTimeoutException(String messageId, long timeoutMs) {
        super("No response to " + messageId + " within " + timeoutMs + "ms");
        this.messageId = messageId;
        this.timeoutMs = timeoutMs;
    }

    public String getMessageId() {
        return messageId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
