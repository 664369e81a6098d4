package com.syncmirror.queue;

import com.syncmirror.protocol.Message;

/**
 * An outbound message waiting in the {@link MessageQueue}, with its retry count.
 */
public final class QueuedMessage {

    private final Message message;
    private final long enqueuedAt;
    private int retries;

    QueuedMessage(Message message) {
        this.message = message;
        this.enqueuedAt = System.currentTimeMillis();
    }

    public Message getMessage() {
        return message;
    }

    public long getEnqueuedAt() {
        return enqueuedAt;
    }

    public int getRetries() {
        return retries;
    }

    /**
     * @return the retry count after this failure
     */
    public int recordFailure() {
        return ++retries;
    }

    @Override
    public String toString() {
        return "QueuedMessage{" + message + ", retries=" + retries + '}';
    }
}
