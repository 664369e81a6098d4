package com.syncmirror.client;

/**
 * Point-in-time counters of a {@link SyncClient}.
 */
public final class SyncMetrics {

    private final boolean connected;
    private final SyncStatus status;
    private final int queueDepth;
    private final int bufferedCount;
    private final int reconnectAttempts;
    private final int pendingResponses;
    private final int openConnections;
    private final String activeConnectionId;
    private final long messagesSent;
    private final long messagesReceived;
    private final long messagesFailed;
    private final long duplicatesDropped;
    private final long unroutedMessages;
    private final long handlerErrors;

    SyncMetrics(boolean connected, SyncStatus status, int queueDepth, int bufferedCount,
                int reconnectAttempts, int pendingResponses, int openConnections,
                String activeConnectionId, long messagesSent, long messagesReceived,
                long messagesFailed, long duplicatesDropped, long unroutedMessages,
                long handlerErrors) {
        this.connected = connected;
        this.status = status;
        this.queueDepth = queueDepth;
        this.bufferedCount = bufferedCount;
        this.reconnectAttempts = reconnectAttempts;
        this.pendingResponses = pendingResponses;
        this.openConnections = openConnections;
        this.activeConnectionId = activeConnectionId;
        this.messagesSent = messagesSent;
        this.messagesReceived = messagesReceived;
        this.messagesFailed = messagesFailed;
        this.duplicatesDropped = duplicatesDropped;
        this.unroutedMessages = unroutedMessages;
        this.handlerErrors = handlerErrors;
    }

    public boolean isConnected() {
        return connected;
    }

    public SyncStatus getStatus() {
        return status;
    }

    public int getQueueDepth() {
        return queueDepth;
    }

    public int getBufferedCount() {
        return bufferedCount;
    }

    public int getReconnectAttempts() {
        return reconnectAttempts;
    }

    public int getPendingResponses() {
        return pendingResponses;
    }

    public int getOpenConnections() {
        return openConnections;
    }

    public String getActiveConnectionId() {
        return activeConnectionId;
    }

    public long getMessagesSent() {
        return messagesSent;
    }

    public long getMessagesReceived() {
        return messagesReceived;
    }

    public long getMessagesFailed() {
        return messagesFailed;
    }

    public long getDuplicatesDropped() {
        return duplicatesDropped;
    }

    public long getUnroutedMessages() {
        return unroutedMessages;
    }

    public long getHandlerErrors() {
        return handlerErrors;
    }

    @Override
    public String toString() {
        return "SyncMetrics{" +
                "connected=" + connected +
                ", status=" + status +
                ", queueDepth=" + queueDepth +
                ", bufferedCount=" + bufferedCount +
                ", reconnectAttempts=" + reconnectAttempts +
                ", pendingResponses=" + pendingResponses +
                ", openConnections=" + openConnections +
                ", sent=" + messagesSent +
                ", received=" + messagesReceived +
                ", failed=" + messagesFailed +
                '}';
    }
}
