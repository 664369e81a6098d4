package com.syncmirror.error;

import com.syncmirror.protocol.MessageType;

/**
 * An application handler threw while processing an inbound message.
 * Logged at the dispatch boundary and never rethrown.
 */
public class HandlerException extends SyncException {

    private final MessageType messageType;

    public HandlerException(MessageType messageType, Throwable cause) {
        super("Handler failed for " + messageType, cause);
        this.messageType = messageType;
    }

    public MessageType getMessageType() {
        return messageType;
    }
}
