package com.syncmirror.error;

/**
 * A frame could not be encoded to, or decoded from, the JSON envelope.
 */
public class MessageCodecException extends SyncException {

    public MessageCodecException(String message) {
        super(message);
    }

    public MessageCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
