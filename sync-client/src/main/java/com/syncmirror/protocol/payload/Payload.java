package com.syncmirror.protocol.payload;

/**
 * Marker for the typed body of a message. Every {@link com.syncmirror.protocol.MessageType}
 * maps to exactly one implementation.
 */
public interface Payload {
}
