package com.syncmirror.protocol.payload;

/**
 * A payload that references the id of an earlier outbound message.
 */
public interface Correlated {

    /**
     * @return the referenced message id, or null when this payload is unsolicited
     */
    String correlationId();
}
