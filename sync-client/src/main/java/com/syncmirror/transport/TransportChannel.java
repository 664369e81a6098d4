package com.syncmirror.transport;

import com.syncmirror.error.SendFailureException;

/**
 * A single open duplex message channel.
 */
public interface TransportChannel {

    String id();

    /**
     * Writes one text frame.
     *
     * @throws SendFailureException if the channel cannot accept the frame
     */
    void send(String text);

    boolean isOpen();

    /**
     * Closes the channel. Idempotent.
     */
    void close();
}
