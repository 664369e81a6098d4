package com.syncmirror.error;

/**
 * The remote authority refused the identify handshake, or never answered it.
 * The connection attempt counts as failed; the pool keeps running.
 */
public class HandshakeRejectedException extends TransportException {

    public HandshakeRejectedException(String message) {
        super(message);
    }
}
