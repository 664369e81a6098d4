package com.syncmirror.transport;

/**
 * Receives inbound traffic and lifecycle notifications for one channel.
 * Callbacks arrive on the binding's I/O thread in wire order.
 */
public interface TransportListener {

    void onText(String text);

    /**
     * The channel closed, locally or remotely.
     *
     * @param cause the failure that closed it, or null for an orderly close
     */
    void onClosed(Throwable cause);
}
