package com.syncmirror.transport;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Platform binding that opens duplex message channels to the remote authority.
 *
 * The protocol state machine (pool, queue, replay, state store) lives above this
 * seam and never touches sockets, so it can run against an in-memory binding.
 */
public interface SyncTransportClient {

    /**
     * Opens one channel to the endpoint.
     *
     * The returned future completes once the channel can carry messages, or completes
     * exceptionally with a {@link com.syncmirror.error.TransportException}. The listener
     * receives inbound text and the eventual close of the channel.
     */
    CompletableFuture<TransportChannel> open(URI endpoint, TransportListener listener);

    /**
     * Releases resources owned by the binding (I/O threads, buffers).
     */
    void shutdown();
}
