package com.syncmirror.queue;

import com.syncmirror.protocol.Message;

/**
 * Observes what a full {@link MessageQueue} gives up.
 */
public interface OverflowListener {

    /**
     * A queued low-priority message was evicted to make room.
     */
    void onEvicted(Message evicted);

    /**
     * The incoming message was dropped because nothing could be evicted.
     */
    void onDropped(Message dropped);
}
