package com.syncmirror.client;

import com.syncmirror.buffer.PendingLocalEvent;
import com.syncmirror.connection.PooledConnection;
import com.syncmirror.protocol.Message;
import com.syncmirror.protocol.payload.ContextUpdatePayload;
import com.syncmirror.state.Milestone;
import com.syncmirror.state.SyncStateSnapshot;

/**
 * Observer for client lifecycle and state events. Every method defaults to a no-op.
 *
 * Callbacks run on I/O or timer threads while the client's lock is held: keep them
 * short and never block on the client from inside one. Exceptions are logged and
 * swallowed.
 */
public interface SyncClientListener {

    default void onConnected(PooledConnection active) {
    }

    default void onDisconnected(Throwable cause) {
    }

    default void onConnectionSwitch(PooledConnection from, PooledConnection to) {
    }

    /**
     * @param description human-readable status line for UI or telemetry
     */
    default void onStatusChange(SyncStatus status, String description) {
    }

    default void onReconnectScheduled(int attempt, long delayMs) {
    }

    default void onStateChange(SyncStateSnapshot previous, SyncStateSnapshot current) {
    }

    default void onMilestone(Milestone milestone, SyncStateSnapshot state) {
    }

    default void onContextUpdate(ContextUpdatePayload context) {
    }

    default void onEventAcknowledged(String eventId) {
    }

    /**
     * An outbound message exhausted its retries or could not be encoded.
     */
    default void onMessageFailed(Message message, Throwable cause) {
    }

    /**
     * An outbound message was dropped because the queue was full.
     */
    default void onQueueOverflow(Message dropped) {
    }

    /**
     * A queued low-priority message was evicted to make room.
     */
    default void onMessageEvicted(Message evicted) {
    }

    default void onBufferEviction(PendingLocalEvent evicted) {
    }
}
