package com.syncmirror.dispatch;

/**
 * Where {@link EventDispatcher#dispatch} delivered a message.
 */
public enum DispatchResult {
    /** Completed a pending sendAndAwait; type handlers were skipped. */
    RESOLVED_PENDING,
    /** Delivered to one or more handlers registered for its type. */
    HANDLED,
    /** Consumed by a built-in handler only. */
    INTERNAL_ONLY,
    /** Delivered to the catch-all handlers. */
    UNKNOWN_HANDLED,
    /** Nobody took it; counted. */
    UNROUTED
}
