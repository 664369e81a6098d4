package com.syncmirror.dispatch;

import com.syncmirror.protocol.Message;

/**
 * Receives inbound messages of the types it was registered for.
 *
 * Anything thrown is caught and logged by the dispatcher; it never reaches the
 * connection or other handlers.
 */
@FunctionalInterface
public interface MessageHandler {

    void onMessage(Message message) throws Exception;
}
