package com.syncmirror.dispatch;

import com.syncmirror.error.HandlerException;
import com.syncmirror.protocol.Message;
import com.syncmirror.protocol.MessageType;
import com.syncmirror.queue.PendingResponseTable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes inbound messages.
 *
 * Routing order for each message:
 * 1. The built-in handler for its type, if any (state store, acks, context)
 * 2. The pending-response table, when the message carries a correlation id;
 *    a match completes the awaiting future and ends routing
 * 3. Application handlers for its type, in registration order
 * 4. Otherwise catch-all handlers, if the message reached no handler at all
 * 5. Otherwise the message is counted as unrouted
 *
 * A failing handler is logged and counted; the remaining handlers still run.
 *
 * Thread Safety:
 * - Handler lists are copy-on-write, so registration may happen from any thread,
 *   including from inside a handler
 */
public class EventDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final PendingResponseTable pendingResponses;
    private final Map<MessageType, MessageHandler> internalHandlers = new EnumMap<>(MessageType.class);
    private final Map<MessageType, List<MessageHandler>> handlers = new EnumMap<>(MessageType.class);
    private final List<MessageHandler> unknownHandlers = new CopyOnWriteArrayList<>();

    private final AtomicLong unroutedCount = new AtomicLong();
    private final AtomicLong handlerErrorCount = new AtomicLong();

    public EventDispatcher(PendingResponseTable pendingResponses) {
        this.pendingResponses = pendingResponses;
        for (MessageType type : MessageType.values()) {
            handlers.put(type, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * Installs the built-in handler for a type. Meant for the owning client at construction.
     */
    public void registerInternal(MessageType type, MessageHandler handler) {
        internalHandlers.put(type, handler);
    }

    public void on(MessageType type, MessageHandler handler) {
        handlers.get(type).add(handler);
    }

    /**
     * Removes one registration of the handler.
     *
     * @return true if it was registered
     */
    public boolean off(MessageType type, MessageHandler handler) {
        return handlers.get(type).remove(handler);
    }

    public void onUnknown(MessageHandler handler) {
        unknownHandlers.add(handler);
    }

    public boolean offUnknown(MessageHandler handler) {
        return unknownHandlers.remove(handler);
    }

    public int handlerCount(MessageType type) {
        return handlers.get(type).size();
    }

    public DispatchResult dispatch(Message message) {
        MessageType type = message.getType();

        MessageHandler internal = internalHandlers.get(type);
        if (internal != null) {
            invoke(internal, message);
        }

        if (message.getCorrelationId() != null && pendingResponses.resolve(message)) {
            return DispatchResult.RESOLVED_PENDING;
        }

        List<MessageHandler> typeHandlers = handlers.get(type);
        if (!typeHandlers.isEmpty()) {
            for (MessageHandler handler : typeHandlers) {
                invoke(handler, message);
            }
            return DispatchResult.HANDLED;
        }

        if (internal != null) {
            return DispatchResult.INTERNAL_ONLY;
        }

        if (!unknownHandlers.isEmpty()) {
            for (MessageHandler handler : unknownHandlers) {
                invoke(handler, message);
            }
            return DispatchResult.UNKNOWN_HANDLED;
        }

        unroutedCount.incrementAndGet();
        logger.debug("No handler for {} {}", type, message.getId());
        return DispatchResult.UNROUTED;
    }

    private void invoke(MessageHandler handler, Message message) {
        try {
            handler.onMessage(message);
        } catch (Exception e) {
            handlerErrorCount.incrementAndGet();
            HandlerException failure = new HandlerException(message.getType(), e);
            logger.error("Handler failed for {} {}", message.getType(), message.getId(), failure);
        }
    }

    public long getUnroutedCount() {
        return unroutedCount.get();
    }

    public long getHandlerErrorCount() {
        return handlerErrorCount.get();
    }
}
