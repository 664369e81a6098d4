package com.syncmirror.client;

import com.syncmirror.buffer.OfflineBuffer;
import com.syncmirror.buffer.PendingLocalEvent;
import com.syncmirror.connection.ClientIdentity;
import com.syncmirror.connection.ConnectionPool;
import com.syncmirror.connection.PoolListener;
import com.syncmirror.connection.PooledConnection;
import com.syncmirror.dispatch.EventDispatcher;
import com.syncmirror.dispatch.MessageHandler;
import com.syncmirror.error.DisconnectedException;
import com.syncmirror.error.MessageCodecException;
import com.syncmirror.error.QueueOverflowException;
import com.syncmirror.error.SendFailureException;
import com.syncmirror.protocol.Message;
import com.syncmirror.protocol.MessageSerializer;
import com.syncmirror.protocol.MessageType;
import com.syncmirror.protocol.Priority;
import com.syncmirror.protocol.payload.CommandPayload;
import com.syncmirror.protocol.payload.ContextUpdatePayload;
import com.syncmirror.protocol.payload.ErrorPayload;
import com.syncmirror.protocol.payload.EventAckPayload;
import com.syncmirror.protocol.payload.EventPayload;
import com.syncmirror.protocol.payload.Payload;
import com.syncmirror.queue.MessageQueue;
import com.syncmirror.queue.OverflowListener;
import com.syncmirror.queue.PendingResponseTable;
import com.syncmirror.queue.QueuedMessage;
import com.syncmirror.state.Milestone;
import com.syncmirror.state.StateUpdate;
import com.syncmirror.state.SyncStateSnapshot;
import com.syncmirror.state.SyncStateStore;
import com.syncmirror.transport.SyncTransportClient;

import io.netty.util.concurrent.DefaultThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Keeps a local mirror of the remote authority's state and delivers local events to it.
 *
 * Architecture:
 * - {@link ConnectionPool}: N connections, one active, failover to warm standbys
 * - {@link ReconnectionSupervisor}: exponential backoff once the pool is empty
 * - {@link MessageQueue}: bounded priority queue drained onto the active connection
 * - {@link PendingResponseTable}: futures for {@link #sendAndAwait} callers
 * - {@link OfflineBuffer}: unacknowledged events, replayed after every reconnect
 * - {@link SyncStateStore}: the mirrored state, changed only by inbound state_sync
 * - {@link EventDispatcher}: routes inbound messages to the store and to handlers
 *
 * Threading Model:
 * - Caller threads, transport I/O threads and one timer thread all mutate the pool,
 *   queue, buffer and store under a single lock, so they see one serialized history
 * - {@link #getState()} and {@link #getStatus()} never take the lock
 * - Only {@link #connect()} and {@link #sendAndAwait} futures ever complete exceptionally;
 *   every other failure surfaces as a status change, listener callback or metric
 *
 * The client takes ownership of the transport and shuts it down in {@link #close()}.
 */
public class SyncClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SyncClient.class);

    public static final String CLIENT_VERSION = "1.0.0";

    private final SyncClientConfig config;
    private final SyncTransportClient transport;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final String clientId;
    private final Object mutex = new Object();

    private final ConnectionPool pool;
    private final MessageQueue queue;
    private final PendingResponseTable pendingResponses;
    private final OfflineBuffer offlineBuffer;
    private final SyncStateStore stateStore;
    private final EventDispatcher dispatcher;
    private final ReconnectionSupervisor supervisor;
    private final RecentMessageIds recentIds;
    private final List<SyncClientListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong messagesFailed = new AtomicLong();
    private final AtomicLong duplicatesDropped = new AtomicLong();

    // Guarded by mutex
    private boolean started;
    private boolean closed;
    private CompletableFuture<Void> connecting;
    private long submissions;
    // Events submitted while connected, from enqueue until sent, so a release keeps their sequence
    private final Map<String, PendingLocalEvent> queuedEvents = new HashMap<>();
    private ScheduledFuture<?> heartbeatTask;
    private ScheduledFuture<?> drainTask;

    public SyncClient(SyncClientConfig config, SyncTransportClient transport) {
        this(config, transport, Executors.newSingleThreadScheduledExecutor(
                new DefaultThreadFactory("sync-client-timer", true)), true);
    }

    /**
     * Uses a caller-supplied scheduler, which {@link #close()} leaves running.
     */
    public SyncClient(SyncClientConfig config, SyncTransportClient transport, ScheduledExecutorService scheduler) {
        this(config, transport, scheduler, false);
    }

    private SyncClient(SyncClientConfig config, SyncTransportClient transport,
                       ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.config = config;
        this.transport = transport;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.clientId = UUID.randomUUID().toString();

        this.queue = new MessageQueue(config.getQueueCapacity(), new QueueOverflowHandler());
        this.pendingResponses = new PendingResponseTable(scheduler);
        this.offlineBuffer = new OfflineBuffer(config.getBufferCapacity());
        this.stateStore = new SyncStateStore(config.getHistoryCapacity(), config.getTrendEpsilon(),
                config.getMilestones());
        this.dispatcher = new EventDispatcher(pendingResponses);
        this.recentIds = new RecentMessageIds(config.getDedupWindow());
        this.supervisor = new ReconnectionSupervisor(
                new BackoffPolicy(config.getReconnectBaseMs(), config.getReconnectCapMs()),
                config.getMaxReconnectAttempts(), scheduler, new SupervisorEvents());
        this.pool = new ConnectionPool(transport, config.getEndpoint(), new MessageSerializer(), scheduler, mutex,
                new ClientIdentity(clientId, config.getPlatform(), config.getCapabilities(), CLIENT_VERSION),
                config.getConnectTimeoutMs(), config.getHandshakeTimeoutMs(), new PoolEvents());

        dispatcher.registerInternal(MessageType.STATE_SYNC, this::applyStateSync);
        dispatcher.registerInternal(MessageType.CONTEXT_UPDATE, this::applyContextUpdate);
        dispatcher.registerInternal(MessageType.EVENT_ACK, this::applyEventAck);
        dispatcher.registerInternal(MessageType.ERROR, this::logAuthorityError);
    }

    // === Lifecycle ===

    /**
     * Opens the pool and enables automatic reconnection.
     *
     * The future completes once one connection has completed its handshake, with the
     * offline buffer already replayed onto the queue. If every attempt fails it
     * completes exceptionally and a reconnect is scheduled.
     */
    public CompletableFuture<Void> connect() {
        synchronized (mutex) {
            ensureOpen();
            started = true;
            if (pool.hasActive()) {
                return CompletableFuture.completedFuture(null);
            }
            supervisor.cancelPending();
            return attemptConnect();
        }
    }

    private CompletableFuture<Void> attemptConnect() {
        supervisor.connecting(config.getEndpoint().toString());
        CompletableFuture<Void> attempt = pool.connect(config.getPoolSize());
        if (attempt != connecting) {
            connecting = attempt;
            attempt.whenComplete((ignored, error) -> {
                if (error != null) {
                    onConnectFailed(unwrap(error));
                }
            });
        }
        return attempt;
    }

    private void onConnectFailed(Throwable cause) {
        synchronized (mutex) {
            if (!started || closed || pool.hasActive()) {
                return;
            }
            logger.warn("Connect to {} failed: {}", config.getEndpoint(), cause.getMessage());
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        supervisor.scheduleReconnect(() -> runGuarded("reconnect", () -> {
            synchronized (mutex) {
                if (started && !closed && !pool.hasActive()) {
                    attemptConnect();
                }
            }
        }));
    }

    /**
     * Stops reconnecting, closes every connection and fails all pending responses with
     * {@link DisconnectedException}. Queued messages and buffered events are kept, so a
     * later {@link #connect()} resumes where this left off.
     */
    public void disconnect() {
        synchronized (mutex) {
            boolean wasConnected = pool.hasActive();
            started = false;
            supervisor.stop();
            cancelTimers();
            DisconnectedException reason = new DisconnectedException("Client disconnected");
            pool.closeAll(reason);
            pendingResponses.failAll(reason);
            offlineBuffer.clearInFlight();
            logger.info("Disconnected (queued: {}, buffered: {})", queue.size(), offlineBuffer.size());
            if (wasConnected) {
                notifyListeners(l -> l.onDisconnected(null));
            }
        }
    }

    /**
     * Disconnects and releases the transport, and the scheduler if this client created it.
     */
    @Override
    public void close() {
        synchronized (mutex) {
            if (closed) {
                return;
            }
            disconnect();
            closed = true;
        }
        transport.shutdown();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        logger.info("Sync client {} closed", clientId);
    }

    // === Outbound ===

    /**
     * Submits a local event at NORMAL priority.
     *
     * @return the event id, which the authority's event_ack will reference
     */
    public String submit(String content, Map<String, String> context) {
        return submit(content, context, Priority.NORMAL);
    }

    /**
     * Submits a local event. Never blocks and never fails for being offline: without an
     * active connection the event goes to the offline buffer for replay.
     *
     * @return the event id, which the authority's event_ack will reference
     */
    public String submit(String content, Map<String, String> context, Priority priority) {
        synchronized (mutex) {
            ensureOpen();
            PendingLocalEvent event = new PendingLocalEvent(UUID.randomUUID().toString(), submissions++,
                    content, context, priority, System.currentTimeMillis());
            if (pool.hasActive()) {
                queuedEvents.put(event.getId(), event);
                queue.enqueue(toMessage(event));
                drain();
            } else {
                bufferEvent(event);
                logger.debug("Buffered event {} while {}", event.getId(), supervisor.getStatus());
            }
            return event.getId();
        }
    }

    /**
     * Queues a message and waits for the inbound message that references its id.
     *
     * The timeout is local: the message may still be delivered after the future has
     * failed with {@link com.syncmirror.error.ResponseTimeoutException}. An error reply
     * completes the future normally with the ERROR message.
     */
    public CompletableFuture<Message> sendAndAwait(MessageType type, Payload payload, long timeoutMs) {
        return sendAndAwait(type, payload, Priority.NORMAL, timeoutMs);
    }

    public CompletableFuture<Message> sendAndAwait(MessageType type, Payload payload) {
        return sendAndAwait(type, payload, Priority.NORMAL, config.getMessageTimeoutMs());
    }

    private CompletableFuture<Message> sendAndAwait(MessageType type, Payload payload, Priority priority,
                                                   long timeoutMs) {
        Message message = Message.builder().type(type).payload(payload).priority(priority).build();
        synchronized (mutex) {
            ensureOpen();
            CompletableFuture<Message> response = pendingResponses.register(message.getId(), timeoutMs);
            // A dropped message fails the future through the overflow handler
            if (queue.enqueue(message)) {
                drain();
            }
            return response;
        }
    }

    /**
     * Queues a message without waiting for any response.
     *
     * @return the message id
     */
    public String send(MessageType type, Payload payload, Priority priority) {
        Message message = Message.builder().type(type).payload(payload).priority(priority).build();
        synchronized (mutex) {
            ensureOpen();
            if (queue.enqueue(message)) {
                drain();
            }
            return message.getId();
        }
    }

    /**
     * Shares this client's conversation context with the authority.
     */
    public String updateContext(String conversationId, List<String> activeTopics, String summary) {
        ContextUpdatePayload payload = new ContextUpdatePayload(conversationId, activeTopics, summary,
                List.of(config.getPlatform()), null);
        return send(MessageType.CONTEXT_UPDATE, payload, Priority.NORMAL);
    }

    /**
     * Asks the authority to rebroadcast its full state; the reply is applied to the
     * store before the future completes.
     */
    public CompletableFuture<Message> requestFullSync() {
        return sendAndAwait(MessageType.COMMAND, CommandPayload.fullSync(), Priority.HIGH,
                config.getMessageTimeoutMs());
    }

    /**
     * Puts buffered events that are not already in flight back on the queue, in
     * submission order. Safe to call repeatedly; does nothing without an active connection.
     *
     * @return the number of events newly put in flight
     */
    public int replay() {
        synchronized (mutex) {
            return replayBuffered();
        }
    }

    /**
     * Resets the reconnect budget, then connects if there is no active connection, or
     * otherwise replays the buffer and requests a full sync.
     */
    public CompletableFuture<Void> forceSync() {
        synchronized (mutex) {
            ensureOpen();
            supervisor.resetAttempts();
            if (!pool.hasActive()) {
                logger.info("Force sync from {}: connecting", supervisor.getStatus());
                return connect();
            }
            replayBuffered();
            return requestFullSync().thenApply(reply -> null);
        }
    }

    private int replayBuffered() {
        if (!pool.hasActive()) {
            return 0;
        }
        int replayed = 0;
        for (PendingLocalEvent event : offlineBuffer.beginReplay(queue::contains)) {
            if (queue.enqueue(toMessage(event))) {
                replayed++;
            }
        }
        if (replayed > 0) {
            logger.info("Replaying {} buffered event(s)", replayed);
        }
        drain();
        return replayed;
    }

    /**
     * Sends queued messages on the active connection until the queue is empty or a
     * send fails. Without an active connection this is a no-op.
     */
    private void drain() {
        while (pool.hasActive() && !queue.isEmpty()) {
            QueuedMessage next = queue.poll();
            Message message = next.getMessage();
            try {
                pool.send(message);
                messagesSent.incrementAndGet();
                queuedEvents.remove(message.getId());
            } catch (MessageCodecException e) {
                failMessage(message, e);
            } catch (SendFailureException e) {
                int retries = next.recordFailure();
                if (retries < config.getMaxRetries()) {
                    logger.warn("Send of {} {} failed (attempt {}/{}), retrying: {}", message.getType(),
                            message.getId(), retries, config.getMaxRetries(), e.getMessage());
                    queue.requeueFront(next);
                    return;
                }
                failMessage(message, e);
            }
        }
    }

    private void failMessage(Message message, Throwable cause) {
        messagesFailed.incrementAndGet();
        logger.warn("Giving up on {} {}: {}", message.getType(), message.getId(), cause.getMessage());
        notifyListeners(l -> l.onMessageFailed(message, cause));
        releaseUnsent(message, cause);
    }

    /**
     * A message left the queue without being sent: fail its waiter, and keep an event
     * in the offline buffer so it is replayed later.
     */
    private void releaseUnsent(Message message, Throwable cause) {
        pendingResponses.fail(message.getId(), cause);
        if (message.getType() != MessageType.EVENT || !message.hasPayload()) {
            return;
        }
        PendingLocalEvent submitted = queuedEvents.remove(message.getId());
        if (offlineBuffer.contains(message.getId())) {
            offlineBuffer.markNotInFlight(message.getId());
        } else if (submitted != null) {
            bufferEvent(submitted);
        } else {
            EventPayload payload = message.getPayload(EventPayload.class);
            bufferEvent(new PendingLocalEvent(message.getId(), submissions++, payload.getContent(),
                    payload.getContext(), message.getPriority(), payload.getCreatedAt()));
        }
    }

    private void bufferEvent(PendingLocalEvent event) {
        PendingLocalEvent evicted = offlineBuffer.add(event);
        if (evicted != null) {
            notifyListeners(l -> l.onBufferEviction(evicted));
        }
    }

    private Message toMessage(PendingLocalEvent event) {
        return Message.builder()
                .id(event.getId())
                .type(MessageType.EVENT)
                .payload(new EventPayload(event.getContent(), event.getContext(), config.getPlatform(),
                        event.getCreatedAt()))
                .priority(event.getPriority())
                .timestamp(event.getCreatedAt())
                .build();
    }

    // === Inbound ===

    private void onInbound(PooledConnection connection, Message message) {
        if (!message.getType().isHeartbeat() && !recentIds.add(message.getId())) {
            duplicatesDropped.incrementAndGet();
            logger.debug("Dropping duplicate {} {} from connection {}", message.getType(), message.getId(),
                    connection.getId());
            return;
        }
        messagesReceived.incrementAndGet();
        logger.debug("Received {} {} on connection {}", message.getType(), message.getId(), connection.getId());
        dispatcher.dispatch(message);
    }

    private void applyStateSync(Message message) {
        if (!message.hasPayload()) {
            logger.warn("Ignoring state_sync {} without payload", message.getId());
            return;
        }
        StateUpdate update = stateStore.applyInbound(message);
        notifyListeners(l -> l.onStateChange(update.getPrevious(), update.getCurrent()));
        for (Milestone milestone : update.getNewMilestones()) {
            notifyListeners(l -> l.onMilestone(milestone, update.getCurrent()));
        }
    }

    private void applyContextUpdate(Message message) {
        if (!message.hasPayload()) {
            return;
        }
        ContextUpdatePayload context = message.getPayload(ContextUpdatePayload.class);
        stateStore.applyContext(context);
        notifyListeners(l -> l.onContextUpdate(context));
    }

    private void applyEventAck(Message message) {
        if (!message.hasPayload()) {
            return;
        }
        String eventId = message.getPayload(EventAckPayload.class).getEventId();
        if (offlineBuffer.acknowledge(eventId) != null) {
            logger.debug("Buffered event {} acknowledged", eventId);
        }
        notifyListeners(l -> l.onEventAcknowledged(eventId));
    }

    private void logAuthorityError(Message message) {
        if (message.hasPayload()) {
            ErrorPayload error = message.getPayload(ErrorPayload.class);
            logger.warn("Authority reported error {}: {} (reply to {})",
                    error.getCode(), error.getMessage(), error.getReplyTo());
        }
    }

    // === Handlers and listeners ===

    public void on(MessageType type, MessageHandler handler) {
        dispatcher.on(type, handler);
    }

    /**
     * Registers a handler that receives the typed payload.
     *
     * @return the registered handler, for {@link #off}
     */
    public <P extends Payload> MessageHandler on(MessageType type, Class<P> payloadClass, Consumer<P> consumer) {
        if (!payloadClass.isAssignableFrom(type.getPayloadType())) {
            throw new IllegalArgumentException(type + " carries " + type.getPayloadType().getSimpleName()
                    + ", not " + payloadClass.getSimpleName());
        }
        MessageHandler handler = message -> {
            if (message.hasPayload()) {
                consumer.accept(message.getPayload(payloadClass));
            }
        };
        dispatcher.on(type, handler);
        return handler;
    }

    public boolean off(MessageType type, MessageHandler handler) {
        return dispatcher.off(type, handler);
    }

    /**
     * Registers a catch-all for messages no other handler takes, including unknown wire types.
     */
    public void onUnknown(MessageHandler handler) {
        dispatcher.onUnknown(handler);
    }

    public void addListener(SyncClientListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SyncClientListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(Consumer<SyncClientListener> callback) {
        for (SyncClientListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                logger.error("Listener {} failed", listener, e);
            }
        }
    }

    // === Queries ===

    /**
     * Latest immutable state snapshot. Never blocks.
     */
    public SyncStateSnapshot getState() {
        return stateStore.snapshot();
    }

    public SyncStatus getStatus() {
        return supervisor.getStatus();
    }

    public boolean isConnected() {
        return pool.hasActive();
    }

    public SyncMetrics getMetrics() {
        synchronized (mutex) {
            return new SyncMetrics(
                    pool.hasActive(),
                    supervisor.getStatus(),
                    queue.size(),
                    offlineBuffer.size(),
                    supervisor.getAttempts(),
                    pendingResponses.size(),
                    pool.getOpenCount(),
                    pool.getActiveConnectionId(),
                    messagesSent.get(),
                    messagesReceived.get(),
                    messagesFailed.get(),
                    duplicatesDropped.get(),
                    dispatcher.getUnroutedCount(),
                    dispatcher.getHandlerErrorCount());
        }
    }

    public String getClientId() {
        return clientId;
    }

    public SyncClientConfig getConfig() {
        return config;
    }

    /**
     * Buffered events in submission order.
     */
    public List<PendingLocalEvent> getBufferedEvents() {
        synchronized (mutex) {
            return offlineBuffer.snapshot();
        }
    }

    /**
     * Queued messages in drain order.
     */
    public List<Message> getQueuedMessages() {
        synchronized (mutex) {
            return queue.snapshot();
        }
    }

    public List<PooledConnection> getConnections() {
        return pool.getConnections();
    }

    // === Timers ===

    private void startTimers() {
        cancelTimers();
        long heartbeatMs = config.getHeartbeatIntervalMs();
        if (heartbeatMs > 0) {
            heartbeatTask = scheduler.scheduleAtFixedRate(
                    () -> runGuarded("heartbeat", () -> pool.heartbeat(config.getMaxMissedPongs())),
                    heartbeatMs, heartbeatMs, TimeUnit.MILLISECONDS);
        }
        long drainMs = config.getDrainIntervalMs();
        drainTask = scheduler.scheduleWithFixedDelay(() -> runGuarded("drain", () -> {
            synchronized (mutex) {
                drain();
            }
        }), drainMs, drainMs, TimeUnit.MILLISECONDS);
    }

    private void cancelTimers() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
        if (drainTask != null) {
            drainTask.cancel(false);
            drainTask = null;
        }
    }

    /**
     * A periodic task that throws is never run again, so timer work is logged and contained here.
     */
    private static void runGuarded(String task, Runnable body) {
        try {
            body.run();
        } catch (RuntimeException e) {
            logger.error("Timer task '{}' failed", task, e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Sync client is closed");
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    /**
     * Connection lifecycle from the pool. Runs under the client lock.
     */
    private final class PoolEvents implements PoolListener {

        @Override
        public void onConnected(PooledConnection active) {
            supervisor.connected(config.getEndpoint().toString());
            startTimers();
            notifyListeners(l -> l.onConnected(active));
            replayBuffered();
            drain();
        }

        @Override
        public void onConnectionSwitch(PooledConnection from, PooledConnection to) {
            notifyListeners(l -> l.onConnectionSwitch(from, to));
            int released = offlineBuffer.releaseInFlight(queue::contains);
            if (released > 0) {
                logger.info("Failover to {}: {} unacknowledged event(s) will be replayed", to.getId(), released);
            }
            replayBuffered();
            drain();
        }

        @Override
        public void onDisconnected(Throwable cause) {
            cancelTimers();
            int cleared = offlineBuffer.clearInFlight();
            logger.info("Connection lost ({}), {} in-flight event(s) will be replayed", cause.getMessage(), cleared);
            notifyListeners(l -> l.onDisconnected(cause));
            if (started && !closed) {
                scheduleReconnect();
            }
        }

        @Override
        public void onMessage(PooledConnection connection, Message message) {
            onInbound(connection, message);
        }
    }

    private final class SupervisorEvents implements ReconnectionSupervisor.Listener {

        @Override
        public void onStatusChange(SyncStatus status, String description) {
            notifyListeners(l -> l.onStatusChange(status, description));
        }

        @Override
        public void onReconnectScheduled(int attempt, long delayMs) {
            notifyListeners(l -> l.onReconnectScheduled(attempt, delayMs));
        }
    }

    /**
     * Whatever a full queue gives up is released like any other unsent message.
     */
    private final class QueueOverflowHandler implements OverflowListener {

        @Override
        public void onEvicted(Message evicted) {
            notifyListeners(l -> l.onMessageEvicted(evicted));
            releaseUnsent(evicted, new QueueOverflowException("Evicted from full queue: " + evicted.getId()));
        }

        @Override
        public void onDropped(Message dropped) {
            notifyListeners(l -> l.onQueueOverflow(dropped));
            releaseUnsent(dropped, new QueueOverflowException("Dropped by full queue: " + dropped.getId()));
        }
    }
}
