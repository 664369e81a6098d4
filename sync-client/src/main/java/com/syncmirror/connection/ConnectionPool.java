package com.syncmirror.connection;

import com.syncmirror.error.HandshakeRejectedException;
import com.syncmirror.error.MessageCodecException;
import com.syncmirror.error.SendFailureException;
import com.syncmirror.error.TransportException;
import com.syncmirror.protocol.Message;
import com.syncmirror.protocol.MessageSerializer;
import com.syncmirror.protocol.MessageType;
import com.syncmirror.protocol.Priority;
import com.syncmirror.protocol.payload.AuthAckPayload;
import com.syncmirror.protocol.payload.HeartbeatPayload;
import com.syncmirror.transport.SyncTransportClient;
import com.syncmirror.transport.TransportChannel;
import com.syncmirror.transport.TransportListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Manages N parallel connections to the same endpoint.
 *
 * - {@link #connect(int)} opens up to N connections concurrently and succeeds as soon
 *   as one completes its handshake; it fails only when every attempt has failed
 * - The first connection to complete its handshake becomes active, the others are
 *   warm standbys
 * - When the active connection fails the first ready standby is promoted. With none
 *   ready the pool reports itself disconnected; members still handshaking carry on as
 *   a new connect attempt, and the pool closes only when none are left
 *
 * Thread Safety:
 * - All state is guarded by the mutex handed in by the owner, so transport callbacks,
 *   timers and callers are serialized with the owner's own queue and store mutations
 * - Every callback first checks that its connection is still a pool member, so late
 *   events from replaced connections are ignored
 */
public class ConnectionPool {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);

    private final SyncTransportClient transport;
    private final URI endpoint;
    private final MessageSerializer serializer;
    private final ScheduledExecutorService scheduler;
    private final Object mutex;
    private final ClientIdentity identity;
    private final long connectTimeoutMs;
    private final long handshakeTimeoutMs;
    private final PoolListener listener;

    private final List<PooledConnection> connections = new ArrayList<>();
    private PooledConnection active;
    private ConnectRound round;

    public ConnectionPool(SyncTransportClient transport,
                          URI endpoint,
                          MessageSerializer serializer,
                          ScheduledExecutorService scheduler,
                          Object mutex,
                          ClientIdentity identity,
                          long connectTimeoutMs,
                          long handshakeTimeoutMs,
                          PoolListener listener) {
        this.transport = transport;
        this.endpoint = endpoint;
        this.serializer = serializer;
        this.scheduler = scheduler;
        this.mutex = mutex;
        this.identity = identity;
        this.connectTimeoutMs = connectTimeoutMs;
        this.handshakeTimeoutMs = handshakeTimeoutMs;
        this.listener = listener;
    }

    /**
     * Opens up to {@code poolSize} connections.
     *
     * Returns the in-progress attempt if one is running (including members left
     * handshaking after the active connection was lost), or an already completed
     * future if the pool has an active connection.
     */
    public CompletableFuture<Void> connect(int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be >= 1, got " + poolSize);
        }
        synchronized (mutex) {
            if (active != null) {
                return CompletableFuture.completedFuture(null);
            }
            if (round != null && !round.future.isDone()) {
                return round.future;
            }
            // Leftovers from an earlier round can never become active now
            for (PooledConnection stale : new ArrayList<>(connections)) {
                stale.terminate(ConnectionState.CLOSED);
            }
            connections.clear();

            ConnectRound r = new ConnectRound(poolSize);
            round = r;
            logger.info("Opening {} connection(s) to {}", poolSize, endpoint);
            for (int i = 0; i < poolSize; i++) {
                openConnection(i, r);
            }
            return r.future;
        }
    }

    private void openConnection(int index, ConnectRound r) {
        PooledConnection conn = new PooledConnection(index, r);
        connections.add(conn);
        conn.setConnectTimeout(scheduler.schedule(() -> onConnectTimeout(conn),
                connectTimeoutMs, TimeUnit.MILLISECONDS));

        CompletableFuture<TransportChannel> opening;
        try {
            opening = transport.open(endpoint, new ConnectionListener(conn));
        } catch (RuntimeException e) {
            opening = CompletableFuture.failedFuture(e);
        }
        opening.whenComplete((channel, error) -> onOpened(conn, channel, error));
    }

    private void onOpened(PooledConnection conn, TransportChannel channel, Throwable error) {
        synchronized (mutex) {
            conn.cancelConnectTimeout();
            if (error != null) {
                handleFailure(conn, unwrap(error));
                return;
            }
            if (!isMember(conn) || conn.getState().isTerminal()) {
                // Timed out or the pool was closed while the transport was still opening
                channel.close();
                return;
            }
            conn.attach(channel);
            logger.debug("Connection {} open, sending handshake", conn.getId());

            Message auth = Message.builder()
                    .type(MessageType.AUTH)
                    .payload(identity.toAuthPayload(conn.getIndex()))
                    .priority(Priority.HIGH)
                    .build();
            try {
                sendDirect(conn, auth);
            } catch (SendFailureException | MessageCodecException e) {
                handleFailure(conn, e);
                return;
            }
            conn.setHandshakeTimeout(scheduler.schedule(() -> onHandshakeTimeout(conn),
                    handshakeTimeoutMs, TimeUnit.MILLISECONDS));
        }
    }

    private void onConnectTimeout(PooledConnection conn) {
        synchronized (mutex) {
            if (isMember(conn) && conn.getState() == ConnectionState.CONNECTING) {
                handleFailure(conn, new TransportException(
                        "Connect to " + endpoint + " timed out after " + connectTimeoutMs + "ms"));
            }
        }
    }

    private void onHandshakeTimeout(PooledConnection conn) {
        synchronized (mutex) {
            if (isMember(conn) && !conn.getState().isTerminal() && !conn.isHandshakeComplete()) {
                handleFailure(conn, new HandshakeRejectedException(
                        "No auth_ack within " + handshakeTimeoutMs + "ms"));
            }
        }
    }

    private void onText(PooledConnection conn, String text) {
        Message message;
        try {
            message = serializer.deserialize(text);
        } catch (MessageCodecException e) {
            conn.recordError();
            logger.error("Dropping malformed frame on connection {}: {}", conn.getId(), e.getMessage());
            return;
        }

        synchronized (mutex) {
            if (!isMember(conn) || conn.getState().isTerminal()) {
                return;
            }
            conn.recordReceived();
            switch (message.getType()) {
                case AUTH_ACK -> onAuthAck(conn, message.hasPayload()
                        ? message.getPayload(AuthAckPayload.class)
                        : AuthAckPayload.reject("empty auth_ack"));
                case PING -> replyPong(conn);
                case PONG -> conn.pongReceived();
                default -> listener.onMessage(conn, message);
            }
        }
    }

    private void onAuthAck(PooledConnection conn, AuthAckPayload ack) {
        conn.cancelHandshakeTimeout();
        if (!ack.isAccepted()) {
            handleFailure(conn, new HandshakeRejectedException("Handshake rejected: " + ack.getReason()));
            return;
        }
        if (conn.isHandshakeComplete()) {
            logger.debug("Duplicate auth_ack on connection {}", conn.getId());
            return;
        }
        conn.markHandshakeComplete(ack.getSessionId());

        if (active == null) {
            active = conn;
            logger.info("Connection {} is active (session {})", conn.getId(), ack.getSessionId());
            listener.onConnected(conn);
            ConnectRound r = conn.getRound();
            if (r == round) {
                round = null;
            }
            r.future.complete(null);
        } else {
            logger.info("Connection {} ready as standby", conn.getId());
        }
    }

    private void onClosed(PooledConnection conn, Throwable cause) {
        synchronized (mutex) {
            handleFailure(conn, cause != null
                    ? cause
                    : new TransportException("Connection " + conn.getId() + " closed by remote"));
        }
    }

    /**
     * Single exit path for a failed connection. Runs at most once per connection.
     */
    private void handleFailure(PooledConnection conn, Throwable cause) {
        if (!isMember(conn) || conn.getState().isTerminal()) {
            return;
        }
        boolean wasActive = conn == active;
        connections.remove(conn);
        conn.recordError();
        conn.terminate(ConnectionState.ERROR);
        logger.warn("Connection {} failed: {}", conn.getId(), cause.getMessage());

        ConnectRound r = conn.getRound();
        if (!r.future.isDone()) {
            r.failed++;
            if (r.failed >= r.attempts) {
                if (r == round) {
                    round = null;
                }
                logger.warn("All {} connection attempt(s) to {} failed", r.attempts, endpoint);
                r.future.completeExceptionally(new TransportException(
                        "All " + r.attempts + " connection attempt(s) to " + endpoint + " failed", cause));
            }
            return;
        }

        if (!wasActive) {
            return;
        }
        active = null;
        PooledConnection standby = firstReadyStandby();
        if (standby != null) {
            active = standby;
            logger.info("Failover: connection {} -> {}", conn.getId(), standby.getId());
            listener.onConnectionSwitch(conn, standby);
        } else if (!connections.isEmpty()) {
            ConnectRound recovery = new ConnectRound(connections.size());
            round = recovery;
            for (PooledConnection pending : connections) {
                pending.adopt(recovery);
            }
            logger.info("Active connection lost, waiting on {} connection(s) still handshaking",
                    connections.size());
            listener.onDisconnected(cause);
        } else {
            logger.info("Active connection lost and no standby left");
            closeAll(cause);
            listener.onDisconnected(cause);
        }
    }

    private PooledConnection firstReadyStandby() {
        for (PooledConnection candidate : connections) {
            if (candidate.isReady()) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Sends an application message on the active connection.
     *
     * @throws SendFailureException  if there is no active connection or the write is refused
     * @throws MessageCodecException if the message cannot be encoded
     */
    public void send(Message message) {
        synchronized (mutex) {
            if (active == null) {
                throw new SendFailureException("No active connection");
            }
            sendDirect(active, message);
        }
    }

    private void sendDirect(PooledConnection conn, Message message) {
        String frame = serializer.serialize(message);
        conn.send(frame);
        logger.debug("Sent {} {} on connection {}", message.getType(), message.getId(), conn.getId());
    }

    private void replyPong(PooledConnection conn) {
        Message pong = Message.builder()
                .type(MessageType.PONG)
                .payload(new HeartbeatPayload(System.currentTimeMillis()))
                .build();
        try {
            sendDirect(conn, pong);
        } catch (SendFailureException e) {
            logger.warn("Could not answer ping on connection {}: {}", conn.getId(), e.getMessage());
        }
    }

    /**
     * One heartbeat tick: counts the previous ping as missed if no pong arrived, fails
     * connections that reached {@code maxMissedPongs}, and pings every ready connection.
     */
    public void heartbeat(int maxMissedPongs) {
        synchronized (mutex) {
            for (PooledConnection conn : new ArrayList<>(connections)) {
                if (!conn.isReady()) {
                    continue;
                }
                int missed = conn.checkPong();
                if (missed > 0) {
                    logger.warn("Connection {} missed {} pong(s)", conn.getId(), missed);
                }
                if (missed >= maxMissedPongs) {
                    handleFailure(conn, new TransportException(
                            "Connection " + conn.getId() + " missed " + missed + " consecutive pongs"));
                    continue;
                }
                Message ping = Message.builder()
                        .type(MessageType.PING)
                        .payload(new HeartbeatPayload(System.currentTimeMillis()))
                        .build();
                try {
                    sendDirect(conn, ping);
                    conn.pingSent();
                } catch (SendFailureException e) {
                    handleFailure(conn, new TransportException("Heartbeat send failed", e));
                }
            }
        }
    }

    /**
     * Closes every connection and fails an in-progress connect attempt with {@code reason}.
     * Does not notify the listener.
     */
    public void closeAll(Throwable reason) {
        synchronized (mutex) {
            active = null;
            List<PooledConnection> closing = new ArrayList<>(connections);
            connections.clear();
            for (PooledConnection conn : closing) {
                conn.terminate(ConnectionState.CLOSED);
            }
            ConnectRound r = round;
            round = null;
            if (r != null && !r.future.isDone()) {
                r.future.completeExceptionally(reason);
            }
            if (!closing.isEmpty()) {
                logger.info("Closed {} connection(s)", closing.size());
            }
        }
    }

    public boolean hasActive() {
        synchronized (mutex) {
            return active != null;
        }
    }

    public PooledConnection getActive() {
        synchronized (mutex) {
            return active;
        }
    }

    public String getActiveConnectionId() {
        synchronized (mutex) {
            return active != null ? active.getId() : null;
        }
    }

    public int getOpenCount() {
        synchronized (mutex) {
            int open = 0;
            for (PooledConnection conn : connections) {
                if (conn.getState() == ConnectionState.OPEN) {
                    open++;
                }
            }
            return open;
        }
    }

    /**
     * Returns a snapshot of the current members.
     */
    public List<PooledConnection> getConnections() {
        synchronized (mutex) {
            return List.copyOf(connections);
        }
    }

    private boolean isMember(PooledConnection conn) {
        return connections.contains(conn);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    /**
     * Tracks one {@link #connect(int)} call across its parallel attempts.
     */
    static final class ConnectRound {
        final CompletableFuture<Void> future = new CompletableFuture<>();
        final int attempts;
        int failed;

        ConnectRound(int attempts) {
            this.attempts = attempts;
        }
    }

    /**
     * Bridges one transport channel's callbacks back into the pool.
     */
    private final class ConnectionListener implements TransportListener {
        private final PooledConnection conn;

        ConnectionListener(PooledConnection conn) {
            this.conn = conn;
        }

        @Override
        public void onText(String text) {
            ConnectionPool.this.onText(conn, text);
        }

        @Override
        public void onClosed(Throwable cause) {
            ConnectionPool.this.onClosed(conn, cause);
        }
    }
}
