package com.syncmirror.connection;

import com.syncmirror.error.SendFailureException;
import com.syncmirror.transport.TransportChannel;

import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One member of the connection pool.
 *
 * Each pooled connection tracks:
 * - Unique connection ID and its slot in the pool
 * - The transport channel once it has opened
 * - Whether the application-level handshake has completed
 * - Heartbeat bookkeeping (outstanding ping, consecutive missed pongs)
 * - Traffic counters, for observability only
 *
 * Thread Safety:
 * - Lifecycle fields are mutated only by {@link ConnectionPool} under its mutex;
 *   they are volatile so metrics can read them from any thread
 * - Counters use AtomicLong
 */
public class PooledConnection {

    private final String id;
    private final int index;
    private final long createdAt;
    private ConnectionPool.ConnectRound round;

    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile TransportChannel channel;
    private volatile boolean handshakeComplete;
    private volatile String sessionId;
    private volatile long lastActivity;

    private boolean awaitingPong;
    private int missedPongs;
    private ScheduledFuture<?> connectTimeout;
    private ScheduledFuture<?> handshakeTimeout;

    private final AtomicLong sentCount = new AtomicLong();
    private final AtomicLong receivedCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();

    PooledConnection(int index, ConnectionPool.ConnectRound round) {
        this.id = UUID.randomUUID().toString();
        this.index = index;
        this.round = round;
        this.createdAt = System.currentTimeMillis();
        this.lastActivity = createdAt;
    }

    public String getId() {
        return id;
    }

    public int getIndex() {
        return index;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isHandshakeComplete() {
        return handshakeComplete;
    }

    /**
     * Open and handshaken: eligible to carry traffic as active or standby.
     */
    public boolean isReady() {
        return state == ConnectionState.OPEN && handshakeComplete;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getLastActivity() {
        return lastActivity;
    }

    public long getSentCount() {
        return sentCount.get();
    }

    public long getReceivedCount() {
        return receivedCount.get();
    }

    public long getErrorCount() {
        return errorCount.get();
    }

    ConnectionPool.ConnectRound getRound() {
        return round;
    }

    // Moves a still-handshaking member into the attempt that replaces a lost active connection
    void adopt(ConnectionPool.ConnectRound recovery) {
        this.round = recovery;
    }

    void attach(TransportChannel channel) {
        this.channel = channel;
        this.state = ConnectionState.OPEN;
        this.lastActivity = System.currentTimeMillis();
    }

    void markHandshakeComplete(String sessionId) {
        this.handshakeComplete = true;
        this.sessionId = sessionId;
    }

    /**
     * Writes one frame on this connection's channel.
     *
     * @throws SendFailureException if the channel is missing, closed or refuses the frame
     */
    void send(String frame) {
        TransportChannel ch = channel;
        if (ch == null || state != ConnectionState.OPEN) {
            throw new SendFailureException("Connection " + id + " is not open (" + state + ")");
        }
        try {
            ch.send(frame);
        } catch (SendFailureException e) {
            errorCount.incrementAndGet();
            throw e;
        }
        sentCount.incrementAndGet();
        lastActivity = System.currentTimeMillis();
    }

    void recordReceived() {
        receivedCount.incrementAndGet();
        lastActivity = System.currentTimeMillis();
    }

    void recordError() {
        errorCount.incrementAndGet();
    }

    /**
     * Called on every heartbeat tick before a new ping goes out.
     *
     * @return consecutive pongs missed so far
     */
    int checkPong() {
        if (awaitingPong) {
            missedPongs++;
        }
        return missedPongs;
    }

    void pingSent() {
        awaitingPong = true;
    }

    void pongReceived() {
        awaitingPong = false;
        missedPongs = 0;
    }

    void setConnectTimeout(ScheduledFuture<?> connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    void cancelConnectTimeout() {
        if (connectTimeout != null) {
            connectTimeout.cancel(false);
            connectTimeout = null;
        }
    }

    void setHandshakeTimeout(ScheduledFuture<?> handshakeTimeout) {
        this.handshakeTimeout = handshakeTimeout;
    }

    void cancelHandshakeTimeout() {
        if (handshakeTimeout != null) {
            handshakeTimeout.cancel(false);
            handshakeTimeout = null;
        }
    }

    /**
     * Moves to a terminal state and closes the channel. Idempotent.
     */
    void terminate(ConnectionState terminalState) {
        if (state.isTerminal()) {
            return;
        }
        state = terminalState;
        cancelConnectTimeout();
        cancelHandshakeTimeout();
        TransportChannel ch = channel;
        if (ch != null) {
            ch.close();
        }
    }

    @Override
    public String toString() {
        return "PooledConnection{" +
                "id='" + id + '\'' +
                ", index=" + index +
                ", state=" + state +
                ", handshakeComplete=" + handshakeComplete +
                ", sent=" + sentCount.get() +
                ", received=" + receivedCount.get() +
                '}';
    }
}
