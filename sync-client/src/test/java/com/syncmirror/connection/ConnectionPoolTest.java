package com.syncmirror.connection;

import com.syncmirror.Await;
import com.syncmirror.error.HandshakeRejectedException;
import com.syncmirror.error.SendFailureException;
import com.syncmirror.error.TransportException;
import com.syncmirror.protocol.Message;
import com.syncmirror.protocol.MessageSerializer;
import com.syncmirror.protocol.MessageType;
import com.syncmirror.protocol.payload.AuthPayload;
import com.syncmirror.protocol.payload.HeartbeatPayload;
import com.syncmirror.protocol.payload.StateSyncPayload;
import com.syncmirror.transport.InMemoryAuthority;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for pooled connections: partial success, standby promotion and handshake failures.
 */
@DisplayName("Connection Pool Tests")
class ConnectionPoolTest {

    private static final URI ENDPOINT = URI.create("ws://authority.test/sync");

    private InMemoryAuthority authority;
    private ScheduledExecutorService scheduler;
    private RecordingListener events;
    private ConnectionPool pool;

    @BeforeEach
    void setUp() {
        authority = new InMemoryAuthority();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        events = new RecordingListener();
        pool = newPool(2000);
    }

    @AfterEach
    void tearDown() {
        pool.closeAll(new TransportException("test finished"));
        scheduler.shutdownNow();
        authority.shutdown();
    }

    private ConnectionPool newPool(long handshakeTimeoutMs) {
        ClientIdentity identity = new ClientIdentity("client-1", "jvm", List.of("state_sync"), "1.0.0");
        return new ConnectionPool(authority, ENDPOINT, new MessageSerializer(), scheduler, new Object(),
                identity, 2000, handshakeTimeoutMs, events);
    }

    private InMemoryAuthority.Channel channelOf(PooledConnection conn) {
        return authority.getChannels().get(conn.getIndex());
    }

    private static Throwable causeOf(CompletableFuture<Void> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return e.getCause();
    }

    // ==========================================
    // Test: Connecting
    // ==========================================

    @Test
    @DisplayName("Should open, authenticate and activate a single connection")
    void testConnectSingle() throws Exception {
        pool.connect(1).get(5, TimeUnit.SECONDS);

        assertTrue(pool.hasActive());
        assertEquals(1, events.connected.size());
        assertTrue(pool.getActive().isReady());
        assertNotNull(pool.getActive().getSessionId());

        Message auth = authority.receivedOfType(MessageType.AUTH).get(0);
        AuthPayload payload = auth.getPayload(AuthPayload.class);
        assertEquals("client-1", payload.getClientId());
        assertEquals("jvm", payload.getPlatform());
        assertEquals(List.of("state_sync"), payload.getCapabilities());
        assertEquals(0, payload.getPoolIndex());
    }

    @Test
    @DisplayName("Should succeed when at least one of N connections opens")
    void testPartialSuccess() throws Exception {
        authority.refuseNextConnections(2);

        pool.connect(3).get(5, TimeUnit.SECONDS);

        assertTrue(pool.hasActive());
        assertEquals(1, pool.getConnections().size());
        assertEquals(3, authority.getOpenAttempts());
    }

    @Test
    @DisplayName("Should fail with TransportException only when every attempt fails")
    void testAllAttemptsFail() {
        authority.refuseConnections = true;

        Throwable cause = causeOf(pool.connect(2));

        assertInstanceOf(TransportException.class, cause);
        assertFalse(pool.hasActive());
        assertTrue(events.connected.isEmpty());
        assertTrue(events.disconnected.isEmpty(), "A failed connect is not a disconnect");
    }

    @Test
    @DisplayName("Connecting while a round is in progress should return the same attempt")
    void testConnectIsIdempotent() throws Exception {
        CompletableFuture<Void> first = pool.connect(1);
        CompletableFuture<Void> second = pool.connect(1);
        first.get(5, TimeUnit.SECONDS);

        assertTrue(pool.connect(1).isDone());
        assertTrue(first == second || second.isDone());
        assertEquals(1, authority.getOpenAttempts());
    }

    @Test
    @DisplayName("A rejected handshake should fail the attempt")
    void testHandshakeRejected() {
        authority.acceptAuth = false;

        Throwable cause = causeOf(pool.connect(1));

        assertInstanceOf(TransportException.class, cause);
        assertInstanceOf(HandshakeRejectedException.class, cause.getCause());
    }

    @Test
    @DisplayName("A missing auth_ack should fail the attempt after the handshake timeout")
    void testHandshakeTimeout() {
        pool = newPool(100);
        authority.answerAuth = false;

        Throwable cause = causeOf(pool.connect(1));

        assertInstanceOf(HandshakeRejectedException.class, cause.getCause());
        Await.until(() -> authority.openChannels().isEmpty(), "timed-out channel closed");
    }

    // ==========================================
    // Test: Failover
    // ==========================================

    @Test
    @DisplayName("Losing a standby should not switch the active connection")
    void testStandbyLossIsSilent() throws Exception {
        pool.connect(2).get(5, TimeUnit.SECONDS);
        Await.until(() -> pool.getConnections().stream().allMatch(PooledConnection::isReady), "standby ready");
        PooledConnection active = pool.getActive();
        PooledConnection standby = pool.getConnections().stream()
                .filter(c -> c != active).findFirst().orElseThrow();

        authority.kill(channelOf(standby));
        Await.until(() -> pool.getConnections().size() == 1, "standby removed");

        assertSame(active, pool.getActive());
        assertTrue(events.switches.isEmpty());
        assertTrue(events.disconnected.isEmpty());
    }

    @Test
    @DisplayName("Losing the active connection should promote the standby exactly once")
    void testFailoverToStandby() throws Exception {
        pool.connect(2).get(5, TimeUnit.SECONDS);
        Await.until(() -> pool.getConnections().stream().allMatch(PooledConnection::isReady), "standby ready");
        PooledConnection active = pool.getActive();

        authority.kill(channelOf(active));
        Await.until(() -> events.switches.size() == 1, "switch reported");
        authority.flush();

        assertEquals(1, events.switches.size());
        assertSame(active, events.switches.get(0)[0]);
        assertSame(pool.getActive(), events.switches.get(0)[1]);
        assertNotSame(active, pool.getActive());
        assertTrue(events.disconnected.isEmpty());
    }

    @Test
    @DisplayName("Losing the last connection should report a disconnect")
    void testLastConnectionLost() throws Exception {
        pool.connect(1).get(5, TimeUnit.SECONDS);

        authority.kill(channelOf(pool.getActive()));
        Await.until(() -> events.disconnected.size() == 1, "disconnect reported");

        assertFalse(pool.hasActive());
        assertTrue(pool.getConnections().isEmpty());
        assertInstanceOf(TransportException.class, events.disconnected.get(0));
    }

    @Test
    @DisplayName("Losing the active connection should keep a standby that is still handshaking")
    void testFailoverWaitsForHandshakingStandby() throws Exception {
        authority.holdAuthAfter(1);
        pool.connect(2).get(5, TimeUnit.SECONDS);
        Await.until(() -> authority.receivedOfType(MessageType.AUTH).size() == 2, "standby handshake sent");
        PooledConnection active = pool.getActive();
        PooledConnection pending = pool.getConnections().stream()
                .filter(c -> c != active).findFirst().orElseThrow();

        authority.kill(channelOf(active));
        Await.until(() -> events.disconnected.size() == 1, "disconnect reported");

        assertFalse(pool.hasActive());
        assertEquals(List.of(pending), pool.getConnections());
        assertTrue(channelOf(pending).isOpen(), "Handshaking standby must not be closed");

        CompletableFuture<Void> reconnect = pool.connect(2);
        assertFalse(reconnect.isDone());

        authority.releaseHeldAuth();
        reconnect.get(5, TimeUnit.SECONDS);

        assertSame(pending, pool.getActive());
        assertEquals(List.of(active, pending), events.connected);
        assertEquals(2, authority.getOpenAttempts(), "No new connection was opened");
        assertTrue(events.switches.isEmpty());
    }

    @Test
    @DisplayName("When the handshaking standby fails too, its attempt should fail and leave the pool empty")
    void testHandshakingStandbyAlsoLost() throws Exception {
        authority.holdAuthAfter(1);
        pool.connect(2).get(5, TimeUnit.SECONDS);
        Await.until(() -> authority.receivedOfType(MessageType.AUTH).size() == 2, "standby handshake sent");
        PooledConnection active = pool.getActive();
        PooledConnection pending = pool.getConnections().stream()
                .filter(c -> c != active).findFirst().orElseThrow();

        authority.kill(channelOf(active));
        Await.until(() -> events.disconnected.size() == 1, "disconnect reported");
        CompletableFuture<Void> reconnect = pool.connect(2);

        authority.kill(channelOf(pending));

        assertInstanceOf(TransportException.class, causeOf(reconnect));
        assertTrue(pool.getConnections().isEmpty());
        assertEquals(1, events.disconnected.size(), "Only the lost active connection is a disconnect");

        authority.releaseHeldAuth();
        pool.connect(1).get(5, TimeUnit.SECONDS);
        assertTrue(pool.hasActive());
        assertEquals(3, authority.getOpenAttempts());
    }

    @Test
    @DisplayName("Sending without an active connection should fail fast")
    void testSendWithoutActive() {
        Message message = Message.builder()
                .type(MessageType.PING)
                .payload(new HeartbeatPayload(1))
                .build();
        assertThrows(SendFailureException.class, () -> pool.send(message));
    }

    // ==========================================
    // Test: Inbound Frames
    // ==========================================

    @Test
    @DisplayName("Malformed frames should be dropped without closing the connection")
    void testMalformedFrameIgnored() throws Exception {
        pool.connect(1).get(5, TimeUnit.SECONDS);
        InMemoryAuthority.Channel channel = channelOf(pool.getActive());

        authority.pushRaw(channel, "{not json");
        authority.push(channel, Message.builder()
                .type(MessageType.STATE_SYNC)
                .payload(new StateSyncPayload(0.3, "ACTIVE"))
                .build());
        Await.until(() -> events.messages.size() == 1, "valid frame delivered");

        assertTrue(pool.hasActive());
        assertEquals(1, pool.getActive().getErrorCount());
        assertTrue(events.disconnected.isEmpty());
    }

    @Test
    @DisplayName("Pings from the authority should be answered and not passed on")
    void testPingAnswered() throws Exception {
        pool.connect(1).get(5, TimeUnit.SECONDS);
        InMemoryAuthority.Channel channel = channelOf(pool.getActive());

        authority.push(channel, Message.builder()
                .type(MessageType.PING)
                .payload(new HeartbeatPayload(System.currentTimeMillis()))
                .build());

        Await.until(() -> channel.hasReceived(MessageType.PONG), "pong sent");
        assertTrue(events.messages.isEmpty());
    }

    @Test
    @DisplayName("Missed pongs should fail the connection like a transport close")
    void testMissedPongs() throws Exception {
        pool.connect(1).get(5, TimeUnit.SECONDS);
        authority.answerPings = false;

        pool.heartbeat(2);
        pool.heartbeat(2);
        assertTrue(pool.hasActive(), "One missed pong is tolerated");
        pool.heartbeat(2);

        assertFalse(pool.hasActive());
        assertEquals(1, events.disconnected.size());
    }

    @Test
    @DisplayName("Answered pings should keep the connection alive")
    void testAnsweredPings() throws Exception {
        pool.connect(1).get(5, TimeUnit.SECONDS);
        InMemoryAuthority.Channel channel = channelOf(pool.getActive());

        for (int i = 0; i < 4; i++) {
            pool.heartbeat(2);
            authority.flush();
            authority.flush();
        }

        assertTrue(pool.hasActive());
        assertEquals(4, channel.getReceived().stream().filter(m -> m.getType() == MessageType.PING).count());
    }

    /**
     * Records every pool callback.
     */
    private static final class RecordingListener implements PoolListener {
        final List<PooledConnection> connected = new CopyOnWriteArrayList<>();
        final List<PooledConnection[]> switches = new CopyOnWriteArrayList<>();
        final List<Throwable> disconnected = new CopyOnWriteArrayList<>();
        final List<Message> messages = new CopyOnWriteArrayList<>();

        @Override
        public void onConnected(PooledConnection active) {
            connected.add(active);
        }

        @Override
        public void onConnectionSwitch(PooledConnection from, PooledConnection to) {
            switches.add(new PooledConnection[]{from, to});
        }

        @Override
        public void onDisconnected(Throwable cause) {
            disconnected.add(cause);
        }

        @Override
        public void onMessage(PooledConnection connection, Message message) {
            messages.add(message);
        }
    }
}
