package com.syncmirror.client;

import org.junit.jupiter.api.*;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for reconnect scheduling, attempt accounting and status transitions.
 */
@DisplayName("Reconnection Supervisor Tests")
class ReconnectionSupervisorTest {

    private ScheduledExecutorService scheduler;
    private List<SyncStatus> statuses;
    private List<Long> delays;
    private ReconnectionSupervisor.Listener listener;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        statuses = new CopyOnWriteArrayList<>();
        delays = new CopyOnWriteArrayList<>();
        listener = new ReconnectionSupervisor.Listener() {
            @Override
            public void onStatusChange(SyncStatus status, String description) {
                statuses.add(status);
            }

            @Override
            public void onReconnectScheduled(int attempt, long delayMs) {
                delays.add(delayMs);
            }
        };
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private ReconnectionSupervisor supervisor(int maxAttempts) {
        return new ReconnectionSupervisor(new BackoffPolicy(10, 40), maxAttempts, scheduler, listener);
    }

    // ==========================================
    // Test: Backoff Sequence
    // ==========================================

    @Test
    @DisplayName("Consecutive failures should follow the capped exponential sequence")
    void testBackoffSequence() {
        ReconnectionSupervisor supervisor = supervisor(-1);

        for (int i = 0; i < 5; i++) {
            assertTrue(supervisor.scheduleReconnect(() -> { }));
        }

        assertEquals(List.of(10L, 20L, 40L, 40L, 40L), delays);
        assertEquals(5, supervisor.getAttempts());
        assertEquals(SyncStatus.RECONNECTING, supervisor.getStatus());
    }

    @Test
    @DisplayName("A successful connection should restart the sequence from the base delay")
    void testResetAfterSuccess() {
        ReconnectionSupervisor supervisor = supervisor(-1);
        supervisor.scheduleReconnect(() -> { });
        supervisor.scheduleReconnect(() -> { });
        supervisor.scheduleReconnect(() -> { });

        supervisor.connected("ws://test");
        supervisor.scheduleReconnect(() -> { });

        assertEquals(List.of(10L, 20L, 40L, 10L), delays);
        assertEquals(1, supervisor.getAttempts());
    }

    @Test
    @DisplayName("The scheduled attempt should run after the delay")
    void testAttemptRuns() throws InterruptedException {
        ReconnectionSupervisor supervisor = supervisor(-1);
        CountDownLatch ran = new CountDownLatch(1);

        supervisor.scheduleReconnect(ran::countDown);

        assertTrue(ran.await(2, TimeUnit.SECONDS));
    }

    // ==========================================
    // Test: Attempt Budget
    // ==========================================

    @Test
    @DisplayName("Should go OFFLINE once the attempt budget is spent")
    void testOfflineAfterMaxAttempts() {
        ReconnectionSupervisor supervisor = supervisor(2);

        assertTrue(supervisor.scheduleReconnect(() -> { }));
        assertTrue(supervisor.scheduleReconnect(() -> { }));
        assertFalse(supervisor.scheduleReconnect(() -> { }));

        assertEquals(SyncStatus.OFFLINE, supervisor.getStatus());
        assertFalse(supervisor.isReconnectPending());
    }

    @Test
    @DisplayName("resetAttempts should re-arm an OFFLINE supervisor")
    void testResetAttempts() {
        ReconnectionSupervisor supervisor = supervisor(1);
        supervisor.scheduleReconnect(() -> { });
        assertFalse(supervisor.scheduleReconnect(() -> { }));

        supervisor.resetAttempts();

        assertTrue(supervisor.scheduleReconnect(() -> { }));
        assertEquals(SyncStatus.RECONNECTING, supervisor.getStatus());
    }

    @Test
    @DisplayName("Zero attempts should go OFFLINE immediately")
    void testZeroAttempts() {
        ReconnectionSupervisor supervisor = supervisor(0);

        assertFalse(supervisor.scheduleReconnect(() -> { }));
        assertTrue(delays.isEmpty());
    }

    // ==========================================
    // Test: Status
    // ==========================================

    @Test
    @DisplayName("stop() should cancel the pending attempt and report DISCONNECTED")
    void testStop() {
        ReconnectionSupervisor supervisor = new ReconnectionSupervisor(
                new BackoffPolicy(60_000, 60_000), -1, scheduler, listener);
        supervisor.scheduleReconnect(() -> fail("Cancelled attempt must not run"));
        assertTrue(supervisor.isReconnectPending());

        supervisor.stop();

        assertFalse(supervisor.isReconnectPending());
        assertEquals(SyncStatus.DISCONNECTED, supervisor.getStatus());
    }

    @Test
    @DisplayName("Should report transitions in order")
    void testStatusSequence() {
        ReconnectionSupervisor supervisor = supervisor(-1);

        supervisor.connecting("ws://test");
        supervisor.connected("ws://test");
        supervisor.scheduleReconnect(() -> { });
        supervisor.stop();

        assertEquals(List.of(SyncStatus.CONNECTING, SyncStatus.CONNECTED,
                SyncStatus.RECONNECTING, SyncStatus.DISCONNECTED), statuses);
    }
}
