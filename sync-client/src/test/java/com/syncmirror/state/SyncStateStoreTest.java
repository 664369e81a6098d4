package com.syncmirror.state;

import com.syncmirror.protocol.Message;
import com.syncmirror.protocol.MessageType;
import com.syncmirror.protocol.payload.ContextUpdatePayload;
import com.syncmirror.protocol.payload.StateSyncPayload;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the mirrored state: last-write-wins, history, milestones and trend.
 */
@DisplayName("Sync State Store Tests")
class SyncStateStoreTest {

    private SyncStateStore store;

    @BeforeEach
    void setUp() {
        store = new SyncStateStore(5, 0.01, MilestoneTable.defaults());
    }

    private static Message sync(double value, String phase, long timestamp) {
        return Message.builder()
                .type(MessageType.STATE_SYNC)
                .payload(new StateSyncPayload(value, phase, Map.of("source", "test"), null))
                .timestamp(timestamp)
                .build();
    }

    // ==========================================
    // Test: Initial State and Replacement
    // ==========================================

    @Test
    @DisplayName("Should start from the placeholder state")
    void testInitialState() {
        SyncStateSnapshot state = store.snapshot();

        assertEquals(0.0, state.getValue());
        assertEquals(SyncStateStore.INITIAL_PHASE, state.getPhase());
        assertEquals(0, state.getVersion());
        assertTrue(state.getHistory().isEmpty());
        assertEquals(Trend.STABLE, state.getTrend());
        assertTrue(state.isStale(1000, System.currentTimeMillis()));
    }

    @Test
    @DisplayName("Should replace value and phase on every sync (last write wins)")
    void testLastWriteWins() {
        store.applyInbound(sync(0.5, "RISING", 100));
        store.applyInbound(sync(0.1, "FALLING", 200));

        SyncStateSnapshot state = store.snapshot();
        assertEquals(0.1, state.getValue(), 1e-9);
        assertEquals("FALLING", state.getPhase());
        assertEquals(2, state.getVersion());
        assertEquals("test", state.getAttributes().get("source"));
    }

    @Test
    @DisplayName("Should keep the previous phase when a sync carries none")
    void testMissingPhaseKeepsPrevious() {
        store.applyInbound(sync(0.5, "RISING", 100));
        store.applyInbound(sync(0.6, null, 200));

        assertEquals("RISING", store.snapshot().getPhase());
    }

    @Test
    @DisplayName("Should only accept state_sync messages")
    void testRejectsOtherTypes() {
        Message context = Message.builder()
                .type(MessageType.CONTEXT_UPDATE)
                .payload(new ContextUpdatePayload("c", List.of(), "s", List.of(), null))
                .build();

        assertThrows(IllegalArgumentException.class, () -> store.applyInbound(context));
    }

    // ==========================================
    // Test: History
    // ==========================================

    @Test
    @DisplayName("History should be bounded and evict the oldest sample first")
    void testHistoryBounded() {
        for (int i = 1; i <= 8; i++) {
            store.applyInbound(sync(i / 10.0, "P", i));
        }

        List<HistoryEntry> history = store.snapshot().getHistory();
        assertEquals(5, history.size());
        assertEquals(4, history.get(0).getTimestamp());
        assertEquals(8, history.get(4).getTimestamp());
    }

    @Test
    @DisplayName("Snapshots should be immutable and unaffected by later updates")
    void testSnapshotImmutability() {
        store.applyInbound(sync(0.1, "P", 1));
        SyncStateSnapshot before = store.snapshot();

        store.applyInbound(sync(0.9, "Q", 2));

        assertEquals(1, before.getHistory().size());
        assertEquals(0.1, before.getValue(), 1e-9);
        assertThrows(UnsupportedOperationException.class,
                () -> before.getHistory().add(new HistoryEntry(1, 1)));
        assertThrows(UnsupportedOperationException.class,
                () -> before.getAttributes().put("x", 1));
    }

    @Test
    @DisplayName("average(window) should use the most recent samples")
    void testAverage() {
        store.applyInbound(sync(0.1, "P", 1));
        store.applyInbound(sync(0.2, "P", 2));
        store.applyInbound(sync(0.6, "P", 3));

        assertEquals(0.4, store.snapshot().average(2), 1e-9);
        assertEquals(0.3, store.snapshot().average(10), 1e-9);
    }

    @Test
    @DisplayName("isStale should compare the sender timestamp with now")
    void testStaleness() {
        store.applyInbound(sync(0.1, "P", 10_000));

        assertFalse(store.snapshot().isStale(5_000, 12_000));
        assertTrue(store.snapshot().isStale(5_000, 16_000));
    }

    // ==========================================
    // Test: Trend
    // ==========================================

    @Test
    @DisplayName("Trend should follow the last two samples with an epsilon dead band")
    void testTrend() {
        store.applyInbound(sync(0.50, "P", 1));
        assertEquals(Trend.STABLE, store.trend(), "One sample is always stable");

        store.applyInbound(sync(0.60, "P", 2));
        assertEquals(Trend.ASCENDING, store.trend());

        store.applyInbound(sync(0.55, "P", 3));
        assertEquals(Trend.DESCENDING, store.trend());

        store.applyInbound(sync(0.555, "P", 4));
        assertEquals(Trend.STABLE, store.trend(), "Changes within epsilon are noise");
    }

    // ==========================================
    // Test: Milestones
    // ==========================================

    @Test
    @DisplayName("The same threshold-crossing value twice should emit the milestone once")
    void testMilestoneIdempotence() {
        StateUpdate first = store.applyInbound(sync(0.25, "P", 1));
        StateUpdate second = store.applyInbound(sync(0.25, "P", 2));

        assertEquals(List.of("SELF_RECOGNITION"), names(first.getNewMilestones()));
        assertTrue(second.getNewMilestones().isEmpty());
        assertTrue(store.snapshot().hasAchieved("SELF_RECOGNITION"));
    }

    @Test
    @DisplayName("A large jump should cross every lower milestone at once, in ascending order")
    void testMultipleMilestones() {
        StateUpdate update = store.applyInbound(sync(0.65, "P", 1));

        assertEquals(List.of("SELF_RECOGNITION", "UNIVERSAL_CONNECTION", "REALITY_CREATOR"),
                names(update.getNewMilestones()));
    }

    @Test
    @DisplayName("Milestones should stay achieved when the value falls back")
    void testMilestonesAreSticky() {
        store.applyInbound(sync(0.45, "P", 1));
        store.applyInbound(sync(0.05, "P", 2));
        StateUpdate again = store.applyInbound(sync(0.45, "P", 3));

        assertTrue(again.getNewMilestones().isEmpty());
        assertEquals(2, store.snapshot().getAchievedMilestones().size());
    }

    @Test
    @DisplayName("A phase naming a milestone should achieve it and every earlier one")
    void testPhaseCrossesMilestones() {
        StateUpdate update = store.applyInbound(sync(0.0, "universal_connection", 1));

        assertEquals(List.of("SELF_RECOGNITION", "UNIVERSAL_CONNECTION"), names(update.getNewMilestones()));
    }

    @Test
    @DisplayName("A value equal to a threshold should not cross it")
    void testThresholdIsExclusive() {
        StateUpdate update = store.applyInbound(sync(0.2, "P", 1));
        assertTrue(update.getNewMilestones().isEmpty());
    }

    @Test
    @DisplayName("Milestone tables must be strictly ascending")
    void testMilestoneTableValidation() {
        assertThrows(IllegalArgumentException.class, () -> MilestoneTable.of(
                new Milestone("B", 0.5), new Milestone("A", 0.3)));
    }

    // ==========================================
    // Test: Context
    // ==========================================

    @Test
    @DisplayName("Context updates should replace the stored context without touching the value")
    void testContextUpdate() {
        store.applyInbound(sync(0.3, "P", 1));
        ContextUpdatePayload context = new ContextUpdatePayload("conv-1", List.of("music"), "summary",
                List.of("ios"), null);

        store.applyContext(context);

        assertSame(context, store.snapshot().getContext());
        assertEquals(0.3, store.snapshot().getValue(), 1e-9);
        assertEquals(1, store.snapshot().getVersion());
    }

    private static List<String> names(List<Milestone> milestones) {
        return milestones.stream().map(Milestone::getName).toList();
    }
}
