package com.syncmirror.buffer;

import com.syncmirror.protocol.Priority;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for offline buffering, eviction and replay bookkeeping.
 */
@DisplayName("Offline Buffer Tests")
class OfflineBufferTest {

    private OfflineBuffer buffer;

    @BeforeEach
    void setUp() {
        buffer = new OfflineBuffer(3);
    }

    private static PendingLocalEvent event(String id, Priority priority, long sequence) {
        return event(id, priority, sequence, 1_000L + sequence);
    }

    private static PendingLocalEvent event(String id, Priority priority, long sequence, long createdAt) {
        return new PendingLocalEvent(id, sequence, "content " + id, Map.of("k", id), priority, createdAt);
    }

    private static List<String> ids(List<PendingLocalEvent> events) {
        List<String> ids = new ArrayList<>();
        events.forEach(e -> ids.add(e.getId()));
        return ids;
    }

    // ==========================================
    // Test: Ordering and Capacity
    // ==========================================

    @Test
    @DisplayName("Should keep events in submission order")
    void testSubmissionOrder() {
        buffer.add(event("b", Priority.NORMAL, 20));
        buffer.add(event("a", Priority.NORMAL, 10));
        buffer.add(event("c", Priority.NORMAL, 20));

        assertEquals(List.of("a", "b", "c"), ids(buffer.snapshot()));
    }

    @Test
    @DisplayName("Should replay in submission order even when the clock stepped back")
    void testOrderIgnoresCreatedAt() {
        buffer.add(event("first", Priority.NORMAL, 0, 2000));
        buffer.add(event("second", Priority.NORMAL, 1, 1000));

        assertEquals(List.of("first", "second"), ids(buffer.beginReplay(id -> false)));
    }

    @Test
    @DisplayName("A re-buffered event should return to its original place")
    void testRebufferKeepsSequence() {
        buffer.add(event("a", Priority.NORMAL, 0));
        buffer.add(event("c", Priority.NORMAL, 2));
        buffer.add(event("b", Priority.NORMAL, 1));

        assertEquals(List.of("a", "b", "c"), ids(buffer.snapshot()));
    }

    @Test
    @DisplayName("Should evict the oldest non-HIGH entry when full")
    void testEvictOldestNonHigh() {
        buffer.add(event("h1", Priority.HIGH, 1));
        buffer.add(event("n1", Priority.NORMAL, 2));
        buffer.add(event("l1", Priority.LOW, 3));

        PendingLocalEvent evicted = buffer.add(event("n2", Priority.NORMAL, 4));

        assertEquals("n1", evicted.getId());
        assertEquals(List.of("h1", "l1", "n2"), ids(buffer.snapshot()));
    }

    @Test
    @DisplayName("Should evict the oldest entry when every entry is HIGH")
    void testEvictOldestWhenAllHigh() {
        buffer.add(event("h1", Priority.HIGH, 1));
        buffer.add(event("h2", Priority.HIGH, 2));
        buffer.add(event("h3", Priority.HIGH, 3));

        PendingLocalEvent evicted = buffer.add(event("h4", Priority.HIGH, 4));

        assertEquals("h1", evicted.getId());
        assertEquals(3, buffer.size());
    }

    @Test
    @DisplayName("Should reject the same event id twice")
    void testDuplicateId() {
        buffer.add(event("a", Priority.NORMAL, 1));
        assertThrows(IllegalStateException.class, () -> buffer.add(event("a", Priority.NORMAL, 2)));
    }

    // ==========================================
    // Test: Replay Bookkeeping
    // ==========================================

    @Test
    @DisplayName("Overlapping replays should never hand out the same entry twice")
    void testReplayIsReentrant() {
        buffer.add(event("a", Priority.NORMAL, 1));
        buffer.add(event("b", Priority.NORMAL, 2));

        List<PendingLocalEvent> first = buffer.beginReplay(id -> false);
        List<PendingLocalEvent> second = buffer.beginReplay(id -> false);

        assertEquals(List.of("a", "b"), ids(first));
        assertTrue(second.isEmpty());
        assertEquals(2, buffer.inFlightCount());
    }

    @Test
    @DisplayName("Entries still queued should be marked but not handed out again")
    void testReplaySkipsQueued() {
        buffer.add(event("a", Priority.NORMAL, 1));
        buffer.add(event("b", Priority.NORMAL, 2));

        List<PendingLocalEvent> replayed = buffer.beginReplay(Set.of("a")::contains);

        assertEquals(List.of("b"), ids(replayed));
        assertTrue(buffer.snapshot().get(0).isInFlight());
    }

    @Test
    @DisplayName("Only acknowledgement should remove an entry")
    void testAcknowledgeRemoves() {
        buffer.add(event("a", Priority.NORMAL, 1));
        buffer.beginReplay(id -> false);

        assertTrue(buffer.contains("a"), "Sending must not remove the entry");
        assertNotNull(buffer.acknowledge("a"));
        assertFalse(buffer.contains("a"));
        assertNull(buffer.acknowledge("a"));
    }

    @Test
    @DisplayName("Clearing in-flight markers should make entries replayable again")
    void testClearInFlight() {
        buffer.add(event("a", Priority.NORMAL, 1));
        buffer.add(event("b", Priority.NORMAL, 2));
        buffer.beginReplay(id -> false);

        assertEquals(2, buffer.clearInFlight());

        List<PendingLocalEvent> again = buffer.beginReplay(id -> false);
        assertEquals(List.of("a", "b"), ids(again));
        assertEquals(2, again.get(0).getReplayCount());
    }

    @Test
    @DisplayName("Releasing after failover should keep entries whose message is still queued")
    void testReleaseInFlightSkipsQueued() {
        buffer.add(event("a", Priority.NORMAL, 1));
        buffer.add(event("b", Priority.NORMAL, 2));
        buffer.beginReplay(id -> false);

        assertEquals(1, buffer.releaseInFlight(Set.of("a")::contains));

        assertEquals(List.of("b"), ids(buffer.beginReplay(id -> false)));
        assertEquals(2, buffer.inFlightCount());
    }

    @Test
    @DisplayName("markNotInFlight should release a single entry")
    void testMarkNotInFlight() {
        buffer.add(event("a", Priority.NORMAL, 1));
        buffer.add(event("b", Priority.NORMAL, 2));
        buffer.beginReplay(id -> false);

        buffer.markNotInFlight("b");

        assertEquals(List.of("b"), ids(buffer.beginReplay(id -> false)));
    }

    @Test
    @DisplayName("The snapshot should be a read-only copy")
    void testSnapshotIsReadOnly() {
        buffer.add(event("a", Priority.NORMAL, 1));
        List<PendingLocalEvent> snapshot = buffer.snapshot();

        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove(0));
        buffer.clear();
        assertEquals(1, snapshot.size());
        assertTrue(buffer.isEmpty());
    }
}
