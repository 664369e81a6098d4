package com.syncmirror.queue;

import com.syncmirror.protocol.Message;
import com.syncmirror.protocol.MessageType;
import com.syncmirror.protocol.Priority;
import com.syncmirror.protocol.payload.EventPayload;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for priority ordering, overflow and retry placement in the outbound queue.
 */
@DisplayName("Message Queue Tests")
class MessageQueueTest {

    private final List<Message> evicted = new ArrayList<>();
    private final List<Message> dropped = new ArrayList<>();

    private MessageQueue newQueue(int capacity) {
        return new MessageQueue(capacity, new OverflowListener() {
            @Override
            public void onEvicted(Message message) {
                evicted.add(message);
            }

            @Override
            public void onDropped(Message message) {
                dropped.add(message);
            }
        });
    }

    private static Message event(String id, Priority priority) {
        return Message.builder()
                .id(id)
                .type(MessageType.EVENT)
                .payload(new EventPayload(id, null, "jvm", 0L))
                .priority(priority)
                .build();
    }

    private static List<String> drainIds(MessageQueue queue) {
        List<String> ids = new ArrayList<>();
        QueuedMessage next;
        while ((next = queue.poll()) != null) {
            ids.add(next.getMessage().getId());
        }
        return ids;
    }

    // ==========================================
    // Test: Priority Ordering
    // ==========================================

    @Test
    @DisplayName("Should drain HIGH before NORMAL before LOW, FIFO within each tier")
    void testPriorityOrdering() {
        MessageQueue queue = newQueue(100);
        queue.enqueue(event("n1", Priority.NORMAL));
        queue.enqueue(event("l1", Priority.LOW));
        queue.enqueue(event("h1", Priority.HIGH));
        queue.enqueue(event("n2", Priority.NORMAL));
        queue.enqueue(event("h2", Priority.HIGH));
        queue.enqueue(event("l2", Priority.LOW));

        assertEquals(List.of("h1", "h2", "n1", "n2", "l1", "l2"), drainIds(queue));
        assertTrue(queue.isEmpty());
    }

    @Test
    @DisplayName("Random mixed sequences should always drain in tier order")
    void testRandomSequencesKeepTierOrder() {
        Random random = new Random(7);
        Priority[] priorities = Priority.values();

        for (int round = 0; round < 50; round++) {
            MessageQueue queue = newQueue(1000);
            List<List<String>> expectedPerTier = new ArrayList<>();
            for (int i = 0; i < priorities.length; i++) {
                expectedPerTier.add(new ArrayList<>());
            }
            int count = 1 + random.nextInt(60);
            for (int i = 0; i < count; i++) {
                Priority priority = priorities[random.nextInt(priorities.length)];
                String id = round + "-" + i;
                queue.enqueue(event(id, priority));
                expectedPerTier.get(priority.ordinal()).add(id);
            }

            List<String> expected = new ArrayList<>();
            expectedPerTier.forEach(expected::addAll);
            assertEquals(expected, drainIds(queue), "Round " + round);
        }
    }

    // ==========================================
    // Test: Overflow
    // ==========================================

    @Test
    @DisplayName("Capacity 3 with low,low,low then high should hold [high, low, low]")
    void testEvictOldestLowForHigh() {
        MessageQueue queue = newQueue(3);
        queue.enqueue(event("l1", Priority.LOW));
        queue.enqueue(event("l2", Priority.LOW));
        queue.enqueue(event("l3", Priority.LOW));

        assertTrue(queue.enqueue(event("h1", Priority.HIGH)));

        List<String> contents = new ArrayList<>();
        queue.snapshot().forEach(m -> contents.add(m.getId()));
        assertEquals(List.of("h1", "l2", "l3"), contents);
        assertEquals(1, evicted.size());
        assertEquals("l1", evicted.get(0).getId());
        assertEquals("h1", queue.poll().getMessage().getId(), "HIGH must be transmitted first");
    }

    @Test
    @DisplayName("Should drop the incoming message when no LOW message can be evicted")
    void testDropIncomingWithoutLowCandidate() {
        MessageQueue queue = newQueue(2);
        queue.enqueue(event("h1", Priority.HIGH));
        queue.enqueue(event("n1", Priority.NORMAL));

        assertFalse(queue.enqueue(event("h2", Priority.HIGH)));

        assertEquals(2, queue.size());
        assertEquals(1, dropped.size());
        assertEquals("h2", dropped.get(0).getId());
        assertTrue(evicted.isEmpty());
        assertFalse(queue.contains("h2"));
    }

    @Test
    @DisplayName("Enqueue should never block or throw when full")
    void testEnqueueNeverThrowsWhenFull() {
        MessageQueue queue = newQueue(1);
        queue.enqueue(event("h0", Priority.HIGH));

        assertDoesNotThrow(() -> {
            for (int i = 0; i < 1000; i++) {
                queue.enqueue(event("n" + i, Priority.NORMAL));
            }
        });
        assertEquals(1, queue.size());
        assertEquals(1000, dropped.size());
    }

    // ==========================================
    // Test: Retry Placement
    // ==========================================

    @Test
    @DisplayName("A requeued message should go ahead of newer peers in its tier")
    void testRequeueFront() {
        MessageQueue queue = newQueue(10);
        queue.enqueue(event("n1", Priority.NORMAL));
        queue.enqueue(event("n2", Priority.NORMAL));
        queue.enqueue(event("h1", Priority.HIGH));

        QueuedMessage first = queue.poll();
        assertEquals("h1", first.getMessage().getId());
        QueuedMessage failed = queue.poll();
        assertEquals("n1", failed.getMessage().getId());
        assertEquals(1, failed.recordFailure());

        queue.enqueue(event("n3", Priority.NORMAL));
        queue.requeueFront(failed);

        QueuedMessage retried = queue.poll();
        assertSame(failed, retried);
        assertEquals(1, retried.getRetries());
        assertEquals(List.of("n2", "n3"), drainIds(queue));
    }

    @Test
    @DisplayName("Polling an empty queue should return null")
    void testPollEmpty() {
        MessageQueue queue = newQueue(5);
        assertNull(queue.poll());
        assertEquals(0, queue.size());
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> newQueue(0));
    }
}
