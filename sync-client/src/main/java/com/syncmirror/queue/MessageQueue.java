package com.syncmirror.queue;

import com.syncmirror.protocol.Message;
import com.syncmirror.protocol.Priority;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded, priority-ordered buffer of outbound messages.
 *
 * All HIGH messages drain before any NORMAL, and all NORMAL before any LOW; each tier
 * is FIFO. Enqueueing never blocks. When full, the oldest LOW message is evicted to
 * make room; with no LOW message queued, the incoming message is dropped.
 *
 * Not thread-safe: the owning client guards it with its mutex.
 */
public class MessageQueue {

    private static final Logger logger = LoggerFactory.getLogger(MessageQueue.class);

    private final int capacity;
    private final Map<Priority, ArrayDeque<QueuedMessage>> tiers = new EnumMap<>(Priority.class);
    private final OverflowListener overflowListener;
    private int size;

    public MessageQueue(int capacity, OverflowListener overflowListener) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.overflowListener = overflowListener;
        for (Priority priority : Priority.values()) {
            tiers.put(priority, new ArrayDeque<>());
        }
    }

    /**
     * Adds a message at the back of its priority tier.
     *
     * @return false if the message was dropped because the queue was full
     */
    public boolean enqueue(Message message) {
        if (size >= capacity) {
            QueuedMessage evicted = tiers.get(Priority.LOW).pollFirst();
            if (evicted == null) {
                logger.warn("Queue full ({}), dropping {} {}", capacity, message.getPriority(), message.getId());
                overflowListener.onDropped(message);
                return false;
            }
            size--;
            logger.warn("Queue full ({}), evicted LOW {}", capacity, evicted.getMessage().getId());
            overflowListener.onEvicted(evicted.getMessage());
        }
        tiers.get(message.getPriority()).addLast(new QueuedMessage(message));
        size++;
        return true;
    }

    /**
     * Removes the next message in drain order, or returns null if empty.
     */
    public QueuedMessage poll() {
        for (Priority priority : Priority.values()) {
            QueuedMessage next = tiers.get(priority).pollFirst();
            if (next != null) {
                size--;
                return next;
            }
        }
        return null;
    }

    /**
     * Puts a message that failed to send back at the front of its tier, ahead of newer peers.
     */
    public void requeueFront(QueuedMessage queued) {
        tiers.get(queued.getMessage().getPriority()).addFirst(queued);
        size++;
    }

    public boolean contains(String messageId) {
        for (ArrayDeque<QueuedMessage> tier : tiers.values()) {
            for (QueuedMessage queued : tier) {
                if (queued.getMessage().getId().equals(messageId)) {
                    return true;
                }
            }
        }
        return false;
    }

    public int size() {
        return size;
    }

    public int size(Priority priority) {
        return tiers.get(priority).size();
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Returns the queued messages in drain order.
     */
    public List<Message> snapshot() {
        List<Message> result = new ArrayList<>(size);
        for (Priority priority : Priority.values()) {
            for (QueuedMessage queued : tiers.get(priority)) {
                result.add(queued.getMessage());
            }
        }
        return Collections.unmodifiableList(result);
    }
}
