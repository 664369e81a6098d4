package com.syncmirror.buffer;

import com.syncmirror.protocol.Priority;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Holds local events that have not been acknowledged, for replay after reconnection.
 *
 * Entries are kept in submission order, by the sequence each event was given when
 * submitted. Wall-clock creation time plays no part, so a clock step cannot reorder replay.
 * An entry leaves the buffer only when acknowledged, evicted, or cleared; sending it
 * is never enough. Each entry carries an in-flight marker so overlapping replays
 * never put the same event on the queue twice.
 *
 * When full, the oldest non-HIGH entry is evicted; if every entry is HIGH, the oldest
 * overall goes.
 *
 * Not thread-safe: the owning client guards it with its mutex.
 */
public class OfflineBuffer {

    private static final Logger logger = LoggerFactory.getLogger(OfflineBuffer.class);

    private static final Comparator<PendingLocalEvent> SUBMISSION_ORDER =
            Comparator.comparingLong(PendingLocalEvent::getSequence);

    private final int capacity;
    private final List<Entry> entries = new ArrayList<>();

    public OfflineBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Adds an event in submission order.
     *
     * @return the entry evicted to make room, or null
     * @throws IllegalStateException if an event with the same id is already buffered
     */
    public PendingLocalEvent add(PendingLocalEvent event) {
        if (indexOf(event.getId()) >= 0) {
            throw new IllegalStateException("Event " + event.getId() + " is already buffered");
        }
        PendingLocalEvent evicted = null;
        if (entries.size() >= capacity) {
            evicted = evictOne();
        }
        entries.add(insertionPoint(event), new Entry(event));
        return evicted;
    }

    // After any entry with an equal sequence, so ties keep arrival order.
    private int insertionPoint(PendingLocalEvent event) {
        int low = 0;
        int high = entries.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (SUBMISSION_ORDER.compare(entries.get(mid).event, event) <= 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private PendingLocalEvent evictOne() {
        int victim = 0;
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).event.getPriority() != Priority.HIGH) {
                victim = i;
                break;
            }
        }
        PendingLocalEvent evicted = entries.remove(victim).event;
        logger.warn("Offline buffer full ({}), evicted {} event {}", capacity, evicted.getPriority(), evicted.getId());
        return evicted;
    }

    /**
     * Starts a replay pass.
     *
     * Marks every entry that is not already in flight and returns, in submission order,
     * the ones that must be put on the queue. Entries whose message is still queued
     * (per {@code alreadyQueued}) are marked but not returned.
     */
    public List<PendingLocalEvent> beginReplay(Predicate<String> alreadyQueued) {
        List<PendingLocalEvent> toSend = new ArrayList<>();
        for (Entry entry : entries) {
            PendingLocalEvent event = entry.event;
            if (event.isInFlight()) {
                continue;
            }
            event.markInFlight();
            if (!alreadyQueued.test(event.getId())) {
                toSend.add(event);
            }
        }
        return toSend;
    }

    /**
     * Removes an acknowledged event.
     *
     * @return the removed event, or null if it was not buffered
     */
    public PendingLocalEvent acknowledge(String eventId) {
        int at = indexOf(eventId);
        return at >= 0 ? entries.remove(at).event : null;
    }

    /**
     * Makes one entry eligible for the next replay again.
     */
    public void markNotInFlight(String eventId) {
        int at = indexOf(eventId);
        if (at >= 0) {
            entries.get(at).event.clearInFlight();
        }
    }

    /**
     * Makes every entry eligible for the next replay again.
     *
     * @return how many entries were in flight
     */
    public int clearInFlight() {
        int cleared = 0;
        for (Entry entry : entries) {
            if (entry.event.isInFlight()) {
                entry.event.clearInFlight();
                cleared++;
            }
        }
        return cleared;
    }

    /**
     * Makes entries eligible for the next replay again, except those whose message is
     * still queued (per {@code stillQueued}); those will go out on whatever connection
     * drains the queue next.
     *
     * @return how many entries were released
     */
    public int releaseInFlight(Predicate<String> stillQueued) {
        int released = 0;
        for (Entry entry : entries) {
            PendingLocalEvent event = entry.event;
            if (event.isInFlight() && !stillQueued.test(event.getId())) {
                event.clearInFlight();
                released++;
            }
        }
        return released;
    }

    public boolean contains(String eventId) {
        return indexOf(eventId) >= 0;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int inFlightCount() {
        int count = 0;
        for (Entry entry : entries) {
            if (entry.event.isInFlight()) {
                count++;
            }
        }
        return count;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Returns the buffered events in submission order.
     */
    public List<PendingLocalEvent> snapshot() {
        List<PendingLocalEvent> result = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            result.add(entry.event);
        }
        return Collections.unmodifiableList(result);
    }

    public void clear() {
        if (!entries.isEmpty()) {
            logger.info("Clearing {} buffered event(s)", entries.size());
        }
        entries.clear();
    }

    private int indexOf(String eventId) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).event.getId().equals(eventId)) {
                return i;
            }
        }
        return -1;
    }

    private static final class Entry {
        final PendingLocalEvent event;

        Entry(PendingLocalEvent event) {
            this.event = event;
        }
    }
}
