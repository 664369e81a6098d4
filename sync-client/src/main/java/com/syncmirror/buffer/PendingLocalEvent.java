package com.syncmirror.buffer;

import com.syncmirror.protocol.Priority;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A locally generated event waiting in the {@link OfflineBuffer} for acknowledgement.
 *
 * The id is also the id of the EVENT message that carries it, so the authority's
 * event_ack can find it. The sequence is assigned once at submission and orders
 * replay; createdAt is informational only.
 */
public final class PendingLocalEvent {

    private final String id;
    private final long sequence;
    private final String content;
    private final Map<String, String> context;
    private final Priority priority;
    private final long createdAt;

    private boolean inFlight;
    private int replayCount;

    public PendingLocalEvent(String id, long sequence, String content, Map<String, String> context,
                             Priority priority, long createdAt) {
        this.id = id;
        this.sequence = sequence;
        this.content = content;
        this.context = context == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.priority = priority;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public long getSequence() {
        return sequence;
    }

    public String getContent() {
        return content;
    }

    public Map<String, String> getContext() {
        return context;
    }

    public Priority getPriority() {
        return priority;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    /**
     * True while a replayed copy sits in the queue or awaits its ack on the wire.
     */
    public boolean isInFlight() {
        return inFlight;
    }

    public int getReplayCount() {
        return replayCount;
    }

    void markInFlight() {
        inFlight = true;
        replayCount++;
    }

    void clearInFlight() {
        inFlight = false;
    }

    @Override
    public String toString() {
        return "PendingLocalEvent{" +
                "id='" + id + '\'' +
                ", sequence=" + sequence +
                ", priority=" + priority +
                ", createdAt=" + createdAt +
                ", inFlight=" + inFlight +
                ", replayCount=" + replayCount +
                '}';
    }
}
