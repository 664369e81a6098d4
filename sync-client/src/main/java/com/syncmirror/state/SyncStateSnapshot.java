package com.syncmirror.state;

import com.syncmirror.protocol.payload.ContextUpdatePayload;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of the mirrored state at one point in time.
 *
 * Safe to share across threads and to hold on to; later updates never change it.
 */
public final class SyncStateSnapshot {

    private final double value;
    private final String phase;
    private final Map<String, Object> attributes;
    private final long timestamp;
    private final long version;
    private final List<HistoryEntry> history;
    private final List<Milestone> achievedMilestones;
    private final Trend trend;
    private final ContextUpdatePayload context;

    SyncStateSnapshot(double value,
                      String phase,
                      Map<String, Object> attributes,
                      long timestamp,
                      long version,
                      List<HistoryEntry> history,
                      List<Milestone> achievedMilestones,
                      Trend trend,
                      ContextUpdatePayload context) {
        this.value = value;
        this.phase = phase;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.timestamp = timestamp;
        this.version = version;
        this.history = List.copyOf(history);
        this.achievedMilestones = List.copyOf(achievedMilestones);
        this.trend = trend;
        this.context = context;
    }

    public double getValue() {
        return value;
    }

    public String getPhase() {
        return phase;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /**
     * Sender timestamp of the sync this state came from (0 before the first sync).
     */
    public long getTimestamp() {
        return timestamp;
    }

    /**
     * Number of syncs applied so far.
     */
    public long getVersion() {
        return version;
    }

    /**
     * Past samples, oldest first.
     */
    public List<HistoryEntry> getHistory() {
        return history;
    }

    public List<Milestone> getAchievedMilestones() {
        return achievedMilestones;
    }

    public boolean hasAchieved(String milestoneName) {
        for (Milestone milestone : achievedMilestones) {
            if (milestone.getName().equals(milestoneName)) {
                return true;
            }
        }
        return false;
    }

    public Trend getTrend() {
        return trend;
    }

    /**
     * Latest conversation context from the authority, or null.
     */
    public ContextUpdatePayload getContext() {
        return context;
    }

    /**
     * Mean of the most recent {@code window} history samples, or the current value
     * when there is no history.
     */
    public double average(int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1, got " + window);
        }
        if (history.isEmpty()) {
            return value;
        }
        int from = Math.max(0, history.size() - window);
        double sum = 0;
        for (int i = from; i < history.size(); i++) {
            sum += history.get(i).getValue();
        }
        return sum / (history.size() - from);
    }

    /**
     * True if no sync has arrived yet, or the last one was sent more than {@code maxAgeMs} before {@code now}.
     */
    public boolean isStale(long maxAgeMs, long now) {
        return version == 0 || now - timestamp > maxAgeMs;
    }

    @Override
    public String toString() {
        return "SyncStateSnapshot{" +
                "value=" + value +
                ", phase='" + phase + '\'' +
                ", version=" + version +
                ", trend=" + trend +
                ", milestones=" + achievedMilestones +
                '}';
    }
}
