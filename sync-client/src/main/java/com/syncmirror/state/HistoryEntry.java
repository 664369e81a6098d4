package com.syncmirror.state;

/**
 * One past value of the mirrored state and the sender time it was broadcast at.
 */
public final class HistoryEntry {

    private final double value;
    private final long timestamp;

    public HistoryEntry(double value, long timestamp) {
        this.value = value;
        this.timestamp = timestamp;
    }

    public double getValue() {
        return value;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "HistoryEntry{value=" + value + ", timestamp=" + timestamp + '}';
    }
}
