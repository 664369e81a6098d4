package com.syncmirror.client;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remembers the last N inbound message ids to drop duplicates, such as the same
 * broadcast arriving over two pooled connections.
 *
 * Not thread-safe: used under the client's lock.
 */
final class RecentMessageIds {

    private final int capacity;
    private final Map<String, Boolean> seen;

    RecentMessageIds(int capacity) {
        this.capacity = capacity;
        this.seen = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > RecentMessageIds.this.capacity;
            }
        };
    }

    /**
     * Records the id.
     *
     * @return false if it was already among the recent ids
     */
    boolean add(String messageId) {
        if (capacity == 0) {
            return true;
        }
        return seen.put(messageId, Boolean.TRUE) == null;
    }

    int size() {
        return seen.size();
    }
}
