package com.syncmirror.state;

import com.syncmirror.protocol.Message;
import com.syncmirror.protocol.MessageType;
import com.syncmirror.protocol.payload.ContextUpdatePayload;
import com.syncmirror.protocol.payload.StateSyncPayload;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Local mirror of the state broadcast by the remote authority.
 *
 * The authority is the single source of truth: {@link #applyInbound(Message)} is the
 * only way value and phase change, and it simply overwrites them (last write wins,
 * by arrival order). Application code never writes here; it round-trips through the
 * authority instead.
 *
 * Thread Safety:
 * - Mutators are called by the owning client under its mutex
 * - Readers get the latest {@link SyncStateSnapshot} through a volatile reference,
 *   so {@link #snapshot()} never blocks and never exposes the internal history
 */
public class SyncStateStore {

    private static final Logger logger = LoggerFactory.getLogger(SyncStateStore.class);

    public static final String INITIAL_PHASE = "INITIAL";

    private final int historyCapacity;
    private final double trendEpsilon;
    private final MilestoneTable milestoneTable;

    private final ArrayDeque<HistoryEntry> history;
    private final Set<Milestone> achieved = new LinkedHashSet<>();

    private double value;
    private String phase = INITIAL_PHASE;
    private Map<String, Object> attributes = Collections.emptyMap();
    private long timestamp;
    private long version;
    private ContextUpdatePayload context;

    private volatile SyncStateSnapshot current;

    public SyncStateStore(int historyCapacity, double trendEpsilon, MilestoneTable milestoneTable) {
        if (historyCapacity < 2) {
            throw new IllegalArgumentException("historyCapacity must be >= 2, got " + historyCapacity);
        }
        this.historyCapacity = historyCapacity;
        this.trendEpsilon = trendEpsilon;
        this.milestoneTable = milestoneTable;
        this.history = new ArrayDeque<>(historyCapacity);
        this.current = buildSnapshot();
    }

    // === Mutation ===

    /**
     * Applies an authoritative state_sync message.
     *
     * @throws IllegalArgumentException if the message is not a state_sync with a payload
     */
    public StateUpdate applyInbound(Message syncMessage) {
        if (syncMessage.getType() != MessageType.STATE_SYNC || !syncMessage.hasPayload()) {
            throw new IllegalArgumentException("Not a state_sync message: " + syncMessage);
        }
        StateSyncPayload payload = syncMessage.getPayload(StateSyncPayload.class);
        SyncStateSnapshot previous = current;

        value = payload.getValue();
        if (payload.getPhase() != null) {
            phase = payload.getPhase();
        }
        attributes = payload.getAttributes();
        timestamp = syncMessage.getTimestamp();
        version++;

        if (history.size() >= historyCapacity) {
            history.pollFirst();
        }
        history.addLast(new HistoryEntry(value, timestamp));

        List<Milestone> newlyAchieved = new ArrayList<>();
        for (Milestone milestone : milestoneTable.crossedBy(value, phase)) {
            if (achieved.add(milestone)) {
                newlyAchieved.add(milestone);
                logger.info("Milestone achieved: {} (value={}, phase={})", milestone.getName(), value, phase);
            }
        }

        current = buildSnapshot();
        logger.debug("State v{} applied: value={}, phase={}", version, value, phase);
        return new StateUpdate(previous, current, newlyAchieved);
    }

    /**
     * Replaces the stored conversation context.
     */
    public SyncStateSnapshot applyContext(ContextUpdatePayload update) {
        context = update;
        current = buildSnapshot();
        return current;
    }

    // === Queries ===

    public SyncStateSnapshot snapshot() {
        return current;
    }

    /**
     * Compares the last two history samples; STABLE with fewer than two.
     */
    public Trend trend() {
        return current.getTrend();
    }

    private Trend computeTrend() {
        if (history.size() < 2) {
            return Trend.STABLE;
        }
        Iterator<HistoryEntry> newestFirst = history.descendingIterator();
        double latest = newestFirst.next().getValue();
        double previous = newestFirst.next().getValue();
        return Trend.between(previous, latest, trendEpsilon);
    }

    private SyncStateSnapshot buildSnapshot() {
        return new SyncStateSnapshot(value, phase, attributes, timestamp, version,
                new ArrayList<>(history), new ArrayList<>(achieved), computeTrend(), context);
    }
}
