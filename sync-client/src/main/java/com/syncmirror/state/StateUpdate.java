package com.syncmirror.state;

import java.util.List;

/**
 * Outcome of applying one inbound sync.
 */
public final class StateUpdate {

    private final SyncStateSnapshot previous;
    private final SyncStateSnapshot current;
    private final List<Milestone> newMilestones;

    StateUpdate(SyncStateSnapshot previous, SyncStateSnapshot current, List<Milestone> newMilestones) {
        this.previous = previous;
        this.current = current;
        this.newMilestones = List.copyOf(newMilestones);
    }

    public SyncStateSnapshot getPrevious() {
        return previous;
    }

    public SyncStateSnapshot getCurrent() {
        return current;
    }

    /**
     * Milestones achieved for the first time by this update, ascending.
     */
    public List<Milestone> getNewMilestones() {
        return newMilestones;
    }
}
