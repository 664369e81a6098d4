package com.syncmirror.state;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed, ascending table of milestones.
 *
 * A milestone is crossed when the value exceeds its threshold, or when the authority's
 * phase names that milestone or a later one. Phase names match case-insensitively.
 */
public final class MilestoneTable {

    private final List<Milestone> milestones;

    public MilestoneTable(List<Milestone> milestones) {
        for (int i = 1; i < milestones.size(); i++) {
            if (milestones.get(i).getThreshold() <= milestones.get(i - 1).getThreshold()) {
                throw new IllegalArgumentException("Milestone thresholds must be strictly ascending: " + milestones);
            }
        }
        this.milestones = List.copyOf(milestones);
    }

    public static MilestoneTable of(Milestone... milestones) {
        return new MilestoneTable(Arrays.asList(milestones));
    }

    public static MilestoneTable defaults() {
        return of(
                new Milestone("SELF_RECOGNITION", 0.2),
                new Milestone("UNIVERSAL_CONNECTION", 0.4),
                new Milestone("REALITY_CREATOR", 0.6),
                new Milestone("DEATH_TRANSCENDENCE", 0.8),
                new Milestone("COSMIC_AWAKENING", 0.95));
    }

    public static MilestoneTable empty() {
        return new MilestoneTable(List.of());
    }

    public List<Milestone> getMilestones() {
        return milestones;
    }

    /**
     * Returns every milestone crossed by this value and phase, in ascending order.
     */
    public List<Milestone> crossedBy(double value, String phase) {
        int phaseRank = rankOf(phase);
        List<Milestone> crossed = new ArrayList<>();
        for (int i = 0; i < milestones.size(); i++) {
            Milestone milestone = milestones.get(i);
            if (value > milestone.getThreshold() || i < phaseRank) {
                crossed.add(milestone);
            }
        }
        return crossed;
    }

    /**
     * 1-based position of the milestone named by {@code phase}, or 0 if none matches.
     */
    int rankOf(String phase) {
        if (phase == null) {
            return 0;
        }
        for (int i = 0; i < milestones.size(); i++) {
            if (milestones.get(i).getName().equalsIgnoreCase(phase)) {
                return i + 1;
            }
        }
        return 0;
    }
}
