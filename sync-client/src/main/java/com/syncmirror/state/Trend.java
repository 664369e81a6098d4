package com.syncmirror.state;

/**
 * Direction of the last change in the mirrored value.
 */
public enum Trend {
    ASCENDING,
    DESCENDING,
    STABLE;

    /**
     * Compares two consecutive samples, treating differences within {@code epsilon} as noise.
     */
    public static Trend between(double previous, double latest, double epsilon) {
        double diff = latest - previous;
        if (diff > epsilon) {
            return ASCENDING;
        }
        if (diff < -epsilon) {
            return DESCENDING;
        }
        return STABLE;
    }
}
