package com.syncmirror.state;

import java.util.Objects;

/**
 * A named threshold on the mirrored value. Achieved at most once per client.
 */
public final class Milestone {

    private final String name;
    private final double threshold;

    public Milestone(String name, double threshold) {
        this.name = Objects.requireNonNull(name, "name");
        this.threshold = threshold;
    }

    public String getName() {
        return name;
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Milestone)) {
            return false;
        }
        Milestone other = (Milestone) o;
        return name.equals(other.name) && Double.compare(threshold, other.threshold) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, threshold);
    }

    @Override
    public String toString() {
        return name + "(" + threshold + ")";
    }
}
