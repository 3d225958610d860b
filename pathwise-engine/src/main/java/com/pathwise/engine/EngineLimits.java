package com.pathwise.engine;

import java.util.Objects;

/**
 * Hard caps for a traversal. All values must be positive.
 */
public final class EngineLimits {

    /** Default: 15 auto-routing hops per turn, 50 events kept per traversal. */
    public static final EngineLimits DEFAULT = new EngineLimits(15, 50);

    private final int maxRouteDepth;
    private final int eventLogCapacity;

    public EngineLimits(int maxRouteDepth, int eventLogCapacity) {
        this.maxRouteDepth = requirePositive(maxRouteDepth, "maxRouteDepth");
        this.eventLogCapacity = requirePositive(eventLogCapacity, "eventLogCapacity");
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    /** Max edges auto-routing follows in one turn; guards against cyclic decision graphs. */
    public int getMaxRouteDepth() {
        return maxRouteDepth;
    }

    /** Max events retained; the oldest is evicted first. */
    public int getEventLogCapacity() {
        return eventLogCapacity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EngineLimits that = (EngineLimits) o;
        return maxRouteDepth == that.maxRouteDepth && eventLogCapacity == that.eventLogCapacity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRouteDepth, eventLogCapacity);
    }
}
