package io.ringcluster.cluster.membership.crdt;

import java.util.Objects;

/**
 * Unique tag for one add: the replica that minted it and that replica's counter at the time.
 */
public record Dot(String origin, long counter) {

    public Dot {
        Objects.requireNonNull(origin, "origin");
        if (counter <= 0) {
            throw new IllegalArgumentException("counter must be > 0");
        }
    }

    @Override
    public String toString() {
        return origin + ":" + counter;
    }
}
