package io.ringcluster.cluster.reconcile;

import io.ringcluster.core.model.NodeId;

import java.util.Set;
import java.util.TreeSet;

/**
 * Diffs desired membership against the peers we hold connections to.
 */
public final class Reconciler {

    private Reconciler() {
    }

    /**
     * @param evicted      the local node is no longer a member; every connection must go
     * @param toConnect    members with no connection record yet
     * @param toDisconnect peers we are connected to that are no longer members
     */
    public record Plan(boolean evicted, Set<NodeId> toConnect, Set<NodeId> toDisconnect) {

        public Plan {
            toConnect = Set.copyOf(toConnect);
            toDisconnect = Set.copyOf(toDisconnect);
        }

        public static Plan eviction() {
            return new Plan(true, Set.of(), Set.of());
        }

        public boolean isNoop() {
            return !evicted && toConnect.isEmpty() && toDisconnect.isEmpty();
        }
    }

    public static Plan plan(final NodeId local, final Set<NodeId> desired, final Set<NodeId> connected) {
        if (!desired.contains(local)) {
            return Plan.eviction();
        }

        final Set<NodeId> toConnect = new TreeSet<>(desired);
        toConnect.removeAll(connected);
        toConnect.remove(local);

        final Set<NodeId> toDisconnect = new TreeSet<>(connected);
        toDisconnect.removeAll(desired);

        return new Plan(false, toConnect, toDisconnect);
    }
}
