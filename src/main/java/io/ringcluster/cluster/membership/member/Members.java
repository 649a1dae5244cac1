package io.ringcluster.cluster.membership.member;

import io.ringcluster.cluster.membership.crdt.Delta;
import io.ringcluster.cluster.membership.crdt.OrSet;
import io.ringcluster.core.model.NodeId;

import java.util.Optional;
import java.util.Set;

/**
 * Replicated cluster membership: an {@link OrSet} of {@link NodeId}s whose dots are minted under the
 * local node's id. The local node adds itself on construction.
 */
public final class Members {

    private final OrSet<NodeId> orset;

    public Members(final NodeId local) {
        this.orset = new OrSet<>(local.toString());
        this.orset.add(local);
    }

    public Delta<NodeId> add(final NodeId node) {
        return orset.add(node);
    }

    /** Tombstone delta for {@code node}, or empty if it is not a member. */
    public Optional<Delta<NodeId>> leave(final NodeId node) {
        return orset.remove(node);
    }

    /** Merges a peer's delta or snapshot; true if the local view changed. */
    public boolean join(final Delta<NodeId> deltaOrState) {
        return orset.join(deltaOrState);
    }

    public Set<NodeId> all() {
        return orset.elements();
    }

    public boolean contains(final NodeId node) {
        return orset.contains(node);
    }

    public Delta<NodeId> snapshot() {
        return orset.snapshot();
    }
}
