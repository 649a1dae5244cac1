package io.ringcluster.core.model;

import java.util.Set;

/**
 * Point-in-time view of the cluster server: live membership, peers with an established link and the
 * total number of connection records (pending ones included).
 */
public record ClusterStatus(Set<NodeId> members, Set<NodeId> established, int numConnections) {

    public ClusterStatus {
        members = Set.copyOf(members);
        established = Set.copyOf(established);
    }
}
