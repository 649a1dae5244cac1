package io.ringcluster.cluster.connection;

import io.ringcluster.core.model.NodeId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Connection records keyed by transport-assigned id, plus the established index: at most one
 * connection per peer, and only connections that completed the handshake.
 */
public final class ConnectionTable {

    private final Map<Long, Connection> connections = new LinkedHashMap<>();
    private final Map<NodeId, Long> established = new HashMap<>();

    public void add(final Connection conn) {
        final Connection prev = connections.putIfAbsent(conn.getId(), conn);
        if (prev != null) {
            throw new IllegalStateException("Duplicate connection id " + conn.getId());
        }
    }

    public Optional<Connection> get(final long id) {
        return Optional.ofNullable(connections.get(id));
    }

    public boolean contains(final long id) {
        return connections.containsKey(id);
    }

    /**
     * Records {@code id} as the authoritative link to {@code peer}. The caller has already resolved any
     * duplicate through {@link DuplicateLinkResolver}.
     */
    public void establish(final long id, final NodeId peer) {
        final Connection conn = connections.get(id);
        if (conn == null) {
            throw new IllegalArgumentException("Unknown connection " + id);
        }
        final Long prev = established.get(peer);
        if (prev != null && prev != id) {
            throw new IllegalStateException("Peer " + peer + " already established on connection " + prev);
        }
        conn.establish(peer);
        established.put(peer, id);
    }

    /**
     * Removes the record and, if it was the authoritative link for its peer, the index entry.
     */
    public Optional<Connection> remove(final long id) {
        final Connection conn = connections.remove(id);
        if (conn == null) return Optional.empty();

        final NodeId peer = conn.getPeer();
        if (peer != null) {
            established.remove(peer, id);
        }
        conn.markClosed();
        return Optional.of(conn);
    }

    /** Removes every record. */
    public List<Connection> clear() {
        final List<Connection> all = new ArrayList<>(connections.values());
        connections.clear();
        established.clear();
        all.forEach(Connection::markClosed);
        return all;
    }

    public Optional<Long> establishedId(final NodeId peer) {
        return Optional.ofNullable(established.get(peer));
    }

    public Set<NodeId> establishedPeers() {
        return Collections.unmodifiableSet(new HashSet<>(established.keySet()));
    }

    /** Identities of every pending-outgoing or established connection. */
    public Set<NodeId> knownPeers() {
        final Set<NodeId> out = new HashSet<>();
        for (final Connection c : connections.values()) {
            if (c.getPeer() != null) out.add(c.getPeer());
        }
        return out;
    }

    /** Ids of connections whose peer is in {@code peers}. */
    public List<Long> idsFor(final Collection<NodeId> peers) {
        final List<Long> out = new ArrayList<>();
        for (final Connection c : connections.values()) {
            if (c.getPeer() != null && peers.contains(c.getPeer())) out.add(c.getId());
        }
        return out;
    }

    public Collection<Connection> all() {
        return Collections.unmodifiableCollection(connections.values());
    }

    public int size() {
        return connections.size();
    }
}
