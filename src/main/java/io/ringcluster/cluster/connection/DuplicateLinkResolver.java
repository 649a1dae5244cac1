package io.ringcluster.cluster.connection;

import io.ringcluster.core.model.NodeId;

import java.util.Optional;

/**
 * Picks which of two links to the same peer survives.
 * <p>
 * The connection whose dialling side has the greater {@link NodeId} is kept. Both endpoints
 * evaluate this from the global node ordering alone, so a simultaneous double-connect collapses to
 * the same single link on both sides without any extra message.
 */
public final class DuplicateLinkResolver {

    private DuplicateLinkResolver() {
    }

    /**
     * @param local            this node
     * @param peer             the peer that just identified itself on a new connection
     * @param savedIsInitiator whether the already established link to {@code peer} was dialled by us
     * @return true if the saved link must be closed in favour of the new one
     */
    public static boolean savedLoses(final NodeId local, final NodeId peer, final boolean savedIsInitiator) {
        /* our dialled link has us as client; their dialled link has them as client */
        if (savedIsInitiator) {
            return local.compareTo(peer) < 0;
        }
        return peer.compareTo(local) < 0;
    }

    /**
     * Id of the connection to close when {@code newId} identifies as {@code peer}, or empty when there
     * is no competing established link.
     */
    public static Optional<Long> connectionToClose(final ConnectionTable table,
                                                   final NodeId local,
                                                   final long newId,
                                                   final NodeId peer) {
        final Optional<Long> savedId = table.establishedId(peer);
        if (savedId.isEmpty() || savedId.get() == newId) return Optional.empty();

        final Optional<Connection> saved = table.get(savedId.get());
        if (saved.isEmpty()) return Optional.empty();

        return Optional.of(savedLoses(local, peer, saved.get().isInitiator()) ? savedId.get() : newId);
    }
}
