package io.ringcluster.cluster.connection;

import io.ringcluster.core.model.NodeId;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Per-socket record owned by the cluster server from accept/connect until close.
 */
@Getter
@ToString
public final class Connection {

    private final long id;
    /** True when this node dialled the connection. */
    private final boolean initiator;

    /** Known up front for dialled connections, learned from the handshake for accepted ones. */
    private NodeId peer;
    private LinkState state = LinkState.UNESTABLISHED;
    /** Our membership snapshot went out; only such connections take part in broadcasts. */
    @Setter
    private boolean membersSent;
    @Setter
    private int timerSlot = -1;

    public Connection(final long id, final NodeId peer, final boolean initiator) {
        this.id = id;
        this.peer = peer;
        this.initiator = initiator;
    }

    public static Connection accepted(final long id) {
        return new Connection(id, null, false);
    }

    public static Connection dialled(final long id, final NodeId peer) {
        return new Connection(id, peer, true);
    }

    public boolean isEstablished() {
        return state == LinkState.ESTABLISHED;
    }

    void establish(final NodeId identifiedPeer) {
        this.peer = identifiedPeer;
        this.state = LinkState.ESTABLISHED;
    }

    void markClosed() {
        this.state = LinkState.CLOSED;
    }
}
