package io.ringcluster.transport.codec;

import io.ringcluster.cluster.membership.crdt.Delta;
import io.ringcluster.core.model.Envelope;
import io.ringcluster.core.model.NodeId;

/**
 * The four frames nodes exchange with each other.
 */
public interface PeerMsg {

    /** Sender identity plus its full membership state; doubles as the handshake. */
    record Members(NodeId from, Delta<NodeId> state) implements PeerMsg {
    }

    /** Liveness heartbeat. */
    record Ping() implements PeerMsg {
    }

    /** Actor envelope relayed between nodes. */
    record EnvelopeMsg(Envelope envelope) implements PeerMsg {
    }

    /** Incremental membership change, gossiped after any mutation that changed state. */
    record DeltaMsg(Delta<NodeId> delta) implements PeerMsg {
    }
}
