package io.ringcluster.cluster.server;

import com.google.protobuf.InvalidProtocolBufferException;
import io.ringcluster.core.error.ClusterException;
import io.ringcluster.core.model.NodeId;
import io.ringcluster.transport.codec.PeerCodec;
import io.ringcluster.transport.codec.PeerMsg;
import io.ringcluster.transport.type.NotificationSink;
import io.ringcluster.transport.type.PeerTransport;

import java.net.ConnectException;
import java.nio.channels.ClosedChannelException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory {@link PeerTransport} that records what the server asks of it. Nothing is sent anywhere;
 * tests feed the other direction in as notifications.
 */
final class RecordingTransport implements PeerTransport {

    record Written(long id, byte[] frame) {
    }

    private final PeerCodec codec = new PeerCodec();
    private long nextId;

    final Map<Long, NodeId> dialled = new LinkedHashMap<>();
    final List<Written> written = new ArrayList<>();
    final Set<Long> deregistered = new LinkedHashSet<>();
    final Set<NodeId> unreachable = new HashSet<>();

    RecordingTransport(final long firstId) {
        this.nextId = firstId;
    }

    @Override
    public void start(final NotificationSink sink) {
    }

    @Override
    public long connect(final NodeId peer) throws ClusterException {
        if (unreachable.contains(peer)) {
            throw ClusterException.connect(peer, new ConnectException("Connection refused"));
        }
        final long id = nextId++;
        dialled.put(id, peer);
        return id;
    }

    /** Simulates the listener accepting a socket; the caller then hands {@code Accepted(id)} to the server. */
    long accept() {
        return nextId++;
    }

    long lastDialled() {
        long last = -1;
        for (final long id : dialled.keySet()) last = id;
        return last;
    }

    @Override
    public void write(final long id, final byte[] frame) throws ClusterException {
        if (deregistered.contains(id)) {
            throw ClusterException.write(id, null, new ClosedChannelException());
        }
        written.add(new Written(id, frame));
    }

    @Override
    public void deregister(final long id) {
        deregistered.add(id);
    }

    @Override
    public void close() {
    }

    List<Written> drain() {
        final List<Written> out = new ArrayList<>(written);
        written.clear();
        return out;
    }

    /** Frames written to {@code id} so far, decoded. */
    List<PeerMsg> sentTo(final long id) throws InvalidProtocolBufferException {
        final List<PeerMsg> out = new ArrayList<>();
        for (final Written w : written) {
            if (w.id() == id) out.add(codec.decode(w.frame()));
        }
        return out;
    }
}
