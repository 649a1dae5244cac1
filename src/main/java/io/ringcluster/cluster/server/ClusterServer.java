package io.ringcluster.cluster.server;

import com.google.protobuf.InvalidProtocolBufferException;
import io.ringcluster.cluster.connection.Connection;
import io.ringcluster.cluster.connection.ConnectionTable;
import io.ringcluster.cluster.connection.DuplicateLinkResolver;
import io.ringcluster.cluster.executor.ExecutorMailbox;
import io.ringcluster.cluster.executor.ExecutorMsg;
import io.ringcluster.cluster.membership.crdt.Delta;
import io.ringcluster.cluster.membership.member.Members;
import io.ringcluster.cluster.reconcile.Reconciler;
import io.ringcluster.cluster.timer.TimingWheel;
import io.ringcluster.config.impl.ClusterConfig;
import io.ringcluster.core.error.ClusterException;
import io.ringcluster.core.model.ClusterStatus;
import io.ringcluster.core.model.CorrelationId;
import io.ringcluster.core.model.Envelope;
import io.ringcluster.core.model.Msg;
import io.ringcluster.core.model.NodeId;
import io.ringcluster.core.model.Pid;
import io.ringcluster.transport.codec.PeerCodec;
import io.ringcluster.transport.codec.PeerMsg;
import io.ringcluster.transport.type.Notification;
import io.ringcluster.transport.type.PeerTransport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;

/**
 * Owns cluster membership and every peer connection of one node.
 * <p>
 * All state is confined to the thread running {@link #run()} (or calling {@link #handle(ClusterMsg)}
 * directly): CRDT merges, connection table edits and timing wheel operations never run
 * concurrently. Socket I/O is delegated to a non-blocking {@link PeerTransport} whose events come
 * back through the same inbox as {@link ClusterMsg.PollNotifications}.
 */
@Slf4j
public final class ClusterServer implements Runnable {

    public static final String NAME = "cluster_server";
    public static final String GROUP = "ringcluster";

    @Getter
    private final Pid pid;
    @Getter
    private final NodeId node;

    private final BlockingQueue<ClusterMsg> inbox;
    private final ExecutorMailbox executor;
    private final PeerTransport transport;
    private final PeerCodec codec = new PeerCodec();
    private final TimingWheel<Long> timerWheel;
    private final Members members;
    private final ConnectionTable connections = new ConnectionTable();
    private final ClusterMetrics metrics = new ClusterMetrics();

    public ClusterServer(final ClusterConfig cfg,
                         final BlockingQueue<ClusterMsg> inbox,
                         final ExecutorMailbox executor,
                         final PeerTransport transport) {
        this.node = cfg.getNode();
        this.pid = pidFor(node);
        this.inbox = inbox;
        this.executor = executor;
        this.transport = transport;
        this.timerWheel = new TimingWheel<>(cfg.timerWheelSize());
        this.members = new Members(node);
    }

    public static Pid pidFor(final NodeId node) {
        return new Pid(NAME, GROUP, node);
    }

    @Override
    public void run() {
        log.info("Starting cluster server {}", node);
        try {
            while (handle(inbox.take())) {
                // keep draining
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Cluster server {} interrupted", node);
        }
        log.info("Cluster server {} stopped", node);
    }

    /**
     * Processes one control message to completion.
     *
     * @return false once the loop must stop: on shutdown, or when the executor is gone
     */
    public boolean handle(final ClusterMsg msg) {
        try {
            dispatch(msg);
            return true;
        } catch (final ClusterException e) {
            if (e.isShutdown()) {
                log.info(e.getMessage());
                return false;
            }
            metrics.errors++;
            for (final long id : e.connectionIds()) {
                close(id);
            }
            if (e.isFatal()) {
                log.error(e.getMessage(), e);
                return false;
            }
            log.warn(e.getMessage(), e);
            return true;
        }
    }

    /* ---------- read-only views, for status replies and tests ---------- */

    public Set<NodeId> members() {
        return members.all();
    }

    public Set<NodeId> establishedPeers() {
        return connections.establishedPeers();
    }

    public Optional<Connection> connection(final long id) {
        return connections.get(id);
    }

    public int connectionCount() {
        return connections.size();
    }

    public ClusterStatus status() {
        return new ClusterStatus(members.all(), connections.establishedPeers(), connections.size());
    }

    /* ---------- control messages ---------- */

    private void dispatch(final ClusterMsg msg) throws ClusterException {
        if (msg instanceof ClusterMsg.PollNotifications p) {
            metrics.pollNotifications++;
            handlePollNotifications(p.notifications());
        } else if (msg instanceof ClusterMsg.Join j) {
            metrics.joins++;
            join(j.node());
        } else if (msg instanceof ClusterMsg.Leave l) {
            metrics.leaves++;
            leave(l.node());
        } else if (msg instanceof ClusterMsg.EnvelopeMsg e) {
            metrics.receivedLocalEnvelopes++;
            if (e.envelope().to().equals(pid)) {
                handleLocal(e.envelope());
            } else {
                sendRemote(e.envelope());
            }
        } else if (msg instanceof ClusterMsg.GetStatus g) {
            metrics.statusRequests++;
            getStatus(g.correlationId());
        } else if (msg instanceof ClusterMsg.Shutdown) {
            throw ClusterException.shutdown(pid);
        } else {
            log.error("Unknown cluster message {}", msg);
        }
    }

    private void join(final NodeId peer) throws ClusterException {
        final Delta<NodeId> delta = members.add(peer);
        final List<ClusterException> errors = new ArrayList<>();
        try {
            broadcastDelta(delta, null);
        } catch (final ClusterException e) {
            errors.add(e);
        }

        if (!peer.equals(node) && !connections.knownPeers().contains(peer)) {
            metrics.connectionAttempts++;
            try {
                connect(peer);
            } catch (final ClusterException e) {
                errors.add(e);
            }
        }

        if (errors.size() == 1) throw errors.get(0);
        if (!errors.isEmpty()) {
            throw ClusterException.aggregate(ClusterException.Kind.BROADCAST, errors);
        }
    }

    private void leave(final NodeId peer) throws ClusterException {
        final Optional<Delta<NodeId>> delta = members.leave(peer);
        if (delta.isPresent()) {
            broadcastDelta(delta.get(), null);
        } else {
            log.debug("Leave for {} ignored: not a member", peer);
        }
    }

    private void getStatus(final CorrelationId correlationId) throws ClusterException {
        if (correlationId == null || correlationId.pid() == null) {
            log.warn("Status request without a reply pid: {}", correlationId);
            return;
        }
        final Envelope reply = new Envelope(correlationId.pid(), pid, correlationId, new Msg.Status(status()));
        /* the executor knows how to reach every pid */
        executor.send(new ExecutorMsg.EnvelopeMsg(reply));
    }

    private void handleLocal(final Envelope envelope) throws ClusterException {
        if (envelope.body() instanceof Msg.GetMetrics) {
            final Envelope reply = new Envelope(envelope.from(), pid, envelope.correlationId(),
                    new Msg.Metrics(metrics.data()));
            executor.send(new ExecutorMsg.EnvelopeMsg(reply));
        } else {
            log.error("Received unknown message for {}: {}", pid, envelope);
        }
    }

    private void sendRemote(final Envelope envelope) throws ClusterException {
        final NodeId target = envelope.to().node();
        final Optional<Long> id = connections.establishedId(target);
        if (id.isEmpty()) {
            log.debug("No established connection to {}, dropping envelope for {}", target, envelope.to());
            return;
        }
        log.trace("send remote to {}", envelope.to());
        write(id.get(), encode(id.get(), target, new PeerMsg.EnvelopeMsg(envelope)));
    }

    /* ---------- readiness notifications ---------- */

    private void handlePollNotifications(final List<Notification> notifications) throws ClusterException {
        log.trace("handle_poll_notifications: {}", notifications.size());
        final List<ClusterException> errors = new ArrayList<>();
        final Set<Long> failed = new HashSet<>();

        for (final Notification n : notifications) {
            final Long id = connectionIdOf(n);
            if (id != null && failed.contains(id)) continue;
            try {
                handleNotification(n);
            } catch (final ClusterException e) {
                if (e.isFatal()) {
                    errors.add(e);
                    break;
                }
                failed.addAll(e.connectionIds());
                errors.add(e);
            }
        }

        if (!errors.isEmpty()) {
            throw ClusterException.aggregate(ClusterException.Kind.POLL_NOTIFICATIONS, errors);
        }
    }

    private void handleNotification(final Notification n) throws ClusterException {
        if (n instanceof Notification.Accepted a) {
            acceptConnection(a.id());
        } else if (n instanceof Notification.Connected c) {
            connectionEstablishedAtTransport(c.id());
        } else if (n instanceof Notification.Frame f) {
            read(f.id(), f.bytes());
        } else if (n instanceof Notification.Closed c) {
            connectionClosedByTransport(c.id(), c.cause());
        } else if (n instanceof Notification.Tick) {
            tick();
        } else if (n instanceof Notification.ExecutorTick) {
            tickExecutor();
        }
    }

    private static Long connectionIdOf(final Notification n) {
        if (n instanceof Notification.Accepted a) return a.id();
        if (n instanceof Notification.Connected c) return c.id();
        if (n instanceof Notification.Frame f) return f.id();
        if (n instanceof Notification.Closed c) return c.id();
        return null;
    }

    private void acceptConnection(final long id) throws ClusterException {
        metrics.acceptedConnections++;
        log.debug("accepted connection {}", id);
        initConnection(Connection.accepted(id));
        sendMembers(id);
    }

    private void connectionEstablishedAtTransport(final long id) throws ClusterException {
        final Optional<Connection> conn = connections.get(id);
        if (conn.isEmpty()) {
            /* closed while the connect was in flight */
            transport.deregister(id);
            return;
        }
        log.debug("connected {} to {}", id, conn.get().getPeer());
        sendMembers(id);
    }

    private void connectionClosedByTransport(final long id, final Throwable cause) {
        if (!connections.contains(id)) return;
        if (cause == null) {
            log.debug("Connection {} closed by peer", id);
        } else {
            log.warn("Connection {} failed: {}", id, cause.toString());
        }
        close(id);
    }

    private void read(final long id, final byte[] frame) throws ClusterException {
        final Optional<Connection> conn = connections.get(id);
        if (conn.isEmpty()) return;

        final PeerMsg msg;
        try {
            msg = codec.decode(frame);
        } catch (final InvalidProtocolBufferException e) {
            throw ClusterException.decode(id, conn.get().getPeer(), e);
        }
        /* any well-formed frame proves the peer is alive */
        resetTimer(id);
        handleDecodedMessage(id, msg);
    }

    private void handleDecodedMessage(final long id, final PeerMsg msg) throws ClusterException {
        if (msg instanceof PeerMsg.Members m) {
            log.info("Got Members from {} on connection {}", m.from(), id);
            establishConnection(id, m.from(), m.state());
            checkConnections();
        } else if (msg instanceof PeerMsg.Ping) {
            log.trace("Got Ping on connection {}", id);
        } else if (msg instanceof PeerMsg.EnvelopeMsg e) {
            metrics.receivedRemoteEnvelopes++;
            log.debug("Got envelope from {} to {}", e.envelope().from(), e.envelope().to());
            executor.send(new ExecutorMsg.EnvelopeMsg(e.envelope()));
        } else if (msg instanceof PeerMsg.DeltaMsg d) {
            log.debug("Got delta on connection {}: {}", id, d.delta());
            if (members.join(d.delta())) {
                broadcastDelta(d.delta(), id);
            }
        }
    }

    /* ---------- handshake ---------- */

    /**
     * Transitions a connection to established once the peer has identified itself. If another link
     * to the same peer is already established, exactly one of the two is closed.
     */
    private void establishConnection(final long id, final NodeId from, final Delta<NodeId> state) throws ClusterException {
        final boolean changed = members.join(state);

        if (from.equals(node)) {
            log.warn("Connection {} identified as ourselves ({}), closing", id, from);
            close(id);
            gossipMerged(changed, state, id);
            return;
        }

        final Optional<Long> closeId = DuplicateLinkResolver.connectionToClose(connections, node, id, from);
        if (closeId.isPresent()) {
            log.debug("Two connections between nodes. Closing the connection where the peer that sorts lower "
                    + "was the connecting client. peer={} id={}", from, closeId.get());
            close(closeId.get());
            if (closeId.get() == id) {
                gossipMerged(changed, state, id);
                return;
            }
        }

        final Optional<Connection> conn = connections.get(id);
        if (conn.isPresent()) {
            log.info("Establish connection {} to {}", id, from);
            connections.establish(id, from);
            resetTimer(id);
        }
        gossipMerged(changed, state, id);
    }

    private void gossipMerged(final boolean changed, final Delta<NodeId> state, final long from) throws ClusterException {
        if (changed) {
            broadcastDelta(state, from);
        }
    }

    /* ---------- connection lifecycle ---------- */

    private void connect(final NodeId peer) throws ClusterException {
        log.debug("connect to {}", peer);
        final long id = transport.connect(peer);
        initConnection(Connection.dialled(id, peer));
    }

    private void initConnection(final Connection conn) {
        log.debug("init_connection id={} initiator={} peer={}", conn.getId(), conn.isInitiator(), conn.getPeer());
        conn.setTimerSlot(timerWheel.insert(conn.getId()));
        connections.add(conn);
    }

    private void sendMembers(final long id) throws ClusterException {
        final Optional<Connection> conn = connections.get(id);
        if (conn.isEmpty()) return;

        log.info("Send members on connection {}", id);
        write(id, encode(id, conn.get().getPeer(), new PeerMsg.Members(node, members.snapshot())));
        conn.get().setMembersSent(true);
    }

    private void resetTimer(final long id) {
        connections.get(id).ifPresent(c -> c.setTimerSlot(timerWheel.reset(id, c.getTimerSlot())));
    }

    /**
     * Closes an existing connection and removes all related state. Unknown ids are ignored.
     */
    private void close(final long id) {
        final Optional<Connection> removed = connections.remove(id);
        if (removed.isEmpty()) return;

        final Connection conn = removed.get();
        timerWheel.remove(id, conn.getTimerSlot());
        transport.deregister(id);
        if (conn.isEstablished()) {
            log.info("Closing established connection {} to {}", id, conn.getPeer());
        } else {
            log.info("Closing unestablished connection {}", id);
        }
    }

    private void write(final long id, final byte[] frame) throws ClusterException {
        log.trace("write {} bytes to {}", frame.length, id);
        transport.write(id, frame);
    }

    private byte[] encode(final Long id, final NodeId peer, final PeerMsg msg) throws ClusterException {
        try {
            return codec.encode(msg);
        } catch (final RuntimeException e) {
            throw ClusterException.encode(id, peer, e);
        }
    }

    /* ---------- ticks ---------- */

    private void tick() throws ClusterException {
        log.trace("tick");
        for (final long id : timerWheel.expire()) {
            log.warn("Connection timeout {}", id);
            close(id);
        }

        ClusterException pingError = null;
        try {
            broadcast(encode(null, null, new PeerMsg.Ping()), null);
        } catch (final ClusterException e) {
            pingError = e;
        }
        checkConnections();
        if (pingError != null) throw pingError;
    }

    private void tickExecutor() throws ClusterException {
        log.trace("tick_executor");
        executor.send(new ExecutorMsg.Tick());
    }

    private void broadcastDelta(final Delta<NodeId> delta, final Long exclude) throws ClusterException {
        log.debug("Broadcasting delta {}", delta);
        broadcast(encode(null, null, new PeerMsg.DeltaMsg(delta)), exclude);
    }

    /**
     * Writes to every connection that has been sent our snapshot. Failures are collected so one bad
     * connection does not stop the others.
     */
    private void broadcast(final byte[] frame, final Long exclude) throws ClusterException {
        final List<ClusterException> errors = new ArrayList<>();
        for (final Connection conn : List.copyOf(connections.all())) {
            if (!conn.isMembersSent()) continue;
            if (exclude != null && conn.getId() == exclude) continue;
            try {
                write(conn.getId(), frame);
            } catch (final ClusterException e) {
                errors.add(e);
            }
        }
        if (!errors.isEmpty()) {
            throw ClusterException.aggregate(ClusterException.Kind.BROADCAST, errors);
        }
    }

    /* ---------- reconciliation ---------- */

    /**
     * Converges the connection set toward the membership set.
     */
    private void checkConnections() {
        final Reconciler.Plan plan = Reconciler.plan(node, members.all(), connections.knownPeers());

        if (plan.evicted()) {
            if (connections.size() > 0) {
                log.warn("{} is no longer a cluster member, closing all {} connections", node, connections.size());
            }
            disconnectAll();
            return;
        }
        if (plan.isNoop()) return;

        log.trace("check_connections to_connect={} to_disconnect={}", plan.toConnect(), plan.toDisconnect());

        for (final NodeId peer : plan.toConnect()) {
            metrics.connectionAttempts++;
            try {
                connect(peer);
            } catch (final ClusterException e) {
                log.warn(e.getMessage(), e.getCause());
            }
        }

        for (final long id : connections.idsFor(plan.toDisconnect())) {
            close(id);
        }
    }

    private void disconnectAll() {
        for (final Connection conn : connections.clear()) {
            timerWheel.remove(conn.getId(), conn.getTimerSlot());
            transport.deregister(conn.getId());
        }
    }
}
