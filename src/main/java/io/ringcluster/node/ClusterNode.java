package io.ringcluster.node;

import io.ringcluster.cluster.executor.ExecutorMailbox;
import io.ringcluster.cluster.server.ClusterMsg;
import io.ringcluster.cluster.server.ClusterServer;
import io.ringcluster.config.impl.ClusterConfig;
import io.ringcluster.core.model.CorrelationId;
import io.ringcluster.core.model.Envelope;
import io.ringcluster.core.model.NodeId;
import io.ringcluster.core.model.Pid;
import io.ringcluster.transport.impl.NettyPeerTransport;
import io.ringcluster.transport.impl.TickScheduler;
import io.ringcluster.transport.type.Notification;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Host-side handle to a running cluster server: wires the Netty transport, the tick timers and the
 * executor mailbox to one {@link ClusterServer} loop running on its own thread.
 * <p>
 * Every operation only enqueues a control message; none of them wait for the network.
 */
@Slf4j
public final class ClusterNode implements AutoCloseable {

    private static final long SHUTDOWN_WAIT_MILLIS = 5_000;

    @Getter
    private final NodeId id;
    private final BlockingQueue<ClusterMsg> inbox = new LinkedBlockingQueue<>();
    private final NettyPeerTransport transport;
    private final TickScheduler ticks;
    private final ClusterServer server;
    private final Thread loop;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private ClusterNode(final ClusterConfig cfg, final ExecutorMailbox executor) {
        this.id = cfg.getNode();
        this.transport = new NettyPeerTransport(new InetSocketAddress(id.host(), id.port()), cfg.getMaxFrameBytes());
        this.ticks = new TickScheduler(cfg.getTickMillis(), cfg.getExecutorTickMillis());
        this.server = new ClusterServer(cfg, inbox, executor, transport);
        this.loop = new Thread(this::runServer, "cluster-server-" + id.name());
    }

    /**
     * Binds the cluster listener and starts the server loop and its timers.
     */
    public static ClusterNode start(final ClusterConfig cfg, final ExecutorMailbox executor) throws InterruptedException {
        final ClusterNode node = new ClusterNode(cfg, executor);
        node.transport.start(node::deliver);
        node.ticks.start(node::deliver);
        node.loop.start();
        log.info("Cluster node {} started", node.id);
        return node;
    }

    private void runServer() {
        try {
            server.run();
        } finally {
            /* loop died on its own (executor gone): nothing would drain the inbox any more */
            if (stopped.compareAndSet(false, true)) {
                log.warn("Cluster server {} stopped unexpectedly, releasing timers and transport", id);
                releaseResources();
            }
        }
    }

    private void deliver(final List<Notification> batch) {
        if (stopped.get()) return;
        inbox.offer(new ClusterMsg.PollNotifications(batch));
    }

    /** Control messages waiting for the server loop. */
    int pendingControlMessages() {
        return inbox.size();
    }

    public Pid clusterServerPid() {
        return server.getPid();
    }

    public void join(final NodeId node) {
        inbox.offer(new ClusterMsg.Join(node));
    }

    public void leave(final NodeId node) {
        inbox.offer(new ClusterMsg.Leave(node));
    }

    public void send(final Envelope envelope) {
        inbox.offer(new ClusterMsg.EnvelopeMsg(envelope));
    }

    /**
     * Requests a status reply, delivered to {@code correlationId.pid()} through the executor.
     */
    public void clusterStatus(final CorrelationId correlationId) {
        inbox.offer(new ClusterMsg.GetStatus(correlationId));
    }

    public boolean isRunning() {
        return loop.isAlive();
    }

    /**
     * Stops the server loop, then the timers and the transport.
     */
    public void shutdown() throws InterruptedException {
        if (!stopped.compareAndSet(false, true)) return;

        inbox.offer(new ClusterMsg.Shutdown());
        loop.join(SHUTDOWN_WAIT_MILLIS);
        if (loop.isAlive()) {
            log.warn("Cluster server {} did not stop within {} ms", id, SHUTDOWN_WAIT_MILLIS);
            loop.interrupt();
        }
        releaseResources();
        log.info("Cluster node {} shut down", id);
    }

    private void releaseResources() {
        ticks.close();
        transport.close();
        inbox.clear();
    }

    @Override
    public void close() {
        try {
            shutdown();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down {}", id);
        }
    }
}
