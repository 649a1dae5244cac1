package integration;

import io.ringcluster.cluster.executor.ExecutorMsg;
import io.ringcluster.cluster.executor.QueueExecutorMailbox;
import io.ringcluster.config.impl.ClusterConfig;
import io.ringcluster.core.model.ClusterStatus;
import io.ringcluster.core.model.CorrelationId;
import io.ringcluster.core.model.Envelope;
import io.ringcluster.core.model.Msg;
import io.ringcluster.core.model.NodeId;
import io.ringcluster.core.model.Pid;
import io.ringcluster.node.ClusterNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two real nodes on loopback with short timings.
 */
final class ClusterIntegrationTest {

    private static final long TIMEOUT_MILLIS = 15_000;

    private NodeId id1;
    private NodeId id2;
    private QueueExecutorMailbox executor1;
    private QueueExecutorMailbox executor2;
    private ClusterNode node1;
    private ClusterNode node2;

    @BeforeEach
    void startNodes() throws Exception {
        id1 = new NodeId("node1", "127.0.0.1:" + freePort());
        id2 = new NodeId("node2", "127.0.0.1:" + freePort());
        executor1 = new QueueExecutorMailbox(new LinkedBlockingQueue<>());
        executor2 = new QueueExecutorMailbox(new LinkedBlockingQueue<>());

        node1 = ClusterNode.start(ClusterConfig.defaults(id1).withTimings(50, 20, 1_000), executor1);
        node2 = ClusterNode.start(ClusterConfig.defaults(id2).withTimings(50, 20, 1_000), executor2);
    }

    @AfterEach
    void stopNodes() {
        if (node1 != null) node1.close();
        if (node2 != null) node2.close();
        executor1.close();
        executor2.close();
    }

    @Test
    void joinFormsClusterAndEnvelopesCrossIt() throws Exception {
        node1.join(id2);

        awaitStatus(node2, executor2, s -> s.members().equals(Set.of(id1, id2)) && s.established().equals(Set.of(id1)));
        awaitStatus(node1, executor1, s -> s.members().equals(Set.of(id1, id2)) && s.established().equals(Set.of(id2)));

        final Pid worker = Pid.of("worker", id2);
        final Pid client = Pid.of("client", id1);
        final Envelope env = new Envelope(worker, client, CorrelationId.request(client, 3L, 11L),
                new Msg.User("ping over the wire".getBytes(StandardCharsets.UTF_8)));
        node1.send(env);

        assertEquals(env, awaitEnvelope(executor2, e -> e.to().equals(worker)));
    }

    @Test
    void metricsRequestIsAnsweredByTheLocalClusterServer() throws Exception {
        node1.join(id2);
        awaitStatus(node1, executor1, s -> s.established().equals(Set.of(id2)));

        final Pid client = Pid.of("client", id1);
        node1.send(new Envelope(node1.clusterServerPid(), client, CorrelationId.pid(client), new Msg.GetMetrics()));

        final Envelope reply = awaitEnvelope(executor1, e -> e.body() instanceof Msg.Metrics);
        assertEquals(client, reply.to());
        assertEquals(node1.clusterServerPid(), reply.from());
        final Msg.Metrics metrics = (Msg.Metrics) reply.body();
        assertTrue(metrics.values().get("connection_attempts") >= 1L);
        assertEquals(1L, metrics.values().get("joins"));
    }

    @Test
    void envelopeForRemoteClusterServerIsHandedToThatNodesExecutor() throws Exception {
        node1.join(id2);
        awaitStatus(node1, executor1, s -> s.established().equals(Set.of(id2)));

        final Pid client = Pid.of("client", id1);
        final Envelope request = new Envelope(node2.clusterServerPid(), client, CorrelationId.pid(client),
                new Msg.GetMetrics());
        node1.send(request);

        assertEquals(request, awaitEnvelope(executor2, e -> e.to().equals(node2.clusterServerPid())));
    }

    @Test
    void nodeThatLeavesIsDroppedByThePeer() throws Exception {
        node1.join(id2);
        awaitStatus(node1, executor1, s -> s.established().equals(Set.of(id2)));

        node2.leave(id2);

        awaitStatus(node1, executor1, s -> s.members().equals(Set.of(id1)) && s.established().isEmpty());
        awaitStatus(node2, executor2, s -> s.numConnections() == 0);
    }

    @Test
    void shutdownStopsTheServerLoop() throws Exception {
        assertTrue(node1.isRunning());
        node1.shutdown();
        assertFalse(node1.isRunning());
    }

    private static ClusterStatus awaitStatus(final ClusterNode node,
                                             final QueueExecutorMailbox executor,
                                             final Predicate<ClusterStatus> done) throws InterruptedException {
        final Pid probe = Pid.of("status-probe", node.getId());
        final long deadline = System.currentTimeMillis() + TIMEOUT_MILLIS;
        ClusterStatus last = null;

        while (System.currentTimeMillis() < deadline) {
            node.clusterStatus(CorrelationId.pid(probe));
            final Envelope reply = pollEnvelope(executor, e -> e.to().equals(probe), 200);
            if (reply != null) {
                last = ((Msg.Status) reply.body()).status();
                if (done.test(last)) return last;
            }
            Thread.sleep(50);
        }
        return fail("status of " + node.getId() + " never converged, last seen " + last);
    }

    private static Envelope awaitEnvelope(final QueueExecutorMailbox executor,
                                          final Predicate<Envelope> match) throws InterruptedException {
        final Envelope env = pollEnvelope(executor, match, TIMEOUT_MILLIS);
        assertNotNull(env, "no matching envelope delivered");
        return env;
    }

    /** Skips executor ticks and unrelated envelopes. */
    private static Envelope pollEnvelope(final QueueExecutorMailbox executor,
                                         final Predicate<Envelope> match,
                                         final long waitMillis) throws InterruptedException {
        final long deadline = System.currentTimeMillis() + waitMillis;
        long remaining = waitMillis;
        while (remaining > 0) {
            final ExecutorMsg msg = executor.queue().poll(remaining, TimeUnit.MILLISECONDS);
            if (msg instanceof ExecutorMsg.EnvelopeMsg e && match.test(e.envelope())) {
                return e.envelope();
            }
            remaining = deadline - System.currentTimeMillis();
        }
        return null;
    }

    private static int freePort() throws IOException {
        try (ServerSocket s = new ServerSocket(0)) {
            s.setReuseAddress(true);
            return s.getLocalPort();
        }
    }
}
