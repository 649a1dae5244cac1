package io.ringcluster.node;

import io.ringcluster.cluster.executor.QueueExecutorMailbox;
import io.ringcluster.config.impl.ClusterConfig;
import io.ringcluster.core.model.NodeId;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.LinkedBlockingQueue;

import static org.junit.jupiter.api.Assertions.*;

final class ClusterNodeTest {

    @Test
    void deadExecutorReleasesTimersAndListener() throws Exception {
        final int port = freePort();
        final QueueExecutorMailbox executor = new QueueExecutorMailbox(new LinkedBlockingQueue<>());
        executor.close();

        final ClusterNode node = ClusterNode.start(
                ClusterConfig.defaults(new NodeId("lonely", "127.0.0.1:" + port)).withTimings(20, 5, 100),
                executor);

        /* first executor tick hits the closed mailbox and ends the loop */
        final long deadline = System.currentTimeMillis() + 5_000;
        while (node.isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(node.isRunning());

        /* several tick periods later nothing has piled up behind the dead loop */
        Thread.sleep(200);
        assertEquals(0, node.pendingControlMessages());
        assertThrows(IOException.class, () -> new Socket("127.0.0.1", port).close());

        /* already torn down */
        node.shutdown();
        assertFalse(node.isRunning());
    }

    private static int freePort() throws IOException {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }
}
