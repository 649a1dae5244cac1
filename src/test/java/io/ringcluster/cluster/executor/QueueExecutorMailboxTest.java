package io.ringcluster.cluster.executor;

import io.ringcluster.core.error.ClusterException;
import io.ringcluster.core.model.Envelope;
import io.ringcluster.core.model.Msg;
import io.ringcluster.core.model.NodeId;
import io.ringcluster.core.model.Pid;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import static org.junit.jupiter.api.Assertions.*;

final class QueueExecutorMailboxTest {

    private static final NodeId NODE = new NodeId("n", "127.0.0.1:9000");

    @Test
    void deliversUntilClosed() throws Exception {
        final QueueExecutorMailbox mailbox = new QueueExecutorMailbox(new LinkedBlockingQueue<>());
        mailbox.send(new ExecutorMsg.Tick());
        assertEquals(new ExecutorMsg.Tick(), mailbox.queue().poll());

        mailbox.close();
        final Envelope env = new Envelope(Pid.of("to", NODE), Pid.of("from", NODE), null, new Msg.GetMetrics());
        final ClusterException e = assertThrows(ClusterException.class,
                () -> mailbox.send(new ExecutorMsg.EnvelopeMsg(env)));
        assertEquals(ClusterException.Kind.SEND, e.getKind());
        assertTrue(e.isFatal());
    }

    @Test
    void boundedQueueIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new QueueExecutorMailbox(new ArrayBlockingQueue<>(1)));
    }
}
