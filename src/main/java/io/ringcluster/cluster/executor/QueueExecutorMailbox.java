package io.ringcluster.cluster.executor;

import io.ringcluster.core.error.ClusterException;
import io.ringcluster.core.model.Pid;

import java.util.concurrent.BlockingQueue;

/**
 * {@link ExecutorMailbox} over an unbounded {@link BlockingQueue}. The consuming side calls
 * {@link #close()} when it stops; later sends fail. A bounded queue is rejected: a full queue would
 * be indistinguishable from a dead executor.
 */
public final class QueueExecutorMailbox implements ExecutorMailbox, AutoCloseable {

    private final BlockingQueue<ExecutorMsg> queue;
    private volatile boolean closed;

    public QueueExecutorMailbox(final BlockingQueue<ExecutorMsg> queue) {
        if (queue.remainingCapacity() < Integer.MAX_VALUE - queue.size()) {
            throw new IllegalArgumentException("executor queue must be unbounded, remaining capacity "
                    + queue.remainingCapacity());
        }
        this.queue = queue;
    }

    public BlockingQueue<ExecutorMsg> queue() {
        return queue;
    }

    @Override
    public void send(final ExecutorMsg msg) throws ClusterException {
        if (closed || !queue.offer(msg)) {
            throw ClusterException.send(msg.getClass().getSimpleName(), recipient(msg));
        }
    }

    @Override
    public void close() {
        closed = true;
    }

    private static Pid recipient(final ExecutorMsg msg) {
        return msg instanceof ExecutorMsg.EnvelopeMsg e ? e.envelope().to() : null;
    }
}
