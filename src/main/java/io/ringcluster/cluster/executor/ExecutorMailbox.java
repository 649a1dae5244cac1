package io.ringcluster.cluster.executor;

import io.ringcluster.core.error.ClusterException;

/**
 * Multi-producer handoff into the executor. A failed send means the executor is gone.
 */
public interface ExecutorMailbox {

    /**
     * @throws ClusterException of kind {@code SEND} when the executor no longer accepts messages
     */
    void send(ExecutorMsg msg) throws ClusterException;
}
