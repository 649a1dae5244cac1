package io.ringcluster.cluster.server;

import io.ringcluster.core.model.CorrelationId;
import io.ringcluster.core.model.Envelope;
import io.ringcluster.core.model.NodeId;
import io.ringcluster.transport.type.Notification;

import java.util.List;

/**
 * Control messages consumed by the {@link ClusterServer} loop.
 */
public interface ClusterMsg {

    /** Reactor readiness batch: socket events and timer ticks. */
    record PollNotifications(List<Notification> notifications) implements ClusterMsg {
        public PollNotifications {
            notifications = List.copyOf(notifications);
        }
    }

    /** Add a node to the cluster and dial it. */
    record Join(NodeId node) implements ClusterMsg {
    }

    /** Remove a node from the cluster. Reconciliation drops its connection on the next tick. */
    record Leave(NodeId node) implements ClusterMsg {
    }

    /** Locally originated envelope bound for another node, or for the cluster server itself. */
    record EnvelopeMsg(Envelope envelope) implements ClusterMsg {
    }

    /** Reply with a {@code ClusterStatus} to {@code correlationId.pid()} through the executor. */
    record GetStatus(CorrelationId correlationId) implements ClusterMsg {
    }

    record Shutdown() implements ClusterMsg {
    }
}
