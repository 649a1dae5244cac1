package io.ringcluster.transport.type;

import io.ringcluster.core.error.ClusterException;
import io.ringcluster.core.model.NodeId;

/**
 * Non-blocking, framed peer connections. Every method returns without waiting for the network;
 * outcomes arrive later as {@link Notification}s on the sink given to {@link #start}.
 */
public interface PeerTransport extends AutoCloseable {

    /**
     * Binds the cluster listener and starts delivering notifications.
     */
    void start(NotificationSink sink) throws InterruptedException;

    /**
     * Starts an outgoing connection to {@code peer}.
     *
     * @return the connection id; {@link Notification.Connected} follows once it is usable
     * @throws ClusterException of kind {@code CONNECT} if the attempt cannot even be started
     */
    long connect(NodeId peer) throws ClusterException;

    /**
     * Queues one frame. Output that cannot be written right away is flushed on the next writability
     * notification.
     *
     * @throws ClusterException of kind {@code WRITE} if the connection is unknown or closed
     */
    void write(long id, byte[] frame) throws ClusterException;

    /**
     * Deregisters and closes the connection. Unknown ids are ignored.
     */
    void deregister(long id);

    @Override
    void close();
}
