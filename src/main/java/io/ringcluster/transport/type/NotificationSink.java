package io.ringcluster.transport.type;

import java.util.List;

/**
 * Receives notification batches from reactor threads. Implementations must be thread-safe and must
 * not block.
 */
@FunctionalInterface
public interface NotificationSink {

    void deliver(List<Notification> batch);
}
