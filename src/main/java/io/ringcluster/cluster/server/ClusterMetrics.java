package io.ringcluster.cluster.server;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain counters maintained by the cluster server loop. Single writer; read only through
 * {@link #data()} from the same thread.
 */
final class ClusterMetrics {

    long pollNotifications;
    long joins;
    long leaves;
    long receivedLocalEnvelopes;
    long receivedRemoteEnvelopes;
    long statusRequests;
    long acceptedConnections;
    long connectionAttempts;
    long errors;

    Map<String, Long> data() {
        final Map<String, Long> out = new LinkedHashMap<>();
        out.put("poll_notifications", pollNotifications);
        out.put("joins", joins);
        out.put("leaves", leaves);
        out.put("received_local_envelopes", receivedLocalEnvelopes);
        out.put("received_remote_envelopes", receivedRemoteEnvelopes);
        out.put("status_requests", statusRequests);
        out.put("accepted_connections", acceptedConnections);
        out.put("connection_attempts", connectionAttempts);
        out.put("errors", errors);
        return out;
    }
}
