package io.ringcluster.cluster.executor;

import io.ringcluster.core.model.Envelope;

/**
 * Messages the cluster server hands to the local actor executor.
 */
public interface ExecutorMsg {

    /** Envelope received from a peer, or a reply produced by the cluster server. */
    record EnvelopeMsg(Envelope envelope) implements ExecutorMsg {
    }

    /** Drives process-level timers. */
    record Tick() implements ExecutorMsg {
    }
}
