package io.ringcluster.core.model;

import java.util.Objects;

/**
 * Addressed, correlatable unit of delivery between actors, local or remote.
 */
public record Envelope(Pid to, Pid from, CorrelationId correlationId, Msg body) {

    public Envelope {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(body, "body");
    }
}
