package io.ringcluster.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Body of an {@link Envelope}. User payloads are opaque bytes; the remaining variants are the
 * requests and replies the runtime itself understands.
 */
public interface Msg {

    record User(byte[] payload) implements Msg {
        public User {
            Objects.requireNonNull(payload, "payload");
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof User other && Arrays.equals(payload, other.payload);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(payload);
        }

        @Override
        public String toString() {
            return "User[" + payload.length + " bytes]";
        }
    }

    record GetMetrics() implements Msg {
    }

    record Metrics(Map<String, Long> values) implements Msg {
        public Metrics {
            values = Map.copyOf(values);
        }
    }

    record Status(ClusterStatus status) implements Msg {
    }

    record Unknown() implements Msg {
    }
}
