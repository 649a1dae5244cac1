package io.ringcluster.config.impl;

import io.ringcluster.core.model.NodeId;
import lombok.Getter;
import lombok.ToString;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Immutable config holder loaded from cluster.yaml
 */
@Getter
@ToString
public final class ClusterConfig {

    public static final long DEFAULT_TICK_MILLIS = 1_000;
    public static final long DEFAULT_EXECUTOR_TICK_MILLIS = 100;
    public static final long DEFAULT_REQUEST_TIMEOUT_MILLIS = 5_000;
    public static final int DEFAULT_MAX_FRAME_BYTES = 100 * 1024 * 1024;

    private final NodeId node;
    private final List<NodeId> seeds;
    private final long tickMillis;
    private final long executorTickMillis;
    private final long requestTimeoutMillis;
    private final int maxFrameBytes;

    public ClusterConfig(final NodeId node,
                         final List<NodeId> seeds,
                         final long tickMillis,
                         final long executorTickMillis,
                         final long requestTimeoutMillis,
                         final int maxFrameBytes) {
        if (tickMillis <= 0 || executorTickMillis <= 0) {
            throw new IllegalArgumentException("tick intervals must be > 0");
        }
        if (requestTimeoutMillis < tickMillis) {
            throw new IllegalArgumentException("requestTimeoutMillis must be >= tickMillis");
        }
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be > 0");
        }
        this.node = node;
        this.seeds = List.copyOf(seeds);
        this.tickMillis = tickMillis;
        this.executorTickMillis = executorTickMillis;
        this.requestTimeoutMillis = requestTimeoutMillis;
        this.maxFrameBytes = maxFrameBytes;
    }

    public static ClusterConfig defaults(final NodeId node) {
        return new ClusterConfig(node, List.of(),
                DEFAULT_TICK_MILLIS, DEFAULT_EXECUTOR_TICK_MILLIS, DEFAULT_REQUEST_TIMEOUT_MILLIS, DEFAULT_MAX_FRAME_BYTES);
    }

    public ClusterConfig withTimings(final long tickMillis, final long executorTickMillis, final long requestTimeoutMillis) {
        return new ClusterConfig(node, seeds, tickMillis, executorTickMillis, requestTimeoutMillis, maxFrameBytes);
    }

    /** Number of timing wheel slots: one per tick of the request timeout window. */
    public int timerWheelSize() {
        return (int) Math.max(1, requestTimeoutMillis / tickMillis);
    }

    public static ClusterConfig load(final String path) throws IOException {
        final Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            final Map<String, Object> m = yaml.load(in);
            if (m == null) {
                throw new IOException("Empty cluster config: " + path);
            }
            return fromMap(m);
        }
    }

    @SuppressWarnings("unchecked")
    static ClusterConfig fromMap(final Map<String, Object> m) throws IOException {
        final Map<String, Object> self = (Map<String, Object>) m.get("node");
        if (self == null) {
            throw new IOException("Missing 'node' section");
        }

        final List<Map<String, Object>> seedsCfg =
                (List<Map<String, Object>>) m.getOrDefault("seeds", List.of());
        final List<NodeId> seeds = seedsCfg.stream()
                .map(ClusterConfig::nodeId)
                .toList();

        return new ClusterConfig(
                nodeId(self),
                seeds,
                ((Number) m.getOrDefault("tickMillis", DEFAULT_TICK_MILLIS)).longValue(),
                ((Number) m.getOrDefault("executorTickMillis", DEFAULT_EXECUTOR_TICK_MILLIS)).longValue(),
                ((Number) m.getOrDefault("requestTimeoutMillis", DEFAULT_REQUEST_TIMEOUT_MILLIS)).longValue(),
                ((Number) m.getOrDefault("maxFrameBytes", DEFAULT_MAX_FRAME_BYTES)).intValue());
    }

    private static NodeId nodeId(final Map<String, Object> n) {
        final String name = (String) n.get("name");
        final String host = (String) n.getOrDefault("host", "127.0.0.1");
        final Integer port = (Integer) n.get("port");
        if (name == null || port == null) {
            throw new IllegalArgumentException("node entries need 'name' and 'port': " + n);
        }
        return new NodeId(name, host + ":" + port);
    }
}
