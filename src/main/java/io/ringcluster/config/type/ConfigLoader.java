package io.ringcluster.config.type;

import io.ringcluster.config.impl.ClusterConfig;

import java.io.IOException;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads cluster configuration from a YAML file by delegating to {@link ClusterConfig#load(String)}.
     * <p>
     * Expected layout:
     * <pre>
     * node:
     *   name: node1
     *   host: 127.0.0.1
     *   port: 11000
     * seeds:
     *   - name: node2
     *     host: 127.0.0.1
     *     port: 11001
     * tickMillis: 1000
     * executorTickMillis: 100
     * requestTimeoutMillis: 5000
     * maxFrameBytes: 104857600
     * </pre>
     *
     * @param path the path to the cluster YAML configuration file
     * @return a populated {@link ClusterConfig} instance
     * @throws IOException if the file cannot be read or is missing the {@code node} section
     */
    public static ClusterConfig load(final String path) throws IOException {
        return ClusterConfig.load(path);
    }
}
